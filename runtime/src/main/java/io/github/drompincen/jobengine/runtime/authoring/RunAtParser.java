package io.github.drompincen.jobengine.runtime.authoring;

import io.github.drompincen.jobengine.runtime.error.InvalidScheduleException;
import io.github.drompincen.jobengine.runtime.error.PastRunTimeException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * Parses user-supplied run times. Accepts an ISO instant, an offset or zoned date-time, or a
 * bare local date-time which is read as UTC.
 */
final class RunAtParser {

    private static final List<Function<String, Instant>> FORMATS = List.of(
            Instant::parse,
            s -> ZonedDateTime.parse(s).toInstant(),
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC));

    private RunAtParser() {}

    static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidScheduleException("runAt is required");
        }
        String text = value.trim();
        DateTimeParseException last = null;
        for (Function<String, Instant> format : FORMATS) {
            try {
                return format.apply(text);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw new InvalidScheduleException("runAt is not an ISO-8601 date-time: " + value, last);
    }

    static Instant parseFuture(String value, Instant now) {
        Instant runAt = parse(value);
        if (!runAt.isAfter(now)) {
            throw new PastRunTimeException("runAt " + runAt + " is not in the future");
        }
        return runAt;
    }
}
