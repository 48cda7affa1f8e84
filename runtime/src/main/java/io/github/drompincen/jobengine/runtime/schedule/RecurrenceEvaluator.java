package io.github.drompincen.jobengine.runtime.schedule;

import io.github.drompincen.jobengine.runtime.error.InvalidScheduleException;
import io.github.drompincen.jobengine.runtime.error.UnsatisfiableScheduleException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes the next firing instant of a cron expression evaluated in the civil time of an
 * IANA zone.
 *
 * <p>Local times that fall into a spring-forward gap are shifted forward by the gap length;
 * local times that occur twice in a fall-back overlap fire on the earlier offset only.
 * Stateless; safe to share between threads.
 */
@Component
public class RecurrenceEvaluator {

    static final int HORIZON_YEARS = 5;

    private final Clock clock;

    public RecurrenceEvaluator(Clock clock) {
        this.clock = clock;
    }

    public Instant nextRun(String cronExpression, String timezone) {
        return nextRun(cronExpression, timezone, clock.instant());
    }

    /**
     * Earliest instant strictly after {@code after} that matches the expression.
     *
     * @throws InvalidScheduleException      malformed expression or unknown zone
     * @throws UnsatisfiableScheduleException nothing matches within the search horizon
     */
    public Instant nextRun(String cronExpression, String timezone, Instant after) {
        CronExpression cron = parse(cronExpression);
        ZoneId zone = zone(timezone);
        Instant horizon = after.atZone(zone).plusYears(HORIZON_YEARS).toInstant();

        LocalDateTime cursor = LocalDateTime.ofInstant(after, zone);
        while (true) {
            LocalDateTime local = cron.next(cursor);
            if (local == null) {
                throw unsatisfiable(cronExpression, timezone);
            }
            // ofLocal with no preferred offset: gap shifts forward, overlap takes the earlier offset
            Instant candidate = ZonedDateTime.ofLocal(local, zone, null).toInstant();
            if (candidate.isAfter(horizon)) {
                throw unsatisfiable(cronExpression, timezone);
            }
            if (candidate.isAfter(after)) {
                return candidate;
            }
            cursor = local;
        }
    }

    public void validate(String cronExpression, String timezone) {
        nextRun(cronExpression, timezone, clock.instant());
    }

    public List<Instant> upcoming(String cronExpression, String timezone, Instant after, int count) {
        List<Instant> result = new ArrayList<>(count);
        Instant cursor = after;
        for (int i = 0; i < count; i++) {
            cursor = nextRun(cronExpression, timezone, cursor);
            result.add(cursor);
        }
        return result;
    }

    public ZoneId zone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new InvalidScheduleException("Timezone is required");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new InvalidScheduleException("Unknown timezone: " + timezone, e);
        }
    }

    CronExpression parse(String cronExpression) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new InvalidScheduleException("Cron expression is required");
        }
        try {
            return CronExpression.parse(normalize(cronExpression));
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(
                    "Invalid cron expression '" + cronExpression + "': " + e.getMessage(), e);
        }
    }

    /** Five-field (minute-first) expressions get a zero seconds field; macros pass through. */
    static String normalize(String cronExpression) {
        String trimmed = cronExpression.trim();
        if (trimmed.startsWith("@")) return trimmed;
        String[] fields = trimmed.split("\\s+");
        return fields.length == 5 ? "0 " + String.join(" ", fields) : String.join(" ", fields);
    }

    private static UnsatisfiableScheduleException unsatisfiable(String cronExpression, String timezone) {
        return new UnsatisfiableScheduleException("Cron expression '" + cronExpression
                + "' has no occurrence in " + timezone + " within " + HORIZON_YEARS + " years");
    }
}
