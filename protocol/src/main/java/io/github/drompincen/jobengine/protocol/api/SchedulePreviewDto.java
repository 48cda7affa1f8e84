package io.github.drompincen.jobengine.protocol.api;

import java.time.Instant;
import java.util.List;

public record SchedulePreviewDto(
        String cronExpression,
        String timezone,
        List<Instant> upcoming
) {}
