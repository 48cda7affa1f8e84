package io.github.drompincen.jobengine.protocol.api;

public record UpdateScheduleRequest(
        String runAt,
        String cronExpression,
        String timezone
) {}
