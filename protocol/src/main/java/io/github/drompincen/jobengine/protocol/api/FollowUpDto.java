package io.github.drompincen.jobengine.protocol.api;

import java.time.Instant;

public record FollowUpDto(
        String jobId,
        String taskId,
        String taskTitle,
        Instant scheduledFor,
        String message
) {}
