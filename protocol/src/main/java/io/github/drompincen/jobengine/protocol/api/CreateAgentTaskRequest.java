package io.github.drompincen.jobengine.protocol.api;

public record CreateAgentTaskRequest(
        String title,
        String instruction,
        String runAt,
        String cronExpression,
        String timezone,
        String preferredChannel,
        String taskId,
        String projectId
) {}
