package io.github.drompincen.jobengine.protocol.api;

/**
 * Creates a notify job. Exactly one of {@code runAt} (one-shot, ISO date-time) or
 * {@code cronExpression} (recurring) must be supplied.
 */
public record CreateReminderRequest(
        String title,
        String message,
        String runAt,
        String cronExpression,
        String timezone,
        String preferredChannel,
        String taskId,
        String projectId,
        String conversationId
) {}
