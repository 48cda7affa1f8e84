package io.github.drompincen.jobengine.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduledJobDto(
        String jobId,
        String ownerId,
        JobKind jobKind,
        ScheduleType scheduleType,
        Instant runAt,
        String cronExpression,
        String timezone,
        Instant nextRunAt,
        String nextRunLocal,
        ActionType actionType,
        Map<String, Object> actionPayload,
        JobStatus status,
        String taskId,
        String projectId,
        String conversationId,
        String title,
        String description,
        long runCount,
        Instant lastRunAt,
        int failureCount,
        int consecutiveFailures,
        String lastError,
        boolean failed,
        String cancelReason,
        Instant createdAt,
        Instant updatedAt
) {}
