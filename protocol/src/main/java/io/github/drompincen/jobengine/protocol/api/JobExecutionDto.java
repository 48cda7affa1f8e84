package io.github.drompincen.jobengine.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobExecutionDto(
        String executionId,
        String jobId,
        Instant scheduledFor,
        Instant startedAt,
        Instant endedAt,
        long durationMs,
        int attempts,
        ExecutionOutcome outcome,
        String errorMessage,
        String conversationId,
        String summary
) {}
