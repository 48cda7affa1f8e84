package io.github.drompincen.jobengine.runtime.port;

public record AgentTaskRequest(
        String ownerId,
        String jobId,
        String title,
        String instruction,
        String taskId,
        String projectId
) {}
