package io.github.drompincen.jobengine.runtime.port;

import java.time.Instant;

public record TaskInfo(String taskId, String title, String status, Instant dueDate, String projectId) {}
