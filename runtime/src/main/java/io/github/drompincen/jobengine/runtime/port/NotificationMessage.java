package io.github.drompincen.jobengine.runtime.port;

public record NotificationMessage(String title, String content, String jobId, String taskId) {}
