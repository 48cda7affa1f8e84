package io.github.drompincen.jobengine.protocol.api;

public record JobStatusChangeRequest(JobStatus status) {}
