package io.github.drompincen.jobengine.protocol.api;

public record CancelJobRequest(String reason) {}
