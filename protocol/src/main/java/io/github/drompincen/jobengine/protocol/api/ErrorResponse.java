package io.github.drompincen.jobengine.protocol.api;

public record ErrorResponse(String code, String message) {}
