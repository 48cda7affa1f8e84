package io.github.drompincen.jobengine.protocol.api;

public record UpdateJobDetailsRequest(
        String title,
        String description
) {}
