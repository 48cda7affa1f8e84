package io.github.drompincen.jobengine.protocol.api;

public record CreateFollowUpRequest(
        String reason,
        String checkAt,
        String instruction
) {}
