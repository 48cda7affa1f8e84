package io.github.drompincen.jobengine.protocol.api;

public enum JobStatus {
    ACTIVE, PAUSED, COMPLETED, CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
