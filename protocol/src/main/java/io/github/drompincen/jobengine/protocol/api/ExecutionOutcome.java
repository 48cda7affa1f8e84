package io.github.drompincen.jobengine.protocol.api;

public enum ExecutionOutcome {
    SUCCESS, FAILED, TIMED_OUT, SKIPPED
}
