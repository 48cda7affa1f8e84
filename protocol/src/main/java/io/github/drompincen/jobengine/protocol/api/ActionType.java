package io.github.drompincen.jobengine.protocol.api;

public enum ActionType {
    NOTIFY, AGENT_TASK
}
