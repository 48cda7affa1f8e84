package io.github.drompincen.jobengine.protocol.api;

public enum ScheduleType {
    ONCE, CRON
}
