package io.github.drompincen.jobengine.protocol.api;

/** Informational classification of why a job exists. Never affects dispatch. */
public enum JobKind {
    REMINDER, ONE_TIME, RECURRING, FOLLOW_UP
}
