package io.github.drompincen.jobengine.runtime.error;

public class InvalidScheduleException extends JobEngineException {

    public InvalidScheduleException(String message) {
        super("INVALID_SCHEDULE", message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super("INVALID_SCHEDULE", message, cause);
    }
}
