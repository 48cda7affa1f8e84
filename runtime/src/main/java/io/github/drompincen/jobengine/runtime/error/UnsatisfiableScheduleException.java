package io.github.drompincen.jobengine.runtime.error;

public class UnsatisfiableScheduleException extends JobEngineException {

    public UnsatisfiableScheduleException(String message) {
        super("UNSATISFIABLE_SCHEDULE", message);
    }
}
