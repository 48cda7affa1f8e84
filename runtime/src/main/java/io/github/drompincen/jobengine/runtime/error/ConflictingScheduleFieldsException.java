package io.github.drompincen.jobengine.runtime.error;

public class ConflictingScheduleFieldsException extends JobEngineException {

    public ConflictingScheduleFieldsException(String message) {
        super("CONFLICTING_SCHEDULE_FIELDS", message);
    }
}
