package io.github.drompincen.jobengine.runtime.error;

public class InvalidActionPayloadException extends JobEngineException {

    public InvalidActionPayloadException(String message) {
        super("INVALID_ACTION_PAYLOAD", message);
    }
}
