package io.github.drompincen.jobengine.runtime.error;

public class IllegalJobTransitionException extends JobEngineException {

    public IllegalJobTransitionException(String message) {
        super("ILLEGAL_TRANSITION", message);
    }
}
