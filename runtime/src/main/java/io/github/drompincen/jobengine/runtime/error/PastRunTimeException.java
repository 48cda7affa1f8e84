package io.github.drompincen.jobengine.runtime.error;

public class PastRunTimeException extends JobEngineException {

    public PastRunTimeException(String message) {
        super("PAST_RUN_TIME", message);
    }
}
