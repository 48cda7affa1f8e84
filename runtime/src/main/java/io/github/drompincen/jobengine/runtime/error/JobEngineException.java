package io.github.drompincen.jobengine.runtime.error;

/**
 * Root of every error the job engine raises to callers. The {@code code} is stable and
 * ends up in the REST error body.
 */
public class JobEngineException extends RuntimeException {

    private final String code;

    public JobEngineException(String code, String message) {
        super(message);
        this.code = code;
    }

    public JobEngineException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
