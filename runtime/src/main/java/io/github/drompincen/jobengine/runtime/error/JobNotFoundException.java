package io.github.drompincen.jobengine.runtime.error;

/** Also raised for a job owned by someone else; ownership is never revealed. */
public class JobNotFoundException extends JobEngineException {

    public JobNotFoundException(String jobId) {
        super("JOB_NOT_FOUND", "Job not found: " + jobId);
    }

    public JobNotFoundException(String kind, String id) {
        super("JOB_NOT_FOUND", kind + " not found: " + id);
    }
}
