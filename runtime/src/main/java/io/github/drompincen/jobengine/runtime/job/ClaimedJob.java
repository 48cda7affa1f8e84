package io.github.drompincen.jobengine.runtime.job;

import io.github.drompincen.jobengine.persistence.document.ScheduledJobDocument;

import java.time.Instant;

/**
 * A job snapshot taken at claim time together with the token that proves ownership of the
 * claim. Every follow-up store write for this dispatch must present the token.
 */
public record ClaimedJob(ScheduledJobDocument job, String claimToken, Instant claimedUntil) {

    public String jobId() {
        return job.getJobId();
    }

    public String ownerId() {
        return job.getOwnerId();
    }
}
