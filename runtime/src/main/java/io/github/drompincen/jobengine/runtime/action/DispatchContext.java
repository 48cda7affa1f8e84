package io.github.drompincen.jobengine.runtime.action;

import io.github.drompincen.jobengine.persistence.document.ScheduledJobDocument;
import io.github.drompincen.jobengine.protocol.api.ActionPayload;
import io.github.drompincen.jobengine.runtime.job.ActionPayloads;

import java.time.Instant;

/** What a handler sees of the job being dispatched. */
public record DispatchContext(ScheduledJobDocument job, Instant scheduledFor, int attempt) {

    public ActionPayload payload() {
        return ActionPayloads.fromMap(job.getActionType(), job.getActionPayload());
    }
}
