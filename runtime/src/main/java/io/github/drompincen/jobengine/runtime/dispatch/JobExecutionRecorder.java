package io.github.drompincen.jobengine.runtime.dispatch;

import io.github.drompincen.jobengine.persistence.document.JobExecutionDocument;
import io.github.drompincen.jobengine.persistence.repository.JobExecutionRepository;
import io.github.drompincen.jobengine.protocol.api.ExecutionOutcome;
import io.github.drompincen.jobengine.runtime.job.ClaimedJob;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

@Component
public class JobExecutionRecorder {

    private final JobExecutionRepository repository;

    public JobExecutionRecorder(JobExecutionRepository repository) {
        this.repository = repository;
    }

    public JobExecutionDocument record(ClaimedJob claim, Instant scheduledFor, Instant startedAt, Instant endedAt,
                                       int attempts, ExecutionOutcome outcome, String errorMessage,
                                       String conversationId, String summary) {
        JobExecutionDocument exec = new JobExecutionDocument();
        exec.setExecutionId(UUID.randomUUID().toString());
        exec.setJobId(claim.jobId());
        exec.setOwnerId(claim.ownerId());
        exec.setScheduledFor(scheduledFor);
        exec.setStartedAt(startedAt);
        exec.setEndedAt(endedAt);
        exec.setDurationMs(endedAt.toEpochMilli() - startedAt.toEpochMilli());
        exec.setAttempts(attempts);
        exec.setOutcome(outcome);
        exec.setErrorMessage(errorMessage);
        exec.setConversationId(conversationId);
        exec.setWorkerId(claim.job().getClaimedBy());
        exec.setSummary(summary);
        return repository.save(exec);
    }
}
