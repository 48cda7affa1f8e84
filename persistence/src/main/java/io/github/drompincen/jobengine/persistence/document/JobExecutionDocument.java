package io.github.drompincen.jobengine.persistence.document;

import io.github.drompincen.jobengine.protocol.api.ExecutionOutcome;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "job_executions")
@CompoundIndex(name = "job_started_idx", def = "{'jobId': 1, 'startedAt': -1}")
@CompoundIndex(name = "owner_started_idx", def = "{'ownerId': 1, 'startedAt': -1}")
public class JobExecutionDocument {

    @Id
    private String executionId;
    private String jobId;
    private String ownerId;
    private Instant scheduledFor;
    private Instant startedAt;
    private Instant endedAt;
    private long durationMs;
    private int attempts;
    private ExecutionOutcome outcome;
    private String errorMessage;
    private String conversationId;
    private String workerId;
    private String summary;

    public JobExecutionDocument() {}

    public String getExecutionId() { return executionId; }
    public void setExecutionId(String executionId) { this.executionId = executionId; }
    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }
    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
    public Instant getScheduledFor() { return scheduledFor; }
    public void setScheduledFor(Instant scheduledFor) { this.scheduledFor = scheduledFor; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getEndedAt() { return endedAt; }
    public void setEndedAt(Instant endedAt) { this.endedAt = endedAt; }
    public long getDurationMs() { return durationMs; }
    public void setDurationMs(long durationMs) { this.durationMs = durationMs; }
    public int getAttempts() { return attempts; }
    public void setAttempts(int attempts) { this.attempts = attempts; }
    public ExecutionOutcome getOutcome() { return outcome; }
    public void setOutcome(ExecutionOutcome outcome) { this.outcome = outcome; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public String getConversationId() { return conversationId; }
    public void setConversationId(String conversationId) { this.conversationId = conversationId; }
    public String getWorkerId() { return workerId; }
    public void setWorkerId(String workerId) { this.workerId = workerId; }
    public String getSummary() { return summary; }
    public void setSummary(String summary) { this.summary = summary; }
}
