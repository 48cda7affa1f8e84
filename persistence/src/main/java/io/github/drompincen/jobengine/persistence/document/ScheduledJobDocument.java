package io.github.drompincen.jobengine.persistence.document;

import io.github.drompincen.jobengine.protocol.api.ActionType;
import io.github.drompincen.jobengine.protocol.api.JobKind;
import io.github.drompincen.jobengine.protocol.api.JobStatus;
import io.github.drompincen.jobengine.protocol.api.ScheduleType;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "scheduled_jobs")
@CompoundIndex(name = "due_pickup_idx", def = "{'status': 1, 'nextRunAt': 1}")
@CompoundIndex(name = "owner_status_idx", def = "{'ownerId': 1, 'status': 1, 'nextRunAt': 1}")
public class ScheduledJobDocument {

    @Id
    private String jobId;
    private String ownerId;
    private JobKind jobKind;
    private ScheduleType scheduleType;
    private Instant runAt;
    private String cronExpression;
    private String timezone;
    private Instant nextRunAt;
    private ActionType actionType;
    private Map<String, Object> actionPayload;
    private JobStatus status = JobStatus.ACTIVE;
    private String taskId;
    private String projectId;
    private String conversationId;
    private String title;
    private String description;

    // Claim lease, set by claimDue and cleared when the dispatch finishes
    private String claimedBy;
    private String claimToken;
    private Instant claimedUntil;

    private long runCount;
    private Instant lastRunAt;
    private int failureCount;
    private int consecutiveFailures;
    private String lastError;
    private Instant lastErrorAt;
    private boolean failed;
    private String cancelReason;

    @Version
    private Long version;
    private Instant createdAt;
    private Instant updatedAt;

    public ScheduledJobDocument() {}

    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }
    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
    public JobKind getJobKind() { return jobKind; }
    public void setJobKind(JobKind jobKind) { this.jobKind = jobKind; }
    public ScheduleType getScheduleType() { return scheduleType; }
    public void setScheduleType(ScheduleType scheduleType) { this.scheduleType = scheduleType; }
    public Instant getRunAt() { return runAt; }
    public void setRunAt(Instant runAt) { this.runAt = runAt; }
    public String getCronExpression() { return cronExpression; }
    public void setCronExpression(String cronExpression) { this.cronExpression = cronExpression; }
    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }
    public Instant getNextRunAt() { return nextRunAt; }
    public void setNextRunAt(Instant nextRunAt) { this.nextRunAt = nextRunAt; }
    public ActionType getActionType() { return actionType; }
    public void setActionType(ActionType actionType) { this.actionType = actionType; }
    public Map<String, Object> getActionPayload() { return actionPayload; }
    public void setActionPayload(Map<String, Object> actionPayload) { this.actionPayload = actionPayload; }
    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }
    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }
    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }
    public String getConversationId() { return conversationId; }
    public void setConversationId(String conversationId) { this.conversationId = conversationId; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getClaimedBy() { return claimedBy; }
    public void setClaimedBy(String claimedBy) { this.claimedBy = claimedBy; }
    public String getClaimToken() { return claimToken; }
    public void setClaimToken(String claimToken) { this.claimToken = claimToken; }
    public Instant getClaimedUntil() { return claimedUntil; }
    public void setClaimedUntil(Instant claimedUntil) { this.claimedUntil = claimedUntil; }
    public long getRunCount() { return runCount; }
    public void setRunCount(long runCount) { this.runCount = runCount; }
    public Instant getLastRunAt() { return lastRunAt; }
    public void setLastRunAt(Instant lastRunAt) { this.lastRunAt = lastRunAt; }
    public int getFailureCount() { return failureCount; }
    public void setFailureCount(int failureCount) { this.failureCount = failureCount; }
    public int getConsecutiveFailures() { return consecutiveFailures; }
    public void setConsecutiveFailures(int consecutiveFailures) { this.consecutiveFailures = consecutiveFailures; }
    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }
    public Instant getLastErrorAt() { return lastErrorAt; }
    public void setLastErrorAt(Instant lastErrorAt) { this.lastErrorAt = lastErrorAt; }
    public boolean isFailed() { return failed; }
    public void setFailed(boolean failed) { this.failed = failed; }
    public String getCancelReason() { return cancelReason; }
    public void setCancelReason(String cancelReason) { this.cancelReason = cancelReason; }
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    /** Convenience: read a payload value as a string. */
    public String payloadString(String key) {
        if (actionPayload == null) return null;
        Object val = actionPayload.get(key);
        return val != null ? val.toString() : null;
    }
}
