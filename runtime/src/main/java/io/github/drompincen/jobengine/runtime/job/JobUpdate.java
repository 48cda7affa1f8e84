package io.github.drompincen.jobengine.runtime.job;

import io.github.drompincen.jobengine.protocol.api.JobStatus;

import java.time.Instant;

/**
 * Partial update applied by {@link ScheduledJobStore#update}. Null fields are left alone.
 * Setting {@code runAt} turns the job into a one-shot; setting {@code cronExpression} makes
 * it recurring.
 */
public class JobUpdate {

    private String title;
    private String description;
    private Instant runAt;
    private String cronExpression;
    private String timezone;
    private JobStatus status;
    private String cancelReason;

    public static JobUpdate details(String title, String description) {
        JobUpdate u = new JobUpdate();
        u.title = title;
        u.description = description;
        return u;
    }

    public static JobUpdate schedule(Instant runAt, String cronExpression, String timezone) {
        JobUpdate u = new JobUpdate();
        u.runAt = runAt;
        u.cronExpression = cronExpression;
        u.timezone = timezone;
        return u;
    }

    public static JobUpdate status(JobStatus status) {
        JobUpdate u = new JobUpdate();
        u.status = status;
        return u;
    }

    public static JobUpdate cancel(String reason) {
        JobUpdate u = status(JobStatus.CANCELLED);
        u.cancelReason = reason;
        return u;
    }

    public boolean changesSchedule() {
        return runAt != null || cronExpression != null || timezone != null;
    }

    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public Instant getRunAt() { return runAt; }
    public String getCronExpression() { return cronExpression; }
    public String getTimezone() { return timezone; }
    public JobStatus getStatus() { return status; }
    public String getCancelReason() { return cancelReason; }
}
