package io.github.drompincen.jobengine.runtime.authoring;

import io.github.drompincen.jobengine.persistence.document.JobExecutionDocument;
import io.github.drompincen.jobengine.persistence.document.ScheduledJobDocument;
import io.github.drompincen.jobengine.protocol.api.JobExecutionDto;
import io.github.drompincen.jobengine.protocol.api.ScheduledJobDto;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public final class JobMapper {

    private JobMapper() {}

    public static ScheduledJobDto toDto(ScheduledJobDocument doc) {
        return new ScheduledJobDto(
                doc.getJobId(),
                doc.getOwnerId(),
                doc.getJobKind(),
                doc.getScheduleType(),
                doc.getRunAt(),
                doc.getCronExpression(),
                doc.getTimezone(),
                doc.getNextRunAt(),
                localTime(doc),
                doc.getActionType(),
                doc.getActionPayload(),
                doc.getStatus(),
                doc.getTaskId(),
                doc.getProjectId(),
                doc.getConversationId(),
                doc.getTitle(),
                doc.getDescription(),
                doc.getRunCount(),
                doc.getLastRunAt(),
                doc.getFailureCount(),
                doc.getConsecutiveFailures(),
                doc.getLastError(),
                doc.isFailed(),
                doc.getCancelReason(),
                doc.getCreatedAt(),
                doc.getUpdatedAt());
    }

    public static JobExecutionDto toDto(JobExecutionDocument doc) {
        return new JobExecutionDto(
                doc.getExecutionId(),
                doc.getJobId(),
                doc.getScheduledFor(),
                doc.getStartedAt(),
                doc.getEndedAt(),
                doc.getDurationMs(),
                doc.getAttempts(),
                doc.getOutcome(),
                doc.getErrorMessage(),
                doc.getConversationId(),
                doc.getSummary());
    }

    // nextRunAt rendered in the job's own zone, e.g. 2026-03-05T08:00-05:00[America/New_York]
    private static String localTime(ScheduledJobDocument doc) {
        if (doc.getNextRunAt() == null || doc.getTimezone() == null) return null;
        try {
            return DateTimeFormatter.ISO_ZONED_DATE_TIME.format(doc.getNextRunAt().atZone(ZoneId.of(doc.getTimezone())));
        } catch (DateTimeException e) {
            return null;
        }
    }
}
