package io.github.drompincen.jobengine.runtime.authoring;

import io.github.drompincen.jobengine.persistence.document.ScheduledJobDocument;
import io.github.drompincen.jobengine.persistence.repository.JobExecutionRepository;
import io.github.drompincen.jobengine.protocol.api.ActionType;
import io.github.drompincen.jobengine.protocol.api.AgentTaskPayload;
import io.github.drompincen.jobengine.protocol.api.CreateAgentTaskRequest;
import io.github.drompincen.jobengine.protocol.api.CreateReminderRequest;
import io.github.drompincen.jobengine.protocol.api.JobExecutionDto;
import io.github.drompincen.jobengine.protocol.api.JobKind;
import io.github.drompincen.jobengine.protocol.api.JobStatus;
import io.github.drompincen.jobengine.protocol.api.NotifyPayload;
import io.github.drompincen.jobengine.protocol.api.ScheduleType;
import io.github.drompincen.jobengine.protocol.api.SchedulePreviewDto;
import io.github.drompincen.jobengine.protocol.api.ScheduledJobDto;
import io.github.drompincen.jobengine.protocol.api.UpdateJobDetailsRequest;
import io.github.drompincen.jobengine.protocol.api.UpdateScheduleRequest;
import io.github.drompincen.jobengine.runtime.error.ConflictingScheduleFieldsException;
import io.github.drompincen.jobengine.runtime.error.IllegalJobTransitionException;
import io.github.drompincen.jobengine.runtime.error.InvalidActionPayloadException;
import io.github.drompincen.jobengine.runtime.error.InvalidScheduleException;
import io.github.drompincen.jobengine.runtime.error.JobNotFoundException;
import io.github.drompincen.jobengine.runtime.error.TaskNotFoundException;
import io.github.drompincen.jobengine.runtime.job.JobUpdate;
import io.github.drompincen.jobengine.runtime.job.ScheduledJobStore;
import io.github.drompincen.jobengine.runtime.port.TaskDirectory;
import io.github.drompincen.jobengine.runtime.schedule.RecurrenceEvaluator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Validating front door for creating and managing jobs. Every error here is thrown to the
 * caller before anything is persisted.
 */
@Service
public class JobAuthoringService {

    static final int DEFAULT_LIST_LIMIT = 50;
    static final int MAX_LIST_LIMIT = 200;
    static final int DEFAULT_PREVIEW_COUNT = 5;
    static final int MAX_PREVIEW_COUNT = 20;

    private final ScheduledJobStore store;
    private final RecurrenceEvaluator evaluator;
    private final TaskDirectory taskDirectory;
    private final JobExecutionRepository executionRepository;
    private final Clock clock;
    private final String defaultTimezone;

    public JobAuthoringService(ScheduledJobStore store,
                               RecurrenceEvaluator evaluator,
                               TaskDirectory taskDirectory,
                               JobExecutionRepository executionRepository,
                               Clock clock,
                               @Value("${jobengine.defaults.timezone:America/New_York}") String defaultTimezone) {
        this.store = store;
        this.evaluator = evaluator;
        this.taskDirectory = taskDirectory;
        this.executionRepository = executionRepository;
        this.clock = clock;
        this.defaultTimezone = defaultTimezone;
    }

    public ScheduledJobDto createReminder(String ownerId, CreateReminderRequest request) {
        String title = firstNonBlank(request.title(), request.message());
        if (title == null) {
            throw new InvalidActionPayloadException("A reminder needs a title or a message");
        }
        String message = firstNonBlank(request.message(), title);

        ScheduledJobDocument job = draft(ownerId, request.runAt(), request.cronExpression(), request.timezone());
        job.setJobKind(JobKind.REMINDER);
        job.setActionType(ActionType.NOTIFY);
        job.setActionPayload(new NotifyPayload(message, request.preferredChannel()).toMap());
        job.setTitle(title);
        job.setDescription(request.message());
        job.setConversationId(request.conversationId());
        linkTaskAndProject(job, ownerId, request.taskId(), request.projectId());

        return JobMapper.toDto(store.create(job));
    }

    public ScheduledJobDto createAgentTask(String ownerId, CreateAgentTaskRequest request) {
        if (isBlank(request.instruction())) {
            throw new InvalidActionPayloadException("An agent task needs an instruction");
        }
        String title = firstNonBlank(request.title(), abbreviate(request.instruction()));

        ScheduledJobDocument job = draft(ownerId, request.runAt(), request.cronExpression(), request.timezone());
        job.setJobKind(job.getScheduleType() == ScheduleType.CRON ? JobKind.RECURRING : JobKind.ONE_TIME);
        job.setActionType(ActionType.AGENT_TASK);
        job.setActionPayload(new AgentTaskPayload(request.instruction(), request.taskId(),
                request.projectId(), request.preferredChannel()).toMap());
        job.setTitle(title);
        job.setDescription(request.instruction());
        linkTaskAndProject(job, ownerId, request.taskId(), request.projectId());

        return JobMapper.toDto(store.create(job));
    }

    public List<ScheduledJobDto> list(String ownerId, JobStatus status, JobKind jobKind, Integer limit) {
        int effective = limit == null || limit <= 0 ? DEFAULT_LIST_LIMIT : Math.min(limit, MAX_LIST_LIMIT);
        return store.listByOwner(ownerId, status, jobKind, effective).stream()
                .map(JobMapper::toDto)
                .toList();
    }

    public ScheduledJobDto get(String ownerId, String jobId) {
        return JobMapper.toDto(store.getById(ownerId, jobId));
    }

    /** Cancelling an already completed or cancelled job is a no-op. */
    public ScheduledJobDto cancel(String ownerId, String jobId, String reason) {
        return JobMapper.toDto(store.update(ownerId, jobId, JobUpdate.cancel(reason)));
    }

    public ScheduledJobDto pauseOrResume(String ownerId, String jobId, JobStatus desired) {
        if (desired != JobStatus.ACTIVE && desired != JobStatus.PAUSED) {
            throw new IllegalJobTransitionException("Status can only be set to ACTIVE or PAUSED; use cancel to stop a job");
        }
        return JobMapper.toDto(store.update(ownerId, jobId, JobUpdate.status(desired)));
    }

    public ScheduledJobDto updateSchedule(String ownerId, String jobId, UpdateScheduleRequest request) {
        boolean hasRunAt = !isBlank(request.runAt());
        boolean hasCron = !isBlank(request.cronExpression());
        if (hasRunAt && hasCron) {
            throw new ConflictingScheduleFieldsException("Provide either runAt or cronExpression, not both");
        }
        if (!hasRunAt && !hasCron && isBlank(request.timezone())) {
            throw new InvalidScheduleException("Provide runAt, cronExpression or timezone");
        }
        Instant runAt = hasRunAt ? RunAtParser.parseFuture(request.runAt(), clock.instant()) : null;
        String timezone = isBlank(request.timezone()) ? null : request.timezone().trim();
        if (hasCron) {
            ScheduledJobDocument current = store.getById(ownerId, jobId);
            evaluator.validate(request.cronExpression(), timezone != null ? timezone : current.getTimezone());
        }
        return JobMapper.toDto(store.update(ownerId, jobId,
                JobUpdate.schedule(runAt, hasCron ? request.cronExpression().trim() : null, timezone)));
    }

    public ScheduledJobDto updateDetails(String ownerId, String jobId, UpdateJobDetailsRequest request) {
        if (request.title() != null && request.title().isBlank()) {
            throw new InvalidActionPayloadException("Title cannot be blank");
        }
        return JobMapper.toDto(store.update(ownerId, jobId,
                JobUpdate.details(request.title(), request.description())));
    }

    public SchedulePreviewDto previewSchedule(String cronExpression, String timezone, Integer count) {
        String zone = isBlank(timezone) ? defaultTimezone : timezone.trim();
        int n = count == null || count <= 0 ? DEFAULT_PREVIEW_COUNT : Math.min(count, MAX_PREVIEW_COUNT);
        return new SchedulePreviewDto(cronExpression, zone,
                evaluator.upcoming(cronExpression, zone, clock.instant(), n));
    }

    public Page<JobExecutionDto> listExecutions(String ownerId, String jobId, int page, int size) {
        store.getById(ownerId, jobId);
        return executionRepository.findByJobIdAndOwnerIdOrderByStartedAtDesc(
                        jobId, ownerId, PageRequest.of(Math.max(0, page), Math.min(Math.max(1, size), MAX_LIST_LIMIT)))
                .map(JobMapper::toDto);
    }

    String defaultTimezone() {
        return defaultTimezone;
    }

    private ScheduledJobDocument draft(String ownerId, String runAt, String cronExpression, String timezone) {
        boolean hasRunAt = !isBlank(runAt);
        boolean hasCron = !isBlank(cronExpression);
        if (hasRunAt && hasCron) {
            throw new ConflictingScheduleFieldsException("Provide either runAt or cronExpression, not both");
        }
        if (!hasRunAt && !hasCron) {
            throw new InvalidScheduleException("Provide runAt for a one-time job or cronExpression for a recurring one");
        }

        String zone = isBlank(timezone) ? defaultTimezone : timezone.trim();
        ScheduledJobDocument job = new ScheduledJobDocument();
        job.setOwnerId(ownerId);
        job.setTimezone(zone);
        if (hasRunAt) {
            evaluator.zone(zone);
            job.setScheduleType(ScheduleType.ONCE);
            job.setRunAt(RunAtParser.parseFuture(runAt, clock.instant()));
        } else {
            evaluator.validate(cronExpression, zone);
            job.setScheduleType(ScheduleType.CRON);
            job.setCronExpression(cronExpression.trim());
        }
        return job;
    }

    private void linkTaskAndProject(ScheduledJobDocument job, String ownerId, String taskId, String projectId) {
        if (!isBlank(taskId)) {
            taskDirectory.findTask(ownerId, taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
            job.setTaskId(taskId);
        }
        if (!isBlank(projectId)) {
            if (!taskDirectory.projectExists(ownerId, projectId)) {
                throw new JobNotFoundException("Project", projectId);
            }
            job.setProjectId(projectId);
        }
    }

    private static String abbreviate(String text) {
        String oneLine = text.strip().replaceAll("\\s+", " ");
        return oneLine.length() <= 60 ? oneLine : oneLine.substring(0, 57) + "...";
    }

    static String firstNonBlank(String... values) {
        for (String v : values) {
            if (!isBlank(v)) return v.trim();
        }
        return null;
    }

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
