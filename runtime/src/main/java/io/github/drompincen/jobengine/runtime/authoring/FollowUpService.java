package io.github.drompincen.jobengine.runtime.authoring;

import io.github.drompincen.jobengine.persistence.document.ScheduledJobDocument;
import io.github.drompincen.jobengine.protocol.api.ActionType;
import io.github.drompincen.jobengine.protocol.api.AgentTaskPayload;
import io.github.drompincen.jobengine.protocol.api.CreateFollowUpRequest;
import io.github.drompincen.jobengine.protocol.api.FollowUpDto;
import io.github.drompincen.jobengine.protocol.api.JobKind;
import io.github.drompincen.jobengine.protocol.api.ScheduleType;
import io.github.drompincen.jobengine.runtime.error.InvalidActionPayloadException;
import io.github.drompincen.jobengine.runtime.error.TaskNotFoundException;
import io.github.drompincen.jobengine.runtime.job.ScheduledJobStore;
import io.github.drompincen.jobengine.runtime.port.TaskDirectory;
import io.github.drompincen.jobengine.runtime.port.TaskInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/** Schedules a one-shot agent task that revisits an existing task later. */
@Service
public class FollowUpService {

    private static final Logger log = LoggerFactory.getLogger(FollowUpService.class);

    private final ScheduledJobStore store;
    private final TaskDirectory taskDirectory;
    private final JobAuthoringService authoring;
    private final Clock clock;

    public FollowUpService(ScheduledJobStore store,
                           TaskDirectory taskDirectory,
                           JobAuthoringService authoring,
                           Clock clock) {
        this.store = store;
        this.taskDirectory = taskDirectory;
        this.authoring = authoring;
        this.clock = clock;
    }

    public FollowUpDto createFollowUp(String ownerId, String taskId, CreateFollowUpRequest request) {
        TaskInfo task = taskDirectory.findTask(ownerId, taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        if (JobAuthoringService.isBlank(request.reason())) {
            throw new InvalidActionPayloadException("A follow-up needs a reason");
        }
        String reason = request.reason().trim();
        Instant checkAt = RunAtParser.parseFuture(request.checkAt(), clock.instant());
        String instruction = JobAuthoringService.firstNonBlank(request.instruction(),
                "Follow up on task \"" + task.title() + "\": " + reason);

        ScheduledJobDocument job = new ScheduledJobDocument();
        job.setOwnerId(ownerId);
        job.setJobKind(JobKind.FOLLOW_UP);
        job.setScheduleType(ScheduleType.ONCE);
        job.setRunAt(checkAt);
        job.setTimezone(authoring.defaultTimezone());
        job.setActionType(ActionType.AGENT_TASK);
        job.setActionPayload(new AgentTaskPayload(instruction, taskId, null, null).toMap());
        job.setTaskId(taskId);
        job.setProjectId(task.projectId());
        job.setTitle("Follow-up: " + task.title());
        job.setDescription(reason);
        ScheduledJobDocument saved = store.create(job);

        taskDirectory.appendComment(taskId, ownerId, "Scheduled follow-up for " + checkAt + ": " + reason);
        log.info("Scheduled follow-up {} for task {} at {}", saved.getJobId(), taskId, checkAt);

        return new FollowUpDto(saved.getJobId(), taskId, task.title(), checkAt,
                "Follow-up scheduled for " + checkAt);
    }
}
