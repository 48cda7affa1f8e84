package io.github.drompincen.jobengine.gateway.controller;

import io.github.drompincen.jobengine.protocol.api.CancelJobRequest;
import io.github.drompincen.jobengine.protocol.api.CreateAgentTaskRequest;
import io.github.drompincen.jobengine.protocol.api.CreateReminderRequest;
import io.github.drompincen.jobengine.protocol.api.JobExecutionDto;
import io.github.drompincen.jobengine.protocol.api.JobKind;
import io.github.drompincen.jobengine.protocol.api.JobStatus;
import io.github.drompincen.jobengine.protocol.api.JobStatusChangeRequest;
import io.github.drompincen.jobengine.protocol.api.ScheduledJobDto;
import io.github.drompincen.jobengine.protocol.api.UpdateJobDetailsRequest;
import io.github.drompincen.jobengine.protocol.api.UpdateScheduleRequest;
import io.github.drompincen.jobengine.runtime.authoring.JobAuthoringService;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/owners/{ownerId}/jobs")
public class ScheduledJobController {

    private final JobAuthoringService authoringService;

    public ScheduledJobController(JobAuthoringService authoringService) {
        this.authoringService = authoringService;
    }

    @PostMapping("/reminders")
    public ResponseEntity<ScheduledJobDto> createReminder(@PathVariable String ownerId,
                                                          @RequestBody CreateReminderRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authoringService.createReminder(ownerId, req));
    }

    @PostMapping("/agent-tasks")
    public ResponseEntity<ScheduledJobDto> createAgentTask(@PathVariable String ownerId,
                                                           @RequestBody CreateAgentTaskRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authoringService.createAgentTask(ownerId, req));
    }

    @GetMapping
    public List<ScheduledJobDto> list(@PathVariable String ownerId,
                                      @RequestParam(required = false) JobStatus status,
                                      @RequestParam(required = false) JobKind jobKind,
                                      @RequestParam(required = false) Integer limit) {
        return authoringService.list(ownerId, status, jobKind, limit);
    }

    @GetMapping("/{jobId}")
    public ScheduledJobDto get(@PathVariable String ownerId, @PathVariable String jobId) {
        return authoringService.get(ownerId, jobId);
    }

    @PatchMapping("/{jobId}")
    public ScheduledJobDto updateDetails(@PathVariable String ownerId, @PathVariable String jobId,
                                         @RequestBody UpdateJobDetailsRequest req) {
        return authoringService.updateDetails(ownerId, jobId, req);
    }

    @PutMapping("/{jobId}/schedule")
    public ScheduledJobDto updateSchedule(@PathVariable String ownerId, @PathVariable String jobId,
                                          @RequestBody UpdateScheduleRequest req) {
        return authoringService.updateSchedule(ownerId, jobId, req);
    }

    @PutMapping("/{jobId}/status")
    public ScheduledJobDto changeStatus(@PathVariable String ownerId, @PathVariable String jobId,
                                        @RequestBody JobStatusChangeRequest req) {
        return authoringService.pauseOrResume(ownerId, jobId, req.status());
    }

    @PostMapping("/{jobId}/cancel")
    public ScheduledJobDto cancel(@PathVariable String ownerId, @PathVariable String jobId,
                                  @RequestBody(required = false) CancelJobRequest req) {
        return authoringService.cancel(ownerId, jobId, req != null ? req.reason() : null);
    }

    @GetMapping("/{jobId}/executions")
    public Page<JobExecutionDto> executions(@PathVariable String ownerId, @PathVariable String jobId,
                                            @RequestParam(defaultValue = "0") int page,
                                            @RequestParam(defaultValue = "20") int size) {
        return authoringService.listExecutions(ownerId, jobId, page, size);
    }
}
