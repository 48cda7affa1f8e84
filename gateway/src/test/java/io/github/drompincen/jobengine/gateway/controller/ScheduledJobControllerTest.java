package io.github.drompincen.jobengine.gateway.controller;

import io.github.drompincen.jobengine.protocol.api.ActionType;
import io.github.drompincen.jobengine.protocol.api.CancelJobRequest;
import io.github.drompincen.jobengine.protocol.api.CreateAgentTaskRequest;
import io.github.drompincen.jobengine.protocol.api.CreateReminderRequest;
import io.github.drompincen.jobengine.protocol.api.ExecutionOutcome;
import io.github.drompincen.jobengine.protocol.api.JobExecutionDto;
import io.github.drompincen.jobengine.protocol.api.JobKind;
import io.github.drompincen.jobengine.protocol.api.JobStatus;
import io.github.drompincen.jobengine.protocol.api.JobStatusChangeRequest;
import io.github.drompincen.jobengine.protocol.api.ScheduleType;
import io.github.drompincen.jobengine.protocol.api.ScheduledJobDto;
import io.github.drompincen.jobengine.protocol.api.UpdateScheduleRequest;
import io.github.drompincen.jobengine.runtime.authoring.JobAuthoringService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ScheduledJobControllerTest {

    @Mock private JobAuthoringService authoringService;

    private ScheduledJobController controller;

    @BeforeEach
    void setUp() {
        controller = new ScheduledJobController(authoringService);
    }

    private static ScheduledJobDto job(String jobId, JobStatus status) {
        Instant now = Instant.parse("2026-03-05T12:00:00Z");
        return new ScheduledJobDto(jobId, "u1", JobKind.REMINDER, ScheduleType.ONCE, now.plusSeconds(3600), null,
                "UTC", now.plusSeconds(3600), null, ActionType.NOTIFY, Map.of("message", "stretch"), status,
                null, null, null, "Stretch", null, 0, null, 0, 0, null, false, null, now, now);
    }

    @Test
    void createReminder_returnsCreated() {
        CreateReminderRequest req = new CreateReminderRequest("Stretch", "stretch", "2026-03-05T13:00:00Z",
                null, null, null, null, null, null);
        when(authoringService.createReminder("u1", req)).thenReturn(job("j1", JobStatus.ACTIVE));

        ResponseEntity<ScheduledJobDto> response = controller.createReminder("u1", req);

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().jobId()).isEqualTo("j1");
    }

    @Test
    void createAgentTask_returnsCreated() {
        CreateAgentTaskRequest req = new CreateAgentTaskRequest("Weekly review", "Summarize open tasks", null,
                "0 9 * * MON", "America/New_York", null, null, null);
        when(authoringService.createAgentTask("u1", req)).thenReturn(job("j2", JobStatus.ACTIVE));

        ResponseEntity<ScheduledJobDto> response = controller.createAgentTask("u1", req);

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(response.getBody().jobId()).isEqualTo("j2");
    }

    @Test
    void list_passesFiltersThrough() {
        when(authoringService.list("u1", JobStatus.PAUSED, JobKind.REMINDER, 10))
                .thenReturn(List.of(job("j1", JobStatus.PAUSED)));

        List<ScheduledJobDto> jobs = controller.list("u1", JobStatus.PAUSED, JobKind.REMINDER, 10);

        assertThat(jobs).extracting(ScheduledJobDto::jobId).containsExactly("j1");
    }

    // ---- status changes ----

    @Test
    void changeStatus_delegatesToPauseOrResume() {
        when(authoringService.pauseOrResume("u1", "j1", JobStatus.PAUSED)).thenReturn(job("j1", JobStatus.PAUSED));

        ScheduledJobDto dto = controller.changeStatus("u1", "j1", new JobStatusChangeRequest(JobStatus.PAUSED));

        assertThat(dto.status()).isEqualTo(JobStatus.PAUSED);
    }

    @Test
    void cancel_withoutBody_passesNullReason() {
        when(authoringService.cancel(eq("u1"), eq("j1"), isNull())).thenReturn(job("j1", JobStatus.CANCELLED));

        ScheduledJobDto dto = controller.cancel("u1", "j1", null);

        assertThat(dto.status()).isEqualTo(JobStatus.CANCELLED);
        verify(authoringService).cancel("u1", "j1", null);
    }

    @Test
    void cancel_withReason_passesReason() {
        when(authoringService.cancel("u1", "j1", "no longer needed")).thenReturn(job("j1", JobStatus.CANCELLED));

        controller.cancel("u1", "j1", new CancelJobRequest("no longer needed"));

        verify(authoringService).cancel("u1", "j1", "no longer needed");
    }

    @Test
    void updateSchedule_delegates() {
        UpdateScheduleRequest req = new UpdateScheduleRequest(null, "0 8 * * *", "UTC");
        when(authoringService.updateSchedule("u1", "j1", req)).thenReturn(job("j1", JobStatus.ACTIVE));

        assertThat(controller.updateSchedule("u1", "j1", req).jobId()).isEqualTo("j1");
    }

    @Test
    void executions_usesPageAndSize() {
        JobExecutionDto exec = new JobExecutionDto("e1", "j1", Instant.parse("2026-03-05T12:00:00Z"),
                Instant.parse("2026-03-05T12:00:01Z"), Instant.parse("2026-03-05T12:00:02Z"), 1000L, 1,
                ExecutionOutcome.SUCCESS, null, null, null);
        Page<JobExecutionDto> page = new PageImpl<>(List.of(exec), PageRequest.of(1, 5), 6);
        when(authoringService.listExecutions("u1", "j1", 1, 5)).thenReturn(page);

        Page<JobExecutionDto> result = controller.executions("u1", "j1", 1, 5);

        assertThat(result.getContent()).hasSize(1);
        assertThat(result.getTotalElements()).isEqualTo(6);
        verify(authoringService, never()).listExecutions(any(), any(), eq(0), anyInt());
    }
}
