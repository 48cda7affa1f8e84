package io.github.drompincen.jobengine.runtime.action;

import io.github.drompincen.jobengine.persistence.document.ScheduledJobDocument;
import io.github.drompincen.jobengine.protocol.api.ActionType;
import io.github.drompincen.jobengine.protocol.api.AgentTaskPayload;
import io.github.drompincen.jobengine.runtime.port.AgentTaskRequest;
import io.github.drompincen.jobengine.runtime.port.ExecutionEngine;
import io.github.drompincen.jobengine.runtime.port.StartResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Spawn-and-detach: success means the agent run was started, not that it finished. */
@Component
public class AgentTaskActionHandler implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(AgentTaskActionHandler.class);
    static final String DEFAULT_INSTRUCTION = "Execute scheduled task";

    private final ExecutionEngine executionEngine;

    public AgentTaskActionHandler(ExecutionEngine executionEngine) {
        this.executionEngine = executionEngine;
    }

    @Override
    public ActionType actionType() {
        return ActionType.AGENT_TASK;
    }

    @Override
    public ActionOutcome execute(DispatchContext context) {
        ScheduledJobDocument job = context.job();
        AgentTaskPayload payload = (AgentTaskPayload) context.payload();

        String instruction = firstNonBlank(payload.instruction(), job.getDescription(), DEFAULT_INSTRUCTION);
        String taskId = payload.taskId() != null ? payload.taskId() : job.getTaskId();
        String projectId = payload.projectId() != null ? payload.projectId() : job.getProjectId();

        StartResult result = executionEngine.startTask(new AgentTaskRequest(
                job.getOwnerId(), job.getJobId(), job.getTitle(), instruction, taskId, projectId));
        if (!result.started()) {
            log.warn("Execution engine refused job {}: {}", job.getJobId(), result.error());
            return ActionOutcome.failure("Agent task not started: " + result.error());
        }
        return ActionOutcome.started(result.conversationId(), "Agent task started");
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
