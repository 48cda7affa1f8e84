package io.github.drompincen.jobengine.protocol.api;

import java.util.LinkedHashMap;
import java.util.Map;

public record AgentTaskPayload(
        String instruction,
        String taskId,
        String projectId,
        String preferredChannel
) implements ActionPayload {

    @Override
    public ActionType actionType() {
        return ActionType.AGENT_TASK;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(INSTRUCTION, instruction);
        if (taskId != null) map.put(TASK_ID, taskId);
        if (projectId != null) map.put(PROJECT_ID, projectId);
        if (preferredChannel != null) map.put(PREFERRED_CHANNEL, preferredChannel);
        return map;
    }
}
