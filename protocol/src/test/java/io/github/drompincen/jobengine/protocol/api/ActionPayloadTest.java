package io.github.drompincen.jobengine.protocol.api;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ActionPayloadTest {

    @Test
    void notifyPayloadUsesStoredKeys() {
        NotifyPayload payload = new NotifyPayload("call mom", "email");

        assertThat(payload.actionType()).isEqualTo(ActionType.NOTIFY);
        assertThat(payload.toMap()).containsExactly(
                Map.entry("message", "call mom"),
                Map.entry("preferred_channel", "email"));
    }

    @Test
    void notifyPayloadOmitsMissingChannel() {
        assertThat(new NotifyPayload("hi", null).toMap()).containsOnlyKeys("message");
    }

    @Test
    void agentTaskPayloadCarriesLinks() {
        AgentTaskPayload payload = new AgentTaskPayload("check inbox", "task-1", null, "app");

        assertThat(payload.actionType()).isEqualTo(ActionType.AGENT_TASK);
        assertThat(payload.toMap())
                .containsEntry("instruction", "check inbox")
                .containsEntry("task_id", "task-1")
                .containsEntry("preferred_channel", "app")
                .doesNotContainKey("project_id");
    }
}
