package io.github.drompincen.jobengine.runtime.job;

import io.github.drompincen.jobengine.protocol.api.ActionPayload;
import io.github.drompincen.jobengine.protocol.api.ActionType;
import io.github.drompincen.jobengine.protocol.api.AgentTaskPayload;
import io.github.drompincen.jobengine.protocol.api.NotifyPayload;
import io.github.drompincen.jobengine.runtime.error.InvalidActionPayloadException;

import java.util.Map;

/** Converts between the stored payload map and the typed payload for an action type. */
public final class ActionPayloads {

    private ActionPayloads() {}

    public static ActionPayload fromMap(ActionType actionType, Map<String, Object> map) {
        if (actionType == null) {
            throw new InvalidActionPayloadException("Action type is required");
        }
        if (map == null) {
            throw new InvalidActionPayloadException("Action payload is required for " + actionType);
        }
        return switch (actionType) {
            case NOTIFY -> new NotifyPayload(
                    string(map, ActionPayload.MESSAGE),
                    string(map, ActionPayload.PREFERRED_CHANNEL));
            case AGENT_TASK -> new AgentTaskPayload(
                    string(map, ActionPayload.INSTRUCTION),
                    string(map, ActionPayload.TASK_ID),
                    string(map, ActionPayload.PROJECT_ID),
                    string(map, ActionPayload.PREFERRED_CHANNEL));
        };
    }

    /**
     * Checks the map carries what its handler needs: a message for notify, an instruction
     * for agent tasks. Returns the typed payload.
     */
    public static ActionPayload validate(ActionType actionType, Map<String, Object> map) {
        ActionPayload payload = fromMap(actionType, map);
        if (payload instanceof NotifyPayload notify && isBlank(notify.message())) {
            throw new InvalidActionPayloadException("Notify payload requires a non-empty message");
        }
        if (payload instanceof AgentTaskPayload task && isBlank(task.instruction())) {
            throw new InvalidActionPayloadException("Agent task payload requires a non-empty instruction");
        }
        return payload;
    }

    private static String string(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (!(value instanceof String s)) {
            throw new InvalidActionPayloadException("Payload field '" + key + "' must be a string");
        }
        return s;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
