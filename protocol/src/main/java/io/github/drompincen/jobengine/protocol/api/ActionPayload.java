package io.github.drompincen.jobengine.protocol.api;

import java.util.Map;

/**
 * Typed view of a job's action payload. Stored as a plain map; the map keys are the
 * constants declared here.
 */
public interface ActionPayload {

    String MESSAGE = "message";
    String PREFERRED_CHANNEL = "preferred_channel";
    String INSTRUCTION = "instruction";
    String TASK_ID = "task_id";
    String PROJECT_ID = "project_id";

    ActionType actionType();

    Map<String, Object> toMap();
}
