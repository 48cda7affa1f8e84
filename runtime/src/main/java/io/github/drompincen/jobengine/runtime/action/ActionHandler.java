package io.github.drompincen.jobengine.runtime.action;

import io.github.drompincen.jobengine.protocol.api.ActionType;

/**
 * Executes one kind of job action. Handlers never write to the job store; the dispatcher
 * records whatever outcome they return. A thrown exception counts as a failure.
 */
public interface ActionHandler {

    ActionType actionType();

    ActionOutcome execute(DispatchContext context);
}
