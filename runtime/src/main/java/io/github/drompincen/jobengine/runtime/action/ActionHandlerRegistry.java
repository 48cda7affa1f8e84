package io.github.drompincen.jobengine.runtime.action;

import io.github.drompincen.jobengine.protocol.api.ActionType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class ActionHandlerRegistry {

    private final Map<ActionType, ActionHandler> handlers = new EnumMap<>(ActionType.class);

    public ActionHandlerRegistry(List<ActionHandler> handlers) {
        for (ActionHandler handler : handlers) {
            ActionHandler previous = this.handlers.put(handler.actionType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for " + handler.actionType() + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
    }

    public ActionHandler handlerFor(ActionType actionType) {
        ActionHandler handler = handlers.get(actionType);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for " + actionType);
        }
        return handler;
    }
}
