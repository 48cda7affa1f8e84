package io.github.drompincen.jobengine.protocol.api;

import java.util.LinkedHashMap;
import java.util.Map;

public record NotifyPayload(String message, String preferredChannel) implements ActionPayload {

    @Override
    public ActionType actionType() {
        return ActionType.NOTIFY;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(MESSAGE, message);
        if (preferredChannel != null) map.put(PREFERRED_CHANNEL, preferredChannel);
        return map;
    }
}
