package io.github.drompincen.jobengine.runtime.port;

public record StartResult(boolean started, String conversationId, String error) {

    public static StartResult started(String conversationId) {
        return new StartResult(true, conversationId, null);
    }

    public static StartResult failure(String error) {
        return new StartResult(false, null, error);
    }
}
