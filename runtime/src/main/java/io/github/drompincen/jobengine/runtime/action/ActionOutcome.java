package io.github.drompincen.jobengine.runtime.action;

public record ActionOutcome(boolean success, String error, String conversationId, String summary) {

    public static ActionOutcome success(String summary) {
        return new ActionOutcome(true, null, null, summary);
    }

    public static ActionOutcome started(String conversationId, String summary) {
        return new ActionOutcome(true, null, conversationId, summary);
    }

    public static ActionOutcome failure(String error) {
        return new ActionOutcome(false, error, null, null);
    }
}
