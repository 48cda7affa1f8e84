package io.github.drompincen.jobengine.runtime.adapter;

/** Published when a scheduled agent task has been seeded into a new conversation. */
public record AgentTaskStartedEvent(String ownerId, String jobId, String conversationId, String instruction) {}
