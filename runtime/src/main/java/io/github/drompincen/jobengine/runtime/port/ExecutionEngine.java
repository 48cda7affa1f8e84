package io.github.drompincen.jobengine.runtime.port;

/**
 * Starts an asynchronous agent execution. Implementations return as soon as the run has
 * been handed off; its eventual outcome is not reported back.
 */
public interface ExecutionEngine {

    StartResult startTask(AgentTaskRequest request);
}
