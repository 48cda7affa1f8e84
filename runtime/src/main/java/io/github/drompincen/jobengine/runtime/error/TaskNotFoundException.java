package io.github.drompincen.jobengine.runtime.error;

public class TaskNotFoundException extends JobEngineException {

    public TaskNotFoundException(String taskId) {
        super("TASK_NOT_FOUND", "Task not found: " + taskId);
    }
}
