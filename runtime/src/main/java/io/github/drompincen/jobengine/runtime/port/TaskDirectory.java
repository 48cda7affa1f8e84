package io.github.drompincen.jobengine.runtime.port;

import java.util.Optional;

/** Read access to the owner's tasks and projects, plus the task comment trail. */
public interface TaskDirectory {

    Optional<TaskInfo> findTask(String ownerId, String taskId);

    void appendComment(String taskId, String ownerId, String text);

    boolean projectExists(String ownerId, String projectId);
}
