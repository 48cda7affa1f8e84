package io.github.drompincen.jobengine.runtime.adapter;

import io.github.drompincen.jobengine.persistence.document.TaskCommentDocument;
import io.github.drompincen.jobengine.persistence.document.TaskDocument;
import io.github.drompincen.jobengine.persistence.repository.ProjectRepository;
import io.github.drompincen.jobengine.persistence.repository.TaskCommentRepository;
import io.github.drompincen.jobengine.persistence.repository.TaskRepository;
import io.github.drompincen.jobengine.runtime.port.TaskDirectory;
import io.github.drompincen.jobengine.runtime.port.TaskInfo;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

@Component
public class MongoTaskDirectory implements TaskDirectory {

    private final TaskRepository taskRepository;
    private final TaskCommentRepository commentRepository;
    private final ProjectRepository projectRepository;
    private final Clock clock;

    public MongoTaskDirectory(TaskRepository taskRepository,
                              TaskCommentRepository commentRepository,
                              ProjectRepository projectRepository,
                              Clock clock) {
        this.taskRepository = taskRepository;
        this.commentRepository = commentRepository;
        this.projectRepository = projectRepository;
        this.clock = clock;
    }

    @Override
    public Optional<TaskInfo> findTask(String ownerId, String taskId) {
        return taskRepository.findByTaskIdAndOwnerId(taskId, ownerId)
                .map(MongoTaskDirectory::toInfo);
    }

    @Override
    public void appendComment(String taskId, String ownerId, String text) {
        TaskCommentDocument comment = new TaskCommentDocument();
        comment.setCommentId(UUID.randomUUID().toString());
        comment.setTaskId(taskId);
        comment.setAuthorType("agent");
        comment.setAuthorId(ownerId);
        comment.setCommentType("note");
        comment.setContent(text);
        comment.setCreatedAt(clock.instant());
        commentRepository.save(comment);
    }

    @Override
    public boolean projectExists(String ownerId, String projectId) {
        return projectRepository.existsByProjectIdAndOwnerId(projectId, ownerId);
    }

    private static TaskInfo toInfo(TaskDocument doc) {
        return new TaskInfo(doc.getTaskId(), doc.getTitle(), doc.getStatus(), doc.getDueDate(), doc.getProjectId());
    }
}
