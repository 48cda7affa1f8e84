package io.github.drompincen.jobengine.persistence.repository;

import io.github.drompincen.jobengine.persistence.document.TaskCommentDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface TaskCommentRepository extends MongoRepository<TaskCommentDocument, String> {
    List<TaskCommentDocument> findByTaskIdOrderByCreatedAtAsc(String taskId);
}
