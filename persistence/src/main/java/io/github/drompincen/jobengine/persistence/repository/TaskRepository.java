package io.github.drompincen.jobengine.persistence.repository;

import io.github.drompincen.jobengine.persistence.document.TaskDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface TaskRepository extends MongoRepository<TaskDocument, String> {
    Optional<TaskDocument> findByTaskIdAndOwnerId(String taskId, String ownerId);
    List<TaskDocument> findByOwnerIdAndStatus(String ownerId, String status);
}
