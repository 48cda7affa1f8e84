package io.github.drompincen.jobengine.persistence.repository;

import io.github.drompincen.jobengine.persistence.document.ProjectDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ProjectRepository extends MongoRepository<ProjectDocument, String> {
    boolean existsByProjectIdAndOwnerId(String projectId, String ownerId);
}
