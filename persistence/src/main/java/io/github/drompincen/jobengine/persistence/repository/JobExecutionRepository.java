package io.github.drompincen.jobengine.persistence.repository;

import io.github.drompincen.jobengine.persistence.document.JobExecutionDocument;
import io.github.drompincen.jobengine.protocol.api.ExecutionOutcome;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface JobExecutionRepository extends MongoRepository<JobExecutionDocument, String> {
    Page<JobExecutionDocument> findByJobIdAndOwnerIdOrderByStartedAtDesc(
            String jobId, String ownerId, Pageable pageable);
    Page<JobExecutionDocument> findByOwnerIdOrderByStartedAtDesc(String ownerId, Pageable pageable);
    long countByJobIdAndOutcome(String jobId, ExecutionOutcome outcome);
}
