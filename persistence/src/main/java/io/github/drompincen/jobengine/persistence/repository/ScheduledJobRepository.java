package io.github.drompincen.jobengine.persistence.repository;

import io.github.drompincen.jobengine.persistence.document.ScheduledJobDocument;
import io.github.drompincen.jobengine.protocol.api.JobKind;
import io.github.drompincen.jobengine.protocol.api.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ScheduledJobRepository extends MongoRepository<ScheduledJobDocument, String> {
    Optional<ScheduledJobDocument> findByJobIdAndOwnerId(String jobId, String ownerId);
    List<ScheduledJobDocument> findByOwnerIdOrderByNextRunAtAsc(String ownerId, Pageable pageable);
    List<ScheduledJobDocument> findByOwnerIdAndStatusOrderByNextRunAtAsc(
            String ownerId, JobStatus status, Pageable pageable);
    List<ScheduledJobDocument> findByOwnerIdAndJobKindOrderByNextRunAtAsc(
            String ownerId, JobKind jobKind, Pageable pageable);
    List<ScheduledJobDocument> findByOwnerIdAndStatusAndJobKindOrderByNextRunAtAsc(
            String ownerId, JobStatus status, JobKind jobKind, Pageable pageable);
    List<ScheduledJobDocument> findByTaskIdAndOwnerId(String taskId, String ownerId);
    long countByOwnerIdAndStatus(String ownerId, JobStatus status);
}
