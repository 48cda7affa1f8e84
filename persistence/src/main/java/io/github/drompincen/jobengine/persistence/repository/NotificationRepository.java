package io.github.drompincen.jobengine.persistence.repository;

import io.github.drompincen.jobengine.persistence.document.NotificationDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface NotificationRepository extends MongoRepository<NotificationDocument, String> {
    List<NotificationDocument> findByOwnerIdOrderByCreatedAtDesc(String ownerId);
    long countByOwnerIdAndRead(String ownerId, boolean read);
}
