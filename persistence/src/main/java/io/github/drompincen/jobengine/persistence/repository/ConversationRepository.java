package io.github.drompincen.jobengine.persistence.repository;

import io.github.drompincen.jobengine.persistence.document.ConversationDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface ConversationRepository extends MongoRepository<ConversationDocument, String> {
    Optional<ConversationDocument> findFirstByOwnerIdAndStatusOrderByCreatedAtDesc(String ownerId, String status);
    Optional<ConversationDocument> findByConversationIdAndOwnerId(String conversationId, String ownerId);
}
