package io.github.drompincen.jobengine.persistence.repository;

import io.github.drompincen.jobengine.persistence.document.MessageDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface MessageRepository extends MongoRepository<MessageDocument, String> {
    List<MessageDocument> findByConversationIdOrderByTimestampAsc(String conversationId);
}
