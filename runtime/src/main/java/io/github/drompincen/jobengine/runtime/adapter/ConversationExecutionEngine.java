package io.github.drompincen.jobengine.runtime.adapter;

import io.github.drompincen.jobengine.persistence.document.ConversationDocument;
import io.github.drompincen.jobengine.persistence.document.MessageDocument;
import io.github.drompincen.jobengine.persistence.repository.ConversationRepository;
import io.github.drompincen.jobengine.persistence.repository.MessageRepository;
import io.github.drompincen.jobengine.runtime.port.AgentTaskRequest;
import io.github.drompincen.jobengine.runtime.port.ExecutionEngine;
import io.github.drompincen.jobengine.runtime.port.StartResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Default execution engine. Opens a fresh conversation seeded with the instruction and
 * announces it with an {@link AgentTaskStartedEvent}; whoever runs the agent loop listens
 * for that event.
 */
@Component
public class ConversationExecutionEngine implements ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ConversationExecutionEngine.class);

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ConversationExecutionEngine(ConversationRepository conversationRepository,
                                       MessageRepository messageRepository,
                                       ApplicationEventPublisher eventPublisher,
                                       Clock clock) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    public StartResult startTask(AgentTaskRequest request) {
        Instant now = clock.instant();

        ConversationDocument conversation = new ConversationDocument();
        conversation.setConversationId(UUID.randomUUID().toString());
        conversation.setOwnerId(request.ownerId());
        conversation.setChannelType("app");
        conversation.setStatus(ConversationDocument.STATUS_ACTIVE);
        conversation.setTitle("Scheduled: " + request.title());
        Map<String, String> metadata = new HashMap<>();
        metadata.put("type", "scheduled_job");
        metadata.put("jobId", request.jobId());
        if (request.taskId() != null) metadata.put("taskId", request.taskId());
        if (request.projectId() != null) metadata.put("projectId", request.projectId());
        conversation.setMetadata(metadata);
        conversation.setCreatedAt(now);
        conversation.setUpdatedAt(now);
        conversationRepository.save(conversation);

        // Seed the user turn so the agent loop has something to answer
        MessageDocument msg = new MessageDocument();
        msg.setMessageId(UUID.randomUUID().toString());
        msg.setConversationId(conversation.getConversationId());
        msg.setRole("user");
        msg.setContent("[Scheduled Task: " + request.title() + "]\n\n" + request.instruction());
        msg.setTimestamp(now);
        messageRepository.save(msg);

        eventPublisher.publishEvent(new AgentTaskStartedEvent(
                request.ownerId(), request.jobId(), conversation.getConversationId(), request.instruction()));
        log.info("Started agent task for job {} in conversation {}",
                request.jobId(), conversation.getConversationId());
        return StartResult.started(conversation.getConversationId());
    }
}
