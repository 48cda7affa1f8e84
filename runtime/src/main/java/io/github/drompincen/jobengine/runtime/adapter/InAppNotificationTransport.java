package io.github.drompincen.jobengine.runtime.adapter;

import io.github.drompincen.jobengine.persistence.document.ConversationDocument;
import io.github.drompincen.jobengine.persistence.document.MessageDocument;
import io.github.drompincen.jobengine.persistence.document.NotificationDocument;
import io.github.drompincen.jobengine.persistence.repository.ConversationRepository;
import io.github.drompincen.jobengine.persistence.repository.MessageRepository;
import io.github.drompincen.jobengine.persistence.repository.NotificationRepository;
import io.github.drompincen.jobengine.runtime.port.DeliveryResult;
import io.github.drompincen.jobengine.runtime.port.NotificationMessage;
import io.github.drompincen.jobengine.runtime.port.NotificationTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Default transport: posts the notification as an assistant message in the owner's most
 * recent active conversation and keeps a notification record for the inbox.
 */
@Component
public class InAppNotificationTransport implements NotificationTransport {

    private static final Logger log = LoggerFactory.getLogger(InAppNotificationTransport.class);

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public InAppNotificationTransport(ConversationRepository conversationRepository,
                                      MessageRepository messageRepository,
                                      NotificationRepository notificationRepository,
                                      Clock clock) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.notificationRepository = notificationRepository;
        this.clock = clock;
    }

    @Override
    public DeliveryResult send(String ownerId, String channel, NotificationMessage message) {
        Instant now = clock.instant();
        ConversationDocument conversation = conversationRepository
                .findFirstByOwnerIdAndStatusOrderByCreatedAtDesc(ownerId, ConversationDocument.STATUS_ACTIVE)
                .orElseGet(() -> createInbox(ownerId, channel, now));

        MessageDocument msg = new MessageDocument();
        msg.setMessageId(UUID.randomUUID().toString());
        msg.setConversationId(conversation.getConversationId());
        msg.setRole("assistant");
        msg.setContent(message.content());
        Map<String, String> metadata = new HashMap<>();
        metadata.put("type", "scheduled_notification");
        if (message.jobId() != null) metadata.put("jobId", message.jobId());
        msg.setMetadata(metadata);
        msg.setTimestamp(now);
        messageRepository.save(msg);

        NotificationDocument notification = new NotificationDocument();
        notification.setNotificationId(UUID.randomUUID().toString());
        notification.setOwnerId(ownerId);
        notification.setType("reminder");
        notification.setChannel(channel);
        notification.setTitle(message.title());
        notification.setBody(message.content());
        if (message.taskId() != null) {
            notification.setLinkType("task");
            notification.setLinkId(message.taskId());
        }
        notification.setCreatedAt(now);
        notificationRepository.save(notification);

        log.debug("Delivered notification {} to conversation {} (channel {})",
                notification.getNotificationId(), conversation.getConversationId(), channel);
        return DeliveryResult.accepted(notification.getNotificationId());
    }

    private ConversationDocument createInbox(String ownerId, String channel, Instant now) {
        ConversationDocument conversation = new ConversationDocument();
        conversation.setConversationId(UUID.randomUUID().toString());
        conversation.setOwnerId(ownerId);
        conversation.setChannelType(channel);
        conversation.setStatus(ConversationDocument.STATUS_ACTIVE);
        conversation.setTitle("Notifications");
        conversation.setCreatedAt(now);
        conversation.setUpdatedAt(now);
        return conversationRepository.save(conversation);
    }
}
