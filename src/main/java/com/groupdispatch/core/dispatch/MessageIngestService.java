package com.groupdispatch.core.dispatch;

import com.groupdispatch.core.events.DispatchEvent;
import com.groupdispatch.core.events.EventBus;
import com.groupdispatch.core.model.InboundMessage;
import com.groupdispatch.core.model.Timestamps;
import com.groupdispatch.core.persistence.DispatchStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Entry point for inbound messages from channel adapters and the HTTP API.
 * <p>
 * Every message updates chat metadata so unregistered chats can be discovered; only
 * messages of registered conversations are stored for dispatch. Timestamps are assigned
 * here, strictly increasing, so watermark comparisons never tie.
 * <p>
 * A timestamp is issued and its message stored under one lock: the dispatch loop may
 * advance the global watermark past any stored timestamp, so no message may become
 * visible after a younger one.
 */
@Service
public class MessageIngestService {

    private static final Logger log = LoggerFactory.getLogger(MessageIngestService.class);

    private final DispatchStore store;
    private final ConversationRegistry registry;
    private final EventBus eventBus;
    private final Object ingestLock = new Object();

    public MessageIngestService(DispatchStore store, ConversationRegistry registry, EventBus eventBus) {
        this.store = store;
        this.registry = registry;
        this.eventBus = eventBus;
    }

    /**
     * @param chatName chat display name if the platform supplied one (nullable)
     * @return the stored message, or empty if the conversation is not registered
     */
    public Optional<InboundMessage> storeMessage(String conversationId, String messageId, String sender,
                                                 String senderName, String content, boolean fromAssistant,
                                                 String chatName) {
        InboundMessage message;
        String timestamp;
        synchronized (ingestLock) {
            timestamp = Timestamps.next();
            store.storeChatMetadata(conversationId, chatName, timestamp);
            if (registry.get(conversationId).isEmpty()) {
                log.debug("Message for unregistered chat {} recorded as metadata only", conversationId);
                return Optional.empty();
            }
            message = new InboundMessage(messageId, conversationId, sender, senderName, content, timestamp,
                    fromAssistant);
            store.storeMessage(message);
        }
        eventBus.publish(DispatchEvent.of("message.received", conversationId,
                Map.of("messageId", messageId, "timestamp", timestamp)));
        return Optional.of(message);
    }

    /**
     * Records a chat's name without a message, e.g. from a platform metadata sync.
     */
    public void storeChatMetadata(String conversationId, String chatName) {
        store.storeChatMetadata(conversationId, chatName, Timestamps.now());
    }
}
