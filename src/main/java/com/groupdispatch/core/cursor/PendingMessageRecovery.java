package com.groupdispatch.core.cursor;

import com.groupdispatch.core.dispatch.ConversationRegistry;
import com.groupdispatch.core.dispatch.DispatchProperties;
import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.InboundMessage;
import com.groupdispatch.core.persistence.DispatchStore;
import com.groupdispatch.core.queue.ConversationQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Startup scan for messages that were never handed to an agent, e.g. because the service
 * stopped mid-turn. Conversations with pending messages get a queued check, the same path
 * live traffic takes.
 */
@Service
public class PendingMessageRecovery {

    private static final Logger log = LoggerFactory.getLogger(PendingMessageRecovery.class);

    private final ConversationRegistry registry;
    private final DispatchStore store;
    private final CursorStore cursors;
    private final ConversationQueue queue;
    private final DispatchProperties properties;

    public PendingMessageRecovery(ConversationRegistry registry, DispatchStore store, CursorStore cursors,
                                  ConversationQueue queue, DispatchProperties properties) {
        this.registry = registry;
        this.store = store;
        this.cursors = cursors;
        this.queue = queue;
        this.properties = properties;
    }

    /**
     * @return number of conversations a check was queued for
     */
    public int recover() {
        int queued = 0;
        for (Conversation conversation : registry.all()) {
            List<InboundMessage> pending = pending(conversation.id());
            if (!pending.isEmpty()) {
                log.info("Recovery: {} unprocessed message(s) in {}", pending.size(), conversation.name());
                queue.enqueueCheck(conversation.id());
                queued++;
            }
        }
        return queued;
    }

    /**
     * Messages of the conversation past its agent-delivered watermark, oldest first.
     */
    public List<InboundMessage> pending(String conversationId) {
        return store.getMessagesSince(conversationId, cursors.agentDelivered(conversationId),
                properties.getAssistantName());
    }
}
