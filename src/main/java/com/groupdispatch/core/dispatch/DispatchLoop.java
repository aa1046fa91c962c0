package com.groupdispatch.core.dispatch;

import com.groupdispatch.channel.TypingManager;
import com.groupdispatch.core.cursor.CursorStore;
import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.InboundMessage;
import com.groupdispatch.core.model.NewMessages;
import com.groupdispatch.core.persistence.DispatchStore;
import com.groupdispatch.core.persistence.StoreException;
import com.groupdispatch.core.queue.ConversationQueue;
import com.groupdispatch.core.queue.SubmitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Polls the store for new messages of registered conversations and hands them on.
 * <p>
 * New messages move the global-seen watermark. Per conversation, a batch that passes
 * trigger gating is piped into the live sandbox if there is one; otherwise a message check
 * is queued and the {@link ConversationProcessor} takes over.
 */
@Service
public class DispatchLoop {

    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    private final ConversationRegistry registry;
    private final DispatchStore store;
    private final CursorStore cursors;
    private final TriggerPolicy triggerPolicy;
    private final ConversationQueue queue;
    private final TypingManager typing;
    private final DispatchProperties properties;

    private volatile boolean running;
    private volatile Instant lastPollAt;
    private Thread thread;

    public DispatchLoop(ConversationRegistry registry,
                        DispatchStore store,
                        CursorStore cursors,
                        TriggerPolicy triggerPolicy,
                        ConversationQueue queue,
                        TypingManager typing,
                        DispatchProperties properties) {
        this.registry = registry;
        this.store = store;
        this.cursors = cursors;
        this.triggerPolicy = triggerPolicy;
        this.queue = queue;
        this.typing = typing;
        this.properties = properties;
    }

    public synchronized void start() {
        if (running) {
            log.debug("Dispatch loop already running");
            return;
        }
        running = true;
        thread = new Thread(this::run, "dispatch-loop");
        thread.setDaemon(true);
        thread.start();
        log.info("Dispatch loop started (trigger: @{}, interval {}ms)",
                properties.getAssistantName(), properties.getPollIntervalMs());
    }

    public synchronized void stop() {
        running = false;
        if (thread != null) {
            thread.interrupt();
            thread = null;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public Instant lastPollAt() {
        return lastPollAt;
    }

    private void run() {
        while (running) {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                log.error("Error in dispatch loop", e);
            }
            try {
                Thread.sleep(properties.getPollIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * One polling pass.
     *
     * @return number of conversations that received messages (piped or queued)
     */
    public int pollOnce() {
        lastPollAt = Instant.now();
        Set<String> ids = registry.ids();
        if (ids.isEmpty()) {
            return 0;
        }
        NewMessages batch = store.getNewMessages(ids, cursors.globalSeen(), properties.getAssistantName());
        if (batch.messages().isEmpty()) {
            return 0;
        }
        log.info("{} new message(s)", batch.messages().size());
        cursors.advanceGlobal(batch.newTimestamp());

        Map<String, List<InboundMessage>> byConversation = new LinkedHashMap<>();
        for (InboundMessage m : batch.messages()) {
            byConversation.computeIfAbsent(m.conversationId(), k -> new ArrayList<>()).add(m);
        }

        int handled = 0;
        for (Map.Entry<String, List<InboundMessage>> entry : byConversation.entrySet()) {
            Conversation conversation = registry.get(entry.getKey()).orElse(null);
            if (conversation == null || !triggerPolicy.admits(conversation, entry.getValue())) {
                continue;
            }
            if (dispatch(conversation)) {
                handled++;
            }
        }
        return handled;
    }

    private boolean dispatch(Conversation conversation) {
        String id = conversation.id();
        if (!queue.hasLiveSession(id)) {
            queue.enqueueCheck(id);
            return true;
        }

        List<InboundMessage> pending = store.getMessagesSince(id, cursors.agentDelivered(id),
                properties.getAssistantName());
        if (pending.isEmpty()) {
            // A turn already picked these up.
            return false;
        }
        String tentative = pending.get(pending.size() - 1).timestamp();
        String previous;
        try {
            previous = cursors.advance(id, tentative);
        } catch (StoreException e) {
            log.error("Cannot advance watermark of {}, queuing a check instead", id, e);
            queue.enqueueCheck(id);
            return true;
        }

        if (queue.submit(id, MessageFormatter.formatMessages(pending)) == SubmitResult.PIPED) {
            typing.start(id);
            log.debug("Piped {} message(s) into active sandbox of {}", pending.size(), id);
            return true;
        }

        try {
            cursors.rollbackIfUnchanged(id, tentative, previous);
        } catch (StoreException e) {
            log.error("Rollback of {} after failed pipe could not be persisted", id, e);
        }
        queue.enqueueCheck(id);
        return true;
    }
}
