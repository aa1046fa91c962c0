package com.groupdispatch.core.dispatch;

import com.groupdispatch.channel.ChannelRouter;
import com.groupdispatch.channel.TypingManager;
import com.groupdispatch.core.cursor.CursorStore;
import com.groupdispatch.core.events.DispatchEvent;
import com.groupdispatch.core.events.EventBus;
import com.groupdispatch.core.logging.MdcContext;
import com.groupdispatch.core.metrics.DispatchMetrics;
import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.InboundMessage;
import com.groupdispatch.core.persistence.DispatchStore;
import com.groupdispatch.core.persistence.StoreException;
import com.groupdispatch.core.queue.ConversationQueue;
import com.groupdispatch.sandbox.SandboxEvent;
import com.groupdispatch.sandbox.SandboxOutcome;
import com.groupdispatch.sandbox.SandboxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Runs one message turn for a conversation: collects pending messages, applies trigger
 * gating, advances the agent-delivered watermark, invokes the sandbox and relays its output.
 * <p>
 * The watermark is advanced and persisted before the sandbox starts. When the turn fails
 * before anything reached the user, the advance is rolled back so the same messages are
 * retried; once output was delivered, or while shutting down, the advance is kept.
 */
@Service
public class ConversationProcessor {

    private static final Logger log = LoggerFactory.getLogger(ConversationProcessor.class);

    private final ConversationRegistry registry;
    private final DispatchStore store;
    private final CursorStore cursors;
    private final TriggerPolicy triggerPolicy;
    private final SandboxRequestFactory requestFactory;
    private final SandboxRunner runner;
    private final ChannelRouter router;
    private final TypingManager typing;
    private final ConversationQueue queue;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;
    private final EventBus eventBus;

    public ConversationProcessor(ConversationRegistry registry,
                                 DispatchStore store,
                                 CursorStore cursors,
                                 TriggerPolicy triggerPolicy,
                                 SandboxRequestFactory requestFactory,
                                 SandboxRunner runner,
                                 ChannelRouter router,
                                 TypingManager typing,
                                 ConversationQueue queue,
                                 DispatchProperties properties,
                                 DispatchMetrics metrics,
                                 EventBus eventBus) {
        this.registry = registry;
        this.store = store;
        this.cursors = cursors;
        this.triggerPolicy = triggerPolicy;
        this.requestFactory = requestFactory;
        this.runner = runner;
        this.router = router;
        this.typing = typing;
        this.queue = queue;
        this.properties = properties;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    /** What happened during a turn, as seen from the event stream. */
    private static final class TurnTracker {
        volatile boolean outputSent;
        volatile boolean hadError;
    }

    /**
     * @return false if the turn should be retried
     */
    public boolean processMessages(String conversationId) {
        Conversation conversation = registry.get(conversationId).orElse(null);
        if (conversation == null) {
            return true;
        }
        MdcContext.setConversation(conversationId, conversation.folder());
        try {
            return runTurn(conversation);
        } finally {
            MdcContext.clear();
        }
    }

    private boolean runTurn(Conversation conversation) {
        String id = conversation.id();
        List<InboundMessage> pending = store.getMessagesSince(id, cursors.agentDelivered(id),
                properties.getAssistantName());
        if (pending.isEmpty()) {
            return true;
        }
        if (!triggerPolicy.admits(conversation, pending)) {
            log.debug("{} pending message(s) in {} without trigger, waiting", pending.size(), id);
            metrics.recordTurn("skipped");
            return true;
        }

        String prompt = MessageFormatter.formatMessages(pending);
        String tentative = pending.get(pending.size() - 1).timestamp();
        long skipsAtStart = cursors.skipCount(id);
        String previous;
        try {
            previous = cursors.advance(id, tentative);
        } catch (StoreException e) {
            log.error("Cannot advance watermark of {}, turn aborted", id, e);
            metrics.recordTurn("failed");
            return false;
        }

        log.info("Processing {} message(s) for {}", pending.size(), conversation.name());
        eventBus.publish(DispatchEvent.of("turn.started", id, Map.of("messages", pending.size())));

        TurnTracker turn = new TurnTracker();
        SandboxOutcome outcome;
        typing.start(id);
        try {
            outcome = runner.run(requestFactory.forMessages(conversation, prompt),
                    event -> onEvent(id, turn, event));
        } finally {
            typing.stop(id);
        }

        if (outcome.isSuccess() && !turn.hadError) {
            metrics.recordTurn("success");
            eventBus.publish(DispatchEvent.of("turn.completed", id, Map.of("watermark", tentative)));
            return true;
        }

        String reason = outcome.error() != null ? outcome.error() : "sandbox reported error";
        if (queue.isShuttingDown()) {
            log.warn("Turn for {} failed during shutdown ({}), watermark kept", id, reason);
            metrics.recordTurn("failed");
            return false;
        }
        if (turn.outputSent) {
            log.warn("Turn for {} failed after output was sent ({}), watermark kept, not retrying", id, reason);
            metrics.recordTurn("failed");
            eventBus.publish(DispatchEvent.of("turn.failed", id, Map.of("error", reason, "rolledBack", false)));
            return true;
        }

        try {
            if (cursors.rollbackTurn(id, previous, skipsAtStart)) {
                metrics.recordTurn("rolled_back");
                eventBus.publish(DispatchEvent.of("cursor.rolled_back", id, Map.of("watermark", previous)));
            } else {
                metrics.recordTurn("failed");
            }
        } catch (StoreException e) {
            log.error("Rollback of {} could not be persisted", id, e);
            metrics.recordTurn("failed");
        }
        log.warn("Turn for {} failed ({}), will retry", id, reason);
        return false;
    }

    private void onEvent(String conversationId, TurnTracker turn, SandboxEvent event) {
        if (event instanceof SandboxEvent.PartialOutput p) {
            deliver(conversationId, turn, p.text());
        } else if (event instanceof SandboxEvent.Result r) {
            typing.stop(conversationId);
            deliver(conversationId, turn, r.text());
        } else if (event instanceof SandboxEvent.Failure f) {
            typing.stop(conversationId);
            turn.hadError = true;
            if (turn.outputSent && f.userMessage() != null) {
                deliver(conversationId, turn, f.userMessage());
            }
        }
    }

    private void deliver(String conversationId, TurnTracker turn, String raw) {
        if (raw == null) {
            return;
        }
        String text = ChannelRouter.stripInternalTags(raw);
        if (text.isEmpty()) {
            return;
        }
        log.info("Agent output for {}: {}", conversationId, text.length() > 200 ? text.substring(0, 200) : text);
        if (router.routeOutbound(conversationId, router.formatOutbound(conversationId, text))) {
            turn.outputSent = true;
        }
    }
}
