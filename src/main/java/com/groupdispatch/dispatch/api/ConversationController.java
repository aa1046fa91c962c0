package com.groupdispatch.dispatch.api;

import com.groupdispatch.core.cursor.CursorStore;
import com.groupdispatch.core.cursor.PendingMessageRecovery;
import com.groupdispatch.core.dispatch.ConversationRegistry;
import com.groupdispatch.core.dispatch.MessageIngestService;
import com.groupdispatch.core.engine.DispatchEngine;
import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.InboundMessage;
import com.groupdispatch.core.model.Timestamps;
import com.groupdispatch.core.queue.ConversationQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.*;

/**
 * REST controller for conversation registration, message ingest and operator actions.
 */
@RestController
@RequestMapping("/api/v1/conversations")
public class ConversationController {

    private static final Logger log = LoggerFactory.getLogger(ConversationController.class);

    private final ConversationRegistry registry;
    private final MessageIngestService ingestService;
    private final PendingMessageRecovery pendingMessages;
    private final CursorStore cursors;
    private final ConversationQueue queue;
    private final DispatchEngine engine;
    private final SseStreamingService sseStreamingService;

    public ConversationController(ConversationRegistry registry,
                                  MessageIngestService ingestService,
                                  PendingMessageRecovery pendingMessages,
                                  CursorStore cursors,
                                  ConversationQueue queue,
                                  DispatchEngine engine,
                                  SseStreamingService sseStreamingService) {
        this.registry = registry;
        this.ingestService = ingestService;
        this.pendingMessages = pendingMessages;
        this.cursors = cursors;
        this.queue = queue;
        this.engine = engine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /api/v1/conversations: Registered conversations with their watermark and sandbox state.
     */
    @GetMapping
    public List<Map<String, Object>> listConversations() {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Conversation conversation : registry.all()) {
            result.add(summary(conversation));
        }
        result.sort(Comparator.comparing(m -> (String) m.get("folder")));
        return result;
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getConversation(@PathVariable String id) {
        return registry.get(id)
                .map(c -> ResponseEntity.ok(summary(c)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/conversations: Register a conversation.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> register(@RequestBody RegisterConversationRequest request) {
        if (isBlank(request.id()) || isBlank(request.name()) || isBlank(request.folder())) {
            return ResponseEntity.badRequest().body(Map.of("error", "id, name and folder are required"));
        }
        String trigger = isBlank(request.trigger()) ? null : request.trigger();
        boolean requiresTrigger = request.requiresTrigger() == null || request.requiresTrigger();
        try {
            Conversation registered = registry.register(new Conversation(request.id(), request.name(),
                    request.folder(), trigger, requiresTrigger, Timestamps.now(), request.sandboxSettings()));
            log.info("Registered conversation {} via API", registered.id());
            return ResponseEntity.status(HttpStatus.CREATED).body(summary(registered));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * DELETE /api/v1/conversations/{id}: Unregister a conversation. Stored messages are kept.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> unregister(@PathVariable String id) {
        if (!registry.unregister(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/conversations/{id}/messages: Ingest an inbound message.
     * Messages for unregistered chats only update chat metadata and yield 202.
     */
    @PostMapping("/{id}/messages")
    public ResponseEntity<Map<String, Object>> ingest(@PathVariable String id,
                                                      @RequestBody InboundMessageRequest request) {
        if (request.content() == null || request.sender() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "sender and content are required"));
        }
        String messageId = isBlank(request.messageId()) ? UUID.randomUUID().toString() : request.messageId();
        String senderName = request.senderName() != null ? request.senderName() : request.sender();
        boolean fromAssistant = Boolean.TRUE.equals(request.fromAssistant());

        Optional<InboundMessage> stored = ingestService.storeMessage(id, messageId, request.sender(), senderName,
                request.content(), fromAssistant, request.chatName());
        if (stored.isEmpty()) {
            return ResponseEntity.accepted().body(Map.of("stored", false));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "stored", true,
                "id", stored.get().id(),
                "timestamp", stored.get().timestamp()));
    }

    /**
     * GET /api/v1/conversations/{id}/pending: Messages not yet delivered to an agent.
     */
    @GetMapping("/{id}/pending")
    public ResponseEntity<List<InboundMessage>> pending(@PathVariable String id) {
        if (registry.get(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(pendingMessages.pending(id));
    }

    /**
     * POST /api/v1/conversations/{id}/stop: Ask the running sandbox to stop its turn.
     */
    @PostMapping("/{id}/stop")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable String id) {
        if (registry.get(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        boolean sent = engine.interruptConversation(id);
        return sent ? ResponseEntity.ok(Map.of("conversationId", id, "status", "interrupted"))
                    : ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "No running sandbox"));
    }

    /**
     * POST /api/v1/conversations/{id}/restart: Kill the sandbox; the next message starts a new one.
     */
    @PostMapping("/{id}/restart")
    public ResponseEntity<Map<String, Object>> restart(@PathVariable String id) {
        if (registry.get(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        boolean killed = engine.restartConversation(id);
        return killed ? ResponseEntity.ok(Map.of("conversationId", id, "status", "restarted"))
                      : ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "No running sandbox"));
    }

    /**
     * GET /api/v1/conversations/{id}/events: SSE stream of one conversation's dispatch events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable String id) {
        return sseStreamingService.createEmitter(id);
    }

    private Map<String, Object> summary(Conversation conversation) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", conversation.id());
        m.put("name", conversation.name());
        m.put("folder", conversation.folder());
        m.put("trigger", conversation.trigger());
        m.put("requiresTrigger", conversation.requiresTrigger());
        m.put("privileged", registry.isPrivileged(conversation));
        m.put("addedAt", conversation.addedAt());
        m.put("agentDelivered", cursors.agentDelivered(conversation.id()));
        m.put("sandboxRunning", queue.hasLiveSession(conversation.id()));
        return m;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
