package com.groupdispatch.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the dispatch engine, used for SSE streaming.
 *
 * @param eventType      e.g. "sandbox.started", "turn.completed", "cursor.rolled_back"
 * @param conversationId the conversation this event belongs to
 * @param payload        arbitrary key-value data associated with the event
 * @param timestamp      when the event occurred
 */
public record DispatchEvent(
    String eventType,
    String conversationId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static DispatchEvent of(String eventType, String conversationId, Map<String, Object> payload) {
        return new DispatchEvent(eventType, conversationId, payload, Instant.now());
    }
}
