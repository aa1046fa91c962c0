package com.groupdispatch.core.cursor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groupdispatch.core.persistence.DispatchStore;
import com.groupdispatch.core.persistence.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Owns the two message watermarks: the global-seen watermark of the dispatch loop and
 * the per-conversation agent-delivered watermarks.
 * <p>
 * Every mutation is written to the {@link DispatchStore} first and applied in memory only
 * once the write succeeded, so a {@link StoreException} leaves the previous value in place.
 * Writes are serialized on this instance.
 * <p>
 * The agent-delivered advance before an invocation is tentative: if the turn fails before
 * any output reaches the user, {@link #rollbackTurn} restores the pre-turn value, even past
 * messages piped into the failed session meanwhile. Operator skips made through
 * {@link #skipTo} are counted per conversation and survive that rollback.
 * This is a compensating action, not a transaction.
 */
@Service
public class CursorStore {

    private static final Logger log = LoggerFactory.getLogger(CursorStore.class);

    static final String GLOBAL_KEY = "last_timestamp";
    static final String AGENT_KEY = "last_agent_timestamp";

    private static final TypeReference<Map<String, String>> MAP_TYPE = new TypeReference<>() {};

    private final DispatchStore store;
    private final ObjectMapper objectMapper;

    private String globalSeen = "";
    private final Map<String, String> agentDelivered = new HashMap<>();
    private final Map<String, Long> skips = new HashMap<>();

    public CursorStore(DispatchStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    /**
     * Reloads both watermarks from the store. A corrupt agent-delivered entry resets to empty,
     * which re-delivers rather than drops.
     */
    public synchronized void load() {
        globalSeen = store.getRouterState(GLOBAL_KEY).orElse("");
        agentDelivered.clear();
        store.getRouterState(AGENT_KEY).ifPresent(json -> {
            try {
                agentDelivered.putAll(objectMapper.readValue(json, MAP_TYPE));
            } catch (JsonProcessingException e) {
                log.warn("Corrupt {} in router state, resetting: {}", AGENT_KEY, e.getMessage());
            }
        });
        log.info("Loaded cursors: globalSeen={}, {} conversation watermark(s)", globalSeen, agentDelivered.size());
    }

    public synchronized String globalSeen() {
        return globalSeen;
    }

    /**
     * @return the agent-delivered watermark, or the empty string when nothing was delivered yet
     */
    public synchronized String agentDelivered(String conversationId) {
        return agentDelivered.getOrDefault(conversationId, "");
    }

    public synchronized Map<String, String> agentDeliveredSnapshot() {
        return Map.copyOf(agentDelivered);
    }

    /**
     * Moves the global-seen watermark forward. Older values are ignored.
     *
     * @throws StoreException if the new value could not be persisted
     */
    public synchronized void advanceGlobal(String timestamp) {
        if (timestamp == null || timestamp.compareTo(globalSeen) <= 0) {
            return;
        }
        store.setRouterState(GLOBAL_KEY, timestamp);
        globalSeen = timestamp;
    }

    /**
     * Moves a conversation's agent-delivered watermark forward and persists it.
     *
     * @return the value before the advance
     * @throws StoreException if the new value could not be persisted; the watermark is unchanged
     */
    public synchronized String advance(String conversationId, String timestamp) {
        String previous = agentDelivered(conversationId);
        if (timestamp.compareTo(previous) <= 0) {
            return previous;
        }
        persistAgent(conversationId, timestamp);
        log.debug("Advanced agent watermark of {}: {} -> {}", conversationId, previous, timestamp);
        return previous;
    }

    /**
     * Advances a conversation's watermark on operator request ({@code /stop}, {@code /restart},
     * shutdown) and records the skip so a failing turn does not undo it.
     *
     * @return the value before the advance
     * @throws StoreException if the new value could not be persisted
     */
    public synchronized String skipTo(String conversationId, String timestamp) {
        String previous = advance(conversationId, timestamp);
        skips.merge(conversationId, 1L, Long::sum);
        log.info("Operator skip of {}: {} -> {}", conversationId, previous, agentDelivered(conversationId));
        return previous;
    }

    /**
     * Number of operator skips of a conversation since this instance loaded. Not persisted.
     */
    public synchronized long skipCount(String conversationId) {
        return skips.getOrDefault(conversationId, 0L);
    }

    /**
     * Restores the pre-turn watermark of a failed turn. Messages piped into the session
     * during the turn are re-delivered with it. The rollback is skipped only when an
     * operator skip happened after {@code skipsAtStart} was read.
     *
     * @return true if the rollback was applied
     * @throws StoreException if the restored value could not be persisted
     */
    public synchronized boolean rollbackTurn(String conversationId, String previous, long skipsAtStart) {
        String current = agentDelivered(conversationId);
        if (skipCount(conversationId) != skipsAtStart) {
            log.info("Skipping rollback of {}: operator moved watermark to {}", conversationId, current);
            return false;
        }
        persistAgent(conversationId, previous);
        log.warn("Rolled back agent watermark of {}: {} -> {}", conversationId, current, previous);
        return true;
    }

    /**
     * Restores {@code previous} only if the watermark still holds {@code expectedTentative}.
     * Used when a pipe into a session fails; a watermark moved by a later pipe or turn is left alone.
     *
     * @return true if the rollback was applied
     * @throws StoreException if the restored value could not be persisted
     */
    public synchronized boolean rollbackIfUnchanged(String conversationId, String expectedTentative, String previous) {
        String current = agentDelivered(conversationId);
        if (!current.equals(expectedTentative)) {
            log.info("Skipping rollback of {}: watermark moved on to {}", conversationId, current);
            return false;
        }
        persistAgent(conversationId, previous);
        log.warn("Rolled back agent watermark of {}: {} -> {}", conversationId, expectedTentative, previous);
        return true;
    }

    /**
     * Writes both watermarks as they are now.
     */
    public synchronized void save() {
        store.setRouterState(GLOBAL_KEY, globalSeen);
        store.setRouterState(AGENT_KEY, writeJson(agentDelivered));
    }

    private void persistAgent(String conversationId, String value) {
        Map<String, String> next = new HashMap<>(agentDelivered);
        if (value.isEmpty()) {
            next.remove(conversationId);
        } else {
            next.put(conversationId, value);
        }
        store.setRouterState(AGENT_KEY, writeJson(next));
        agentDelivered.clear();
        agentDelivered.putAll(next);
    }

    private String writeJson(Map<String, String> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cursors", e);
        }
    }
}
