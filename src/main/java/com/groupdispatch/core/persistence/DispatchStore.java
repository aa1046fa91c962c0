package com.groupdispatch.core.persistence;

import com.groupdispatch.core.model.ChatInfo;
import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.InboundMessage;
import com.groupdispatch.core.model.NewMessages;
import com.groupdispatch.core.model.ScheduledTask;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable state of the dispatch engine.
 * Implementations: {@link JdbcDispatchStore} (SQLite/PostgreSQL), {@link InMemoryDispatchStore} (fallback).
 * <p>
 * All methods throw {@link StoreException} on I/O failure.
 */
public interface DispatchStore {

    // -- Conversation registration --

    Map<String, Conversation> getAllConversations();

    Optional<Conversation> getConversation(String id);

    void saveConversation(Conversation conversation);

    void deleteConversation(String id);

    // -- Chat metadata --

    /**
     * Records that a chat was seen. A null name keeps the previously stored name.
     */
    void storeChatMetadata(String id, String name, String timestamp);

    List<ChatInfo> getAllChats();

    // -- Messages --

    /** Appends a message; storing the same (id, conversation) twice is a no-op. */
    void storeMessage(InboundMessage message);

    /**
     * Messages across the given conversations newer than {@code sinceTimestamp},
     * excluding assistant-authored ones.
     *
     * @param botPrefix legacy marker: content starting with {@code botPrefix + ":"} is treated as assistant output
     */
    NewMessages getNewMessages(Collection<String> conversationIds, String sinceTimestamp, String botPrefix);

    /**
     * Messages of one conversation newer than {@code sinceTimestamp}, oldest first,
     * excluding assistant-authored ones.
     */
    List<InboundMessage> getMessagesSince(String conversationId, String sinceTimestamp, String botPrefix);

    // -- Router key-value state --

    Optional<String> getRouterState(String key);

    void setRouterState(String key, String value);

    // -- Continuation tokens keyed by conversation folder --

    Map<String, String> getAllSessions();

    void setSession(String folder, String token);

    // -- Scheduled tasks --

    void saveTask(ScheduledTask task);

    Optional<ScheduledTask> getTask(String id);

    List<ScheduledTask> getAllTasks();

    /** Active tasks whose next run is at or before {@code now}. */
    List<ScheduledTask> getDueTasks(String now);

    void deleteTask(String id);
}
