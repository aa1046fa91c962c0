package com.groupdispatch.core.persistence;

import com.groupdispatch.core.model.ChatInfo;
import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.InboundMessage;
import com.groupdispatch.core.model.NewMessages;
import com.groupdispatch.core.model.ScheduledTask;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable {@link DispatchStore} used when no DataSource is configured.
 * State is lost on restart.
 */
public class InMemoryDispatchStore implements DispatchStore {

    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();
    private final Map<String, ChatInfo> chats = new ConcurrentHashMap<>();
    private final List<InboundMessage> messages = new ArrayList<>();
    private final Set<String> messageKeys = new HashSet<>();
    private final Map<String, String> routerState = new ConcurrentHashMap<>();
    private final Map<String, String> sessions = new ConcurrentHashMap<>();
    private final Map<String, ScheduledTask> tasks = new ConcurrentHashMap<>();

    @Override
    public Map<String, Conversation> getAllConversations() {
        Map<String, Conversation> result = new LinkedHashMap<>();
        conversations.values().stream()
                .sorted(Comparator.comparing(Conversation::addedAt))
                .forEach(c -> result.put(c.id(), c));
        return result;
    }

    @Override
    public Optional<Conversation> getConversation(String id) {
        return Optional.ofNullable(conversations.get(id));
    }

    @Override
    public void saveConversation(Conversation conversation) {
        conversations.put(conversation.id(), conversation);
    }

    @Override
    public void deleteConversation(String id) {
        conversations.remove(id);
    }

    @Override
    public void storeChatMetadata(String id, String name, String timestamp) {
        chats.merge(id, new ChatInfo(id, name, timestamp), (old, fresh) -> new ChatInfo(
                id,
                fresh.name() != null ? fresh.name() : old.name(),
                old.lastMessageTime() == null || (timestamp != null && timestamp.compareTo(old.lastMessageTime()) > 0)
                        ? timestamp : old.lastMessageTime()));
    }

    @Override
    public List<ChatInfo> getAllChats() {
        return chats.values().stream()
                .sorted(Comparator.comparing(ChatInfo::lastMessageTime,
                        Comparator.nullsLast(Comparator.<String>reverseOrder())))
                .toList();
    }

    @Override
    public synchronized void storeMessage(InboundMessage message) {
        if (messageKeys.add(message.id() + "\u0000" + message.conversationId())) {
            messages.add(message);
        }
    }

    @Override
    public synchronized NewMessages getNewMessages(Collection<String> conversationIds, String sinceTimestamp,
                                                   String botPrefix) {
        Set<String> ids = new HashSet<>(conversationIds);
        List<InboundMessage> result = messages.stream()
                .filter(m -> ids.contains(m.conversationId()))
                .filter(m -> isAfter(m, sinceTimestamp) && !isAssistant(m, botPrefix))
                .sorted(Comparator.comparing(InboundMessage::timestamp))
                .toList();
        String newest = result.isEmpty() ? sinceTimestamp : result.get(result.size() - 1).timestamp();
        return new NewMessages(result, newest);
    }

    @Override
    public synchronized List<InboundMessage> getMessagesSince(String conversationId, String sinceTimestamp,
                                                              String botPrefix) {
        return messages.stream()
                .filter(m -> m.conversationId().equals(conversationId))
                .filter(m -> isAfter(m, sinceTimestamp) && !isAssistant(m, botPrefix))
                .sorted(Comparator.comparing(InboundMessage::timestamp))
                .toList();
    }

    @Override
    public Optional<String> getRouterState(String key) {
        return Optional.ofNullable(routerState.get(key));
    }

    @Override
    public void setRouterState(String key, String value) {
        routerState.put(key, value);
    }

    @Override
    public Map<String, String> getAllSessions() {
        return Map.copyOf(sessions);
    }

    @Override
    public void setSession(String folder, String token) {
        sessions.put(folder, token);
    }

    @Override
    public void saveTask(ScheduledTask task) {
        tasks.put(task.id(), task);
    }

    @Override
    public Optional<ScheduledTask> getTask(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    @Override
    public List<ScheduledTask> getAllTasks() {
        return tasks.values().stream()
                .sorted(Comparator.comparing(ScheduledTask::createdAt).reversed())
                .toList();
    }

    @Override
    public List<ScheduledTask> getDueTasks(String now) {
        return tasks.values().stream()
                .filter(t -> t.status() == ScheduledTask.Status.ACTIVE)
                .filter(t -> t.nextRun() != null && t.nextRun().compareTo(now) <= 0)
                .sorted(Comparator.comparing(ScheduledTask::nextRun))
                .toList();
    }

    @Override
    public void deleteTask(String id) {
        tasks.remove(id);
    }

    private static boolean isAfter(InboundMessage m, String since) {
        return since == null || m.timestamp().compareTo(since) > 0;
    }

    private static boolean isAssistant(InboundMessage m, String botPrefix) {
        return m.fromAssistant() || (m.content() != null && m.content().startsWith(botPrefix + ":"));
    }
}
