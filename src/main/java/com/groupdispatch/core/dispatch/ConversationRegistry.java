package com.groupdispatch.core.dispatch;

import com.groupdispatch.core.model.AvailableConversation;
import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.ScheduledTask;
import com.groupdispatch.core.persistence.DispatchStore;
import com.groupdispatch.sandbox.EnvironmentSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Registered conversations, loaded from the store at startup and kept in sync on
 * (un)registration.
 */
@Service
public class ConversationRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConversationRegistry.class);

    private static final Pattern FOLDER_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{0,63}$");

    /** Folder mounted read-only into every non-privileged sandbox. */
    static final String GLOBAL_FOLDER = "global";

    private final DispatchStore store;
    private final DispatchProperties properties;
    private final TriggerPolicy triggerPolicy;
    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();

    public ConversationRegistry(DispatchStore store, DispatchProperties properties, TriggerPolicy triggerPolicy) {
        this.store = store;
        this.properties = properties;
        this.triggerPolicy = triggerPolicy;
    }

    public void load() {
        conversations.clear();
        conversations.putAll(store.getAllConversations());
        log.info("Loaded {} registered conversation(s)", conversations.size());
    }

    public Optional<Conversation> get(String conversationId) {
        return Optional.ofNullable(conversations.get(conversationId));
    }

    public Set<String> ids() {
        return Set.copyOf(conversations.keySet());
    }

    public Collection<Conversation> all() {
        return List.copyOf(conversations.values());
    }

    public Optional<Conversation> byFolder(String folder) {
        return conversations.values().stream().filter(c -> c.folder().equals(folder)).findFirst();
    }

    public boolean isPrivileged(Conversation conversation) {
        return triggerPolicy.isPrivileged(conversation);
    }

    /**
     * Registers (or updates) a conversation and creates its folder. A blank trigger
     * defaults to {@code @<assistant name>}.
     *
     * @throws IllegalArgumentException if the folder name is invalid, reserved or used by another conversation
     */
    public Conversation register(Conversation request) {
        Conversation conversation = request.trigger() == null || request.trigger().isBlank()
                ? new Conversation(request.id(), request.name(), request.folder(), "@" + properties.getAssistantName(),
                        request.requiresTrigger(), request.addedAt(), request.sandboxSettings())
                : request;
        String folder = conversation.folder();
        if (folder == null || !FOLDER_NAME.matcher(folder).matches()) {
            throw new IllegalArgumentException("Invalid folder name: " + folder);
        }
        if (GLOBAL_FOLDER.equals(folder)) {
            throw new IllegalArgumentException("Folder name is reserved: " + folder);
        }
        byFolder(folder)
                .filter(other -> !other.id().equals(conversation.id()))
                .ifPresent(other -> {
                    throw new IllegalArgumentException("Folder " + folder + " already used by " + other.id());
                });

        store.saveConversation(conversation);
        try {
            Files.createDirectories(properties.getGroupsPath().resolve(folder).resolve("logs"));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create folder for " + conversation.id(), e);
        }
        conversations.put(conversation.id(), conversation);
        log.info("Conversation registered: {} ({}) -> {}", conversation.id(), conversation.name(), folder);
        return conversation;
    }

    public boolean unregister(String conversationId) {
        if (conversations.remove(conversationId) == null) {
            return false;
        }
        store.deleteConversation(conversationId);
        log.info("Conversation unregistered: {}", conversationId);
        return true;
    }

    /**
     * Known chats a privileged agent may address, newest activity first.
     * Internal bookkeeping rows (ids starting with {@code __}) are left out.
     */
    public List<AvailableConversation> availableConversations() {
        return store.getAllChats().stream()
                .filter(chat -> !chat.id().startsWith("__"))
                .map(chat -> new AvailableConversation(chat.id(), chat.name(), chat.lastMessageTime(),
                        conversations.containsKey(chat.id())))
                .toList();
    }

    /**
     * The environment a conversation's sandbox gets to see. The privileged conversation sees
     * every task and every known chat; others only their own tasks.
     */
    public EnvironmentSnapshot snapshotFor(Conversation conversation) {
        boolean privileged = isPrivileged(conversation);
        List<ScheduledTask> tasks = store.getAllTasks().stream()
                .filter(t -> privileged || t.folder().equals(conversation.folder()))
                .toList();
        List<AvailableConversation> chats = privileged ? availableConversations() : List.of();
        return new EnvironmentSnapshot(tasks, chats);
    }
}
