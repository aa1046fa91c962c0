package com.groupdispatch.core.dispatch;

import com.groupdispatch.core.events.DispatchEvent;
import com.groupdispatch.core.events.EventBus;
import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.InboundMessage;
import com.groupdispatch.core.persistence.InMemoryDispatchStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class MessageIngestServiceTest {

    private static final String GROUP = "group-a@g.us";

    @TempDir
    Path groupsDir;

    private InMemoryDispatchStore store;
    private EventBus eventBus;
    private MessageIngestService ingest;

    @BeforeEach
    void setUp() {
        var properties = new DispatchProperties();
        properties.setGroupsDir(groupsDir.toString());
        store = new InMemoryDispatchStore();
        eventBus = new EventBus();
        var registry = new ConversationRegistry(store, properties, new TriggerPolicy(properties));
        registry.register(new Conversation(GROUP, "Team A", "team-a", "@Andy", true,
                "2026-01-01T00:00:00.000Z", null));
        ingest = new MessageIngestService(store, registry, eventBus);
    }

    @Test
    @DisplayName("stores messages of registered conversations and publishes an event")
    void storesRegistered() {
        List<DispatchEvent> events = new ArrayList<>();
        eventBus.subscribe(GROUP, events::add);

        var stored = ingest.storeMessage(GROUP, "m1", "alice@s", "Alice", "@Andy hi", false, "Team A");

        assertTrue(stored.isPresent());
        assertEquals(1, store.getMessagesSince(GROUP, "", "Andy").size());
        assertEquals(1, events.size());
        assertEquals("message.received", events.get(0).eventType());
        assertEquals("m1", events.get(0).payload().get("messageId"));
    }

    @Test
    @DisplayName("unregistered chats only update chat metadata")
    void metadataOnly() {
        var stored = ingest.storeMessage("stranger@g.us", "m1", "bob@s", "Bob", "hello", false, "Strangers");

        assertTrue(stored.isEmpty());
        assertTrue(store.getMessagesSince("stranger@g.us", "", "Andy").isEmpty());
        assertTrue(store.getAllChats().stream()
                .anyMatch(chat -> chat.id().equals("stranger@g.us") && "Strangers".equals(chat.name())));
    }

    @Test
    @DisplayName("assigned timestamps strictly increase")
    void increasingTimestamps() {
        String first = ingest.storeMessage(GROUP, "m1", "alice@s", "Alice", "one", false, null)
                .orElseThrow().timestamp();
        String second = ingest.storeMessage(GROUP, "m2", "alice@s", "Alice", "two", false, null)
                .orElseThrow().timestamp();

        assertTrue(second.compareTo(first) > 0);
    }

    @Test
    @DisplayName("concurrent senders store messages in timestamp order")
    void concurrentIngestKeepsOrder() throws Exception {
        List<String> insertOrder = new ArrayList<>();
        var recordingStore = new InMemoryDispatchStore() {
            @Override
            public synchronized void storeMessage(InboundMessage message) {
                Thread.yield();
                insertOrder.add(message.timestamp());
                super.storeMessage(message);
            }
        };
        var properties = new DispatchProperties();
        properties.setGroupsDir(groupsDir.toString());
        var registry = new ConversationRegistry(recordingStore, properties, new TriggerPolicy(properties));
        registry.register(new Conversation(GROUP, "Team A", "team-a", "@Andy", true,
                "2026-01-01T00:00:00.000Z", null));
        var concurrentIngest = new MessageIngestService(recordingStore, registry, eventBus);

        ExecutorService senders = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> sent = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String id = "m" + i;
                sent.add(senders.submit(() ->
                        concurrentIngest.storeMessage(GROUP, id, "alice@s", "Alice", "hi", false, null)));
            }
            for (Future<?> f : sent) {
                f.get();
            }
        } finally {
            senders.shutdownNow();
        }

        assertEquals(200, insertOrder.size());
        assertEquals(insertOrder.stream().sorted().toList(), insertOrder);
    }
}
