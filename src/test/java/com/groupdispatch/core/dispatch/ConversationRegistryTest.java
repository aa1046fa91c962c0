package com.groupdispatch.core.dispatch;

import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.ScheduledTask;
import com.groupdispatch.core.persistence.InMemoryDispatchStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConversationRegistryTest {

    @TempDir
    Path groupsDir;

    private InMemoryDispatchStore store;
    private ConversationRegistry registry;

    @BeforeEach
    void setUp() {
        var properties = new DispatchProperties();
        properties.setGroupsDir(groupsDir.toString());
        store = new InMemoryDispatchStore();
        registry = new ConversationRegistry(store, properties, new TriggerPolicy(properties));
    }

    private static Conversation conversation(String id, String folder, String trigger) {
        return new Conversation(id, "Name " + id, folder, trigger, true, "2026-01-01T00:00:00.000Z", null);
    }

    private static ScheduledTask task(String id, String folder) {
        return new ScheduledTask(id, folder, "x@g.us", "p", ScheduledTask.ScheduleType.ONCE,
                "2026-01-01T00:00:00.000Z", ScheduledTask.ContextMode.ISOLATED, "2026-01-01T00:00:00.000Z",
                null, null, ScheduledTask.Status.ACTIVE, "2026-01-01T00:00:00.000Z");
    }

    @Test
    @DisplayName("register stores the conversation and creates its folder")
    void register() {
        registry.register(conversation("a@g.us", "team-a", "@Andy"));

        assertTrue(registry.get("a@g.us").isPresent());
        assertTrue(store.getConversation("a@g.us").isPresent());
        assertTrue(Files.isDirectory(groupsDir.resolve("team-a").resolve("logs")));
        assertEquals("a@g.us", registry.byFolder("team-a").orElseThrow().id());
    }

    @Test
    @DisplayName("a blank trigger defaults to the assistant name")
    void defaultTrigger() {
        Conversation saved = registry.register(conversation("a@g.us", "team-a", " "));

        assertEquals("@Andy", saved.trigger());
        assertEquals("@Andy", store.getConversation("a@g.us").orElseThrow().trigger());
    }

    @ParameterizedTest
    @ValueSource(strings = {"../escape", "with space", "", "-leading", "global"})
    @DisplayName("invalid or reserved folder names are rejected")
    void rejectsFolder(String folder) {
        assertThrows(IllegalArgumentException.class,
                () -> registry.register(conversation("a@g.us", folder, "@Andy")));
        assertTrue(registry.ids().isEmpty());
    }

    @Test
    @DisplayName("a folder belongs to one conversation, but re-registering the owner is an update")
    void folderOwnership() {
        registry.register(conversation("a@g.us", "team-a", "@Andy"));

        assertThrows(IllegalArgumentException.class,
                () -> registry.register(conversation("b@g.us", "team-a", "@Andy")));
        assertDoesNotThrow(() -> registry.register(conversation("a@g.us", "team-a", "@Bot")));
        assertEquals("@Bot", registry.get("a@g.us").orElseThrow().trigger());
    }

    @Test
    @DisplayName("unregister removes the conversation and reports unknown ids")
    void unregister() {
        registry.register(conversation("a@g.us", "team-a", "@Andy"));

        assertTrue(registry.unregister("a@g.us"));
        assertFalse(registry.unregister("a@g.us"));
        assertTrue(store.getConversation("a@g.us").isEmpty());
    }

    @Test
    @DisplayName("load picks up conversations persisted earlier")
    void load() {
        store.saveConversation(conversation("a@g.us", "team-a", "@Andy"));

        registry.load();

        assertEquals(1, registry.all().size());
    }

    @Test
    @DisplayName("the privileged snapshot sees every task and chat, others only their own tasks")
    void snapshots() {
        Conversation main = registry.register(conversation("main@s", "main", "@Andy"));
        Conversation team = registry.register(conversation("a@g.us", "team-a", "@Andy"));
        store.saveTask(task("t1", "main"));
        store.saveTask(task("t2", "team-a"));
        store.storeChatMetadata("a@g.us", "Team A", "2026-01-01T00:00:01.000Z");
        store.storeChatMetadata("new@g.us", "Newcomer", "2026-01-01T00:00:02.000Z");
        store.storeChatMetadata("__group_sync__", "internal", "2026-01-01T00:00:03.000Z");

        var mainView = registry.snapshotFor(main);
        var teamView = registry.snapshotFor(team);

        assertEquals(2, mainView.tasks().size());
        assertEquals(2, mainView.conversations().size());
        assertEquals("new@g.us", mainView.conversations().get(0).jid());
        assertFalse(mainView.conversations().get(0).registered());
        assertEquals(1, teamView.tasks().size());
        assertTrue(teamView.conversations().isEmpty());
    }
}
