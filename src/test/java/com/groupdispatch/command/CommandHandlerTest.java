package com.groupdispatch.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.groupdispatch.channel.Channel;
import com.groupdispatch.channel.ChannelRouter;
import com.groupdispatch.channel.TypingManager;
import com.groupdispatch.core.dispatch.ConversationRegistry;
import com.groupdispatch.core.dispatch.DispatchProperties;
import com.groupdispatch.core.dispatch.TriggerPolicy;
import com.groupdispatch.core.metrics.DispatchMetrics;
import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.ScheduledTask;
import com.groupdispatch.core.persistence.InMemoryDispatchStore;
import com.groupdispatch.sandbox.EnvironmentSnapshot;
import com.groupdispatch.sandbox.SnapshotWriter;
import com.groupdispatch.scheduler.ScheduleCalculator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CommandHandlerTest {

    private static final String MAIN_JID = "main@s";
    private static final String TEAM_JID = "a@g.us";
    private static final String OTHER_JID = "b@g.us";

    @TempDir
    Path root;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryDispatchStore store;
    private ConversationRegistry registry;
    private ChannelRouter router;
    private TypingManager typing;
    private SnapshotWriter snapshotWriter;
    private SimpleMeterRegistry meterRegistry;
    private CommandHandler handler;

    @BeforeEach
    void setUp() {
        var properties = new DispatchProperties();
        properties.setGroupsDir(root.resolve("groups").toString());
        properties.setDataDir(root.resolve("data").toString());
        properties.setTimezone("UTC");
        store = new InMemoryDispatchStore();
        registry = new ConversationRegistry(store, properties, new TriggerPolicy(properties));
        registry.register(conversation(MAIN_JID, "main"));
        registry.register(conversation(TEAM_JID, "team-a"));
        registry.register(conversation(OTHER_JID, "team-b"));

        router = mock(ChannelRouter.class);
        when(router.formatOutbound(anyString(), anyString())).thenAnswer(inv -> "Andy: " + inv.getArgument(1));
        typing = mock(TypingManager.class);
        snapshotWriter = mock(SnapshotWriter.class);
        meterRegistry = new SimpleMeterRegistry();
        handler = new CommandHandler(registry, store, router, typing, new ScheduleCalculator(properties),
                snapshotWriter, properties, new DispatchMetrics(meterRegistry));
    }

    private static Conversation conversation(String jid, String folder) {
        return new Conversation(jid, folder, folder, "@Andy", true, "2026-01-01T00:00:00.000Z", null);
    }

    /** Parses a request written with single quotes for readability. */
    private CommandRequest request(String json) throws Exception {
        return objectMapper.readValue(json.replace('\'', '"'), CommandRequest.class);
    }

    private ScheduledTask storedTask(String id, String folder) {
        var task = new ScheduledTask(id, folder, TEAM_JID, "p", ScheduledTask.ScheduleType.INTERVAL, "60000",
                ScheduledTask.ContextMode.ISOLATED, "2026-01-01T00:01:00.000Z", null, null,
                ScheduledTask.Status.ACTIVE, "2026-01-01T00:00:00.000Z");
        store.saveTask(task);
        return task;
    }

    // -- message --

    @Nested
    @DisplayName("message")
    class Message {

        @Test
        @DisplayName("a folder may message its own conversation")
        void ownConversation() throws Exception {
            assertTrue(handler.handle("team-a", request("{'type':'message','chatJid':'a@g.us','text':'done!'}")));

            verify(typing).stop(TEAM_JID);
            verify(router).routeOutbound(TEAM_JID, "Andy: done!");
        }

        @Test
        @DisplayName("messages to another conversation are blocked unless privileged")
        void crossConversation() throws Exception {
            assertFalse(handler.handle("team-a", request("{'type':'message','chatJid':'b@g.us','text':'psst'}")));
            verify(router, never()).routeOutbound(anyString(), anyString());

            assertTrue(handler.handle("main", request("{'type':'message','chatJid':'b@g.us','text':'hello'}")));
            verify(router).routeOutbound(OTHER_JID, "Andy: hello");
        }

        @Test
        @DisplayName("incomplete requests are rejected and counted")
        void incomplete() throws Exception {
            assertFalse(handler.handle("main", request("{'type':'message','chatJid':'a@g.us'}")));

            assertEquals(1.0, meterRegistry.get("groupdispatch.commands.total")
                    .tag("type", "message").tag("success", "false").counter().count());
        }
    }

    // -- tasks --

    @Nested
    @DisplayName("tasks")
    class Tasks {

        @Test
        @DisplayName("schedule_task stores an active task due at its first run")
        void schedule() throws Exception {
            assertTrue(handler.handle("team-a", request("""
                    {'type':'schedule_task','targetJid':'a@g.us','prompt':'check the news',
                     'schedule_type':'once','schedule_value':'2030-01-01T09:00:00Z','context_mode':'group'}""")));

            ScheduledTask task = store.getAllTasks().get(0);
            assertTrue(task.id().startsWith("task-"));
            assertEquals("team-a", task.folder());
            assertEquals(TEAM_JID, task.chatId());
            assertEquals(ScheduledTask.ScheduleType.ONCE, task.scheduleType());
            assertEquals(ScheduledTask.ContextMode.GROUP, task.contextMode());
            assertEquals("2030-01-01T09:00:00.000Z", task.nextRun());
            assertEquals(ScheduledTask.Status.ACTIVE, task.status());
        }

        @Test
        @DisplayName("context mode defaults to isolated")
        void isolatedByDefault() throws Exception {
            handler.handle("team-a", request("""
                    {'type':'schedule_task','targetJid':'a@g.us','prompt':'p',
                     'schedule_type':'interval','schedule_value':'3600000'}"""));

            assertEquals(ScheduledTask.ContextMode.ISOLATED, store.getAllTasks().get(0).contextMode());
        }

        @Test
        @DisplayName("only the privileged folder schedules for other conversations")
        void scheduleAuthorization() throws Exception {
            String json = """
                    {'type':'schedule_task','targetJid':'b@g.us','prompt':'p',
                     'schedule_type':'cron','schedule_value':'0 9 * * *'}""";

            assertFalse(handler.handle("team-a", request(json)));
            assertTrue(store.getAllTasks().isEmpty());

            assertTrue(handler.handle("main", request(json)));
            assertEquals("team-b", store.getAllTasks().get(0).folder());
        }

        @Test
        @DisplayName("invalid schedules and unknown targets are rejected")
        void invalidSchedule() throws Exception {
            assertFalse(handler.handle("main", request("""
                    {'type':'schedule_task','targetJid':'a@g.us','prompt':'p',
                     'schedule_type':'cron','schedule_value':'not a cron'}""")));
            assertFalse(handler.handle("main", request("""
                    {'type':'schedule_task','targetJid':'a@g.us','prompt':'p',
                     'schedule_type':'hourly','schedule_value':'1'}""")));
            assertFalse(handler.handle("main", request("""
                    {'type':'schedule_task','targetJid':'nobody@g.us','prompt':'p',
                     'schedule_type':'interval','schedule_value':'1000'}""")));
            assertTrue(store.getAllTasks().isEmpty());
        }

        @Test
        @DisplayName("pause, resume and cancel act on the folder's own tasks")
        void lifecycle() throws Exception {
            storedTask("t1", "team-a");

            assertTrue(handler.handle("team-a", request("{'type':'pause_task','taskId':'t1'}")));
            assertEquals(ScheduledTask.Status.PAUSED, store.getTask("t1").orElseThrow().status());

            assertTrue(handler.handle("team-a", request("{'type':'resume_task','taskId':'t1'}")));
            assertEquals(ScheduledTask.Status.ACTIVE, store.getTask("t1").orElseThrow().status());

            assertTrue(handler.handle("team-a", request("{'type':'cancel_task','taskId':'t1'}")));
            assertTrue(store.getTask("t1").isEmpty());
        }

        @Test
        @DisplayName("another folder's task cannot be touched")
        void foreignTask() throws Exception {
            storedTask("t1", "team-b");

            assertFalse(handler.handle("team-a", request("{'type':'cancel_task','taskId':'t1'}")));
            assertTrue(store.getTask("t1").isPresent());
            assertFalse(handler.handle("team-a", request("{'type':'pause_task','taskId':'missing'}")));

            assertTrue(handler.handle("main", request("{'type':'pause_task','taskId':'t1'}")));
        }
    }

    // -- conversations --

    @Nested
    @DisplayName("conversation management")
    class Management {

        @Test
        @DisplayName("register_group is privileged and applies folder rules")
        void register() throws Exception {
            String json = "{'type':'register_group','jid':'c@g.us','name':'Team C','folder':'team-c','trigger':'@Andy'}";

            assertFalse(handler.handle("team-a", request(json)));
            assertTrue(registry.get("c@g.us").isEmpty());

            assertTrue(handler.handle("main", request(json)));
            Conversation c = registry.get("c@g.us").orElseThrow();
            assertEquals("team-c", c.folder());
            assertTrue(c.requiresTrigger());

            assertFalse(handler.handle("main", request(
                    "{'type':'register_group','jid':'d@g.us','name':'D','folder':'team-c','trigger':'@Andy'}")));
            assertFalse(handler.handle("main", request(
                    "{'type':'register_group','jid':'d@g.us','name':'D','folder':'team-d'}")));
        }

        @Test
        @DisplayName("register_group keeps sandbox settings and an explicit trigger opt-out")
        void registerWithSettings() throws Exception {
            assertTrue(handler.handle("main", request("""
                    {'type':'register_group','jid':'c@g.us','name':'C','folder':'team-c','trigger':'@Andy',
                     'requiresTrigger':false,'containerConfig':{'memoryLimitMb':1024,
                     'additionalMounts':[{'hostPath':'/srv/x','containerPath':'x','readonly':true}]}}""")));

            Conversation c = registry.get("c@g.us").orElseThrow();
            assertFalse(c.requiresTrigger());
            assertEquals(Integer.valueOf(1024), c.sandboxSettings().memoryLimitMb());
            assertEquals(1, c.sandboxSettings().additionalMounts().size());
        }

        @Test
        @DisplayName("unregister_group is privileged")
        void unregister() throws Exception {
            assertFalse(handler.handle("team-a", request("{'type':'unregister_group','jid':'b@g.us'}")));
            assertTrue(registry.get(OTHER_JID).isPresent());

            assertTrue(handler.handle("main", request("{'type':'unregister_group','jid':'b@g.us'}")));
            assertTrue(registry.get(OTHER_JID).isEmpty());
        }

        @Test
        @DisplayName("refresh_groups syncs channels and rewrites the privileged snapshot")
        void refresh() throws Exception {
            Channel channel = mock(Channel.class);
            when(router.channels()).thenReturn(List.of(channel));

            assertFalse(handler.handle("team-a", request("{'type':'refresh_groups'}")));
            verify(channel, never()).syncMetadata(anyBoolean());

            assertTrue(handler.handle("main", request("{'type':'refresh_groups'}")));
            verify(channel).syncMetadata(true);
            verify(snapshotWriter).write(eq("main"), any(EnvironmentSnapshot.class));
        }

        @Test
        @DisplayName("unknown types are rejected")
        void unknownType() throws Exception {
            assertFalse(handler.handle("main", request("{'type':'format_disk'}")));
            assertFalse(handler.handle("main", request("{}")));
        }
    }
}
