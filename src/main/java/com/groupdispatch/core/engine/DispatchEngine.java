package com.groupdispatch.core.engine;

import com.groupdispatch.channel.ChannelRouter;
import com.groupdispatch.channel.TypingManager;
import com.groupdispatch.command.CommandChannelWatcher;
import com.groupdispatch.core.cursor.CursorStore;
import com.groupdispatch.core.cursor.PendingMessageRecovery;
import com.groupdispatch.core.dispatch.ConversationProcessor;
import com.groupdispatch.core.dispatch.ConversationRegistry;
import com.groupdispatch.core.dispatch.DispatchLoop;
import com.groupdispatch.core.dispatch.DispatchProperties;
import com.groupdispatch.core.dispatch.SessionTokens;
import com.groupdispatch.core.events.DispatchEvent;
import com.groupdispatch.core.events.EventBus;
import com.groupdispatch.core.persistence.StoreException;
import com.groupdispatch.core.queue.ConversationQueue;
import com.groupdispatch.core.queue.SandboxSession;
import com.groupdispatch.sandbox.SandboxProvider;
import com.groupdispatch.scheduler.ScheduledTaskRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Wires the dispatch components together and owns their lifecycle.
 * <p>
 * Startup loads persisted state, clears sandboxes orphaned by a previous run, connects the
 * channels, re-queues conversations with undelivered messages and then starts the polling
 * loops. Shutdown stops intake first, drains the queue within the configured grace period
 * and saves the watermarks last.
 */
@Service
public class DispatchEngine implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(DispatchEngine.class);

    private final ConversationRegistry registry;
    private final CursorStore cursors;
    private final SessionTokens sessionTokens;
    private final SandboxProvider sandboxProvider;
    private final ConversationQueue queue;
    private final ConversationProcessor processor;
    private final ChannelRouter router;
    private final TypingManager typing;
    private final PendingMessageRecovery recovery;
    private final DispatchLoop dispatchLoop;
    private final CommandChannelWatcher commandWatcher;
    private final ScheduledTaskRunner taskRunner;
    private final DispatchProperties properties;
    private final EventBus eventBus;

    private volatile boolean running;

    public DispatchEngine(ConversationRegistry registry,
                          CursorStore cursors,
                          SessionTokens sessionTokens,
                          SandboxProvider sandboxProvider,
                          ConversationQueue queue,
                          ConversationProcessor processor,
                          ChannelRouter router,
                          TypingManager typing,
                          PendingMessageRecovery recovery,
                          DispatchLoop dispatchLoop,
                          CommandChannelWatcher commandWatcher,
                          ScheduledTaskRunner taskRunner,
                          DispatchProperties properties,
                          EventBus eventBus) {
        this.registry = registry;
        this.cursors = cursors;
        this.sessionTokens = sessionTokens;
        this.sandboxProvider = sandboxProvider;
        this.queue = queue;
        this.processor = processor;
        this.router = router;
        this.typing = typing;
        this.recovery = recovery;
        this.dispatchLoop = dispatchLoop;
        this.commandWatcher = commandWatcher;
        this.taskRunner = taskRunner;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    @Override
    public boolean isAutoStartup() {
        return properties.isAutostart();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        registry.load();
        cursors.load();
        sessionTokens.load();
        log.info("Loaded {} conversation(s), {} session token(s)",
                registry.ids().size(), sessionTokens.snapshot().size());

        try {
            int orphans = sandboxProvider.cleanupOrphans();
            if (orphans > 0) {
                log.info("Stopped {} orphaned sandbox(es)", orphans);
            }
        } catch (RuntimeException e) {
            log.warn("Orphan cleanup via {} failed: {}", sandboxProvider.name(), e.getMessage());
        }

        queue.setMessageProcessor(processor::processMessages);
        router.connectAll();
        int recovered = recovery.recover();

        dispatchLoop.start();
        try {
            commandWatcher.start();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start command channel watcher", e);
        }
        taskRunner.start();
        running = true;

        eventBus.publish(DispatchEvent.of("engine.started", null,
                Map.of("conversations", registry.ids().size(), "recovered", recovered)));
        log.info("Dispatch engine started (assistant: {}, main folder: {})",
                properties.getAssistantName(), properties.getMainFolder());
    }

    @Override
    public void stop() {
        shutdown(properties.getShutdownTimeoutMs());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Graceful shutdown. Conversations whose sandbox is still live have their watermark moved
     * up to the global-seen mark so the messages already piped are not replayed after restart.
     */
    public synchronized void shutdown(long timeoutMs) {
        if (!running) {
            return;
        }
        log.info("Shutting down dispatch engine (grace {}ms)", timeoutMs);
        queue.markShuttingDown();
        router.disconnectAll();

        for (SandboxSession.Snapshot session : queue.liveSessions()) {
            advanceToGlobal(session.conversationId());
        }

        dispatchLoop.stop();
        commandWatcher.stop();
        taskRunner.stop();
        typing.stopAll();
        queue.shutdown(timeoutMs);

        try {
            cursors.save();
        } catch (StoreException e) {
            log.error("Failed to save watermarks on shutdown", e);
        }
        running = false;
        eventBus.publish(DispatchEvent.of("engine.stopped", null, Map.of()));
        log.info("Dispatch engine stopped");
    }

    // ── Operator actions ────────────────────────────────────────────────

    /**
     * Asks the conversation's sandbox to stop its current turn. Messages seen so far count as
     * delivered.
     *
     * @return false if the conversation has no sandbox
     */
    public boolean interruptConversation(String conversationId) {
        if (!queue.hasLiveSession(conversationId)) {
            return false;
        }
        advanceToGlobal(conversationId);
        boolean sent = queue.interrupt(conversationId);
        log.info("Interrupt requested for {} (delivered: {})", conversationId, sent);
        return sent;
    }

    /**
     * Kills the conversation's sandbox. The next message starts a fresh one.
     *
     * @return false if the conversation has no sandbox
     */
    public boolean restartConversation(String conversationId) {
        if (!queue.hasLiveSession(conversationId)) {
            return false;
        }
        advanceToGlobal(conversationId);
        boolean killed = queue.kill(conversationId);
        typing.stop(conversationId);
        log.info("Restart requested for {} (killed: {})", conversationId, killed);
        return killed;
    }

    private void advanceToGlobal(String conversationId) {
        String global = cursors.globalSeen();
        if (global.isEmpty()) {
            return;
        }
        try {
            cursors.skipTo(conversationId, global);
        } catch (StoreException e) {
            log.warn("Could not advance watermark of {}: {}", conversationId, e.getMessage());
        }
    }
}
