package com.groupdispatch.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.groupdispatch.core.dispatch.SessionTokens;
import com.groupdispatch.core.events.DispatchEvent;
import com.groupdispatch.core.events.EventBus;
import com.groupdispatch.core.logging.MdcContext;
import com.groupdispatch.core.metrics.DispatchMetrics;
import com.groupdispatch.core.persistence.StoreException;
import com.groupdispatch.core.queue.ConversationQueue;
import com.groupdispatch.core.queue.SandboxSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs one sandbox invocation end to end on the calling (worker) thread.
 * <p>
 * Flow: write snapshot -> spawn -> register with the queue -> send input ->
 * decode events until stdout closes -> wait for exit -> unregister.
 * <p>
 * Continuation tokens are persisted as soon as they arrive. A run fails when the sandbox
 * reported an {@code error} event, exited non-zero, or exited without any {@code result}.
 */
@Service
public class SandboxRunner {

    private static final Logger log = LoggerFactory.getLogger(SandboxRunner.class);

    private static final Duration EXIT_GRACE = Duration.ofSeconds(30);

    /**
     * Receives each decoded event after the runner's own bookkeeping.
     */
    @FunctionalInterface
    public interface EventListener {
        void onEvent(SandboxEvent event);
    }

    private final SandboxProvider provider;
    private final ConversationQueue queue;
    private final SnapshotWriter snapshotWriter;
    private final SandboxEventDecoder decoder;
    private final SessionTokens sessionTokens;
    private final SandboxProperties properties;
    private final ScheduledExecutorService timers;
    private final ObjectMapper objectMapper;
    private final DispatchMetrics metrics;
    private final EventBus eventBus;

    public SandboxRunner(SandboxProvider provider,
                         ConversationQueue queue,
                         SnapshotWriter snapshotWriter,
                         SandboxEventDecoder decoder,
                         SessionTokens sessionTokens,
                         SandboxProperties properties,
                         @Qualifier("dispatchTimers") ScheduledExecutorService timers,
                         ObjectMapper objectMapper,
                         DispatchMetrics metrics,
                         EventBus eventBus) {
        this.provider = provider;
        this.queue = queue;
        this.snapshotWriter = snapshotWriter;
        this.decoder = decoder;
        this.sessionTokens = sessionTokens;
        this.properties = properties;
        this.timers = timers;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    /** Per-run mutable state, touched only by the decoding thread and the watchdog. */
    private static final class RunState {
        volatile boolean resultSeen;
        volatile boolean failed;
        volatile String lastError;
        volatile String token;
        volatile boolean timedOut;
        ScheduledFuture<?> watchdog;
    }

    public SandboxOutcome run(SandboxRequest request, EventListener listener) {
        String conversationId = request.conversationId();
        try {
            snapshotWriter.write(request.folder(), request.snapshot());
        } catch (IOException e) {
            log.error("Failed to write environment snapshot for {}", request.folder(), e);
            return SandboxOutcome.error("snapshot write failed: " + e.getMessage());
        }

        SandboxProcess process;
        try {
            process = provider.start(request);
        } catch (SandboxStartException e) {
            log.error("Sandbox spawn failed for {}: {}", conversationId, e.getMessage(), e);
            metrics.recordSandboxStart(false);
            return SandboxOutcome.error("spawn failed: " + e.getMessage());
        }
        metrics.recordSandboxStart(true);

        SandboxSession session;
        try {
            session = queue.registerProcess(conversationId, process, process.name(), request.folder(),
                    request.scheduledTask());
        } catch (IllegalStateException e) {
            log.error("Refusing second sandbox for {}: {}", conversationId, e.getMessage());
            process.kill();
            return SandboxOutcome.error(e.getMessage());
        }

        MdcContext.setSandbox(process.name());
        eventBus.publish(DispatchEvent.of("sandbox.started", conversationId,
                Map.of("sandbox", process.name(), "folder", request.folder())));
        long started = System.currentTimeMillis();
        RunState state = new RunState();
        long timeoutMs = timeoutMs(request);
        armWatchdog(state, process, timeoutMs);

        try {
            session.writeLine(objectMapper.writeValueAsString(SandboxInput.from(request)));
            decoder.decode(process.output(), event -> {
                armWatchdog(state, process, timeoutMs);
                handle(request, state, event);
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.error("Event listener failed for {}", conversationId, e);
                }
            });
            return finish(request, state, process);
        } catch (IOException e) {
            log.error("Sandbox stream of {} failed: {}", process.name(), e.getMessage());
            if (process.isAlive()) {
                process.kill();
            }
            return SandboxOutcome.error("stream failure: " + e.getMessage(), state.token, null, state.resultSeen);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.kill();
            return SandboxOutcome.error("interrupted", state.token, null, state.resultSeen);
        } finally {
            if (state.watchdog != null) {
                state.watchdog.cancel(false);
            }
            queue.unregisterProcess(conversationId, process);
            long elapsed = System.currentTimeMillis() - started;
            metrics.recordSandboxLifetime(elapsed);
            eventBus.publish(DispatchEvent.of("sandbox.stopped", conversationId,
                    Map.of("sandbox", process.name(), "elapsedMs", elapsed)));
            MdcContext.clearSandbox();
        }
    }

    private void handle(SandboxRequest request, RunState state, SandboxEvent event) {
        if (event instanceof SandboxEvent.NewContinuationToken t) {
            state.token = t.token();
            if (request.persistSession()) {
                try {
                    sessionTokens.update(request.folder(), t.token());
                } catch (StoreException e) {
                    log.error("Failed to persist continuation token for {}", request.folder(), e);
                }
            }
        } else if (event instanceof SandboxEvent.Result) {
            state.resultSeen = true;
            queue.markIdle(request.conversationId());
        } else if (event instanceof SandboxEvent.Failure f) {
            state.failed = true;
            state.lastError = f.detail();
            log.warn("Sandbox reported error for {}: {}", request.conversationId(), f.detail());
        }
    }

    private SandboxOutcome finish(SandboxRequest request, RunState state, SandboxProcess process)
            throws InterruptedException {
        if (!process.awaitExit(EXIT_GRACE)) {
            log.warn("Sandbox {} closed stdout but did not exit, killing", process.name());
            process.kill();
            return SandboxOutcome.error("did not exit after closing output", state.token, null, state.resultSeen);
        }
        int exitCode = process.exitCode();
        if (state.timedOut) {
            if (state.resultSeen && !state.failed) {
                log.info("Sandbox {} timed out while idle after a result", process.name());
                return SandboxOutcome.success(state.token, exitCode);
            }
            return SandboxOutcome.error("timed out", state.token, exitCode, state.resultSeen);
        }
        if (exitCode != 0) {
            log.error("Sandbox {} exited with code {}", process.name(), exitCode);
            return SandboxOutcome.error("exited with code " + exitCode, state.token, exitCode, state.resultSeen);
        }
        if (state.failed) {
            return SandboxOutcome.error(state.lastError, state.token, exitCode, state.resultSeen);
        }
        if (!state.resultSeen) {
            log.error("Sandbox {} exited without a result", process.name());
            return SandboxOutcome.error("exited without result", state.token, exitCode, false);
        }
        log.info("Sandbox {} finished for {}", process.name(), request.conversationId());
        return SandboxOutcome.success(state.token, exitCode);
    }

    /**
     * Kills the process when no event arrived within the timeout. Re-armed on every event.
     */
    private void armWatchdog(RunState state, SandboxProcess process, long timeoutMs) {
        if (state.watchdog != null) {
            state.watchdog.cancel(false);
        }
        state.watchdog = timers.schedule(() -> {
            log.error("Sandbox {} timed out after {}ms without output, killing", process.name(), timeoutMs);
            state.timedOut = true;
            process.kill();
        }, timeoutMs, TimeUnit.MILLISECONDS);
    }

    private long timeoutMs(SandboxRequest request) {
        Integer override = request.settings() != null ? request.settings().timeoutSeconds() : null;
        int seconds = override != null ? override : properties.getTimeoutSeconds();
        return seconds * 1000L;
    }
}
