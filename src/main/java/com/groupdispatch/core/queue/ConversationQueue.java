package com.groupdispatch.core.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groupdispatch.core.dispatch.DispatchProperties;
import com.groupdispatch.core.metrics.DispatchMetrics;
import com.groupdispatch.sandbox.SandboxProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-conversation process queue.
 * <p>
 * Maps each conversation to at most one live {@link SandboxSession}, serializes processing
 * runs per conversation, caps the number of concurrently active conversations and retries
 * failed runs with exponential backoff.
 * <p>
 * Locking: each conversation slot is its own monitor. The capacity counter and waiting
 * list are guarded by {@code capacityLock}, which is only ever taken while holding a slot
 * lock or no lock at all, never the other way round.
 */
@Service
public class ConversationQueue {

    private static final Logger log = LoggerFactory.getLogger(ConversationQueue.class);

    /**
     * Processes the pending messages of one conversation.
     */
    @FunctionalInterface
    public interface MessageProcessor {
        /**
         * @return true on success; false schedules a retry
         */
        boolean process(String conversationId);
    }

    private static final class Slot {
        boolean active;
        boolean pendingCheck;
        String runningTaskId;
        final Map<String, Runnable> pendingTasks = new LinkedHashMap<>();
        SandboxSession session;
        int retryCount;
        ScheduledFuture<?> retryFuture;
    }

    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();
    private final Object capacityLock = new Object();
    private final Set<String> waiting = new LinkedHashSet<>();
    private int activeCount;

    private final ExecutorService workers;
    private final ScheduledExecutorService timers;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;
    private final ObjectMapper objectMapper;

    private volatile MessageProcessor messageProcessor;
    private volatile boolean shuttingDown;

    public ConversationQueue(@Qualifier("sandboxWorkers") ExecutorService workers,
                             @Qualifier("dispatchTimers") ScheduledExecutorService timers,
                             DispatchProperties properties,
                             DispatchMetrics metrics,
                             ObjectMapper objectMapper) {
        this.workers = workers;
        this.timers = timers;
        this.properties = properties;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    public void setMessageProcessor(MessageProcessor processor) {
        this.messageProcessor = processor;
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    /**
     * Stops accepting new work. Turns that fail from here on keep their watermark advance.
     */
    public void markShuttingDown() {
        shuttingDown = true;
    }

    // ── Stdin routing ───────────────────────────────────────────────────

    /**
     * Pipes {@code text} into the conversation's live sandbox.
     * Never waits for the sandbox to act on it. A scheduled-task sandbox is reported as
     * {@link SubmitResult#NOT_RUNNING}, so the caller queues a message check behind it.
     */
    public SubmitResult submit(String conversationId, String text) {
        Slot slot = slot(conversationId);
        synchronized (slot) {
            SandboxSession session = slot.session;
            if (session == null || session.isTask() || session.inputClosed || !session.process().isAlive()) {
                return SubmitResult.NOT_RUNNING;
            }
            try {
                session.writeLine(objectMapper.writeValueAsString(
                        objectMapper.createObjectNode().put("type", "message").put("text", text)));
            } catch (IOException e) {
                log.warn("Failed to pipe message into {}, clearing registration: {}", session.label(), e.getMessage());
                clearSession(slot, session);
                return SubmitResult.NOT_RUNNING;
            }
            session.state = SandboxSession.State.RUNNING;
            armIdleTimer(conversationId, slot, session);
        }
        metrics.recordPipedMessage();
        log.debug("Piped message into sandbox of {}", conversationId);
        return SubmitResult.PIPED;
    }

    /**
     * Records the live sandbox of a conversation.
     *
     * @param task true for a scheduled-task run, which never takes piped messages
     * @throws IllegalStateException if another live sandbox is already registered
     */
    public SandboxSession registerProcess(String conversationId, SandboxProcess process, String label, String folder,
                                          boolean task) {
        Slot slot = slot(conversationId);
        synchronized (slot) {
            SandboxSession existing = slot.session;
            if (existing != null && existing.process().isAlive()) {
                throw new IllegalStateException("Conversation " + conversationId
                        + " already has a live sandbox: " + existing.label());
            }
            if (existing != null) {
                clearSession(slot, existing);
            }
            SandboxSession session = new SandboxSession(conversationId, process, label, folder, task);
            session.state = SandboxSession.State.RUNNING;
            slot.session = session;
            armIdleTimer(conversationId, slot, session);
            log.info("Registered {}sandbox {} for {}", task ? "task " : "", label, conversationId);
            return session;
        }
    }

    /**
     * Clears the registration if {@code process} is still the registered one.
     */
    public void unregisterProcess(String conversationId, SandboxProcess process) {
        Slot slot = slot(conversationId);
        synchronized (slot) {
            if (slot.session != null && slot.session.process() == process) {
                clearSession(slot, slot.session);
                log.debug("Unregistered sandbox of {}", conversationId);
            }
        }
    }

    /**
     * Marks the session as waiting for input after a turn finished and re-arms the idle timer.
     */
    public void markIdle(String conversationId) {
        Slot slot = slot(conversationId);
        synchronized (slot) {
            SandboxSession session = slot.session;
            if (session == null || session.inputClosed) {
                return;
            }
            session.state = SandboxSession.State.IDLE;
            armIdleTimer(conversationId, slot, session);
            if (!slot.pendingTasks.isEmpty()) {
                // Queued tasks only run once this process lets go of the conversation.
                closeInputLocked(slot, session);
            }
        }
    }

    /**
     * Closes the sandbox's stdin without killing it; the agent finishes and exits.
     *
     * @return true if input was open and is now closed
     */
    public boolean closeInput(String conversationId) {
        Slot slot = slot(conversationId);
        synchronized (slot) {
            SandboxSession session = slot.session;
            if (session == null || session.inputClosed) {
                return false;
            }
            closeInputLocked(slot, session);
            return true;
        }
    }

    /**
     * Sends the cooperative stop signal to the conversation's sandbox.
     *
     * @return false if no sandbox is registered or the signal could not be delivered
     */
    public boolean interrupt(String conversationId) {
        SandboxSession session;
        Slot slot = slot(conversationId);
        synchronized (slot) {
            session = slot.session;
        }
        if (session == null) {
            return false;
        }
        try {
            session.process().interrupt();
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to interrupt sandbox {}: {}", session.label(), e.getMessage());
            return false;
        }
    }

    /**
     * Forcibly terminates the conversation's sandbox. The registration is cleared even if
     * the kill itself fails.
     *
     * @return false if no sandbox was registered
     */
    public boolean kill(String conversationId) {
        SandboxSession session;
        Slot slot = slot(conversationId);
        synchronized (slot) {
            session = slot.session;
            if (session == null) {
                return false;
            }
            clearSession(slot, session);
        }
        try {
            session.process().kill();
        } catch (RuntimeException e) {
            log.warn("Kill of sandbox {} failed: {}", session.label(), e.getMessage(), e);
        }
        return true;
    }

    // ── Scheduling ──────────────────────────────────────────────────────

    /**
     * Requests a message check for the conversation. Runs it on a worker right away when the
     * conversation is idle and capacity allows; otherwise the check is parked.
     */
    public void enqueueCheck(String conversationId) {
        if (shuttingDown) {
            return;
        }
        Slot slot = slot(conversationId);
        synchronized (slot) {
            if (slot.active) {
                slot.pendingCheck = true;
                log.debug("Conversation {} busy, check queued", conversationId);
                return;
            }
            if (!acquireCapacity(conversationId)) {
                slot.pendingCheck = true;
                return;
            }
            slot.active = true;
        }
        workers.execute(() -> runCheck(conversationId));
    }

    /**
     * Queues scheduled-task work for the conversation. A task id already queued or running
     * is ignored. Tasks drain before message checks.
     */
    public void enqueueTask(String conversationId, String taskId, Runnable work) {
        if (shuttingDown) {
            return;
        }
        Slot slot = slot(conversationId);
        synchronized (slot) {
            if (taskId.equals(slot.runningTaskId) || slot.pendingTasks.containsKey(taskId)) {
                log.debug("Task {} already queued for {}", taskId, conversationId);
                return;
            }
            if (slot.active) {
                slot.pendingTasks.put(taskId, work);
                if (slot.session != null && slot.session.state == SandboxSession.State.IDLE) {
                    closeInputLocked(slot, slot.session);
                }
                return;
            }
            if (!acquireCapacity(conversationId)) {
                slot.pendingTasks.put(taskId, work);
                return;
            }
            slot.active = true;
            slot.runningTaskId = taskId;
        }
        workers.execute(() -> runTask(conversationId, taskId, work));
    }

    private void runCheck(String conversationId) {
        MessageProcessor processor = messageProcessor;
        boolean success;
        try {
            success = processor == null || processor.process(conversationId);
        } catch (RuntimeException e) {
            log.error("Processing of {} failed", conversationId, e);
            success = false;
        }
        Slot slot = slot(conversationId);
        synchronized (slot) {
            if (success) {
                slot.retryCount = 0;
            } else {
                scheduleRetry(conversationId, slot);
            }
        }
        drain(conversationId);
    }

    private void runTask(String conversationId, String taskId, Runnable work) {
        try {
            work.run();
        } catch (RuntimeException e) {
            log.error("Task {} for {} failed", taskId, conversationId, e);
        } finally {
            Slot slot = slot(conversationId);
            synchronized (slot) {
                slot.runningTaskId = null;
            }
        }
        drain(conversationId);
    }

    private void scheduleRetry(String conversationId, Slot slot) {
        if (shuttingDown) {
            return;
        }
        slot.retryCount++;
        if (slot.retryCount > properties.getMaxRetries()) {
            log.error("Max retries exceeded for {}, dropping until the next incoming message", conversationId);
            slot.retryCount = 0;
            return;
        }
        long delayMs = properties.getBaseRetryMs() * (1L << (slot.retryCount - 1));
        log.info("Scheduling retry {} for {} in {}ms", slot.retryCount, conversationId, delayMs);
        metrics.recordRetryScheduled();
        slot.retryFuture = timers.schedule(() -> enqueueCheck(conversationId), delayMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Starts the next piece of work for a conversation whose run just finished, or releases
     * its capacity and hands it to waiting conversations.
     */
    private void drain(String conversationId) {
        Slot slot = slot(conversationId);
        Runnable next;
        synchronized (slot) {
            next = shuttingDown ? null : nextWork(conversationId, slot);
            if (next == null) {
                slot.active = false;
                releaseCapacity();
            }
        }
        if (next != null) {
            workers.execute(next);
            return;
        }
        drainWaiting();
    }

    private void drainWaiting() {
        while (!shuttingDown) {
            String candidate;
            synchronized (capacityLock) {
                if (activeCount >= properties.getMaxConcurrentSandboxes() || waiting.isEmpty()) {
                    return;
                }
                Iterator<String> it = waiting.iterator();
                candidate = it.next();
                it.remove();
            }
            Slot slot = slot(candidate);
            Runnable next;
            synchronized (slot) {
                if (slot.active || (slot.pendingTasks.isEmpty() && !slot.pendingCheck)) {
                    continue;
                }
                synchronized (capacityLock) {
                    if (activeCount >= properties.getMaxConcurrentSandboxes()) {
                        waiting.add(candidate);
                        return;
                    }
                    activeCount++;
                }
                slot.active = true;
                next = nextWork(candidate, slot);
            }
            workers.execute(next);
        }
    }

    /** Takes the next queued task, or the pending check. Caller holds the slot lock. */
    private Runnable nextWork(String conversationId, Slot slot) {
        if (!slot.pendingTasks.isEmpty()) {
            Iterator<Map.Entry<String, Runnable>> it = slot.pendingTasks.entrySet().iterator();
            Map.Entry<String, Runnable> entry = it.next();
            it.remove();
            slot.runningTaskId = entry.getKey();
            return () -> runTask(conversationId, entry.getKey(), entry.getValue());
        }
        if (slot.pendingCheck) {
            slot.pendingCheck = false;
            return () -> runCheck(conversationId);
        }
        return null;
    }

    /** Caller holds a slot lock. */
    private boolean acquireCapacity(String conversationId) {
        synchronized (capacityLock) {
            if (activeCount >= properties.getMaxConcurrentSandboxes()) {
                waiting.add(conversationId);
                log.debug("At concurrency limit ({}), {} waiting", activeCount, conversationId);
                return false;
            }
            activeCount++;
            return true;
        }
    }

    private void releaseCapacity() {
        synchronized (capacityLock) {
            activeCount--;
        }
    }

    // ── Idle timer ──────────────────────────────────────────────────────

    /** Caller holds the slot lock. */
    private void armIdleTimer(String conversationId, Slot slot, SandboxSession session) {
        cancelIdleTimer(session);
        long generation = ++session.idleGeneration;
        session.idleTimer = timers.schedule(() -> onIdleTimeout(conversationId, slot, session, generation),
                properties.getIdleTimeoutMs(), TimeUnit.MILLISECONDS);
    }

    private void onIdleTimeout(String conversationId, Slot slot, SandboxSession session, long generation) {
        synchronized (slot) {
            if (slot.session != session || session.inputClosed || session.idleGeneration != generation) {
                return;
            }
            log.debug("Idle timeout for {}, closing sandbox input", conversationId);
            closeInputLocked(slot, session);
        }
    }

    private static void cancelIdleTimer(SandboxSession session) {
        if (session.idleTimer != null) {
            session.idleTimer.cancel(false);
            session.idleTimer = null;
        }
    }

    private void closeInputLocked(Slot slot, SandboxSession session) {
        session.inputClosed = true;
        cancelIdleTimer(session);
        try {
            session.closeWriter();
        } catch (IOException e) {
            log.debug("Closing input of {} failed: {}", session.label(), e.getMessage());
        }
    }

    private void clearSession(Slot slot, SandboxSession session) {
        cancelIdleTimer(session);
        session.idleGeneration++;
        session.state = SandboxSession.State.TERMINATED;
        if (slot.session == session) {
            slot.session = null;
        }
    }

    // ── Introspection ───────────────────────────────────────────────────

    public boolean hasLiveSession(String conversationId) {
        Slot slot = slots.get(conversationId);
        if (slot == null) {
            return false;
        }
        synchronized (slot) {
            return slot.session != null && slot.session.process().isAlive();
        }
    }

    public List<SandboxSession.Snapshot> liveSessions() {
        List<SandboxSession.Snapshot> result = new ArrayList<>();
        slots.forEach((id, slot) -> {
            synchronized (slot) {
                SandboxSession s = slot.session;
                if (s != null) {
                    result.add(new SandboxSession.Snapshot(id, s.label(), s.folder(), s.state,
                            s.inputClosed, s.startedAt(), s.isTask()));
                }
            }
        });
        return result;
    }

    public int activeCount() {
        synchronized (capacityLock) {
            return activeCount;
        }
    }

    // ── Shutdown ────────────────────────────────────────────────────────

    /**
     * Interrupts every live sandbox, waits until {@code timeoutMs} has elapsed or all have
     * exited, then kills the survivors.
     */
    public void shutdown(long timeoutMs) {
        markShuttingDown();
        long deadline = System.currentTimeMillis() + timeoutMs;

        List<SandboxSession> live = new ArrayList<>();
        slots.forEach((id, slot) -> {
            synchronized (slot) {
                if (slot.retryFuture != null) {
                    slot.retryFuture.cancel(false);
                }
                slot.pendingCheck = false;
                slot.pendingTasks.clear();
                if (slot.session != null) {
                    cancelIdleTimer(slot.session);
                    live.add(slot.session);
                }
            }
        });
        log.info("Shutting down queue: {} live sandbox(es)", live.size());

        for (SandboxSession session : live) {
            try {
                session.process().interrupt();
            } catch (RuntimeException e) {
                log.warn("Interrupt of {} failed: {}", session.label(), e.getMessage());
            }
        }

        for (SandboxSession session : live) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                break;
            }
            try {
                session.process().awaitExit(Duration.ofMillis(remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        for (SandboxSession session : live) {
            if (session.process().isAlive()) {
                log.warn("Sandbox {} did not stop in time, killing", session.label());
                kill(session.conversationId());
            }
        }
    }

    private Slot slot(String conversationId) {
        return slots.computeIfAbsent(conversationId, k -> new Slot());
    }
}
