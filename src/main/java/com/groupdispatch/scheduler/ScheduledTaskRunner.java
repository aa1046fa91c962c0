package com.groupdispatch.scheduler;

import com.groupdispatch.channel.ChannelRouter;
import com.groupdispatch.core.dispatch.ConversationRegistry;
import com.groupdispatch.core.dispatch.DispatchProperties;
import com.groupdispatch.core.dispatch.SandboxRequestFactory;
import com.groupdispatch.core.logging.MdcContext;
import com.groupdispatch.core.metrics.DispatchMetrics;
import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.ScheduledTask;
import com.groupdispatch.core.model.Timestamps;
import com.groupdispatch.core.persistence.DispatchStore;
import com.groupdispatch.core.queue.ConversationQueue;
import com.groupdispatch.sandbox.SandboxEvent;
import com.groupdispatch.sandbox.SandboxOutcome;
import com.groupdispatch.sandbox.SandboxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polls for due scheduled tasks and runs each through the owning conversation's queue slot,
 * so a task never overlaps a message turn of the same conversation.
 * <p>
 * A task sharing the conversation's context resumes its agent session; an isolated task
 * starts fresh and leaves the conversation's session untouched. The sandbox is told to
 * finish as soon as the task produced its result.
 */
@Service
public class ScheduledTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(ScheduledTaskRunner.class);

    private static final int RESULT_SUMMARY_LENGTH = 200;

    private final DispatchStore store;
    private final ConversationRegistry registry;
    private final ConversationQueue queue;
    private final SandboxRunner runner;
    private final SandboxRequestFactory requestFactory;
    private final ChannelRouter router;
    private final ScheduleCalculator calculator;
    private final DispatchMetrics metrics;
    private final DispatchProperties properties;

    private ScheduledExecutorService poller;

    public ScheduledTaskRunner(DispatchStore store,
                               ConversationRegistry registry,
                               ConversationQueue queue,
                               SandboxRunner runner,
                               SandboxRequestFactory requestFactory,
                               ChannelRouter router,
                               ScheduleCalculator calculator,
                               DispatchMetrics metrics,
                               DispatchProperties properties) {
        this.store = store;
        this.registry = registry;
        this.queue = queue;
        this.runner = runner;
        this.requestFactory = requestFactory;
        this.router = router;
        this.calculator = calculator;
        this.metrics = metrics;
        this.properties = properties;
    }

    public synchronized void start() {
        if (poller != null) {
            return;
        }
        poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "task-scheduler");
            t.setDaemon(true);
            return t;
        });
        poller.scheduleWithFixedDelay(this::pollSafely, 0, properties.getSchedulerPollIntervalMs(),
                TimeUnit.MILLISECONDS);
        log.info("Task scheduler started (interval {}ms)", properties.getSchedulerPollIntervalMs());
    }

    public synchronized void stop() {
        if (poller != null) {
            poller.shutdownNow();
            poller = null;
        }
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (RuntimeException e) {
            log.error("Error in task scheduler", e);
        }
    }

    /**
     * Queues every due task.
     *
     * @return number of tasks handed to the queue
     */
    public int pollOnce() {
        List<ScheduledTask> due = store.getDueTasks(Timestamps.now());
        int queued = 0;
        for (ScheduledTask task : due) {
            Optional<Conversation> conversation = registry.byFolder(task.folder());
            if (conversation.isEmpty()) {
                log.error("Task {} belongs to unregistered folder {}, pausing it", task.id(), task.folder());
                store.saveTask(task.afterRun(Timestamps.now(), "Error: conversation not registered",
                        task.nextRun()).withStatus(ScheduledTask.Status.PAUSED));
                continue;
            }
            Conversation target = conversation.get();
            queue.enqueueTask(target.id(), task.id(), () -> runTask(task.id(), target));
            queued++;
        }
        if (queued > 0) {
            log.info("Queued {} due task(s)", queued);
        }
        return queued;
    }

    /**
     * Runs one task now on the calling thread.
     */
    void runTask(String taskId, Conversation conversation) {
        Optional<ScheduledTask> current = store.getTask(taskId);
        if (current.isEmpty() || current.get().status() != ScheduledTask.Status.ACTIVE) {
            log.debug("Task {} no longer active, skipping", taskId);
            return;
        }
        ScheduledTask task = current.get();
        MdcContext.setTask(conversation.id(), conversation.folder(), taskId);
        try {
            log.info("Running scheduled task {} for {}", taskId, conversation.name());
            AtomicReference<String> lastResult = new AtomicReference<>();
            boolean shareSession = task.contextMode() == ScheduledTask.ContextMode.GROUP;

            SandboxOutcome outcome = runner.run(
                    requestFactory.forTask(conversation, task.prompt(), shareSession),
                    event -> onEvent(task, conversation, event, lastResult));

            String summary;
            if (outcome.isSuccess()) {
                String text = lastResult.get();
                summary = text == null ? "Completed"
                        : text.length() > RESULT_SUMMARY_LENGTH ? text.substring(0, RESULT_SUMMARY_LENGTH) : text;
            } else {
                summary = "Error: " + outcome.error();
            }
            metrics.recordTaskRun(outcome.isSuccess());
            recordRun(taskId, summary);
        } finally {
            MdcContext.clear();
        }
    }

    private void onEvent(ScheduledTask task, Conversation conversation, SandboxEvent event,
                         AtomicReference<String> lastResult) {
        if (event instanceof SandboxEvent.Result r && r.text() != null) {
            String text = ChannelRouter.stripInternalTags(r.text());
            if (!text.isEmpty()) {
                router.routeOutbound(task.chatId(), router.formatOutbound(task.chatId(), text));
                lastResult.set(text);
            }
            queue.closeInput(conversation.id());
        } else if (event instanceof SandboxEvent.Failure f) {
            log.warn("Task {} reported error: {}", task.id(), f.detail());
        }
    }

    private void recordRun(String taskId, String summary) {
        Optional<ScheduledTask> latest = store.getTask(taskId);
        if (latest.isEmpty()) {
            log.info("Task {} was cancelled while running", taskId);
            return;
        }
        ScheduledTask task = latest.get();
        String next = calculator.nextRun(task, Instant.now());
        ScheduledTask updated = task.afterRun(Timestamps.now(), summary, next);
        if (task.status() == ScheduledTask.Status.PAUSED) {
            updated = updated.withStatus(ScheduledTask.Status.PAUSED);
        }
        store.saveTask(updated);
        log.info("Task {} done, next run: {}", taskId, next == null ? "none" : next);
    }
}
