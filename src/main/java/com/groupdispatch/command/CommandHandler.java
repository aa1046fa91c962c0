package com.groupdispatch.command;

import com.groupdispatch.channel.Channel;
import com.groupdispatch.channel.ChannelRouter;
import com.groupdispatch.channel.TypingManager;
import com.groupdispatch.core.dispatch.ConversationRegistry;
import com.groupdispatch.core.dispatch.DispatchProperties;
import com.groupdispatch.core.metrics.DispatchMetrics;
import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.ScheduledTask;
import com.groupdispatch.core.model.Timestamps;
import com.groupdispatch.core.persistence.DispatchStore;
import com.groupdispatch.sandbox.SnapshotWriter;
import com.groupdispatch.scheduler.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Executes command-channel requests on behalf of a source folder.
 * <p>
 * Requests from the privileged folder may act on any conversation. Requests from any other
 * folder may only address their own conversation and tasks; everything else is rejected.
 * Rejected or malformed requests are logged and reported as not handled. Exceptions are
 * reserved for failures while carrying out a valid request.
 */
@Service
public class CommandHandler {

    private static final Logger log = LoggerFactory.getLogger(CommandHandler.class);

    private final ConversationRegistry registry;
    private final DispatchStore store;
    private final ChannelRouter router;
    private final TypingManager typing;
    private final ScheduleCalculator calculator;
    private final SnapshotWriter snapshotWriter;
    private final DispatchProperties properties;
    private final DispatchMetrics metrics;

    public CommandHandler(ConversationRegistry registry,
                          DispatchStore store,
                          ChannelRouter router,
                          TypingManager typing,
                          ScheduleCalculator calculator,
                          SnapshotWriter snapshotWriter,
                          DispatchProperties properties,
                          DispatchMetrics metrics) {
        this.registry = registry;
        this.store = store;
        this.router = router;
        this.typing = typing;
        this.calculator = calculator;
        this.snapshotWriter = snapshotWriter;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * @return true if the request was carried out, false if it was rejected
     */
    public boolean handle(String sourceFolder, CommandRequest request) {
        String type = request.type() == null ? "unknown" : request.type();
        boolean privileged = properties.getMainFolder().equals(sourceFolder);
        boolean handled = switch (type) {
            case CommandRequest.MESSAGE -> relayMessage(sourceFolder, privileged, request);
            case CommandRequest.SCHEDULE_TASK -> scheduleTask(sourceFolder, privileged, request);
            case CommandRequest.PAUSE_TASK, CommandRequest.RESUME_TASK, CommandRequest.CANCEL_TASK ->
                    changeTask(sourceFolder, privileged, type, request);
            case CommandRequest.REFRESH_GROUPS -> refreshGroups(sourceFolder, privileged);
            case CommandRequest.REGISTER_GROUP -> registerGroup(sourceFolder, privileged, request);
            case CommandRequest.UNREGISTER_GROUP -> unregisterGroup(sourceFolder, privileged, request);
            default -> {
                log.warn("Unknown command type '{}' from {}", type, sourceFolder);
                yield false;
            }
        };
        metrics.recordCommand(type, handled);
        return handled;
    }

    private boolean relayMessage(String sourceFolder, boolean privileged, CommandRequest request) {
        if (isBlank(request.chatJid()) || isBlank(request.text())) {
            log.warn("Incomplete message command from {}", sourceFolder);
            return false;
        }
        Optional<Conversation> target = registry.get(request.chatJid());
        if (!privileged && (target.isEmpty() || !target.get().folder().equals(sourceFolder))) {
            log.warn("Unauthorized message from {} to {} blocked", sourceFolder, request.chatJid());
            return false;
        }
        typing.stop(request.chatJid());
        router.routeOutbound(request.chatJid(), router.formatOutbound(request.chatJid(), request.text()));
        log.info("Command message from {} sent to {}", sourceFolder, request.chatJid());
        return true;
    }

    private boolean scheduleTask(String sourceFolder, boolean privileged, CommandRequest request) {
        if (isBlank(request.prompt()) || isBlank(request.scheduleType()) || isBlank(request.scheduleValue())
                || isBlank(request.targetJid())) {
            log.warn("Incomplete schedule_task command from {}", sourceFolder);
            return false;
        }
        Optional<Conversation> target = registry.get(request.targetJid());
        if (target.isEmpty()) {
            log.warn("Cannot schedule task: {} is not registered", request.targetJid());
            return false;
        }
        String targetFolder = target.get().folder();
        if (!privileged && !targetFolder.equals(sourceFolder)) {
            log.warn("Unauthorized schedule_task from {} for {} blocked", sourceFolder, targetFolder);
            return false;
        }

        ScheduledTask.ScheduleType scheduleType;
        String firstRun;
        try {
            scheduleType = ScheduledTask.ScheduleType.valueOf(request.scheduleType().toUpperCase(Locale.ROOT));
            firstRun = calculator.firstRun(scheduleType, request.scheduleValue(), Instant.now());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid schedule from {}: {}", sourceFolder, e.getMessage());
            return false;
        }
        ScheduledTask.ContextMode contextMode = "group".equalsIgnoreCase(request.contextMode())
                ? ScheduledTask.ContextMode.GROUP : ScheduledTask.ContextMode.ISOLATED;

        String taskId = "task-" + System.currentTimeMillis() + "-" + UUID.randomUUID().toString().substring(0, 6);
        store.saveTask(new ScheduledTask(taskId, targetFolder, request.targetJid(), request.prompt(), scheduleType,
                request.scheduleValue(), contextMode, firstRun, null, null, ScheduledTask.Status.ACTIVE,
                Timestamps.now()));
        log.info("Task {} created by {} for {} ({})", taskId, sourceFolder, targetFolder, contextMode);
        return true;
    }

    private boolean changeTask(String sourceFolder, boolean privileged, String type, CommandRequest request) {
        if (isBlank(request.taskId())) {
            return false;
        }
        Optional<ScheduledTask> task = store.getTask(request.taskId());
        if (task.isEmpty() || (!privileged && !task.get().folder().equals(sourceFolder))) {
            log.warn("Unauthorized {} of task {} from {} blocked", type, request.taskId(), sourceFolder);
            return false;
        }
        switch (type) {
            case CommandRequest.CANCEL_TASK -> store.deleteTask(request.taskId());
            case CommandRequest.PAUSE_TASK -> store.saveTask(task.get().withStatus(ScheduledTask.Status.PAUSED));
            default -> store.saveTask(task.get().withStatus(ScheduledTask.Status.ACTIVE));
        }
        log.info("Task {} {} by {}", request.taskId(), type.replace("_task", ""), sourceFolder);
        return true;
    }

    private boolean refreshGroups(String sourceFolder, boolean privileged) {
        if (!privileged) {
            log.warn("Unauthorized refresh_groups from {} blocked", sourceFolder);
            return false;
        }
        for (Channel channel : router.channels()) {
            channel.syncMetadata(true);
        }
        Conversation source = registry.byFolder(sourceFolder).orElse(null);
        try {
            if (source != null) {
                snapshotWriter.write(sourceFolder, registry.snapshotFor(source));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to rewrite snapshot for " + sourceFolder, e);
        }
        log.info("Conversation metadata refreshed for {}", sourceFolder);
        return true;
    }

    private boolean registerGroup(String sourceFolder, boolean privileged, CommandRequest request) {
        if (!privileged) {
            log.warn("Unauthorized register_group from {} blocked", sourceFolder);
            return false;
        }
        if (isBlank(request.jid()) || isBlank(request.name()) || isBlank(request.folder())
                || isBlank(request.trigger())) {
            log.warn("Incomplete register_group command from {}", sourceFolder);
            return false;
        }
        boolean requiresTrigger = request.requiresTrigger() == null || request.requiresTrigger();
        try {
            registry.register(new Conversation(request.jid(), request.name(), request.folder(), request.trigger(),
                    requiresTrigger, Timestamps.now(), request.containerConfig()));
        } catch (IllegalArgumentException e) {
            log.warn("Rejected register_group from {}: {}", sourceFolder, e.getMessage());
            return false;
        }
        return true;
    }

    private boolean unregisterGroup(String sourceFolder, boolean privileged, CommandRequest request) {
        if (!privileged) {
            log.warn("Unauthorized unregister_group from {} blocked", sourceFolder);
            return false;
        }
        if (isBlank(request.jid())) {
            return false;
        }
        return registry.unregister(request.jid());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
