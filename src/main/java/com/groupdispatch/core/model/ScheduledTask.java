package com.groupdispatch.core.model;

import java.io.Serializable;

/**
 * A recurring or one-off prompt run on behalf of a conversation.
 *
 * @param id            task id
 * @param folder        folder of the owning conversation
 * @param chatId        conversation the results are delivered to
 * @param prompt        prompt handed to the sandbox
 * @param scheduleType  cron, interval or once
 * @param scheduleValue cron expression, interval in ms, or ISO timestamp
 * @param contextMode   whether the task shares the conversation's agent session
 * @param nextRun       next due time (ISO-8601), null when finished
 * @param lastRun       last run time (nullable)
 * @param lastResult    summary of the last run (nullable)
 * @param status        active, paused or completed
 * @param createdAt     creation time
 */
public record ScheduledTask(
    String id,
    String folder,
    String chatId,
    String prompt,
    ScheduleType scheduleType,
    String scheduleValue,
    ContextMode contextMode,
    String nextRun,
    String lastRun,
    String lastResult,
    Status status,
    String createdAt
) implements Serializable {

    public enum ScheduleType { CRON, INTERVAL, ONCE }

    public enum ContextMode { GROUP, ISOLATED }

    public enum Status { ACTIVE, PAUSED, COMPLETED }

    public ScheduledTask withStatus(Status newStatus) {
        return new ScheduledTask(id, folder, chatId, prompt, scheduleType, scheduleValue, contextMode,
                nextRun, lastRun, lastResult, newStatus, createdAt);
    }

    public ScheduledTask afterRun(String runAt, String result, String next) {
        Status newStatus = next == null ? Status.COMPLETED : status;
        return new ScheduledTask(id, folder, chatId, prompt, scheduleType, scheduleValue, contextMode,
                next, runAt, result, newStatus, createdAt);
    }
}
