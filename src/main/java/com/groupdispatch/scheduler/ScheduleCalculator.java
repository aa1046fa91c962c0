package com.groupdispatch.scheduler;

import com.groupdispatch.core.dispatch.DispatchProperties;
import com.groupdispatch.core.model.ScheduledTask;
import com.groupdispatch.core.model.Timestamps;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

/**
 * Computes due times of scheduled tasks in the configured timezone.
 * <p>
 * Cron values accept both the 5-field form ({@code 0 9 * * 1}) and Spring's 6-field form
 * with seconds. Interval values are milliseconds. Once values are ISO-8601 instants.
 */
@Component
public class ScheduleCalculator {

    private final DispatchProperties properties;

    public ScheduleCalculator(DispatchProperties properties) {
        this.properties = properties;
    }

    /**
     * First due time of a new task.
     *
     * @throws IllegalArgumentException if the schedule value is invalid for its type
     */
    public String firstRun(ScheduledTask.ScheduleType type, String value, Instant now) {
        return switch (type) {
            case CRON -> nextCron(value, now);
            case INTERVAL -> Timestamps.format(now.plusMillis(parseInterval(value)));
            case ONCE -> parseOnce(value);
        };
    }

    /**
     * Due time after a completed run, or null when the task is finished.
     */
    public String nextRun(ScheduledTask task, Instant now) {
        return switch (task.scheduleType()) {
            case CRON -> nextCron(task.scheduleValue(), now);
            case INTERVAL -> Timestamps.format(now.plusMillis(parseInterval(task.scheduleValue())));
            case ONCE -> null;
        };
    }

    private String nextCron(String value, Instant now) {
        CronExpression cron = parseCron(value);
        ZonedDateTime next = cron.next(now.atZone(properties.getZoneId()));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression never fires: " + value);
        }
        return Timestamps.format(next.toInstant());
    }

    static CronExpression parseCron(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Empty cron expression");
        }
        String expression = value.strip();
        if (expression.split("\\s+").length == 5) {
            expression = "0 " + expression;
        }
        return CronExpression.parse(expression);
    }

    static long parseInterval(String value) {
        long ms;
        try {
            ms = Long.parseLong(value.strip());
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid interval: " + value);
        }
        if (ms <= 0) {
            throw new IllegalArgumentException("Interval must be positive: " + value);
        }
        return ms;
    }

    static String parseOnce(String value) {
        try {
            return Timestamps.normalize(value);
        } catch (DateTimeParseException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid timestamp: " + value);
        }
    }
}
