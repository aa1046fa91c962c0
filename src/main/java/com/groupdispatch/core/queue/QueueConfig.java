package com.groupdispatch.core.queue;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools used by the {@link ConversationQueue}.
 * Sandbox runs block on process output for their whole lifetime, so the worker pool is
 * unbounded; the queue itself enforces the concurrency cap.
 */
@Configuration
public class QueueConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sandboxWorkers() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "sandbox-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService dispatchTimers() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "dispatch-timer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
