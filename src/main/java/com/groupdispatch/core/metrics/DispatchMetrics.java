package com.groupdispatch.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for conversation dispatch.
 */
@Service
public class DispatchMetrics {

    private final MeterRegistry registry;

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "success", "skipped", "failed" or "rolled_back"
     */
    public void recordTurn(String outcome) {
        Counter.builder("groupdispatch.turns.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordPipedMessage() {
        Counter.builder("groupdispatch.messages.piped")
                .description("Messages written into an already running sandbox")
                .register(registry)
                .increment();
    }

    public void recordSandboxStart(boolean success) {
        Counter.builder("groupdispatch.sandbox.starts")
                .tag("result", success ? "started" : "failed")
                .register(registry)
                .increment();
    }

    public void recordSandboxLifetime(long ms) {
        Timer.builder("groupdispatch.sandbox.lifetime")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRetryScheduled() {
        Counter.builder("groupdispatch.retries.scheduled")
                .register(registry)
                .increment();
    }

    public void recordCommand(String type, boolean success) {
        Counter.builder("groupdispatch.commands.total")
                .tag("type", type)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordTaskRun(boolean success) {
        Counter.builder("groupdispatch.tasks.runs")
                .tag("result", success ? "success" : "error")
                .register(registry)
                .increment();
    }
}
