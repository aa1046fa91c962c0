package com.groupdispatch.core.health;

import com.groupdispatch.core.dispatch.DispatchLoop;
import com.groupdispatch.core.persistence.DispatchStore;
import com.groupdispatch.core.queue.ConversationQueue;
import com.groupdispatch.sandbox.SandboxProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DispatchStore store;
    private final SandboxProvider sandboxProvider;
    private final DispatchLoop dispatchLoop;
    private final ConversationQueue queue;

    public HealthCheckService(
            DispatchStore store,
            @Autowired(required = false) SandboxProvider sandboxProvider,
            DispatchLoop dispatchLoop,
            ConversationQueue queue) {
        this.store = store;
        this.sandboxProvider = sandboxProvider;
        this.dispatchLoop = dispatchLoop;
        this.queue = queue;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkSandboxProvider());
        results.add(checkDispatchLoop());
        return results;
    }

    private HealthStatus checkStore() {
        try {
            store.getRouterState("last_timestamp");
            return new HealthStatus("store", HealthStatus.Status.UP,
                    "Store reachable (" + store.getClass().getSimpleName() + ")", Map.of());
        } catch (RuntimeException e) {
            log.warn("Store health check failed: {}", e.getMessage());
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "Store error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkSandboxProvider() {
        if (sandboxProvider == null) {
            return new HealthStatus("sandbox", HealthStatus.Status.DOWN,
                    "No SandboxProvider configured", Map.of());
        }
        try {
            if (sandboxProvider.isAvailable()) {
                return new HealthStatus("sandbox", HealthStatus.Status.UP,
                        "Provider " + sandboxProvider.name() + " available",
                        Map.of("provider", sandboxProvider.name()));
            }
            return new HealthStatus("sandbox", HealthStatus.Status.DOWN,
                    "Provider " + sandboxProvider.name() + " unreachable",
                    Map.of("provider", sandboxProvider.name()));
        } catch (RuntimeException e) {
            log.warn("Sandbox health check failed: {}", e.getMessage());
            return new HealthStatus("sandbox", HealthStatus.Status.DOWN,
                    "Sandbox error: " + e.getMessage(), Map.of("provider", sandboxProvider.name()));
        }
    }

    private HealthStatus checkDispatchLoop() {
        var metadata = Map.of(
                "activeSandboxes", String.valueOf(queue.activeCount()),
                "lastPoll", String.valueOf(dispatchLoop.lastPollAt()));
        if (queue.isShuttingDown()) {
            return new HealthStatus("dispatch", HealthStatus.Status.DEGRADED,
                    "Shutting down", metadata);
        }
        if (dispatchLoop.isRunning()) {
            return new HealthStatus("dispatch", HealthStatus.Status.UP,
                    "Dispatch loop running", metadata);
        }
        return new HealthStatus("dispatch", HealthStatus.Status.DOWN,
                "Dispatch loop not running", metadata);
    }
}
