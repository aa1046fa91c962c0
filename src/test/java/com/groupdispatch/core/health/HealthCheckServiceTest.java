package com.groupdispatch.core.health;

import com.groupdispatch.core.dispatch.DispatchLoop;
import com.groupdispatch.core.persistence.DispatchStore;
import com.groupdispatch.core.persistence.StoreException;
import com.groupdispatch.core.queue.ConversationQueue;
import com.groupdispatch.sandbox.SandboxProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    private DispatchStore store;
    private SandboxProvider provider;
    private DispatchLoop loop;
    private ConversationQueue queue;

    @BeforeEach
    void setUp() {
        store = mock(DispatchStore.class);
        when(store.getRouterState(anyString())).thenReturn(Optional.empty());
        provider = mock(SandboxProvider.class);
        when(provider.name()).thenReturn("docker");
        when(provider.isAvailable()).thenReturn(true);
        loop = mock(DispatchLoop.class);
        when(loop.isRunning()).thenReturn(true);
        when(loop.lastPollAt()).thenReturn(Instant.parse("2026-01-01T00:00:00Z"));
        queue = mock(ConversationQueue.class);
        when(queue.activeCount()).thenReturn(2);
    }

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(r -> r.component().equals(name)).findFirst().orElseThrow();
    }

    @Test
    void allUp() {
        var results = new HealthCheckService(store, provider, loop, queue).checkAll();

        assertEquals(3, results.size());
        assertTrue(results.stream().allMatch(r -> r.status() == HealthStatus.Status.UP));
        assertEquals("docker", component(results, "sandbox").metadata().get("provider"));
        assertEquals("2", component(results, "dispatch").metadata().get("activeSandboxes"));
        assertEquals("2026-01-01T00:00:00Z", component(results, "dispatch").metadata().get("lastPoll"));
    }

    @Test
    void storeFailureIsDown() {
        when(store.getRouterState(anyString())).thenThrow(new StoreException("database is locked", null));

        var result = component(new HealthCheckService(store, provider, loop, queue).checkAll(), "store");

        assertEquals(HealthStatus.Status.DOWN, result.status());
        assertTrue(result.detail().contains("database is locked"));
    }

    @Test
    void missingOrUnreachableProviderIsDown() {
        assertEquals(HealthStatus.Status.DOWN,
                component(new HealthCheckService(store, null, loop, queue).checkAll(), "sandbox").status());

        when(provider.isAvailable()).thenReturn(false);
        assertEquals(HealthStatus.Status.DOWN,
                component(new HealthCheckService(store, provider, loop, queue).checkAll(), "sandbox").status());
    }

    @Test
    void dispatchReflectsLoopAndShutdown() {
        when(loop.isRunning()).thenReturn(false);
        assertEquals(HealthStatus.Status.DOWN,
                component(new HealthCheckService(store, provider, loop, queue).checkAll(), "dispatch").status());

        when(queue.isShuttingDown()).thenReturn(true);
        assertEquals(HealthStatus.Status.DEGRADED,
                component(new HealthCheckService(store, provider, loop, queue).checkAll(), "dispatch").status());
    }
}
