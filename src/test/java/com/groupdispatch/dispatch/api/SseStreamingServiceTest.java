package com.groupdispatch.dispatch.api;

import com.groupdispatch.core.events.DispatchEvent;
import com.groupdispatch.core.events.EventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private static final String GROUP = "group-a@g.us";

    private EventBus eventBus;
    private ScheduledExecutorService timers;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = spy(new EventBus());
        timers = mock(ScheduledExecutorService.class);
        service = new SseStreamingService(eventBus, timers);
    }

    // -- Opening streams --

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("creates a distinct emitter per call for the same conversation")
        void distinctEmitters() {
            SseEmitter first = service.createEmitter(GROUP);
            SseEmitter second = service.createEmitter(GROUP);

            assertNotSame(first, second);
            assertEquals(2, service.activeEmitterCount(GROUP));
        }

        @Test
        @DisplayName("a conversation id subscribes to that conversation only")
        void conversationSubscription() {
            service.createEmitter(GROUP);

            verify(eventBus).subscribe(eq(GROUP), any());
            verify(eventBus, never()).subscribeAll(any());
        }

        @Test
        @DisplayName("a null conversation id subscribes to every event")
        void globalSubscription() {
            service.createEmitter(null);

            verify(eventBus).subscribeAll(any());
            verify(eventBus, never()).subscribe(any(), any());
            assertEquals(1, service.activeEmitterCount(null));
            assertEquals(0, service.activeEmitterCount(GROUP));
        }

        @Test
        @DisplayName("uses the configured timeout")
        void timeout() {
            var shortLived = new SseStreamingService(eventBus, timers, 1234L);
            assertEquals(1234L, shortLived.createEmitter(GROUP).getTimeout());
        }
    }

    // -- Frames --

    @Nested
    @DisplayName("frames")
    class FrameTests {

        @Test
        @DisplayName("lead with the conversation id and end with the event timestamp")
        void frameLayout() {
            var event = DispatchEvent.of("turn.completed", GROUP, Map.of("watermark", "2026-01-01T00:00:01.000Z"));

            var data = SseStreamingService.frameData(event);

            assertEquals(List.of("conversationId", "watermark", "timestamp"), new ArrayList<>(data.keySet()));
            assertEquals(GROUP, data.get("conversationId"));
            assertEquals(event.timestamp().toString(), data.get("timestamp"));
        }

        @Test
        @DisplayName("engine-level events carry no conversation id")
        void engineEvent() {
            var data = SseStreamingService.frameData(DispatchEvent.of("engine.started", null, Map.of()));

            assertFalse(data.containsKey("conversationId"));
        }
    }

    // -- Dead streams --

    @Nested
    @DisplayName("dead streams")
    class DeadStreamTests {

        @Test
        @DisplayName("a stream whose send fails is dropped and unsubscribed")
        void droppedOnFailedSend() {
            SseEmitter dead = service.createEmitter(GROUP);
            service.createEmitter(GROUP);
            dead.complete();

            assertDoesNotThrow(() ->
                    eventBus.publish(DispatchEvent.of("message.piped", GROUP, Map.of("count", 2))));

            assertEquals(1, service.activeEmitterCount(GROUP));
        }

        @Test
        @DisplayName("heartbeats drop dead streams too")
        void heartbeatDropsDead() {
            service.createEmitter(GROUP).complete();
            service.createEmitter(null);

            service.sendHeartbeats();

            assertEquals(0, service.activeEmitterCount(GROUP));
            assertEquals(1, service.activeEmitterCount());
        }

        @Test
        @DisplayName("other conversations' subscribers are untouched")
        void otherConversation() {
            var received = new ArrayList<DispatchEvent>();
            eventBus.subscribe(GROUP, received::add);
            service.createEmitter("group-b@g.us").complete();

            eventBus.publish(DispatchEvent.of("turn.started", GROUP, Map.of()));

            assertEquals(1, received.size());
            assertEquals(1, service.activeEmitterCount("group-b@g.us"));
        }
    }

    // -- Lifecycle --

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("heartbeat runs on the shared timers and is cancelled on close")
        void heartbeatScheduling() {
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            doReturn(future).when(timers).scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));

            service.startHeartbeat();
            service.createEmitter(GROUP);
            service.closeAll();

            verify(timers).scheduleAtFixedRate(any(Runnable.class), eq(30L), eq(30L), eq(TimeUnit.SECONDS));
            verify(future).cancel(false);
            verify(timers, never()).shutdown();
            assertEquals(0, service.activeEmitterCount());
        }
    }

    // -- Concurrency --

    @Nested
    @DisplayName("concurrent access")
    class ConcurrentTests {

        @Test
        @DisplayName("streams opened from many threads are all registered")
        void concurrentCreation() throws Exception {
            int threads = 8;
            var done = new CountDownLatch(threads);
            for (int i = 0; i < threads; i++) {
                String id = "group-" + (i % 2) + "@g.us";
                new Thread(() -> {
                    service.createEmitter(id);
                    done.countDown();
                }).start();
            }

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(threads, service.activeEmitterCount());
            assertEquals(threads / 2, service.activeEmitterCount("group-0@g.us"));
        }
    }
}
