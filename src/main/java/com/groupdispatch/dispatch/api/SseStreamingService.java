package com.groupdispatch.dispatch.api;

import com.groupdispatch.core.events.DispatchEvent;
import com.groupdispatch.core.events.EventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serves dispatch events as server-sent events.
 * <p>
 * Streams are bucketed by conversation id; the {@value #ALL} bucket follows every event.
 * Each frame carries a service-wide sequence number as its SSE id so a client can spot
 * frames it missed while reconnecting. A stream whose send fails is dropped on the spot
 * instead of waiting for the container's error callback.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    static final String ALL = "*";

    /** Conversations are long-lived, so streams are too: 1 hour. */
    private static final long DEFAULT_TIMEOUT_MS = 60 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final ScheduledExecutorService timers;
    private final long timeoutMs;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, Set<EventStream>> streams = new ConcurrentHashMap<>();

    private ScheduledFuture<?> heartbeat;

    @Autowired
    public SseStreamingService(EventBus eventBus, @Qualifier("dispatchTimers") ScheduledExecutorService timers) {
        this(eventBus, timers, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, ScheduledExecutorService timers, long timeoutMs) {
        this.eventBus = eventBus;
        this.timers = timers;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeat = timers.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void closeAll() {
        if (heartbeat != null) {
            heartbeat.cancel(false);
        }
        streams.values().forEach(bucket -> bucket.forEach(stream -> stream.close(true)));
        streams.clear();
    }

    /**
     * Opens a stream of one conversation's events, or of every event if {@code conversationId} is null.
     */
    public SseEmitter createEmitter(String conversationId) {
        String key = conversationId == null ? ALL : conversationId;
        var stream = new EventStream(key, new SseEmitter(timeoutMs));
        streams.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(stream);

        stream.subscription = conversationId == null
                ? eventBus.subscribeAll(stream::forward)
                : eventBus.subscribe(conversationId, stream::forward);

        stream.emitter.onCompletion(() -> stream.close(false));
        stream.emitter.onTimeout(() -> stream.close(false));
        stream.emitter.onError(ex -> {
            log.debug("SSE stream of {} failed: {}", key, ex.getMessage());
            stream.close(false);
        });

        stream.send(SseEmitter.event().comment("connected"));
        log.info("SSE stream opened for {} ({} open)", key, activeEmitterCount());
        return stream.emitter;
    }

    public int activeEmitterCount() {
        return streams.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * @return open streams following {@code conversationId}, not counting all-event streams
     */
    public int activeEmitterCount(String conversationId) {
        Set<EventStream> bucket = streams.get(conversationId == null ? ALL : conversationId);
        return bucket == null ? 0 : bucket.size();
    }

    void sendHeartbeats() {
        for (Set<EventStream> bucket : streams.values()) {
            bucket.forEach(stream -> stream.send(SseEmitter.event().comment("heartbeat")));
        }
    }

    /**
     * Frame body of an event. The conversation id leads so all-event clients can route frames.
     */
    static Map<String, Object> frameData(DispatchEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (event.conversationId() != null) {
            data.put("conversationId", event.conversationId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private final class EventStream {

        private final String key;
        private final SseEmitter emitter;
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile EventBus.Subscription subscription;

        EventStream(String key, SseEmitter emitter) {
            this.key = key;
            this.emitter = emitter;
        }

        void forward(DispatchEvent event) {
            send(SseEmitter.event()
                    .id(Long.toString(sequence.incrementAndGet()))
                    .name(event.eventType())
                    .data(frameData(event)));
        }

        synchronized void send(SseEmitter.SseEventBuilder frame) {
            if (closed.get()) {
                return;
            }
            try {
                emitter.send(frame);
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping SSE stream of {}: {}", key, e.getMessage());
                close(false);
            }
        }

        /**
         * @param completeEmitter false when the emitter already finished or failed on its own
         */
        void close(boolean completeEmitter) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            if (subscription != null) {
                subscription.unsubscribe();
            }
            streams.computeIfPresent(key, (k, bucket) -> {
                bucket.remove(this);
                return bucket.isEmpty() ? null : bucket;
            });
            if (completeEmitter) {
                emitter.complete();
            }
        }
    }
}
