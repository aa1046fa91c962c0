package com.groupdispatch.channel;

import com.groupdispatch.core.dispatch.DispatchProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps a conversation's typing indicator alive while the agent works.
 * Platforms expire the indicator after a few seconds, so it is refreshed periodically.
 */
@Service
public class TypingManager {

    private final ChannelRouter router;
    private final ScheduledExecutorService timers;
    private final DispatchProperties properties;
    private final Map<String, ScheduledFuture<?>> active = new ConcurrentHashMap<>();

    public TypingManager(ChannelRouter router,
                         @Qualifier("dispatchTimers") ScheduledExecutorService timers,
                         DispatchProperties properties) {
        this.router = router;
        this.timers = timers;
        this.properties = properties;
    }

    public void start(String conversationId) {
        cancel(conversationId);
        long interval = properties.getTypingIntervalMs();
        active.put(conversationId, timers.scheduleAtFixedRate(
                () -> router.setTyping(conversationId, true), 0, interval, TimeUnit.MILLISECONDS));
    }

    public void stop(String conversationId) {
        if (cancel(conversationId)) {
            router.setTyping(conversationId, false);
        }
    }

    public boolean isActive(String conversationId) {
        return active.containsKey(conversationId);
    }

    public void stopAll() {
        active.keySet().forEach(this::stop);
    }

    private boolean cancel(String conversationId) {
        ScheduledFuture<?> future = active.remove(conversationId);
        if (future == null) {
            return false;
        }
        future.cancel(false);
        return true;
    }
}
