package com.groupdispatch.channel;

import com.groupdispatch.core.dispatch.DispatchProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TypingManagerTest {

    private static final String GROUP = "a@g.us";

    private ChannelRouter router;
    private List<Runnable> refreshers;
    private List<ScheduledFuture<?>> futures;
    private TypingManager typing;

    @BeforeEach
    void setUp() {
        router = mock(ChannelRouter.class);
        refreshers = new ArrayList<>();
        futures = new ArrayList<>();
        ScheduledExecutorService timers = mock(ScheduledExecutorService.class);
        doAnswer(inv -> {
            refreshers.add(inv.getArgument(0));
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            futures.add(future);
            return future;
        }).when(timers).scheduleAtFixedRate(any(Runnable.class), anyLong(), eq(4000L), eq(TimeUnit.MILLISECONDS));
        typing = new TypingManager(router, timers, new DispatchProperties());
    }

    @Test
    void startRefreshesTheIndicatorPeriodically() {
        typing.start(GROUP);

        assertTrue(typing.isActive(GROUP));
        refreshers.get(0).run();
        verify(router).setTyping(GROUP, true);
    }

    @Test
    void stopCancelsAndClearsTheIndicatorOnce() {
        typing.start(GROUP);

        typing.stop(GROUP);
        typing.stop(GROUP);

        verify(futures.get(0)).cancel(false);
        verify(router, times(1)).setTyping(GROUP, false);
        assertFalse(typing.isActive(GROUP));
    }

    @Test
    void restartReplacesThePreviousRefresher() {
        typing.start(GROUP);
        typing.start(GROUP);

        verify(futures.get(0)).cancel(false);
        assertEquals(2, futures.size());
        verify(router, never()).setTyping(GROUP, false);
    }

    @Test
    void stopAllClearsEveryConversation() {
        typing.start(GROUP);
        typing.start("tg:1");

        typing.stopAll();

        assertFalse(typing.isActive(GROUP));
        assertFalse(typing.isActive("tg:1"));
        verify(router).setTyping("tg:1", false);
    }
}
