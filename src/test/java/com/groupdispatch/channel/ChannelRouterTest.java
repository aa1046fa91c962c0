package com.groupdispatch.channel;

import com.groupdispatch.core.dispatch.DispatchProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ChannelRouterTest {

    private Channel whatsapp;
    private Channel telegram;
    private ChannelRouter router;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        whatsapp = channel("whatsapp", "@g.us", true);
        telegram = channel("telegram", "tg:", false);
        ObjectProvider<Channel> beans = mock(ObjectProvider.class);
        when(beans.orderedStream()).thenReturn(Stream.of(whatsapp));
        router = new ChannelRouter(beans, new DispatchProperties());
        router.register(telegram);
    }

    private static Channel channel(String name, String marker, boolean prefixes) {
        Channel channel = mock(Channel.class);
        when(channel.name()).thenReturn(name);
        when(channel.ownsIdentity(anyString())).thenAnswer(inv -> ((String) inv.getArgument(0)).contains(marker));
        when(channel.prefixesAssistantName()).thenReturn(prefixes);
        return channel;
    }

    @Test
    void routesToTheOwningChannel() {
        assertTrue(router.routeOutbound("tg:42", "hi"));
        assertTrue(router.routeOutbound("1203@g.us", "hello"));

        verify(telegram).sendMessage("tg:42", "hi");
        verify(whatsapp).sendMessage("1203@g.us", "hello");
        assertEquals(2, router.channels().size());
    }

    @Test
    void unknownIdentityIsNotRouted() {
        assertFalse(router.routeOutbound("slack:C1", "hi"));
        assertTrue(router.findChannel("slack:C1").isEmpty());
    }

    @Test
    void sendFailureIsReportedNotThrown() {
        doThrow(new IllegalStateException("socket closed")).when(whatsapp).sendMessage(anyString(), anyString());

        assertFalse(router.routeOutbound("1203@g.us", "hello"));
    }

    @Test
    void prefixesAssistantNameOnlyWhereTheChannelNeedsIt() {
        assertEquals("Andy: hello", router.formatOutbound("1203@g.us", "hello"));
        assertEquals("hello", router.formatOutbound("tg:42", "hello"));
        assertEquals("Andy: hello", router.formatOutbound("unknown", "hello"));
    }

    @Test
    void typingFailuresAreSwallowed() {
        doThrow(new IllegalStateException("rate limited")).when(telegram).setTyping(anyString(), anyBoolean());

        assertDoesNotThrow(() -> router.setTyping("tg:42", true));
    }

    @Test
    void connectsAndDisconnectsEveryChannel() {
        doThrow(new IllegalStateException("already closed")).when(whatsapp).disconnect();

        router.connectAll();
        router.disconnectAll();

        verify(whatsapp).connect();
        verify(telegram).connect();
        verify(telegram).disconnect();
    }

    @Test
    void stripsInternalBlocks() {
        assertEquals("visible", ChannelRouter.stripInternalTags("<internal>a\nb</internal> visible "));
        assertEquals("a  b", ChannelRouter.stripInternalTags("a <internal>x</internal> b"));
        assertEquals("", ChannelRouter.stripInternalTags("<internal>only</internal>"));
    }
}
