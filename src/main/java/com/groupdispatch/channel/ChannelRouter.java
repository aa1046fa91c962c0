package com.groupdispatch.channel;

import com.groupdispatch.core.dispatch.DispatchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Owns the set of connected {@link Channel}s and routes outbound text to the one that
 * owns a conversation identity.
 */
@Service
public class ChannelRouter {

    private static final Logger log = LoggerFactory.getLogger(ChannelRouter.class);

    private static final Pattern INTERNAL_TAGS = Pattern.compile("<internal>[\\s\\S]*?</internal>");

    private final List<Channel> channels = new CopyOnWriteArrayList<>();
    private final DispatchProperties properties;

    public ChannelRouter(ObjectProvider<Channel> channelBeans, DispatchProperties properties) {
        this.properties = properties;
        channelBeans.orderedStream().forEach(channels::add);
    }

    public void register(Channel channel) {
        channels.add(channel);
        log.info("Channel registered: {}", channel.name());
    }

    public List<Channel> channels() {
        return List.copyOf(channels);
    }

    public Optional<Channel> findChannel(String conversationId) {
        return channels.stream().filter(ch -> ch.ownsIdentity(conversationId)).findFirst();
    }

    /**
     * Prefixes the assistant's name unless the owning channel shows the assistant's identity itself.
     */
    public String formatOutbound(String conversationId, String text) {
        boolean prefix = findChannel(conversationId).map(Channel::prefixesAssistantName).orElse(true);
        return prefix ? properties.getAssistantName() + ": " + text : text;
    }

    /**
     * Sends text to the conversation through its channel.
     *
     * @return true if a channel accepted the message
     */
    public boolean routeOutbound(String conversationId, String text) {
        Optional<Channel> channel = findChannel(conversationId);
        if (channel.isEmpty()) {
            log.warn("No channel found for {}", conversationId);
            return false;
        }
        try {
            channel.get().sendMessage(conversationId, text);
            return true;
        } catch (RuntimeException e) {
            log.error("Channel {} failed to send to {}", channel.get().name(), conversationId, e);
            return false;
        }
    }

    public void setTyping(String conversationId, boolean typing) {
        findChannel(conversationId).ifPresent(ch -> {
            try {
                ch.setTyping(conversationId, typing);
            } catch (RuntimeException e) {
                log.debug("Typing update failed for {}: {}", conversationId, e.getMessage());
            }
        });
    }

    public void connectAll() {
        for (Channel channel : channels) {
            channel.connect();
            log.info("Channel connected: {}", channel.name());
        }
    }

    public void disconnectAll() {
        for (Channel channel : channels) {
            try {
                channel.disconnect();
            } catch (RuntimeException e) {
                log.warn("Channel {} failed to disconnect: {}", channel.name(), e.getMessage());
            }
        }
    }

    /**
     * Removes {@code <internal>...</internal>} blocks the agent keeps for itself.
     */
    public static String stripInternalTags(String text) {
        return INTERNAL_TAGS.matcher(text).replaceAll("").strip();
    }
}
