package com.groupdispatch.channel;

/**
 * A messaging platform adapter.
 * <p>
 * Adapters hand every inbound message to
 * {@link com.groupdispatch.core.dispatch.MessageIngestService#storeMessage}; outbound
 * text arrives through {@link #sendMessage}. Register an adapter by exposing it as a
 * Spring bean.
 */
public interface Channel {

    /** Platform name, e.g. "telegram". */
    String name();

    /** Whether the conversation identity belongs to this platform, e.g. ids starting with {@code tg:}. */
    boolean ownsIdentity(String conversationId);

    void sendMessage(String conversationId, String text);

    /** Shows or clears the typing indicator. Best effort. */
    default void setTyping(String conversationId, boolean typing) {
    }

    /**
     * Whether outbound text needs the assistant's name in front of it, for platforms where
     * the assistant posts under a shared account.
     */
    default boolean prefixesAssistantName() {
        return true;
    }

    /** Re-reads chat names and membership from the platform. */
    default void syncMetadata(boolean force) {
    }

    default void connect() {
    }

    default void disconnect() {
    }
}
