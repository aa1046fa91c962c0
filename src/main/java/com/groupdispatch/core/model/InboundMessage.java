package com.groupdispatch.core.model;

import java.io.Serializable;

/**
 * An inbound chat message. Immutable once stored.
 *
 * @param id             platform message id
 * @param conversationId source conversation identity
 * @param sender         sender identity
 * @param senderName     sender display name
 * @param content        text content
 * @param timestamp      fixed-width ISO-8601 UTC timestamp, see {@link Timestamps}
 * @param fromAssistant  true when the assistant itself authored the message
 */
public record InboundMessage(
    String id,
    String conversationId,
    String sender,
    String senderName,
    String content,
    String timestamp,
    boolean fromAssistant
) implements Serializable {}
