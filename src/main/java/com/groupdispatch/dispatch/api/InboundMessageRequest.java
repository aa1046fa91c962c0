package com.groupdispatch.dispatch.api;

/**
 * Request body for ingesting a message from a channel adapter that talks HTTP.
 * {@code messageId} is generated when absent.
 */
public record InboundMessageRequest(
    String messageId,
    String sender,
    String senderName,
    String content,
    String chatName,
    Boolean fromAssistant
) {}
