package com.groupdispatch.core.model;

import java.util.List;

/**
 * Result of a global scan for new messages.
 *
 * @param messages     messages newer than the scanned watermark, oldest first
 * @param newTimestamp the timestamp of the newest message, or the input watermark if none
 */
public record NewMessages(List<InboundMessage> messages, String newTimestamp) {}
