package com.groupdispatch.core.model;

/**
 * Chat metadata seen by a channel, registered or not.
 */
public record ChatInfo(String id, String name, String lastMessageTime) {}
