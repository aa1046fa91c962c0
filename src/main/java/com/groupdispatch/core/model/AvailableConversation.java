package com.groupdispatch.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of the available-conversations snapshot handed to privileged sandboxes.
 */
public record AvailableConversation(
    String jid,
    String name,
    String lastActivity,
    @JsonProperty("isRegistered") boolean registered
) {}
