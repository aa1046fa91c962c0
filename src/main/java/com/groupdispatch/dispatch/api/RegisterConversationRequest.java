package com.groupdispatch.dispatch.api;

import com.groupdispatch.core.model.SandboxSettings;

/**
 * Request body for registering a conversation.
 */
public record RegisterConversationRequest(
    String id,
    String name,
    String folder,
    String trigger,
    Boolean requiresTrigger,
    SandboxSettings sandboxSettings
) {}
