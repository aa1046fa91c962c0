package com.groupdispatch.core.model;

import java.io.Serializable;

/**
 * A registered chat context routed through the dispatch engine.
 *
 * @param id              stable identity, e.g. {@code tg:12345} or {@code 1203@g.us}
 * @param name            display name
 * @param folder          working directory name under the groups directory
 * @param trigger         marker a message must start with when a trigger is required, e.g. {@code @Andy}
 * @param requiresTrigger whether non-privileged turns need a triggering message
 * @param addedAt         registration time (ISO-8601)
 * @param sandboxSettings optional per-conversation sandbox overrides (nullable)
 */
public record Conversation(
    String id,
    String name,
    String folder,
    String trigger,
    boolean requiresTrigger,
    String addedAt,
    SandboxSettings sandboxSettings
) implements Serializable {

    public Conversation withSandboxSettings(SandboxSettings settings) {
        return new Conversation(id, name, folder, trigger, requiresTrigger, addedAt, settings);
    }
}
