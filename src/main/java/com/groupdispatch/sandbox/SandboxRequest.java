package com.groupdispatch.sandbox;

import com.groupdispatch.core.model.SandboxSettings;

/**
 * Everything needed to start or continue an agent session in a sandbox.
 *
 * @param conversationId    conversation the turn belongs to
 * @param folder            the conversation's working directory name
 * @param prompt            formatted prompt for this turn
 * @param continuationToken agent session to resume, or null for a fresh session
 * @param privileged        whether the conversation is the privileged one
 * @param scheduledTask     whether this run serves a scheduled task
 * @param persistSession    whether continuation tokens reported by this run become the conversation's session
 * @param settings          per-conversation overrides (nullable)
 * @param snapshot          environment snapshot written before spawn
 */
public record SandboxRequest(
    String conversationId,
    String folder,
    String prompt,
    String continuationToken,
    boolean privileged,
    boolean scheduledTask,
    boolean persistSession,
    SandboxSettings settings,
    EnvironmentSnapshot snapshot
) {}
