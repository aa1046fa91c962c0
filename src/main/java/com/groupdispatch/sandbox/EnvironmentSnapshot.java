package com.groupdispatch.sandbox;

import com.groupdispatch.core.model.AvailableConversation;
import com.groupdispatch.core.model.ScheduledTask;

import java.util.List;

/**
 * What a sandbox may see of the rest of the system, already filtered for its privilege level.
 *
 * @param tasks         scheduled tasks visible to the conversation
 * @param conversations chats the conversation may address (empty unless privileged)
 */
public record EnvironmentSnapshot(
    List<ScheduledTask> tasks,
    List<AvailableConversation> conversations
) {

    public EnvironmentSnapshot {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        conversations = conversations != null ? List.copyOf(conversations) : List.of();
    }

    public static EnvironmentSnapshot empty() {
        return new EnvironmentSnapshot(List.of(), List.of());
    }
}
