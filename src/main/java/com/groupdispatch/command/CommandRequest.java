package com.groupdispatch.command;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.groupdispatch.core.model.SandboxSettings;

/**
 * A request file dropped by a sandbox into its command directory.
 * Which fields are set depends on {@code type}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandRequest(
    String type,
    String chatJid,
    String text,
    String taskId,
    String prompt,
    @JsonProperty("schedule_type") String scheduleType,
    @JsonProperty("schedule_value") String scheduleValue,
    @JsonProperty("context_mode") String contextMode,
    String targetJid,
    String jid,
    String name,
    String folder,
    String trigger,
    Boolean requiresTrigger,
    SandboxSettings containerConfig
) {

    public static final String MESSAGE = "message";
    public static final String SCHEDULE_TASK = "schedule_task";
    public static final String PAUSE_TASK = "pause_task";
    public static final String RESUME_TASK = "resume_task";
    public static final String CANCEL_TASK = "cancel_task";
    public static final String REFRESH_GROUPS = "refresh_groups";
    public static final String REGISTER_GROUP = "register_group";
    public static final String UNREGISTER_GROUP = "unregister_group";
}
