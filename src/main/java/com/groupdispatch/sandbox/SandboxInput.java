package com.groupdispatch.sandbox;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * First line written to a sandbox's stdin. Follow-up messages are
 * {@code {"type":"message","text":...}} lines piped by the queue.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SandboxInput(
    String prompt,
    String sessionId,
    String groupFolder,
    String chatJid,
    @JsonProperty("isMain") boolean main,
    @JsonProperty("isScheduledTask") boolean scheduledTask
) {

    public static SandboxInput from(SandboxRequest request) {
        return new SandboxInput(request.prompt(), request.continuationToken(), request.folder(),
                request.conversationId(), request.privileged(), request.scheduledTask());
    }
}
