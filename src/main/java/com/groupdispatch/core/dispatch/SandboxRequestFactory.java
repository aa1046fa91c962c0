package com.groupdispatch.core.dispatch;

import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.sandbox.SandboxRequest;
import org.springframework.stereotype.Component;

/**
 * Builds {@link SandboxRequest}s for message turns and scheduled tasks.
 */
@Component
public class SandboxRequestFactory {

    private final ConversationRegistry registry;
    private final SessionTokens sessionTokens;

    public SandboxRequestFactory(ConversationRegistry registry, SessionTokens sessionTokens) {
        this.registry = registry;
        this.sessionTokens = sessionTokens;
    }

    /**
     * A message turn, resuming the conversation's agent session if it has one.
     */
    public SandboxRequest forMessages(Conversation conversation, String prompt) {
        return build(conversation, prompt, sessionTokens.get(conversation.folder()).orElse(null), false, true);
    }

    /**
     * A scheduled-task run.
     *
     * @param shareSession resume the conversation's agent session instead of starting fresh
     */
    public SandboxRequest forTask(Conversation conversation, String prompt, boolean shareSession) {
        String token = shareSession ? sessionTokens.get(conversation.folder()).orElse(null) : null;
        return build(conversation, prompt, token, true, shareSession);
    }

    private SandboxRequest build(Conversation conversation, String prompt, String token,
                                 boolean scheduledTask, boolean persistSession) {
        return new SandboxRequest(
                conversation.id(),
                conversation.folder(),
                prompt,
                token,
                registry.isPrivileged(conversation),
                scheduledTask,
                persistSession,
                conversation.sandboxSettings(),
                registry.snapshotFor(conversation));
    }
}
