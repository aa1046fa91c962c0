package com.groupdispatch.core.dispatch;

import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.InboundMessage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a batch of messages may start a turn.
 * <p>
 * The privileged conversation (folder equal to {@code main-folder}) and conversations that
 * do not require a trigger always qualify. Others need at least one message whose trimmed
 * content starts with the conversation's trigger, case-insensitively.
 */
@Component
public class TriggerPolicy {

    private final DispatchProperties properties;

    public TriggerPolicy(DispatchProperties properties) {
        this.properties = properties;
    }

    public boolean isPrivileged(Conversation conversation) {
        return properties.getMainFolder().equals(conversation.folder());
    }

    public boolean requiresTrigger(Conversation conversation) {
        return !isPrivileged(conversation) && conversation.requiresTrigger();
    }

    public boolean admits(Conversation conversation, List<InboundMessage> messages) {
        if (!requiresTrigger(conversation)) {
            return true;
        }
        Pattern pattern = patternFor(conversation);
        return messages.stream()
                .anyMatch(m -> m.content() != null && pattern.matcher(m.content().strip()).find());
    }

    Pattern patternFor(Conversation conversation) {
        String trigger = conversation.trigger() == null || conversation.trigger().isBlank()
                ? "@" + properties.getAssistantName()
                : conversation.trigger().strip();
        boolean wordEnd = Character.isLetterOrDigit(trigger.charAt(trigger.length() - 1))
                || trigger.endsWith("_");
        return Pattern.compile("^" + Pattern.quote(trigger) + (wordEnd ? "\\b" : ""), Pattern.CASE_INSENSITIVE);
    }
}
