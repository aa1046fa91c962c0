package com.groupdispatch.dispatch.cli;

import com.groupdispatch.core.cursor.CursorStore;
import com.groupdispatch.core.cursor.PendingMessageRecovery;
import com.groupdispatch.core.dispatch.ConversationRegistry;
import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.InboundMessage;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: groupdispatch pending [id]
 * <p>
 * Lists messages stored but not yet delivered to an agent, which the engine will pick up
 * on its next start.
 */
@Command(name = "pending", mixinStandardHelpOptions = true, description = "Show undelivered messages")
@Component
public class PendingCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Conversation id (default: all)")
    private String conversationId;

    private final ConversationRegistry registry;
    private final CursorStore cursors;
    private final PendingMessageRecovery pendingMessages;

    public PendingCommand(ConversationRegistry registry, CursorStore cursors, PendingMessageRecovery pendingMessages) {
        this.registry = registry;
        this.cursors = cursors;
        this.pendingMessages = pendingMessages;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        registry.load();
        cursors.load();

        List<Conversation> targets = new ArrayList<>();
        if (conversationId != null) {
            var conversation = registry.get(conversationId);
            if (conversation.isEmpty()) {
                ConsoleOutput.error("Not registered: " + conversationId);
                return;
            }
            targets.add(conversation.get());
        } else {
            targets.addAll(registry.all());
        }

        int total = 0;
        for (Conversation c : targets) {
            List<InboundMessage> pending = pendingMessages.pending(c.id());
            if (pending.isEmpty()) {
                continue;
            }
            total += pending.size();
            ConsoleOutput.info(c.name() + " (" + c.id() + "): " + pending.size() + " pending");
            for (InboundMessage m : pending) {
                ConsoleOutput.message(m.timestamp(), m.senderName(), m.content());
            }
        }
        if (total == 0) {
            ConsoleOutput.success("No pending messages.");
        }
    }
}
