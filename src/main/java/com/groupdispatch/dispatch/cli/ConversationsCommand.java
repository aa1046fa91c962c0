package com.groupdispatch.dispatch.cli;

import com.groupdispatch.core.cursor.CursorStore;
import com.groupdispatch.core.dispatch.ConversationRegistry;
import com.groupdispatch.core.model.Conversation;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Comparator;
import java.util.List;

/**
 * CLI command: groupdispatch conversations
 */
@Command(name = "conversations", mixinStandardHelpOptions = true, description = "List registered conversations")
@Component
public class ConversationsCommand implements Runnable {

    private final ConversationRegistry registry;
    private final CursorStore cursors;

    public ConversationsCommand(ConversationRegistry registry, CursorStore cursors) {
        this.registry = registry;
        this.cursors = cursors;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        registry.load();
        cursors.load();

        List<Conversation> conversations = registry.all().stream()
                .sorted(Comparator.comparing(Conversation::folder))
                .toList();
        if (conversations.isEmpty()) {
            ConsoleOutput.info("No conversations registered.");
            return;
        }

        System.out.printf("  %-16s %-28s %-10s %-24s %s%n", "FOLDER", "ID", "TRIGGER", "DELIVERED", "NAME");
        System.out.println("  " + "-".repeat(96));
        for (Conversation c : conversations) {
            String trigger = registry.isPrivileged(c) ? "(main)" : c.requiresTrigger() ? "required" : "off";
            String delivered = cursors.agentDelivered(c.id());
            System.out.printf("  %-16s %-28s %-10s %-24s %s%n",
                    c.folder(), c.id(), trigger, delivered.isEmpty() ? "-" : delivered, c.name());
        }
    }
}
