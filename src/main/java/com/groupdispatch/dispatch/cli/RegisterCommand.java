package com.groupdispatch.dispatch.cli;

import com.groupdispatch.core.dispatch.ConversationRegistry;
import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.Timestamps;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: groupdispatch register &lt;id&gt; --name ... --folder ...
 */
@Command(name = "register", mixinStandardHelpOptions = true, description = "Register a conversation")
@Component
public class RegisterCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Conversation id, e.g. tg:12345")
    private String id;

    @Option(names = {"--name", "-n"}, required = true, description = "Display name")
    private String name;

    @Option(names = {"--folder", "-f"}, required = true, description = "Working folder under the groups directory")
    private String folder;

    @Option(names = {"--trigger", "-t"}, description = "Trigger marker (default: @<assistant name>)")
    private String trigger;

    @Option(names = {"--no-trigger"}, description = "Respond to every message, not only triggered ones")
    private boolean noTrigger;

    private final ConversationRegistry registry;

    public RegisterCommand(ConversationRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        registry.load();
        try {
            Conversation registered = registry.register(new Conversation(id, name, folder, trigger, !noTrigger,
                    Timestamps.now(), null));
            ConsoleOutput.success("Registered " + registered.id() + " in folder " + registered.folder()
                    + (registry.isPrivileged(registered) ? " (main)" : ""));
            return 0;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
    }
}
