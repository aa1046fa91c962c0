package com.groupdispatch.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "groupdispatch",
        mixinStandardHelpOptions = true,
        version = "GroupDispatch 0.1.0",
        description = "Per-conversation sandboxed agent dispatch for chat platforms",
        subcommands = {
                ServeCommand.class,
                ConversationsCommand.class,
                RegisterCommand.class,
                PendingCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class GroupDispatchCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
