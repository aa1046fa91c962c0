package com.groupdispatch.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 * In serve mode picocli is skipped so the embedded web server keeps the JVM alive.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final GroupDispatchCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(GroupDispatchCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (isServe(args)) {
            return;
        }
        exitCode = new CommandLine(rootCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public static boolean isServe(String... args) {
        return args.length > 0 && ServeCommand.NAME.equals(args[0]);
    }
}
