package com.groupdispatch.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * {@link SandboxProcess} backed by a {@link Process}.
 * The interrupt and kill actions are supplied by the provider, since stopping a
 * container means signalling the container rather than the local client process.
 */
public class ProcessSandboxProcess implements SandboxProcess {

    private static final Logger log = LoggerFactory.getLogger(ProcessSandboxProcess.class);

    private final String name;
    private final Process process;
    private final Consumer<Process> interruptAction;
    private final Consumer<Process> killAction;

    public ProcessSandboxProcess(String name, Process process,
                                 Consumer<Process> interruptAction, Consumer<Process> killAction) {
        this.name = name;
        this.process = process;
        this.interruptAction = interruptAction;
        this.killAction = killAction;
    }

    @Override
    public String name() { return name; }

    @Override
    public OutputStream input() { return process.getOutputStream(); }

    @Override
    public InputStream output() { return process.getInputStream(); }

    @Override
    public void interrupt() {
        log.info("Interrupting sandbox {}", name);
        interruptAction.accept(process);
    }

    @Override
    public void kill() {
        log.info("Killing sandbox {}", name);
        try {
            killAction.accept(process);
        } finally {
            process.destroyForcibly();
        }
    }

    @Override
    public boolean isAlive() { return process.isAlive(); }

    @Override
    public boolean awaitExit(Duration timeout) throws InterruptedException {
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public int exitCode() { return process.exitValue(); }
}
