package com.groupdispatch.sandbox;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;

/**
 * Handle on a running sandbox process.
 * Implementations: {@link ProcessSandboxProcess} (OS process), test fakes.
 */
public interface SandboxProcess {

    /** Name the sandbox runs under, e.g. the container name. */
    String name();

    /** The sandbox's stdin. */
    OutputStream input();

    /** The sandbox's stdout, carrying framed events. */
    InputStream output();

    /** Cooperative stop signal; the agent should wrap up and exit. */
    void interrupt();

    /** Forced termination. */
    void kill();

    boolean isAlive();

    /**
     * Blocks until the process exits or the timeout elapses.
     *
     * @return true if the process has exited
     */
    boolean awaitExit(Duration timeout) throws InterruptedException;

    /**
     * @return the exit code; only meaningful once the process has exited
     */
    int exitCode();
}
