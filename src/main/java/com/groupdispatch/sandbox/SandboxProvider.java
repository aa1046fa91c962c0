package com.groupdispatch.sandbox;

/**
 * Abstraction over how sandbox processes are spawned.
 * Implementations: {@link DockerSandboxProvider} (default), {@link LocalSandboxProvider} (development).
 */
public interface SandboxProvider {

    /** Short name for logs and health output, e.g. "docker". */
    String name();

    /**
     * Spawns a sandbox for the request. The returned process has not been sent any input yet.
     *
     * @throws SandboxStartException if the process could not be started
     */
    SandboxProcess start(SandboxRequest request);

    /**
     * Stops sandboxes left behind by a previous run of this service.
     *
     * @return number of sandboxes stopped
     */
    default int cleanupOrphans() {
        return 0;
    }

    /** Whether the provider's backend is reachable. */
    default boolean isAvailable() {
        return true;
    }
}
