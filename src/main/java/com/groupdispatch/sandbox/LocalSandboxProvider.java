package com.groupdispatch.sandbox;

import com.groupdispatch.core.dispatch.DispatchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs the agent as a plain local process inside the conversation's folder.
 * No isolation; meant for development on machines without Docker.
 */
public class LocalSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalSandboxProvider.class);

    private final SandboxProperties sandboxProperties;
    private final DispatchProperties dispatchProperties;

    public LocalSandboxProvider(SandboxProperties sandboxProperties, DispatchProperties dispatchProperties) {
        this.sandboxProperties = sandboxProperties;
        this.dispatchProperties = dispatchProperties;
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public SandboxProcess start(SandboxRequest request) {
        Path workDir = dispatchProperties.getGroupsPath().resolve(request.folder());
        Path logsDir = workDir.resolve("logs");
        String name = "local-" + request.folder() + "-" + System.currentTimeMillis();
        try {
            Files.createDirectories(logsDir);
            var builder = new ProcessBuilder(sandboxProperties.getLocalCommand())
                    .directory(workDir.toFile())
                    .redirectError(ProcessBuilder.Redirect.appendTo(logsDir.resolve(name + ".log").toFile()));
            builder.environment().putAll(sandboxProperties.getEnv());
            builder.environment().put("GROUPDISPATCH_IPC_DIR",
                    dispatchProperties.getCommandPath().resolve(request.folder()).toString());
            Process process = builder.start();
            log.info("Started local sandbox {} (pid {})", name, process.pid());
            return new ProcessSandboxProcess(name, process, Process::destroy, p -> {});
        } catch (IOException e) {
            throw new SandboxStartException("Failed to start local sandbox for " + request.folder(), e);
        }
    }
}
