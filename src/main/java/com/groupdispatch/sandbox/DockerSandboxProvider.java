package com.groupdispatch.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Container;
import com.groupdispatch.core.dispatch.DispatchProperties;
import com.groupdispatch.core.model.SandboxSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Docker-based {@link SandboxProvider}.
 * <p>
 * Each sandbox is an interactive, self-removing container ({@code docker run -i --rm})
 * whose stdin and stdout are the event protocol. The container is configured with:
 * <ul>
 *   <li>{@code /workspace/group}: the conversation's folder (read-write)</li>
 *   <li>{@code /workspace/project}: the service's working directory, privileged conversation only</li>
 *   <li>{@code /workspace/global}: the shared {@code global} folder, read-only, other conversations</li>
 *   <li>{@code /home/node/.claude}: per-folder agent session state</li>
 *   <li>{@code /workspace/ipc}: the folder's command channel directory</li>
 *   <li>{@code /workspace/extra/*}: additional mounts from the conversation's settings</li>
 *   <li>memory and CPU limits from the conversation's settings or the global defaults</li>
 * </ul>
 * Stop signals and orphan cleanup go through the Docker API.
 */
public class DockerSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxProvider.class);

    private final DockerClient dockerClient;
    private final SandboxProperties sandboxProperties;
    private final DispatchProperties dispatchProperties;

    public DockerSandboxProvider(DockerClient dockerClient, SandboxProperties sandboxProperties,
                                 DispatchProperties dispatchProperties) {
        this.dockerClient = dockerClient;
        this.sandboxProperties = sandboxProperties;
        this.dispatchProperties = dispatchProperties;
    }

    @Override
    public String name() {
        return "docker";
    }

    @Override
    public SandboxProcess start(SandboxRequest request) {
        String containerName = containerName(request.folder());
        List<String> command = buildCommand(containerName, request);
        File logFile = logFile(request.folder(), containerName);

        log.info("Starting sandbox {} for {} (image: {})",
                containerName, request.conversationId(), sandboxProperties.getImage());
        try {
            Process process = new ProcessBuilder(command)
                    .redirectError(ProcessBuilder.Redirect.appendTo(logFile))
                    .start();
            return new ProcessSandboxProcess(containerName, process,
                    p -> signal(containerName, "SIGINT"),
                    p -> signal(containerName, "SIGKILL"));
        } catch (IOException e) {
            throw new SandboxStartException("Failed to start sandbox " + containerName, e);
        }
    }

    /**
     * Builds the {@code docker run} invocation for a request.
     */
    List<String> buildCommand(String containerName, SandboxRequest request) {
        SandboxSettings settings = request.settings();
        int memoryMb = settings != null && settings.memoryLimitMb() != null
                ? settings.memoryLimitMb() : sandboxProperties.getMemoryLimitMb();
        int cpus = settings != null && settings.cpuCount() != null
                ? settings.cpuCount() : sandboxProperties.getCpuCount();

        var cmd = new ArrayList<String>(List.of("docker", "run", "-i", "--rm", "--name", containerName));
        cmd.add("--memory=" + memoryMb + "m");
        cmd.add("--cpus=" + cpus);
        for (Mount mount : mounts(request)) {
            cmd.add("-v");
            cmd.add(mount.hostPath() + ":" + mount.containerPath() + (mount.readonly() ? ":ro" : ""));
        }
        sandboxProperties.getEnv().forEach((k, v) -> {
            cmd.add("-e");
            cmd.add(k + "=" + v);
        });
        cmd.add("-e");
        cmd.add("TZ=" + dispatchProperties.getZoneId().getId());
        cmd.add(sandboxProperties.getImage());
        return cmd;
    }

    record Mount(String hostPath, String containerPath, boolean readonly) {}

    List<Mount> mounts(SandboxRequest request) {
        Path groups = dispatchProperties.getGroupsPath();
        Path data = dispatchProperties.getDataPath();
        String folder = request.folder();

        var mounts = new ArrayList<Mount>();
        mounts.add(new Mount(groups.resolve(folder).toString(), "/workspace/group", false));
        if (request.privileged()) {
            mounts.add(new Mount(Path.of("").toAbsolutePath().toString(), "/workspace/project", false));
        } else {
            Path global = groups.resolve("global");
            if (Files.isDirectory(global)) {
                mounts.add(new Mount(global.toString(), "/workspace/global", true));
            }
        }

        Path sessionDir = data.resolve("sessions").resolve(folder).resolve(".claude");
        Path ipcDir = dispatchProperties.getCommandPath().resolve(folder);
        createDirectories(sessionDir, ipcDir.resolve("messages"), ipcDir.resolve("tasks"));
        mounts.add(new Mount(sessionDir.toString(), "/home/node/.claude", false));
        mounts.add(new Mount(ipcDir.toString(), "/workspace/ipc", false));

        if (request.settings() != null) {
            for (SandboxSettings.Mount extra : request.settings().additionalMounts()) {
                String target = extra.containerPath().startsWith("/")
                        ? extra.containerPath().substring(1) : extra.containerPath();
                mounts.add(new Mount(extra.hostPath(), "/workspace/extra/" + target, extra.readonly()));
            }
        }
        return mounts;
    }

    String containerName(String folder) {
        String safe = folder.replaceAll("[^a-zA-Z0-9-]", "-");
        return sandboxProperties.getContainerPrefix() + "-" + safe + "-" + System.currentTimeMillis();
    }

    private File logFile(String folder, String containerName) {
        Path logsDir = dispatchProperties.getGroupsPath().resolve(folder).resolve("logs");
        createDirectories(logsDir);
        return logsDir.resolve(containerName + ".log").toFile();
    }

    private void signal(String containerName, String signal) {
        try {
            dockerClient.killContainerCmd(containerName).withSignal(signal).exec();
        } catch (NotFoundException e) {
            log.debug("Container {} already gone", containerName);
        }
    }

    @Override
    public int cleanupOrphans() {
        String prefix = sandboxProperties.getContainerPrefix() + "-";
        List<Container> running = dockerClient.listContainersCmd()
                .withNameFilter(List.of(prefix))
                .exec();
        int stopped = 0;
        for (Container container : running) {
            String name = container.getNames().length > 0 ? container.getNames()[0].replaceFirst("^/", "") : "";
            if (!name.startsWith(prefix)) {
                continue;
            }
            try {
                dockerClient.stopContainerCmd(container.getId()).exec();
                stopped++;
            } catch (RuntimeException e) {
                log.debug("Container {} may already be stopped: {}", name, e.getMessage());
            }
        }
        if (stopped > 0) {
            log.info("Stopped {} orphaned sandbox container(s)", stopped);
        }
        return stopped;
    }

    @Override
    public boolean isAvailable() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (RuntimeException e) {
            log.debug("Docker ping failed: {}", e.getMessage());
            return false;
        }
    }

    private static void createDirectories(Path... dirs) {
        for (Path dir : dirs) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new SandboxStartException("Cannot create " + dir, e);
            }
        }
    }
}
