package com.groupdispatch.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Per-conversation sandbox overrides. Null limits fall back to the global sandbox properties.
 *
 * @param additionalMounts extra host directories exposed to the sandbox
 * @param memoryLimitMb    memory limit in MB (nullable)
 * @param cpuCount         CPU limit (nullable)
 * @param timeoutSeconds   hard limit on a single sandbox process lifetime (nullable)
 */
public record SandboxSettings(
    List<Mount> additionalMounts,
    Integer memoryLimitMb,
    Integer cpuCount,
    Integer timeoutSeconds
) implements Serializable {

    public SandboxSettings {
        additionalMounts = additionalMounts != null ? List.copyOf(additionalMounts) : List.of();
    }

    /**
     * @param hostPath      absolute path on the host
     * @param containerPath mount point inside the sandbox, relative to {@code /workspace/extra}
     * @param readonly      mount read-only
     */
    public record Mount(String hostPath, String containerPath, boolean readonly) implements Serializable {}
}
