package com.groupdispatch.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "groupdispatch")
public class SandboxProperties {

    private Sandbox sandbox = new Sandbox();

    // -- Sandbox accessors (delegate to nested) --
    public String getProvider() { return sandbox.provider; }
    public String getImage() { return sandbox.image; }
    public String getContainerPrefix() { return sandbox.containerPrefix; }
    public int getMemoryLimitMb() { return sandbox.memoryLimitMb; }
    public int getCpuCount() { return sandbox.cpuCount; }
    public int getTimeoutSeconds() { return sandbox.timeoutSeconds; }
    public List<String> getLocalCommand() { return sandbox.localCommand; }
    public Map<String, String> getEnv() { return sandbox.env; }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }

    public static class Sandbox {
        private String provider = "docker";
        private String image = "groupdispatch-agent:latest";
        private String containerPrefix = "groupdispatch";
        private int memoryLimitMb = 2048;
        private int cpuCount = 2;
        private int timeoutSeconds = 1800;
        private List<String> localCommand = List.of("node", "agent-runner/dist/index.js");
        private Map<String, String> env = new LinkedHashMap<>();

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public String getContainerPrefix() { return containerPrefix; }
        public void setContainerPrefix(String containerPrefix) { this.containerPrefix = containerPrefix; }
        public int getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
        public int getCpuCount() { return cpuCount; }
        public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public List<String> getLocalCommand() { return localCommand; }
        public void setLocalCommand(List<String> localCommand) { this.localCommand = localCommand; }
        public Map<String, String> getEnv() { return env; }
        public void setEnv(Map<String, String> env) { this.env = env; }
    }
}
