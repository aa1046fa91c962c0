package com.groupdispatch.core.dispatch;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.ZoneId;

@Component
@ConfigurationProperties(prefix = "groupdispatch")
public class DispatchProperties {

    private String assistantName = "Andy";
    private String mainFolder = "main";
    private String dataDir = "data";
    private String groupsDir = "groups";
    private long pollIntervalMs = 2000;
    private long idleTimeoutMs = 1_800_000;
    private int maxConcurrentSandboxes = 5;
    private int maxRetries = 5;
    private long baseRetryMs = 5000;
    private long shutdownTimeoutMs = 10_000;
    private long typingIntervalMs = 4000;
    private String timezone = "";

    private Engine engine = new Engine();
    private Commands commands = new Commands();
    private Scheduler scheduler = new Scheduler();

    // -- Derived values --

    public Path getDataPath() { return Path.of(dataDir).toAbsolutePath(); }
    public Path getGroupsPath() { return Path.of(groupsDir).toAbsolutePath(); }
    public Path getCommandPath() { return getDataPath().resolve("ipc"); }

    public ZoneId getZoneId() {
        return timezone == null || timezone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timezone);
    }

    public boolean isAutostart() { return engine.autostart; }
    public long getCommandPollIntervalMs() { return commands.pollIntervalMs; }
    public long getSchedulerPollIntervalMs() { return scheduler.pollIntervalMs; }

    public String getAssistantName() { return assistantName; }
    public void setAssistantName(String assistantName) { this.assistantName = assistantName; }
    public String getMainFolder() { return mainFolder; }
    public void setMainFolder(String mainFolder) { this.mainFolder = mainFolder; }
    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }
    public String getGroupsDir() { return groupsDir; }
    public void setGroupsDir(String groupsDir) { this.groupsDir = groupsDir; }
    public long getPollIntervalMs() { return pollIntervalMs; }
    public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    public long getIdleTimeoutMs() { return idleTimeoutMs; }
    public void setIdleTimeoutMs(long idleTimeoutMs) { this.idleTimeoutMs = idleTimeoutMs; }
    public int getMaxConcurrentSandboxes() { return maxConcurrentSandboxes; }
    public void setMaxConcurrentSandboxes(int maxConcurrentSandboxes) { this.maxConcurrentSandboxes = maxConcurrentSandboxes; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public long getBaseRetryMs() { return baseRetryMs; }
    public void setBaseRetryMs(long baseRetryMs) { this.baseRetryMs = baseRetryMs; }
    public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
    public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }
    public long getTypingIntervalMs() { return typingIntervalMs; }
    public void setTypingIntervalMs(long typingIntervalMs) { this.typingIntervalMs = typingIntervalMs; }
    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }

    public Engine getEngine() { return engine; }
    public void setEngine(Engine engine) { this.engine = engine; }
    public Commands getCommands() { return commands; }
    public void setCommands(Commands commands) { this.commands = commands; }
    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }

    public static class Engine {
        private boolean autostart = false;

        public boolean isAutostart() { return autostart; }
        public void setAutostart(boolean autostart) { this.autostart = autostart; }
    }

    public static class Commands {
        private long pollIntervalMs = 1000;

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    }

    public static class Scheduler {
        private long pollIntervalMs = 60_000;

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    }
}
