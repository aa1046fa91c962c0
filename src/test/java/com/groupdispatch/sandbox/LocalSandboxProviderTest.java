package com.groupdispatch.sandbox;

import com.groupdispatch.core.dispatch.DispatchProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class LocalSandboxProviderTest {

    @TempDir
    Path root;

    private SandboxProperties sandboxProperties;
    private LocalSandboxProvider provider;

    @BeforeEach
    void setUp() {
        sandboxProperties = new SandboxProperties();
        var dispatchProperties = new DispatchProperties();
        dispatchProperties.setDataDir(root.resolve("data").toString());
        dispatchProperties.setGroupsDir(root.resolve("groups").toString());
        provider = new LocalSandboxProvider(sandboxProperties, dispatchProperties);
    }

    private static SandboxRequest request() {
        return new SandboxRequest("a@g.us", "team-a", "prompt", null, false, false, true, null,
                EnvironmentSnapshot.empty());
    }

    @Test
    void runsCommandInConversationFolderWithPipedStdio() throws Exception {
        Files.createDirectories(root.resolve("groups").resolve("team-a"));
        sandboxProperties.getSandbox().setLocalCommand(List.of("sh", "-c", "pwd; cat"));

        SandboxProcess process = provider.start(request());
        process.input().write("hello\n".getBytes(StandardCharsets.UTF_8));
        process.input().close();

        try (var reader = new BufferedReader(new InputStreamReader(process.output(), StandardCharsets.UTF_8))) {
            assertTrue(reader.readLine().endsWith("team-a"));
            assertEquals("hello", reader.readLine());
        }
        assertTrue(process.awaitExit(Duration.ofSeconds(10)));
        assertEquals(0, process.exitCode());
        assertTrue(process.name().startsWith("local-team-a-"));
    }

    @Test
    void missingExecutableIsAStartFailure() {
        sandboxProperties.getSandbox().setLocalCommand(List.of(root.resolve("no-such-agent").toString()));

        assertThrows(SandboxStartException.class, () -> provider.start(request()));
    }
}
