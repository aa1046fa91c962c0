package com.groupdispatch.sandbox;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groupdispatch.core.dispatch.DispatchProperties;
import com.groupdispatch.core.model.AvailableConversation;
import com.groupdispatch.core.model.ScheduledTask;
import com.groupdispatch.core.model.Timestamps;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes the environment snapshot into a conversation's command directory, where the
 * sandbox reads it: {@code current_tasks.json} and {@code available_groups.json}.
 * Files are replaced atomically so a sandbox never reads a half-written snapshot.
 */
@Component
public class SnapshotWriter {

    static final String TASKS_FILE = "current_tasks.json";
    static final String GROUPS_FILE = "available_groups.json";

    private final DispatchProperties properties;
    private final ObjectMapper objectMapper;

    public SnapshotWriter(DispatchProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    record TaskEntry(
        String id,
        String groupFolder,
        String prompt,
        @JsonProperty("schedule_type") String scheduleType,
        @JsonProperty("schedule_value") String scheduleValue,
        String status,
        @JsonProperty("next_run") String nextRun
    ) {
        static TaskEntry of(ScheduledTask t) {
            return new TaskEntry(t.id(), t.folder(), t.prompt(), t.scheduleType().name().toLowerCase(),
                    t.scheduleValue(), t.status().name().toLowerCase(), t.nextRun());
        }
    }

    record GroupsFile(List<AvailableConversation> groups, String lastSync) {}

    public void write(String folder, EnvironmentSnapshot snapshot) throws IOException {
        Path dir = properties.getCommandPath().resolve(folder);
        Files.createDirectories(dir);
        writeAtomically(dir.resolve(TASKS_FILE),
                snapshot.tasks().stream().map(TaskEntry::of).toList());
        writeAtomically(dir.resolve(GROUPS_FILE),
                new GroupsFile(snapshot.conversations(), Timestamps.now()));
    }

    private void writeAtomically(Path target, Object value) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
