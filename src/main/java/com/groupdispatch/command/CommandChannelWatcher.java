package com.groupdispatch.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.groupdispatch.core.dispatch.DispatchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls the file-based command channel.
 * <p>
 * Layout under {@code <data-dir>/ipc}: one directory per conversation folder, each with
 * {@code messages/} and {@code tasks/} subdirectories of {@code *.json} request files. The
 * folder a file sits in is its source, which {@link CommandHandler} authorizes against.
 * Each file is consumed at most once: deleted after handling, or moved to
 * {@code errors/<folder>-<file>} when it cannot be parsed or its handler fails.
 */
@Service
public class CommandChannelWatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandChannelWatcher.class);

    static final String ERRORS_DIR = "errors";

    private final CommandHandler handler;
    private final DispatchProperties properties;
    private final ObjectMapper objectMapper;

    private ScheduledExecutorService poller;

    public CommandChannelWatcher(CommandHandler handler, DispatchProperties properties, ObjectMapper objectMapper) {
        this.handler = handler;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public synchronized void start() throws IOException {
        if (poller != null) {
            return;
        }
        Files.createDirectories(properties.getCommandPath());
        poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "command-watcher");
            t.setDaemon(true);
            return t;
        });
        poller.scheduleWithFixedDelay(this::pollSafely, 0, properties.getCommandPollIntervalMs(),
                TimeUnit.MILLISECONDS);
        log.info("Command channel watcher started on {}", properties.getCommandPath());
    }

    public synchronized void stop() {
        if (poller != null) {
            poller.shutdownNow();
            poller = null;
        }
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (IOException | RuntimeException e) {
            log.error("Error reading command channel", e);
        }
    }

    /**
     * Processes every pending request file once.
     *
     * @return number of files consumed (handled, rejected or moved to errors)
     */
    public int pollOnce() throws IOException {
        Path base = properties.getCommandPath();
        if (!Files.isDirectory(base)) {
            return 0;
        }
        int consumed = 0;
        for (Path folderDir : list(base, Files::isDirectory)) {
            String folder = folderDir.getFileName().toString();
            if (ERRORS_DIR.equals(folder)) {
                continue;
            }
            consumed += processDir(folderDir.resolve("messages"), folder);
            consumed += processDir(folderDir.resolve("tasks"), folder);
        }
        return consumed;
    }

    private int processDir(Path dir, String sourceFolder) throws IOException {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        int consumed = 0;
        for (Path file : list(dir, p -> p.getFileName().toString().endsWith(".json"))) {
            try {
                CommandRequest request = objectMapper.readValue(file.toFile(), CommandRequest.class);
                handler.handle(sourceFolder, request);
                Files.delete(file);
            } catch (IOException | RuntimeException e) {
                log.error("Failed to process command file {} from {}", file.getFileName(), sourceFolder, e);
                moveToErrors(file, sourceFolder);
            }
            consumed++;
        }
        return consumed;
    }

    private void moveToErrors(Path file, String sourceFolder) throws IOException {
        Path errors = properties.getCommandPath().resolve(ERRORS_DIR);
        Files.createDirectories(errors);
        Files.move(file, errors.resolve(sourceFolder + "-" + file.getFileName()), StandardCopyOption.REPLACE_EXISTING);
    }

    private static List<Path> list(Path dir, DirectoryStream.Filter<Path> filter) throws IOException {
        List<Path> paths = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, filter)) {
            stream.forEach(paths::add);
        }
        paths.sort(null);
        return paths;
    }
}
