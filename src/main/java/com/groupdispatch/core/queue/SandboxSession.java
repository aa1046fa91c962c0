package com.groupdispatch.core.queue;

import com.groupdispatch.sandbox.SandboxProcess;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * A live sandbox registered for one conversation.
 * <p>
 * Mutable fields are guarded by the owning conversation slot in {@link ConversationQueue};
 * stdin writes are serialized on this instance.
 */
public final class SandboxSession {

    public enum State { STARTING, RUNNING, IDLE, TERMINATED }

    private final String conversationId;
    private final SandboxProcess process;
    private final String label;
    private final String folder;
    private final boolean task;
    private final Instant startedAt;
    private final Writer writer;

    State state = State.STARTING;
    boolean inputClosed;
    ScheduledFuture<?> idleTimer;
    long idleGeneration;

    SandboxSession(String conversationId, SandboxProcess process, String label, String folder, boolean task) {
        this.conversationId = conversationId;
        this.process = process;
        this.label = label;
        this.folder = folder;
        this.task = task;
        this.startedAt = Instant.now();
        this.writer = new BufferedWriter(new OutputStreamWriter(process.input(), StandardCharsets.UTF_8));
    }

    public String conversationId() { return conversationId; }
    public SandboxProcess process() { return process; }
    public String label() { return label; }
    public String folder() { return folder; }

    /** Scheduled-task runs take no piped user messages. */
    public boolean isTask() { return task; }
    public Instant startedAt() { return startedAt; }

    /**
     * Writes one newline-terminated line to the sandbox's stdin and flushes it.
     */
    public synchronized void writeLine(String line) throws IOException {
        writer.write(line);
        writer.write('\n');
        writer.flush();
    }

    synchronized void closeWriter() throws IOException {
        writer.close();
    }

    /**
     * Point-in-time view of a session for status endpoints.
     */
    public record Snapshot(String conversationId, String label, String folder, State state,
                           boolean inputClosed, Instant startedAt, boolean task) {}
}
