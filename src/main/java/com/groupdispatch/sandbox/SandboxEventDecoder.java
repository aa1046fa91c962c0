package com.groupdispatch.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Decodes framed {@link SandboxEvent}s from a sandbox's stdout.
 * <p>
 * Each event is a JSON object placed between an {@link #OUTPUT_START} line and an
 * {@link #OUTPUT_END} line. Anything outside a frame is agent chatter and only logged.
 * Frames with an unknown {@code type} or malformed JSON are rejected with a warning.
 */
public class SandboxEventDecoder {

    private static final Logger log = LoggerFactory.getLogger(SandboxEventDecoder.class);

    public static final String OUTPUT_START = "---GROUPDISPATCH_OUTPUT_START---";
    public static final String OUTPUT_END = "---GROUPDISPATCH_OUTPUT_END---";

    private final ObjectMapper objectMapper;

    public SandboxEventDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads until end of stream, handing every decoded event to {@code sink} in order.
     *
     * @return number of events delivered
     */
    public int decode(InputStream stream, Consumer<SandboxEvent> sink) throws IOException {
        int delivered = 0;
        var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
        StringBuilder frame = null;
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.strip();
            if (trimmed.equals(OUTPUT_START)) {
                if (frame != null) {
                    log.warn("Unterminated sandbox output frame discarded");
                }
                frame = new StringBuilder();
            } else if (trimmed.equals(OUTPUT_END)) {
                if (frame == null) {
                    log.warn("Sandbox output end marker without start");
                    continue;
                }
                Optional<SandboxEvent> event = parse(frame.toString());
                frame = null;
                if (event.isPresent()) {
                    sink.accept(event.get());
                    delivered++;
                }
            } else if (frame != null) {
                frame.append(line).append('\n');
            } else if (!trimmed.isEmpty()) {
                log.debug("sandbox: {}", line);
            }
        }
        if (frame != null) {
            log.warn("Sandbox stream ended inside an output frame");
        }
        return delivered;
    }

    /**
     * Parses a single event payload.
     */
    public Optional<SandboxEvent> parse(String json) {
        try {
            return Optional.ofNullable(objectMapper.readValue(json, SandboxEvent.class));
        } catch (JsonProcessingException e) {
            log.warn("Rejected sandbox event: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
