package com.groupdispatch.sandbox;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * A structured event emitted by a sandbox on stdout.
 * One {@link Result} or {@link Failure} ends a logical turn; a process may serve many turns.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SandboxEvent.PartialOutput.class, name = "partialOutput"),
    @JsonSubTypes.Type(value = SandboxEvent.Result.class, name = "result"),
    @JsonSubTypes.Type(value = SandboxEvent.NewContinuationToken.class, name = "newContinuationToken"),
    @JsonSubTypes.Type(value = SandboxEvent.Failure.class, name = "error")
})
public sealed interface SandboxEvent {

    /** Intermediate text, relayed to the conversation as soon as it arrives. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record PartialOutput(String text) implements SandboxEvent {}

    /**
     * Final answer of a turn. The payload is either a string or a structured value.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Result(JsonNode result) implements SandboxEvent {

        public static Result of(String text) {
            return new Result(TextNode.valueOf(text));
        }

        /**
         * @return the textual result, the JSON rendering of a structured one, or null when empty
         */
        public String text() {
            if (result == null || result.isNull()) {
                return null;
            }
            return result.isTextual() ? result.asText() : result.toString();
        }
    }

    /** The agent session id to resume from on the next invocation. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record NewContinuationToken(String token) implements SandboxEvent {}

    /**
     * The turn failed.
     *
     * @param detail      diagnostic detail, logged only
     * @param userMessage optional text the sandbox wants shown to the user (nullable)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Failure(String detail, String userMessage) implements SandboxEvent {}
}
