package com.groupdispatch.core.dispatch;

import com.groupdispatch.core.model.Conversation;
import com.groupdispatch.core.model.InboundMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TriggerPolicyTest {

    private TriggerPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new TriggerPolicy(new DispatchProperties());
    }

    private static Conversation conversation(String folder, String trigger, boolean requiresTrigger) {
        return new Conversation("a@g.us", "A", folder, trigger, requiresTrigger, "2026-01-01T00:00:00.000Z", null);
    }

    private static List<InboundMessage> messages(String... contents) {
        return java.util.Arrays.stream(contents)
                .map(c -> new InboundMessage("m", "a@g.us", "s", "S", c, "2026-01-01T00:00:01.000Z", false))
                .toList();
    }

    @ParameterizedTest
    @ValueSource(strings = {"@Andy hello", "@andy hello", "  @ANDY, are you there?", "@Andy"})
    @DisplayName("a message starting with the trigger admits the batch")
    void admitsTriggered(String content) {
        assertTrue(policy.admits(conversation("team-a", "@Andy", true), messages("noise", content)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"hello @Andy", "@Andybot hi", "Andy hello", ""})
    @DisplayName("a trigger elsewhere or as a word prefix does not count")
    void rejectsUntriggered(String content) {
        assertFalse(policy.admits(conversation("team-a", "@Andy", true), messages(content)));
    }

    @Test
    @DisplayName("the privileged folder and trigger-free conversations always qualify")
    void exemptions() {
        assertTrue(policy.admits(conversation("main", "@Andy", true), messages("plain")));
        assertTrue(policy.isPrivileged(conversation("main", "@Andy", true)));
        assertFalse(policy.requiresTrigger(conversation("main", "@Andy", true)));
        assertTrue(policy.admits(conversation("team-a", "@Andy", false), messages("plain")));
    }

    @Test
    @DisplayName("a blank trigger falls back to the assistant name")
    void defaultTrigger() {
        assertTrue(policy.admits(conversation("team-a", "", true), messages("@Andy hi")));
    }

    @Test
    @DisplayName("triggers ending in punctuation need no word boundary")
    void punctuationTrigger() {
        assertTrue(policy.admits(conversation("team-a", "!bot:", true), messages("!bot:run")));
    }
}
