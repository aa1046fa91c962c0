package com.groupdispatch.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void setsConversationKeys() {
        MdcContext.setConversation("a@g.us", "team-a");

        assertEquals("a@g.us", MDC.get("conversationId"));
        assertEquals("team-a", MDC.get("folder"));
    }

    @Test
    void taskContextIncludesConversation() {
        MdcContext.setTask("a@g.us", "team-a", "task-1");

        assertEquals("task-1", MDC.get("taskId"));
        assertEquals("a@g.us", MDC.get("conversationId"));
    }

    @Test
    void clearRemovesOnlyDispatchKeys() {
        MDC.put("requestId", "r-1");
        MdcContext.setTask("a@g.us", "team-a", "task-1");
        MdcContext.setSandbox("gd-team-a-1");

        MdcContext.clear();

        assertNull(MDC.get("conversationId"));
        assertNull(MDC.get("folder"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("sandbox"));
        assertEquals("r-1", MDC.get("requestId"));
    }

    @Test
    void clearSandboxKeepsConversation() {
        MdcContext.setConversation("a@g.us", "team-a");
        MdcContext.setSandbox("gd-team-a-1");

        MdcContext.clearSandbox();

        assertNull(MDC.get("sandbox"));
        assertEquals("a@g.us", MDC.get("conversationId"));
    }
}
