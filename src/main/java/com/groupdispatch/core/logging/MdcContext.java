package com.groupdispatch.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing dispatch-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setConversation(String conversationId, String folder) {
        MDC.put("conversationId", conversationId);
        MDC.put("folder", folder);
    }

    public static void setSandbox(String sandboxName) {
        MDC.put("sandbox", sandboxName);
    }

    public static void clearSandbox() {
        MDC.remove("sandbox");
    }

    public static void setTask(String conversationId, String folder, String taskId) {
        setConversation(conversationId, folder);
        MDC.put("taskId", taskId);
    }

    public static void clear() {
        MDC.remove("conversationId");
        MDC.remove("folder");
        MDC.remove("sandbox");
        MDC.remove("taskId");
    }
}
