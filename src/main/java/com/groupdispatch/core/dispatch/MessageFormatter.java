package com.groupdispatch.core.dispatch;

import com.groupdispatch.core.model.InboundMessage;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders pending messages as the prompt of a turn:
 * <pre>
 * &lt;messages&gt;
 * &lt;message sender="Alice" time="2026-01-31T09:15:02.117Z"&gt;hi&lt;/message&gt;
 * &lt;/messages&gt;
 * </pre>
 */
public final class MessageFormatter {

    private MessageFormatter() {}

    public static String formatMessages(List<InboundMessage> messages) {
        String lines = messages.stream()
                .map(m -> "<message sender=\"" + escapeXml(senderOf(m)) + "\" time=\"" + m.timestamp() + "\">"
                        + escapeXml(m.content()) + "</message>")
                .collect(Collectors.joining("\n"));
        return "<messages>\n" + lines + "\n</messages>";
    }

    public static String escapeXml(String s) {
        if (s == null) {
            return "";
        }
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    private static String senderOf(InboundMessage m) {
        return m.senderName() != null && !m.senderName().isBlank() ? m.senderName() : m.sender();
    }
}
