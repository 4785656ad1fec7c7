package io.agentrelay.server.message;

import io.agentrelay.spec.InboundMessage;
import io.agentrelay.spec.MessagePart;
import io.agentrelay.util.Assert;

/**
 * Utility functions for reading the text of a message delivered to an agent.
 */
public final class MessageTextExtractor {

    private MessageTextExtractor() {
        // Utility class - prevent instantiation
    }

    /**
     * Concatenates the text of every text-bearing part, in order.
     *
     * @param message the inbound message
     * @return the trimmed text, empty if no part carries text
     */
    public static String extractText(InboundMessage message) {
        Assert.checkNotNullParam("message", message);
        StringBuilder text = new StringBuilder();
        for (MessagePart part : message.parts()) {
            if (part.isTextBearing()) {
                text.append(part.text());
            }
        }
        return text.toString().trim();
    }
}
