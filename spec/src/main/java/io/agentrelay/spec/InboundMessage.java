package io.agentrelay.spec;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A message as delivered to an agent's message handler.
 *
 * @param parts the ordered parts of the message, never null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InboundMessage(@JsonProperty("parts") List<MessagePart> parts) {

    public InboundMessage {
        parts = parts != null ? List.copyOf(parts) : List.of();
    }
}
