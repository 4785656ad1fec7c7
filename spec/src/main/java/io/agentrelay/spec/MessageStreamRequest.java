package io.agentrelay.spec;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.agentrelay.util.Assert;

/**
 * Body of a {@code POST /v1/message:stream} request.
 * <p>
 * Serializes as {@code {"message": {"content": [{"text": "..."}]}}}.
 * <pre>{@code
 * String body = Utils.marshalTo(MessageStreamRequest.ofText("The future of sustainable energy"));
 * }</pre>
 *
 * @param message the message to send
 */
public record MessageStreamRequest(@JsonProperty("message") StreamMessage message) {

    public static final String PATH = "/v1/message:stream";

    public MessageStreamRequest {
        Assert.checkNotNullParam("message", message);
    }

    /**
     * Creates a request carrying a single text item.
     *
     * @param text the text to send
     * @return the request
     */
    public static MessageStreamRequest ofText(String text) {
        return new MessageStreamRequest(new StreamMessage(List.of(new ContentItem(text))));
    }
}
