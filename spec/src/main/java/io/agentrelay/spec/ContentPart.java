package io.agentrelay.spec;

import io.agentrelay.util.Assert;

/**
 * Flat part with a direct content field: {@code {"content": "..."}}.
 * <p>
 * Non-textual content values are kept in their JSON form.
 *
 * @param content the content rendered as text
 */
public record ContentPart(String content) implements MessagePart {

    public ContentPart {
        Assert.checkNotNullParam("content", content);
    }

    @Override
    public String text() {
        return content;
    }
}
