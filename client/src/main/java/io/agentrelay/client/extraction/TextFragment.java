package io.agentrelay.client.extraction;

import io.agentrelay.util.Assert;

/**
 * Text extracted from a single stream event.
 *
 * @param ordinal position of the originating event within its stream
 * @param text the extracted text
 */
public record TextFragment(long ordinal, String text) {

    public TextFragment {
        Assert.checkNotNullParam("text", text);
    }
}
