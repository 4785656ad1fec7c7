package io.agentrelay.client.extraction;

import io.agentrelay.util.Assert;

/**
 * Outcome of extracting text from one payload.
 *
 * @param text the extracted text, possibly empty
 * @param matched whether the payload was recognised as an envelope or as plain text; a
 *                malformed JSON payload is not matched and contributes nothing
 */
public record Extraction(String text, boolean matched) {

    static final Extraction UNMATCHED = new Extraction("", false);
    static final Extraction EMPTY = new Extraction("", true);

    public Extraction {
        Assert.checkNotNullParam("text", text);
    }
}
