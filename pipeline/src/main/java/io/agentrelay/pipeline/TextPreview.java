package io.agentrelay.pipeline;

import io.agentrelay.util.Assert;

/**
 * Utility functions for showing the start of a long stage output.
 */
public final class TextPreview {

    public static final int MAX_LENGTH = 500;
    static final int MIN_SENTENCE_BREAK = 200;
    static final String ELLIPSIS = "...";

    private TextPreview() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns at most the first {@value #MAX_LENGTH} characters of the text, trimmed. When the
     * text is longer, the preview ends after its last full sentence, provided that sentence
     * ends past character {@value #MIN_SENTENCE_BREAK}, and is followed by {@value #ELLIPSIS}.
     *
     * @param text the text to preview
     * @return the preview
     */
    public static String of(String text) {
        Assert.checkNotNullParam("text", text);
        String preview = text.substring(0, Math.min(MAX_LENGTH, text.length())).trim();
        if (text.length() <= MAX_LENGTH) {
            return preview;
        }
        int lastPeriod = preview.lastIndexOf('.');
        if (lastPeriod > MIN_SENTENCE_BREAK) {
            preview = preview.substring(0, lastPeriod + 1);
        }
        return preview + ELLIPSIS;
    }
}
