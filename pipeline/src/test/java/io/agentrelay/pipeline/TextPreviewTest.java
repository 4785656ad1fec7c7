package io.agentrelay.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TextPreviewTest {

    @Test
    void testShortTextIsOnlyTrimmed() {
        assertEquals("Solar power is growing.", TextPreview.of("  Solar power is growing.  "));
    }

    @Test
    void testLongTextBreaksAfterLastSentence() {
        String first = "a".repeat(299) + ".";
        String text = first + " " + "b".repeat(400);

        assertEquals(first + "...", TextPreview.of(text));
    }

    @Test
    void testEarlySentenceBreakIsIgnored() {
        String text = "Short. " + "c".repeat(800);

        String preview = TextPreview.of(text);

        assertEquals(503, preview.length());
        assertTrue(preview.startsWith("Short. ccc"));
        assertTrue(preview.endsWith("c..."));
    }

    @Test
    void testTextOfExactlyMaxLength() {
        String text = "d".repeat(TextPreview.MAX_LENGTH);

        assertEquals(text, TextPreview.of(text));
    }
}
