package io.agentrelay.client.extraction;

import io.agentrelay.spec.EnvelopeParseException;

/**
 * Receives notifications about what the extraction layer did with each payload.
 * <p>
 * Callbacks run on the thread that performs the extraction, typically the HTTP client's
 * response thread, and must not block.
 */
public interface ExtractionListener {

    ExtractionListener NO_OP = new ExtractionListener() {
    };

    /**
     * A payload was parsed as JSON.
     */
    default void onCandidateParsed(String payload) {
    }

    /**
     * A non-blank fragment was added to a result.
     */
    default void onFragmentExtracted(TextFragment fragment) {
    }

    /**
     * A payload looked like JSON but could not be parsed, and was dropped.
     */
    default void onPayloadDiscarded(EnvelopeParseException error) {
    }

    /**
     * Envelope recovery found no text and resorted to a fallback.
     */
    default void onFallbackTriggered(Fallback fallback) {
    }

    enum Fallback {
        /** Text recovered by scanning for {@code "text"} fields. */
        TEXT_FIELD_SCAN,
        /** Nothing recovered; the error sentinel was returned. */
        ERROR_SENTINEL
    }
}
