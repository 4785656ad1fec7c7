package io.agentrelay.client.extraction;

import java.util.concurrent.atomic.AtomicLong;

import io.agentrelay.spec.EnvelopeParseException;

/**
 * An {@link ExtractionListener} that counts what it is told. Safe to share between
 * concurrent invocations.
 */
public class ExtractionCounters implements ExtractionListener {

    private final AtomicLong candidatesParsed = new AtomicLong();
    private final AtomicLong fragmentsExtracted = new AtomicLong();
    private final AtomicLong payloadsDiscarded = new AtomicLong();
    private final AtomicLong fallbacksTriggered = new AtomicLong();

    @Override
    public void onCandidateParsed(String payload) {
        candidatesParsed.incrementAndGet();
    }

    @Override
    public void onFragmentExtracted(TextFragment fragment) {
        fragmentsExtracted.incrementAndGet();
    }

    @Override
    public void onPayloadDiscarded(EnvelopeParseException error) {
        payloadsDiscarded.incrementAndGet();
    }

    @Override
    public void onFallbackTriggered(Fallback fallback) {
        fallbacksTriggered.incrementAndGet();
    }

    public long getCandidatesParsed() {
        return candidatesParsed.get();
    }

    public long getFragmentsExtracted() {
        return fragmentsExtracted.get();
    }

    public long getPayloadsDiscarded() {
        return payloadsDiscarded.get();
    }

    public long getFallbacksTriggered() {
        return fallbacksTriggered.get();
    }

    @Override
    public String toString() {
        return "ExtractionCounters{" +
                "candidatesParsed=" + candidatesParsed +
                ", fragmentsExtracted=" + fragmentsExtracted +
                ", payloadsDiscarded=" + payloadsDiscarded +
                ", fallbacksTriggered=" + fallbacksTriggered +
                '}';
    }
}
