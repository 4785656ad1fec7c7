package io.agentrelay.client.extraction;

import static io.agentrelay.common.RelayErrorMessages.UNRECOVERABLE_RELAY_CONTENT;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.agentrelay.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers text from a blob that holds raw envelopes glued together, as produced when one agent
 * forwards another agent's stream output verbatim.
 * <p>
 * Envelope boundaries are found by the textual heuristic <code>}{</code>: a closing brace
 * immediately followed by an opening one. Text values that themselves contain <code>}{</code>
 * will be split in the wrong place; the resulting fragments fail to parse and are skipped.
 */
public class ConcatenatedEnvelopeSplitter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConcatenatedEnvelopeSplitter.class);

    public static final String MARKER = EnvelopeExtractor.STATUS_UPDATE;

    static final String BOUNDARY = "}{";
    static final String DELIMITED_BOUNDARY = "}|||{";
    static final String DELIMITER = "|||";

    private static final Pattern TEXT_FIELD = Pattern.compile("\"text\":\\s*\"([^\"]+)\"");

    private final EnvelopeExtractor extractor;
    private final ExtractionListener listener;

    public ConcatenatedEnvelopeSplitter() {
        this(ExtractionListener.NO_OP);
    }

    public ConcatenatedEnvelopeSplitter(ExtractionListener listener) {
        this(new EnvelopeExtractor(listener), listener);
    }

    public ConcatenatedEnvelopeSplitter(EnvelopeExtractor extractor, ExtractionListener listener) {
        Assert.checkNotNullParam("extractor", extractor);
        Assert.checkNotNullParam("listener", listener);
        this.extractor = extractor;
        this.listener = listener;
    }

    /**
     * Returns whether the blob looks like it carries raw envelopes.
     */
    public static boolean containsEnvelopes(String blob) {
        return blob.contains(MARKER);
    }

    /**
     * Splits the blob into envelope candidates.
     *
     * @param blob the text to split
     * @return the candidates in order; a blob without {@value #MARKER} is returned as the
     *         only element, unchanged
     */
    public List<String> split(String blob) {
        Assert.checkNotNullParam("blob", blob);
        if (!containsEnvelopes(blob)) {
            return List.of(blob);
        }
        String delimited = blob.replace(BOUNDARY, DELIMITED_BOUNDARY);
        return Arrays.asList(delimited.split(Pattern.quote(DELIMITER), -1));
    }

    /**
     * Recovers the text carried by the envelopes in the blob.
     * <p>
     * The texts of all candidates that parse as JSON are concatenated and trimmed. Candidates
     * that are not JSON, such as envelopes behind a prefix, are skipped. If no candidate yields text,
     * every {@code "text": "..."} value in the blob is joined with single spaces; if there is
     * none, a fixed error message asking for the text directly is returned.
     *
     * @param blob the text to recover from
     * @return the recovered text, or the blob unchanged when it holds no {@value #MARKER}
     */
    public String recoverText(String blob) {
        Assert.checkNotNullParam("blob", blob);
        if (!containsEnvelopes(blob)) {
            return blob;
        }

        List<String> candidates = split(blob);
        StringBuilder text = new StringBuilder();
        int skipped = 0;
        for (String candidate : candidates) {
            Extraction extraction = extractor.extractEnvelope(candidate);
            if (!extraction.matched()) {
                skipped++;
                continue;
            }
            if (!extraction.text().isBlank()) {
                text.append(extraction.text());
            }
        }
        if (skipped > 0) {
            LOGGER.warn("Skipped {} of {} envelope candidates that could not be parsed", skipped, candidates.size());
        }

        String recovered = text.toString().trim();
        if (!recovered.isEmpty()) {
            LOGGER.debug("Recovered {} characters from {} envelope candidates", recovered.length(), candidates.size());
            return recovered;
        }

        LOGGER.warn("No text recovered from envelopes, scanning for text fields");
        listener.onFallbackTriggered(ExtractionListener.Fallback.TEXT_FIELD_SCAN);
        List<String> values = new ArrayList<>();
        Matcher matcher = TEXT_FIELD.matcher(blob);
        while (matcher.find()) {
            values.add(matcher.group(1));
        }
        if (!values.isEmpty()) {
            return String.join(" ", values);
        }

        LOGGER.error("Unable to recover any text from {} characters of envelopes", blob.length());
        listener.onFallbackTriggered(ExtractionListener.Fallback.ERROR_SENTINEL);
        return UNRECOVERABLE_RELAY_CONTENT;
    }
}
