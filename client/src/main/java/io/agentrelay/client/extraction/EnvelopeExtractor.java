package io.agentrelay.client.extraction;

import static io.agentrelay.util.Utils.STRICT_TREE_READER;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentrelay.spec.EnvelopeParseException;
import io.agentrelay.util.Assert;
import io.agentrelay.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts plain text from a single stream payload.
 * <p>
 * A payload is matched against the following shapes, in order:
 * <ol>
 *   <li>a status envelope, {@code {"statusUpdate":{"status":{"message":{"content":[{"text":...}]}}}}}</li>
 *   <li>a direct envelope, {@code {"content":[{"text":...}]}}</li>
 *   <li>plain text, a payload that is not JSON and does not start with <code>{</code>, used verbatim</li>
 * </ol>
 * Any other JSON value is a structured event without text and yields an empty match. A payload
 * that starts with <code>{</code> but fails to parse is discarded: it is never mistaken for text.
 * <p>
 * Instances are stateless apart from the listener and may be shared.
 */
public class EnvelopeExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(EnvelopeExtractor.class);

    public static final String STATUS_UPDATE = "statusUpdate";
    public static final String STATUS = "status";
    public static final String MESSAGE = "message";
    public static final String CONTENT = "content";
    public static final String TEXT = "text";

    private static final int LOGGED_PAYLOAD_LENGTH = 200;

    private final ExtractionListener listener;

    public EnvelopeExtractor() {
        this(ExtractionListener.NO_OP);
    }

    public EnvelopeExtractor(ExtractionListener listener) {
        Assert.checkNotNullParam("listener", listener);
        this.listener = listener;
    }

    public Extraction extract(String payload) {
        Assert.checkNotNullParam("payload", payload);
        return extract(payload, true);
    }

    /**
     * Extracts text from a payload that must be a JSON envelope. Plain text and blank payloads
     * are discarded like malformed envelopes instead of being used verbatim.
     *
     * @param candidate the payload to parse
     * @return the extraction, unmatched unless the candidate parsed as JSON
     */
    public Extraction extractEnvelope(String candidate) {
        Assert.checkNotNullParam("candidate", candidate);
        return extract(candidate, false);
    }

    private Extraction extract(String payload, boolean plainTextAllowed) {
        JsonNode root;
        try {
            root = STRICT_TREE_READER.readTree(payload);
        } catch (JsonProcessingException e) {
            if (plainTextAllowed && !payload.trim().startsWith("{")) {
                return new Extraction(payload, true);
            }
            return discard(payload, new EnvelopeParseException(payload, e));
        }
        if (root == null || root.isMissingNode()) {
            // blank input, nothing to parse
            return plainTextAllowed
                    ? new Extraction(payload, true)
                    : discard(payload, new EnvelopeParseException(payload, "blank candidate"));
        }
        listener.onCandidateParsed(payload);

        if (!root.isObject()) {
            LOGGER.debug("Ignoring non-object JSON payload of type {}", root.getNodeType());
            return Extraction.EMPTY;
        }
        if (root.has(STATUS_UPDATE)) {
            JsonNode content = root.path(STATUS_UPDATE).path(STATUS).path(MESSAGE).path(CONTENT);
            return new Extraction(textOf(content), true);
        }
        if (root.has(CONTENT)) {
            return new Extraction(textOf(root.path(CONTENT)), true);
        }
        return Extraction.EMPTY;
    }

    private Extraction discard(String payload, EnvelopeParseException cause) {
        LOGGER.warn("Discarding malformed envelope: {}", Utils.truncate(payload, LOGGED_PAYLOAD_LENGTH));
        listener.onPayloadDiscarded(cause);
        return Extraction.UNMATCHED;
    }

    private static String textOf(JsonNode content) {
        if (!content.isArray()) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode item : content) {
            if (!item.isObject() || !item.has(TEXT)) {
                continue;
            }
            JsonNode value = item.get(TEXT);
            if (value.isNull()) {
                continue;
            }
            String itemText = value.isTextual() ? value.textValue() : value.toString();
            if (!itemText.trim().isEmpty()) {
                text.append(itemText);
            }
        }
        return text.toString();
    }
}
