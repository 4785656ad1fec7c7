package io.agentrelay.spec;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

/**
 * Resolves the shape of a {@link MessagePart} from its JSON form.
 * <p>
 * A {@code root} object of kind {@code text} wins over a direct {@code content} field, matching
 * the order in which agent hosts are probed.
 */
public class MessagePartDeserializer extends StdDeserializer<MessagePart> {

    private static final String ROOT = "root";
    private static final String KIND = "kind";
    private static final String CONTENT = "content";

    public MessagePartDeserializer() {
        super(MessagePart.class);
    }

    @Override
    public MessagePart deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.readValueAsTree();
        if (node == null || !node.isObject()) {
            return new UnknownPart(UnknownPart.UNKNOWN);
        }

        JsonNode root = node.get(ROOT);
        if (root != null && root.isObject() && TextPart.TEXT.equals(root.path(KIND).asText())) {
            JsonNode text = root.get(TextPart.TEXT);
            return new TextPart(text == null || text.isNull() ? "" : asText(text));
        }

        if (node.has(CONTENT)) {
            JsonNode content = node.get(CONTENT);
            return new ContentPart(content.isNull() ? "" : asText(content));
        }

        String kind = root != null ? root.path(KIND).asText(UnknownPart.UNKNOWN) : node.path(KIND).asText(UnknownPart.UNKNOWN);
        return new UnknownPart(kind);
    }

    @Override
    public MessagePart getNullValue(DeserializationContext context) {
        return new UnknownPart(UnknownPart.UNKNOWN);
    }

    private static String asText(JsonNode node) {
        return node.isTextual() ? node.textValue() : node.toString();
    }
}
