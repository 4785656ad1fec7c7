package io.agentrelay.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

public class Utils {

    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Reader that rejects input holding anything after the first JSON value, so that two
     * envelopes glued together on one line are reported as malformed instead of silently
     * losing the second one.
     */
    public static final ObjectReader STRICT_TREE_READER = OBJECT_MAPPER.reader()
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private Utils() {
    }

    /**
     * Deserialize a JSON string into an object.
     *
     * @param data the JSON string
     * @param typeRef the type reference of the target type
     * @param <T> the target type
     * @return the deserialized object
     * @throws JsonProcessingException if the data is not valid JSON for the target type
     */
    public static <T> T unmarshalFrom(String data, TypeReference<T> typeRef) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(data, typeRef);
    }

    /**
     * Serialize an object into a JSON string.
     *
     * @param value the object to serialize
     * @return the JSON representation
     * @throws JsonProcessingException if the value cannot be serialized
     */
    public static String marshalTo(Object value) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(value);
    }

    /**
     * Returns at most {@code maxLength} leading characters of the given string.
     *
     * @param value the string to truncate
     * @param maxLength the maximum length to keep
     * @return the truncated string
     */
    public static String truncate(String value, int maxLength) {
        if (value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
