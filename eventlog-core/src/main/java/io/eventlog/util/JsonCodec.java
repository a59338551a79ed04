package io.eventlog.util;

import java.util.Map;

/**
 * Codec for the flat {@code Map<String, String>} event metadata column.
 *
 * <p>The default implementation ({@link FlatJsonCodec}) has no dependencies and only
 * supports flat string-to-string objects. Applications that already use Jackson can plug
 * in their own implementation.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return FlatJsonCodec.INSTANCE;
    }

    /**
     * Encodes metadata as a JSON object string. Returns {@code null} if the map is null or empty.
     *
     * @param metadata the metadata to encode
     * @return JSON string, or {@code null}
     */
    String toJson(Map<String, String> metadata);

    /**
     * Parses a JSON object string into a string map. Returns an empty map for {@code null},
     * blank, or {@code "null"} input.
     *
     * @param json the JSON string to parse
     * @return parsed map (never {@code null})
     * @throws IllegalArgumentException if the input is not a flat JSON object of strings
     */
    Map<String, String> parseObject(String json);
}
