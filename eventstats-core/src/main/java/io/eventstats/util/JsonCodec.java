package io.eventstats.util;

import java.util.Map;

/**
 * Codec for JSON objects used as queue message bodies.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) is a lightweight,
 * zero-dependency encoder/decoder. Parsed values map to Java types as follows:
 * strings to {@link String}, numbers to {@link java.math.BigDecimal}, booleans to
 * {@link Boolean}, {@code null} to {@code null}, objects to {@code Map<String, Object>}
 * and arrays to {@code List<Object>}.
 *
 * <p>Users who already have Jackson, Gson, or another JSON library on the classpath
 * can implement this interface to delegate to their preferred library.
 *
 * @see #getDefault()
 * @see DefaultJsonCodec
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a map as a JSON object string. Supported values are strings, numbers,
     * booleans, {@code null}, nested maps and lists.
     *
     * @param object the object to encode
     * @return JSON string (never {@code null}; an empty map encodes as {@code {}})
     * @throws IllegalArgumentException if a key is null or a value has an unsupported type
     */
    String toJson(Map<String, ?> object);

    /**
     * Parses a JSON document whose top-level value must be an object.
     *
     * @param json the JSON string to parse
     * @return parsed object, in document order (never {@code null})
     * @throws IllegalArgumentException if the input is not a single valid JSON object
     */
    Map<String, Object> parseObject(String json);
}
