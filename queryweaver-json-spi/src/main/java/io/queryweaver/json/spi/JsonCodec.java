package io.queryweaver.json.spi;

import java.util.Map;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap specific JSON libraries (Jackson, Gson, etc.).
 *
 * <p>Stream messages are decoded as generic objects ({@link #readObject(String)}) because their shape
 * varies per message type; request bodies are written from plain maps and lists.
 */
public interface JsonCodec {

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return UTF-8 JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    /**
     * Deserializes a JSON object into an ordered map of plain Java values
     * (maps, lists, strings, numbers, booleans and nulls).
     * @param json JSON text that must hold exactly one object
     * @return the decoded object
     * @throws JsonException if the text is not valid JSON or is not an object
     */
    Map<String, Object> readObject(String json) throws JsonException;
}
