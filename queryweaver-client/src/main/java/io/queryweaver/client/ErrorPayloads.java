package io.queryweaver.client;

import io.queryweaver.core.Protocol;
import io.queryweaver.json.spi.JsonCodec;
import io.queryweaver.json.spi.JsonException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts a human-readable description from the body of a failed HTTP response.
 *
 * <p>The server does not use one error shape: route handlers answer {@code {"error": ...}}, framework
 * validation answers {@code {"detail": ...}} and some paths answer {@code {"message": ...}} or plain text.
 * The lookup order is {@link #MESSAGE_FIELDS}, then the raw body text, then a generic status line.
 */
public final class ErrorPayloads {
    private ErrorPayloads() {}

    public static final List<String> MESSAGE_FIELDS = List.of(Protocol.F_ERROR, Protocol.F_DETAIL, Protocol.F_MESSAGE);

    public static String describe(int status, byte[] body, JsonCodec codec) {
        String text = body == null ? "" : new String(body, StandardCharsets.UTF_8).trim();
        return fromJson(text, codec)
                .orElseGet(() -> text.isEmpty() ? "Request failed with status " + status : text);
    }

    /**
     * @return the first non-blank recognised field of a JSON object body, or empty if the body is not
     *         a JSON object or has none of the fields
     */
    public static Optional<String> fromJson(String text, JsonCodec codec) {
        if (text == null || text.isBlank()) return Optional.empty();

        Map<String, Object> fields;
        try {
            fields = codec.readObject(text);
        } catch (JsonException notJson) {
            return Optional.empty();
        }

        for (String name : MESSAGE_FIELDS) {
            Object value = fields.get(name);
            if (value instanceof String s) {
                if (!s.isBlank()) return Optional.of(s.trim());
            } else if (value != null) {
                return Optional.of(render(value, codec));
            }
        }
        return Optional.empty();
    }

    private static String render(Object value, JsonCodec codec) {
        try {
            return codec.writeString(value);
        } catch (JsonException e) {
            return String.valueOf(value);
        }
    }
}
