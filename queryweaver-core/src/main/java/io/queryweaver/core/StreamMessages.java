package io.queryweaver.core;

import java.util.Map;

/**
 * Maps decoded JSON objects onto {@link StreamMessage} variants.
 */
public final class StreamMessages {
    private StreamMessages() {}

    /**
     * Builds the message variant for a decoded JSON object.
     *
     * @param fields the decoded object; must contain a string {@code type}
     * @throws QueryWeaverException.MalformedMessage if {@code fields} is null or has no string {@code type}
     */
    public static StreamMessage fromFields(Map<String, ?> fields) {
        if (fields == null) {
            throw new QueryWeaverException.MalformedMessage("message is not a JSON object");
        }
        if (!(fields.get(Protocol.F_TYPE) instanceof String type) || type.isBlank()) {
            throw new QueryWeaverException.MalformedMessage("message has no type");
        }

        MessageKind kind = MessageKind.forType(type);
        Map<String, Object> values = Fields.immutableCopy(fields);
        switch (kind) {
            case CONTENT:
                return new StreamMessage.Content(type, text(fields), values);
            case CONFIRMATION_REQUIRED:
                return new StreamMessage.ConfirmationRequired(type, text(fields), operationId(fields), values);
            case ERROR:
                String description = text(fields);
                if (description.isEmpty()) {
                    description = string(fields, Protocol.F_ERROR);
                }
                return new StreamMessage.Error(type, description, values);
            case DONE:
                return new StreamMessage.Done(type, text(fields), values);
            default:
                return new StreamMessage.Status(type, text(fields), values);
        }
    }

    private static String text(Map<String, ?> fields) {
        String content = string(fields, Protocol.F_CONTENT);
        if (content.isEmpty()) content = string(fields, Protocol.F_MESSAGE);
        if (content.isEmpty()) content = string(fields, Protocol.F_DATA);
        return content;
    }

    private static String operationId(Map<String, ?> fields) {
        String id = string(fields, Protocol.F_CONFIRMATION_ID);
        return id.isEmpty() ? string(fields, Protocol.F_SQL_QUERY) : id;
    }

    private static String string(Map<String, ?> fields, String name) {
        Object v = fields.get(name);
        return v instanceof String s ? s : "";
    }
}
