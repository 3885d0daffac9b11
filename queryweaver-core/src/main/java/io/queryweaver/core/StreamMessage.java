package io.queryweaver.core;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A decoded unit of a QueryWeaver streaming response.
 *
 * <p>Every variant keeps the wire {@code type} it was decoded from, a human-readable {@code content}
 * (never null, possibly empty) and an immutable copy of all decoded fields for kind-specific data
 * such as {@code data}, {@code conf} or {@code exp}.
 */
public sealed interface StreamMessage
        permits StreamMessage.Content, StreamMessage.Status, StreamMessage.ConfirmationRequired,
        StreamMessage.Error, StreamMessage.Done {

    String type();

    String content();

    Map<String, Object> fields();

    MessageKind kind();

    default Optional<Object> field(String name) {
        return Optional.ofNullable(fields().get(name));
    }

    /** @return true if the server flagged this message as the final answer of the turn */
    default boolean finalResponse() {
        return Boolean.TRUE.equals(fields().get(Protocol.F_FINAL_RESPONSE));
    }

    /**
     * Creates a synthetic error message, as produced by the client for failures it detects itself.
     */
    static Error error(String description) {
        String text = description == null ? "" : description;
        return new Error(MessageKind.ERROR.wireType(), text,
                Map.of(Protocol.F_TYPE, MessageKind.ERROR.wireType(), Protocol.F_CONTENT, text));
    }

    /**
     * Incremental answer text or a result payload.
     */
    record Content(String type, String content, Map<String, Object> fields) implements StreamMessage {
        public Content {
            Objects.requireNonNull(type, "type");
            content = content == null ? "" : content;
            fields = Fields.immutableCopy(fields);
        }

        @Override
        public MessageKind kind() {
            return MessageKind.CONTENT;
        }
    }

    /**
     * Informational progress such as reasoning steps or schema refresh notices.
     */
    record Status(String type, String content, Map<String, Object> fields) implements StreamMessage {
        public Status {
            Objects.requireNonNull(type, "type");
            content = content == null ? "" : content;
            fields = Fields.immutableCopy(fields);
        }

        @Override
        public MessageKind kind() {
            return MessageKind.STATUS;
        }
    }

    /**
     * The server halted before a destructive operation.
     *
     * @param operationId the identifier the caller echoes back when confirming
     */
    record ConfirmationRequired(String type, String content, String operationId, Map<String, Object> fields)
            implements StreamMessage {
        public ConfirmationRequired {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(operationId, "operationId");
            content = content == null ? "" : content;
            fields = Fields.immutableCopy(fields);
        }

        /** @return the SQL operation class reported by the server, e.g. {@code DELETE} */
        public Optional<String> operationType() {
            Object v = fields.get(Protocol.F_OPERATION_TYPE);
            return v instanceof String s ? Optional.of(s) : Optional.empty();
        }

        @Override
        public MessageKind kind() {
            return MessageKind.CONFIRMATION_REQUIRED;
        }
    }

    /**
     * A server-reported or client-detected failure, described for humans.
     */
    record Error(String type, String content, Map<String, Object> fields) implements StreamMessage {
        public Error {
            Objects.requireNonNull(type, "type");
            content = content == null ? "" : content;
            fields = Fields.immutableCopy(fields);
        }

        @Override
        public MessageKind kind() {
            return MessageKind.ERROR;
        }
    }

    /**
     * Explicit end-of-turn marker. Streams may also end by closing without one.
     */
    record Done(String type, String content, Map<String, Object> fields) implements StreamMessage {
        public Done {
            Objects.requireNonNull(type, "type");
            content = content == null ? "" : content;
            fields = Fields.immutableCopy(fields);
        }

        @Override
        public MessageKind kind() {
            return MessageKind.DONE;
        }
    }
}
