package io.queryweaver.core;

import java.util.Locale;
import java.util.Map;

/**
 * Category of a {@link StreamMessage}.
 *
 * <p>The server emits several concrete wire types per category (for instance {@code reasoning_step} and
 * {@code schema_refresh} are both informational). Unrecognised types are treated as {@link #STATUS}.
 */
public enum MessageKind {
    CONTENT("content"),
    STATUS("status"),
    CONFIRMATION_REQUIRED("confirmation-required"),
    ERROR("error"),
    DONE("done");

    private static final Map<String, MessageKind> BY_TYPE = Map.ofEntries(
            Map.entry("content", CONTENT),
            Map.entry("ai_response", CONTENT),
            Map.entry("sql", CONTENT),
            Map.entry("sql_query", CONTENT),
            Map.entry("result", CONTENT),
            Map.entry("query_result", CONTENT),
            Map.entry("final_result", CONTENT),
            Map.entry("followup", CONTENT),
            Map.entry("followup_questions", CONTENT),
            Map.entry("status", STATUS),
            Map.entry("progress", STATUS),
            Map.entry("reasoning", STATUS),
            Map.entry("reasoning_step", STATUS),
            Map.entry("schema_refresh", STATUS),
            Map.entry("healing_attempt", STATUS),
            Map.entry("healing_success", STATUS),
            Map.entry("operation_cancelled", STATUS),
            Map.entry("confirmation-required", CONFIRMATION_REQUIRED),
            Map.entry("confirmation", CONFIRMATION_REQUIRED),
            Map.entry("destructive_confirmation", CONFIRMATION_REQUIRED),
            Map.entry("error", ERROR),
            Map.entry("done", DONE)
    );

    private final String wireType;

    MessageKind(String wireType) {
        this.wireType = wireType;
    }

    /** @return the canonical wire type of this kind */
    public String wireType() {
        return wireType;
    }

    public static MessageKind forType(String type) {
        if (type == null) return STATUS;
        return BY_TYPE.getOrDefault(type.trim().toLowerCase(Locale.ROOT), STATUS);
    }
}
