package io.queryweaver.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request to ask a natural-language question against one database.
 *
 * <p>No validation happens here: a blank target or query is reported by the client as an error message
 * on the returned stream.
 *
 * @param targetId the database (graph) identifier
 * @param query the question to ask
 * @param history earlier turns, oldest first (may be empty)
 * @param results earlier final answers the server may use as context (may be empty)
 * @param instructions extra guidance for SQL generation (optional, may be null)
 */
public record QueryRequest(String targetId, String query, List<ConversationTurn> history,
                           List<String> results, String instructions) {

    public QueryRequest {
        history = copy(history);
        results = copy(results);
    }

    public QueryRequest(String targetId, String query, List<ConversationTurn> history) {
        this(targetId, query, history, List.of(), null);
    }

    public QueryRequest(String targetId, String query) {
        this(targetId, query, List.of(), List.of(), null);
    }

    public QueryRequest withResults(List<String> results) {
        return new QueryRequest(targetId, query, history, results, instructions);
    }

    public QueryRequest withInstructions(String instructions) {
        return new QueryRequest(targetId, query, history, results, instructions);
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null || values.isEmpty() ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }
}
