package io.queryweaver.client;

import io.queryweaver.core.QueryWeaverException;
import io.queryweaver.core.StreamMessage;

import java.net.URI;
import java.util.List;
import java.util.concurrent.Flow;

/**
 * Client for the QueryWeaver streaming endpoints.
 *
 * <p>Each call returns an unstarted {@link MessageStream}: nothing is sent until the first
 * {@link MessageStream#hasNext()}. Validation failures, HTTP errors, timeouts and malformed frames are
 * delivered as {@link StreamMessage.Error} messages rather than thrown.
 */
public interface QueryWeaverClient {

    /** Asks a question against a database: {@code POST /graphs/{targetId}}. */
    MessageStream beginQuery(QueryRequest request);

    /** Answers a confirmation request: {@code POST /graphs/{targetId}/confirm}. */
    MessageStream confirmOperation(String targetId, ConfirmRequest request);

    /** Connects an external database and streams the schema load progress: {@code POST /database}. */
    MessageStream connectDatabase(ConnectDatabaseRequest request);

    /**
     * Runs a query to completion.
     *
     * @throws QueryWeaverException.StreamFailure if the connection broke mid-stream
     */
    default List<StreamMessage> executeQuery(QueryRequest request) {
        try (MessageStream stream = beginQuery(request)) {
            return stream.toList();
        }
    }

    default Flow.Publisher<StreamMessage> subscribeQuery(QueryRequest request) {
        return new SessionPublisher(() -> beginQuery(request));
    }

    default Flow.Publisher<StreamMessage> subscribeConfirmation(String targetId, ConfirmRequest request) {
        return new SessionPublisher(() -> confirmOperation(targetId, request));
    }

    default Flow.Publisher<StreamMessage> subscribeDatabaseConnection(ConnectDatabaseRequest request) {
        return new SessionPublisher(() -> connectDatabase(request));
    }

    static QueryWeaverClient create(URI baseUri) {
        return builder().baseUri(baseUri).build();
    }

    static QueryWeaverClientBuilder builder() {
        return new QueryWeaverClientBuilder();
    }
}
