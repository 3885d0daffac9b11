package io.queryweaver.client.reactor;

import io.queryweaver.client.ConfirmRequest;
import io.queryweaver.client.ConnectDatabaseRequest;
import io.queryweaver.client.QueryRequest;
import io.queryweaver.client.QueryWeaverClient;
import io.queryweaver.core.StreamMessage;
import reactor.adapter.JdkFlowAdapter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * Reactor adapter over {@link QueryWeaverClient}.
 *
 * <p>Every returned publisher is cold: each subscription sends its own request, and cancelling the
 * subscription cancels the session.
 */
public final class ReactorQueryWeaverClient {

    private final QueryWeaverClient delegate;

    public ReactorQueryWeaverClient(QueryWeaverClient delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public QueryWeaverClient delegate() {
        return delegate;
    }

    public Flux<StreamMessage> query(QueryRequest request) {
        return JdkFlowAdapter.flowPublisherToFlux(delegate.subscribeQuery(request));
    }

    public Flux<StreamMessage> confirm(String targetId, ConfirmRequest request) {
        return JdkFlowAdapter.flowPublisherToFlux(delegate.subscribeConfirmation(targetId, request));
    }

    public Flux<StreamMessage> connectDatabase(ConnectDatabaseRequest request) {
        return JdkFlowAdapter.flowPublisherToFlux(delegate.subscribeDatabaseConnection(request));
    }

    public Mono<List<StreamMessage>> executeQuery(QueryRequest request) {
        return query(request).collectList();
    }
}
