package io.queryweaver.client;

import io.queryweaver.core.FrameSplitter;
import io.queryweaver.core.Protocol;
import io.queryweaver.core.Urls;
import io.queryweaver.http.spi.HttpClientAdapter;
import io.queryweaver.http.spi.HttpClientRequest;
import io.queryweaver.json.spi.JsonCodec;
import io.queryweaver.json.spi.JsonException;
import org.slf4j.Logger;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link QueryWeaverClient} that sends JSON requests through an {@link HttpClientAdapter} and decodes the
 * boundary-framed response bodies.
 */
public final class DefaultQueryWeaverClient implements QueryWeaverClient {

    private final URI baseUri;
    private final HttpClientAdapter http;
    private final JsonCodec codec;
    private final FrameSplitter splitter;
    private final Duration requestTimeout;
    private final String apiToken;
    private final int readBufferSize;
    private final Logger log;

    DefaultQueryWeaverClient(URI baseUri, HttpClientAdapter http, JsonCodec codec, FrameSplitter splitter,
                             Duration requestTimeout, String apiToken, int readBufferSize, Logger log) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.http = Objects.requireNonNull(http, "http");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.splitter = Objects.requireNonNull(splitter, "splitter");
        this.requestTimeout = requestTimeout;
        this.apiToken = apiToken;
        this.readBufferSize = readBufferSize;
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public MessageStream beginQuery(QueryRequest request) {
        if (request == null) {
            return rejected("query", "Query request is required");
        }
        String label = "query[" + request.targetId() + "]";
        if (isBlank(request.targetId())) {
            return rejected(label, "Please select a database first");
        }
        if (isBlank(request.query())) {
            return rejected(label, "Query text is required");
        }

        List<String> chat = new ArrayList<>();
        for (ConversationTurn turn : request.history()) {
            if (turn != null && turn.content() != null) {
                chat.add(turn.content());
            }
        }
        chat.add(request.query());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put(Protocol.F_CHAT, chat);
        if (!request.results().isEmpty()) {
            body.put(Protocol.F_RESULT, request.results());
        }
        if (!isBlank(request.instructions())) {
            body.put(Protocol.F_INSTRUCTIONS, request.instructions());
        }
        return open(label, Urls.resolve(baseUri, Protocol.PATH_GRAPHS, request.targetId()), body);
    }

    @Override
    public MessageStream confirmOperation(String targetId, ConfirmRequest request) {
        String label = "confirm[" + targetId + "]";
        if (isBlank(targetId)) {
            return rejected(label, "Please select a database first");
        }
        if (request == null || isBlank(request.operationId())) {
            return rejected(label, "No operation to confirm");
        }
        if (request.decision() == null) {
            return rejected(label, "Confirmation decision is required");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put(Protocol.F_SQL_QUERY, request.operationId());
        body.put(Protocol.F_CONFIRMATION, request.decision().wireValue());
        body.put(Protocol.F_CHAT, request.chat());
        return open(label, Urls.resolve(baseUri, Protocol.PATH_GRAPHS, targetId, Protocol.PATH_CONFIRM), body);
    }

    @Override
    public MessageStream connectDatabase(ConnectDatabaseRequest request) {
        String label = "database";
        if (request == null || isBlank(request.url())) {
            return rejected(label, "Database URL is required");
        }
        return open(label, Urls.resolve(baseUri, Protocol.PATH_DATABASE), Map.of(Protocol.F_URL, request.url()));
    }

    private MessageStream open(String label, URI uri, Map<String, Object> body) {
        byte[] bytes;
        try {
            bytes = codec.writeBytes(body);
        } catch (JsonException e) {
            log.warn("{} request body could not be encoded", label, e);
            return rejected(label, "Request body could not be encoded: " + e.getMessage());
        }

        HttpClientRequest.Builder req = HttpClientRequest.post(uri)
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON)
                .body(bytes)
                .timeout(requestTimeout);
        if (!isBlank(apiToken)) {
            req.header(Protocol.H_AUTHORIZATION, Protocol.BEARER + apiToken);
        }
        return new StreamSession(label, null, req.build(), http, codec, splitter, readBufferSize, log);
    }

    private MessageStream rejected(String label, String reason) {
        return new StreamSession(label, reason, null, http, codec, splitter, readBufferSize, log);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
