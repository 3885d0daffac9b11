package io.queryweaver.client;

import io.queryweaver.core.FrameSplitter;
import io.queryweaver.core.QueryWeaverException;
import io.queryweaver.http.spi.HttpClientAdapter;
import io.queryweaver.http.spi.JdkHttpClientAdapter;
import io.queryweaver.json.spi.JsonCodec;
import io.queryweaver.json.spi.JsonCodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

public final class QueryWeaverClientBuilder {

    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    static final int DEFAULT_READ_BUFFER_SIZE = 8192;

    private URI baseUri;
    private HttpClientAdapter httpClient;
    private JsonCodec jsonCodec;
    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    private String apiToken;
    private String boundary;
    private int readBufferSize = DEFAULT_READ_BUFFER_SIZE;
    private Logger logger;

    public QueryWeaverClientBuilder baseUri(URI baseUri) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        return this;
    }

    public QueryWeaverClientBuilder baseUrl(String baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        try {
            this.baseUri = URI.create(baseUrl);
        } catch (IllegalArgumentException e) {
            throw new QueryWeaverException.InvalidConfiguration("Invalid base URL: " + baseUrl, e);
        }
        return this;
    }

    public QueryWeaverClientBuilder httpClient(HttpClientAdapter httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        return this;
    }

    public QueryWeaverClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.httpClient = new JdkHttpClientAdapter(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    public QueryWeaverClientBuilder jsonCodec(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        return this;
    }

    /**
     * Bounds the wait for response headers. Once the body starts streaming no timeout applies.
     * {@code null} waits indefinitely.
     */
    public QueryWeaverClientBuilder requestTimeout(Duration requestTimeout) {
        if (requestTimeout != null && (requestTimeout.isNegative() || requestTimeout.isZero())) {
            throw new QueryWeaverException.InvalidConfiguration("Request timeout must be positive: " + requestTimeout);
        }
        this.requestTimeout = requestTimeout;
        return this;
    }

    public QueryWeaverClientBuilder apiToken(String apiToken) {
        this.apiToken = apiToken;
        return this;
    }

    public QueryWeaverClientBuilder boundary(String boundary) {
        if (boundary == null || boundary.isEmpty()) {
            throw new QueryWeaverException.InvalidConfiguration("Message boundary must not be empty");
        }
        this.boundary = boundary;
        return this;
    }

    public QueryWeaverClientBuilder readBufferSize(int readBufferSize) {
        if (readBufferSize <= 0) {
            throw new QueryWeaverException.InvalidConfiguration("Read buffer size must be positive: " + readBufferSize);
        }
        this.readBufferSize = readBufferSize;
        return this;
    }

    public QueryWeaverClientBuilder logger(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
        return this;
    }

    /**
     * Applies every setting present in {@code configuration}; absent ones keep their current value.
     */
    public QueryWeaverClientBuilder configuration(QueryWeaverConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        if (configuration.getBaseUrl() != null) baseUrl(configuration.getBaseUrl());
        if (configuration.getRequestTimeout() != null) requestTimeout(configuration.getRequestTimeout());
        if (configuration.getApiToken() != null) apiToken(configuration.getApiToken());
        if (configuration.getBoundary() != null) boundary(configuration.getBoundary());
        if (configuration.getReadBufferSize() != null) readBufferSize(configuration.getReadBufferSize());
        return this;
    }

    public QueryWeaverClient build() {
        if (baseUri == null) {
            throw new QueryWeaverException.InvalidConfiguration("Base URL is required");
        }
        HttpClientAdapter resolvedHttp = httpClient;
        if (resolvedHttp == null) {
            resolvedHttp = requestTimeout == null ? JdkHttpClientAdapter.create() : JdkHttpClientAdapter.create(requestTimeout);
        }
        JsonCodec resolvedCodec = jsonCodec == null ? JsonCodecs.load() : jsonCodec;
        FrameSplitter splitter = boundary == null ? FrameSplitter.standard() : new FrameSplitter(boundary);
        Logger resolvedLogger = logger == null ? LoggerFactory.getLogger(QueryWeaverClient.class) : logger;
        return new DefaultQueryWeaverClient(baseUri, resolvedHttp, resolvedCodec, splitter,
                requestTimeout, apiToken, readBufferSize, resolvedLogger);
    }
}
