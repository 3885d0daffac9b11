package io.queryweaver.http.spi;

import java.io.InputStream;
import java.net.CookieManager;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link HttpClientAdapter} implementation using the JDK 11+ HttpClient.
 *
 * <p>{@link HttpResponse.BodyHandlers#ofInputStream()} completes once the headers have arrived, so the
 * request timeout bounds only the initiation phase of a streaming exchange.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    private final HttpClient httpClient;

    public JdkHttpClientAdapter(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates a new adapter whose client keeps cookies between requests, so session cookies set by
     * the server are sent back like a browser's credentialed requests.
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create() {
        return create(null);
    }

    /**
     * Same as {@link #create()} with a connect timeout.
     * @param connectTimeout TCP connect timeout, or null for the JDK default
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create(Duration connectTimeout) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .cookieHandler(new CookieManager());
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }
        return new JdkHttpClientAdapter(builder.build());
    }

    @Override
    public HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException {
        try {
            HttpResponse<InputStream> response = httpClient.send(toJdkRequest(request), HttpResponse.BodyHandlers.ofInputStream());
            return new StreamingResponse(response);
        } catch (java.net.http.HttpTimeoutException e) {
            throw new HttpTimeoutException("Request to " + request.uri() + " timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientException("Request interrupted", e);
        } catch (Exception e) {
            throw new HttpClientException("Request to " + request.uri() + " failed: " + e.getMessage(), e);
        }
    }

    private static HttpRequest toJdkRequest(HttpClientRequest request) {
        HttpRequest.BodyPublisher bodyPublisher = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
                .method(request.method(), bodyPublisher);
        request.headers().forEach(builder::header);

        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }

        return builder.build();
    }

    private static final class StreamingResponse implements HttpClientResponse {
        private final HttpResponse<InputStream> response;

        StreamingResponse(HttpResponse<InputStream> response) {
            this.response = response;
        }

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Optional<String> header(String name) {
            return response.headers().firstValue(name);
        }

        @Override
        public InputStream bodyAsStream() {
            return response.body();
        }
    }
}
