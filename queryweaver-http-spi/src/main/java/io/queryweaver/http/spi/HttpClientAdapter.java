package io.queryweaver.http.spi;

/**
 * Abstraction for HTTP client implementations.
 *
 * <p>This interface allows the QueryWeaver client to work with different HTTP client libraries
 * without direct dependency on any specific implementation. Implementations should be thread-safe
 * and reusable.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * HttpClientRequest request = HttpClientRequest.post(URI.create("http://localhost:5000/graphs/crm"))
 *         .header("Content-Type", "application/json")
 *         .body(json)
 *         .timeout(Duration.ofSeconds(30))
 *         .build();
 * try (HttpClientResponse response = adapter.sendStreaming(request)) {
 *     InputStream body = response.bodyAsStream();
 *     ...
 * }
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Sends an HTTP request and returns as soon as the response status and headers have arrived.
     *
     * <p>The request timeout, if any, bounds only the wait for the response headers; reading the body
     * afterwards is not subject to it. The caller is responsible for closing the returned response.
     *
     * @param request the HTTP request to send
     * @return the HTTP response with body as InputStream
     * @throws HttpTimeoutException if no response arrived within the request timeout
     * @throws HttpClientException if the request fails
     */
    HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException;
}
