package io.queryweaver.http.spi;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Represents a streaming HTTP response from an {@link HttpClientAdapter}.
 *
 * <p>Closing the response releases the underlying connection. It may be called from a thread other
 * than the one reading the body, and more than once.
 */
public interface HttpClientResponse extends Closeable {

    /**
     * Returns the HTTP status code.
     * @return the status code (e.g., 200, 404, 500)
     */
    int statusCode();

    /**
     * Returns the first value for the specified header name.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    Optional<String> header(String name);

    /**
     * Returns the response body as an input stream.
     * @return the body stream, or null if the response carries no body
     */
    InputStream bodyAsStream();

    @Override
    default void close() throws IOException {
        InputStream body = bodyAsStream();
        if (body != null) {
            body.close();
        }
    }
}
