package io.queryweaver.client;

import io.queryweaver.core.QueryWeaverException;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;

/**
 * Client settings bound from properties under the {@value #PREFIX} prefix.
 *
 * <pre>
 * queryweaver.base-url=https://queryweaver.example.com
 * queryweaver.request-timeout=PT30S
 * queryweaver.api-token=...
 * queryweaver.boundary=|||FALKORDB_MESSAGE_BOUNDARY|||
 * queryweaver.read-buffer-size=8192
 * </pre>
 *
 * Durations are ISO-8601 ({@code PT30S}) or plain milliseconds.
 */
public class QueryWeaverConfiguration {

    public static final String PREFIX = "queryweaver.";

    private String baseUrl;
    private Duration requestTimeout;
    private String apiToken;
    private String boundary;
    private Integer readBufferSize;

    public static QueryWeaverConfiguration fromProperties(Properties properties) {
        QueryWeaverConfiguration config = new QueryWeaverConfiguration();
        config.setBaseUrl(value(properties, "base-url"));
        config.setApiToken(value(properties, "api-token"));
        config.setBoundary(properties.getProperty(PREFIX + "boundary"));

        String timeout = value(properties, "request-timeout");
        if (timeout != null) {
            config.setRequestTimeout(parseDuration("request-timeout", timeout));
        }
        String bufferSize = value(properties, "read-buffer-size");
        if (bufferSize != null) {
            try {
                config.setReadBufferSize(Integer.parseInt(bufferSize));
            } catch (NumberFormatException e) {
                throw new QueryWeaverException.InvalidConfiguration(
                        "Invalid " + PREFIX + "read-buffer-size: " + bufferSize, e);
            }
        }
        return config;
    }

    /**
     * Loads settings from a classpath resource.
     *
     * @throws QueryWeaverException.InvalidConfiguration if the resource is missing or unreadable
     */
    public static QueryWeaverConfiguration load(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = QueryWeaverConfiguration.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new QueryWeaverException.InvalidConfiguration("Configuration resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new QueryWeaverException.InvalidConfiguration("Failed to read configuration resource " + resource, e);
        }
    }

    private static String value(Properties properties, String key) {
        String v = properties.getProperty(PREFIX + key);
        return v == null || v.isBlank() ? null : v.trim();
    }

    static Duration parseDuration(String key, String text) {
        try {
            if (text.chars().allMatch(Character::isDigit)) {
                return Duration.ofMillis(Long.parseLong(text));
            }
            return Duration.parse(text);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new QueryWeaverException.InvalidConfiguration("Invalid " + PREFIX + key + ": " + text, e);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public String getApiToken() {
        return apiToken;
    }

    public void setApiToken(String apiToken) {
        this.apiToken = apiToken;
    }

    public String getBoundary() {
        return boundary;
    }

    public void setBoundary(String boundary) {
        this.boundary = boundary;
    }

    public Integer getReadBufferSize() {
        return readBufferSize;
    }

    public void setReadBufferSize(Integer readBufferSize) {
        this.readBufferSize = readBufferSize;
    }
}
