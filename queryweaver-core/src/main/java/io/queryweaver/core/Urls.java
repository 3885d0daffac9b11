package io.queryweaver.core;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Utility to build endpoint URLs from a base URL and path segments.
 */
public final class Urls {
    private Urls() {}

    /**
     * Appends percent-encoded path segments to {@code base}, ignoring any trailing slash on it.
     */
    public static URI resolve(URI base, String... segments) {
        Objects.requireNonNull(base, "base");
        StringBuilder sb = new StringBuilder(base.toString());
        while (sb.length() > 0 && sb.charAt(sb.length() - 1) == '/') {
            sb.setLength(sb.length() - 1);
        }
        for (String segment : segments) {
            sb.append('/').append(encodeSegment(segment));
        }
        return URI.create(sb.toString());
    }

    public static String encodeSegment(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
