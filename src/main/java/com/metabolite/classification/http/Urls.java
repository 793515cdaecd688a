package com.metabolite.classification.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Encoding helpers for building request URIs from free-text metabolite names.
 */
public final class Urls {

    private Urls() {
    }

    public static String encodeQueryParam(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    public static String encodePathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * Strips trailing slashes so paths can be appended with a leading one.
     */
    public static String normalizeBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("base URL must not be blank");
        }
        String normalized = baseUrl.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
