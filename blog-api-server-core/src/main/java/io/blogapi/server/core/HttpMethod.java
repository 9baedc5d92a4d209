package io.blogapi.server.core;

import java.util.Locale;
import java.util.Optional;

/**
 * HTTP methods understood by {@link BlogApiHandler}.
 */
public enum HttpMethod {
    GET,
    HEAD,
    POST,
    PUT,
    PATCH,
    DELETE,
    OPTIONS;

    /**
     * Resolve a method name as sent on the wire; empty for methods this server does not model.
     */
    public static Optional<HttpMethod> parse(String name) {
        if (name == null) return Optional.empty();
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
