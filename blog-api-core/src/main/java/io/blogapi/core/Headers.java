package io.blogapi.core;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal helpers for case-insensitive header lookup.
 */
public final class Headers {
    private Headers() {}

    public static Optional<String> firstValue(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null || name == null) return Optional.empty();
        String target = name.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, ? extends Iterable<String>> e : headers.entrySet()) {
            if (e.getKey() == null) continue;
            if (e.getKey().toLowerCase(Locale.ROOT).equals(target)) {
                Iterable<String> vals = e.getValue();
                if (vals == null) return Optional.empty();
                for (String v : vals) {
                    if (v != null) return Optional.of(v);
                }
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Extracts the credentials of a {@code Bearer} authorization header.
     *
     * <p>The scheme is matched case-insensitively. Returns empty when the header is absent, uses another
     * scheme, or carries no credentials.
     */
    public static Optional<String> bearerToken(Map<String, ? extends Iterable<String>> headers) {
        Optional<String> authorization = firstValue(headers, Protocol.H_AUTHORIZATION);
        if (authorization.isEmpty()) return Optional.empty();

        String value = authorization.get().trim();
        int space = value.indexOf(' ');
        if (space <= 0) return Optional.empty();
        if (!value.substring(0, space).equalsIgnoreCase(Protocol.SCHEME_BEARER)) return Optional.empty();

        String token = value.substring(space + 1).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
