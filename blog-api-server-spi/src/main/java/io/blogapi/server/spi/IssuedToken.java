package io.blogapi.server.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * A freshly signed bearer token.
 *
 * @param value compact serialized token
 * @param subject username the token was issued for
 * @param expiresAt absolute expiry
 */
public record IssuedToken(String value, String subject, Instant expiresAt) {
    public IssuedToken {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    @Override
    public String toString() {
        return "IssuedToken[subject=" + subject + ", expiresAt=" + expiresAt + "]";
    }
}
