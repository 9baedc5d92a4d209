package io.blogapi.server.spi;

import java.util.Objects;

/**
 * Outcome of checking a bearer token.
 */
public sealed interface AuthResult permits AuthResult.Valid, AuthResult.Invalid {

    /**
     * Token is authentic, unexpired, and names {@code username}.
     */
    record Valid(String username) implements AuthResult {
        public Valid {
            Objects.requireNonNull(username, "username");
        }
    }

    /**
     * Token must be rejected.
     *
     * @param reason short diagnostic, suitable for logs but not for callers
     */
    record Invalid(String reason) implements AuthResult {
        public Invalid {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
