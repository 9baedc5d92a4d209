package io.blogapi.server.spi;

import java.time.Duration;

/**
 * Issues and verifies stateless signed bearer tokens.
 *
 * <p>Verification only checks the signature, the expiry and the presence of a subject. Whether the
 * subject still exists is decided by the caller.
 */
public interface TokenService {

    /**
     * Issue a token for {@code username} with the configured default lifetime.
     */
    IssuedToken issue(String username);

    /**
     * Issue a token for {@code username} that expires after {@code ttl}.
     */
    IssuedToken issue(String username, Duration ttl);

    /**
     * Verify a token and extract its subject. Never throws for bad tokens.
     */
    AuthResult verify(String token);
}
