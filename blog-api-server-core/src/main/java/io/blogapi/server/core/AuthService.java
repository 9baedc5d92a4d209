package io.blogapi.server.core;

import io.blogapi.core.BlogApiException;
import io.blogapi.server.spi.AuthResult;
import io.blogapi.server.spi.CredentialStore;
import io.blogapi.server.spi.IssuedToken;
import io.blogapi.server.spi.RegisterOutcome;
import io.blogapi.server.spi.TokenService;
import io.blogapi.server.spi.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Registration, login, and bearer-token authentication on top of a {@link CredentialStore} and a
 * {@link TokenService}.
 */
public final class AuthService {

    private static final Logger LOG = LoggerFactory.getLogger(AuthService.class);

    static final String BAD_CREDENTIALS = "Incorrect username or password";
    static final String USERNAME_TAKEN = "Username already registered";

    private final CredentialStore credentials;
    private final TokenService tokens;

    public AuthService(CredentialStore credentials, TokenService tokens) {
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
    }

    /**
     * @throws BlogApiException.ConflictError if the username is taken
     */
    public User register(String username, String email, String rawPassword) {
        RegisterOutcome out = credentials.register(username, email, rawPassword);
        if (out.status() == RegisterOutcome.Status.USERNAME_TAKEN) {
            throw new BlogApiException.ConflictError(USERNAME_TAKEN);
        }
        LOG.info("Registered user {}", username);
        return out.user();
    }

    /**
     * Verify credentials and issue a token with the default lifetime.
     *
     * @throws BlogApiException.AuthenticationError with the same message for unknown users and wrong passwords
     */
    public IssuedToken login(String username, String rawPassword) {
        if (!credentials.verify(username, rawPassword)) {
            LOG.debug("Rejected login for {}", username);
            throw new BlogApiException.AuthenticationError(BAD_CREDENTIALS);
        }
        return tokens.issue(username);
    }

    public IssuedToken issueToken(String username, Duration ttl) {
        return tokens.issue(username, ttl);
    }

    /**
     * Valid only if the token verifies and its subject is still a registered user.
     */
    public AuthResult authenticate(String token) {
        AuthResult result = tokens.verify(token);
        if (result instanceof AuthResult.Valid valid && !credentials.exists(valid.username())) {
            return new AuthResult.Invalid("unknown subject");
        }
        return result;
    }
}
