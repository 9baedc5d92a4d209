package io.blogapi.server.core;

import io.blogapi.server.spi.AuthResult;
import io.blogapi.server.spi.IssuedToken;
import io.blogapi.server.spi.TokenService;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;

/**
 * HS256 JWT {@link TokenService}.
 *
 * <p>Tokens carry {@code sub}, {@code iat} and {@code exp}. Nothing is stored server-side, so a token
 * stays valid until it expires. A token whose header names any algorithm other than HS256 is rejected,
 * even when its signature checks out under the shared key.
 *
 * <pre>{@code
 * TokenService tokens = JwtTokenService.builder(secret)
 *     .ttl(Duration.ofMinutes(30))
 *     .build();
 * }</pre>
 */
public final class JwtTokenService implements TokenService {

    /** The only signing algorithm this service accepts. */
    public static final String ALGORITHM_HS256 = "HS256";

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

    private final SecretKey key;
    private final Duration ttl;
    private final Clock clock;
    private final JwtParser parser;

    /**
     * Creates a new builder.
     *
     * @param secret shared signing secret, at least 32 bytes of UTF-8
     */
    public static Builder builder(String secret) {
        return new Builder(secret);
    }

    private JwtTokenService(Builder builder) {
        if (!ALGORITHM_HS256.equals(builder.algorithm)) {
            throw new IllegalArgumentException("unsupported signing algorithm: " + builder.algorithm);
        }
        try {
            this.key = Keys.hmacShaKeyFor(builder.secret.getBytes(StandardCharsets.UTF_8));
        } catch (WeakKeyException e) {
            throw new IllegalArgumentException("signing secret must be at least 32 bytes for " + ALGORITHM_HS256, e);
        }
        this.ttl = builder.ttl;
        this.clock = builder.clock;
        this.parser = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Builder for {@link JwtTokenService}.
     */
    public static final class Builder {
        private final String secret;
        private String algorithm = ALGORITHM_HS256;
        private Duration ttl = DEFAULT_TTL;
        private Clock clock = Clock.systemUTC();

        private Builder(String secret) {
            this.secret = Objects.requireNonNull(secret, "secret");
        }

        /** Sets the signing algorithm. Only {@value JwtTokenService#ALGORITHM_HS256} is recognized. */
        public Builder algorithm(String algorithm) {
            this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
            return this;
        }

        /** Sets the default token lifetime. Default: 30 minutes. */
        public Builder ttl(Duration ttl) {
            Objects.requireNonNull(ttl, "ttl");
            if (ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl must be positive");
            this.ttl = ttl;
            return this;
        }

        /** Sets the clock used for issuing and expiry checks. Default: system UTC. */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public JwtTokenService build() {
            return new JwtTokenService(this);
        }
    }

    @Override
    public IssuedToken issue(String username) {
        return issue(username, ttl);
    }

    @Override
    public IssuedToken issue(String username, Duration ttl) {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(ttl, "ttl");
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);

        String value = Jwts.builder()
                .subject(username)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
        return new IssuedToken(value, username, expiresAt);
    }

    @Override
    public AuthResult verify(String token) {
        if (token == null || token.isBlank()) return new AuthResult.Invalid("empty token");
        try {
            Jws<Claims> jws = parser.parseSignedClaims(token);
            if (!ALGORITHM_HS256.equals(jws.getHeader().getAlgorithm())) {
                return new AuthResult.Invalid("unexpected signing algorithm");
            }
            Claims claims = jws.getPayload();
            String subject = claims.getSubject();
            if (subject == null || subject.isEmpty()) return new AuthResult.Invalid("missing subject");
            return new AuthResult.Valid(subject);
        } catch (ExpiredJwtException e) {
            return new AuthResult.Invalid("token expired");
        } catch (JwtException | IllegalArgumentException e) {
            return new AuthResult.Invalid("malformed or forged token");
        }
    }

    public Duration ttl() {
        return ttl;
    }
}
