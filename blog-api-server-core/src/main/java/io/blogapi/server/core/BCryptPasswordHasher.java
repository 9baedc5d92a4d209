package io.blogapi.server.core;

import io.blogapi.server.spi.PasswordHasher;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * BCrypt {@link PasswordHasher}.
 *
 * <p>BCrypt only looks at the first 72 bytes of a password; longer passwords are rejected on
 * {@link #hash(String)} and never match.
 */
public final class BCryptPasswordHasher implements PasswordHasher {

    public static final int DEFAULT_STRENGTH = 10;
    public static final int MAX_PASSWORD_BYTES = 72;

    private final BCryptPasswordEncoder encoder;

    public BCryptPasswordHasher() {
        this(DEFAULT_STRENGTH);
    }

    /**
     * @param strength log2 of the number of rounds, 4 to 31
     */
    public BCryptPasswordHasher(int strength) {
        this.encoder = new BCryptPasswordEncoder(strength);
    }

    @Override
    public String hash(String rawPassword) {
        Objects.requireNonNull(rawPassword, "rawPassword");
        if (tooLong(rawPassword)) {
            throw new IllegalArgumentException("password exceeds " + MAX_PASSWORD_BYTES + " bytes");
        }
        return encoder.encode(rawPassword);
    }

    @Override
    public boolean matches(String rawPassword, String hash) {
        if (rawPassword == null || hash == null) return false;
        if (tooLong(rawPassword)) return false;
        return encoder.matches(rawPassword, hash);
    }

    private static boolean tooLong(String rawPassword) {
        return rawPassword.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }
}
