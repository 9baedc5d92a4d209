package io.blogapi.server.spi;

/**
 * Salted, deliberately slow one-way password hashing.
 */
public interface PasswordHasher {

    /**
     * Hash a raw password with a fresh salt. Two calls with the same input return different hashes.
     */
    String hash(String rawPassword);

    /**
     * Check a raw password against a hash produced by {@link #hash(String)}.
     */
    boolean matches(String rawPassword, String hash);
}
