package io.blogapi.server.spi;

/**
 * Holds registered users and their password hashes.
 *
 * <p>Implementations must be safe for concurrent use: two racing registrations of the same username
 * yield exactly one {@link RegisterOutcome.Status#CREATED}.
 */
public interface CredentialStore {

    /**
     * Register a new user. The raw password is hashed before it is stored.
     *
     * @param username unique username (exact match)
     * @param email contact address
     * @param rawPassword plaintext password, never retained
     */
    RegisterOutcome register(String username, String email, String rawPassword);

    /**
     * Check a password against the stored hash.
     *
     * @return false for unknown users and wrong passwords alike
     */
    boolean verify(String username, String rawPassword);

    /**
     * True if {@code username} is registered (exact match).
     */
    boolean exists(String username);
}
