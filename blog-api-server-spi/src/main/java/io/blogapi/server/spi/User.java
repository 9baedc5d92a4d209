package io.blogapi.server.spi;

import java.util.Objects;

/**
 * Registered account. Never updated or deleted.
 *
 * @param username unique identifier, compared by exact string match
 * @param email contact address as supplied at registration
 * @param passwordHash output of a {@link PasswordHasher}; never the raw password
 */
public record User(String username, String email, String passwordHash) {
    public User {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(passwordHash, "passwordHash");
    }

    @Override
    public String toString() {
        return "User[username=" + username + ", email=" + email + "]";
    }
}
