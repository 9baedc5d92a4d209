package io.blogapi.server.core;

import io.blogapi.server.spi.CredentialStore;
import io.blogapi.server.spi.PasswordHasher;
import io.blogapi.server.spi.RegisterOutcome;
import io.blogapi.server.spi.User;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link CredentialStore} backed by a {@link ConcurrentHashMap}.
 *
 * <p>Unknown usernames are still checked against a dummy hash so that a failed login costs the same
 * whether or not the account exists.
 */
public final class InMemoryCredentialStore implements CredentialStore {

    private final ConcurrentHashMap<String, User> users = new ConcurrentHashMap<>();
    private final PasswordHasher hasher;
    private final String dummyHash;

    public InMemoryCredentialStore(PasswordHasher hasher) {
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.dummyHash = hasher.hash("not-a-real-password");
    }

    @Override
    public RegisterOutcome register(String username, String email, String rawPassword) {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(rawPassword, "rawPassword");

        if (users.containsKey(username)) return RegisterOutcome.usernameTaken();

        User user = new User(username, email, hasher.hash(rawPassword));
        User existing = users.putIfAbsent(username, user);
        return existing == null ? RegisterOutcome.created(user) : RegisterOutcome.usernameTaken();
    }

    @Override
    public boolean verify(String username, String rawPassword) {
        User user = username == null ? null : users.get(username);
        if (user == null) {
            hasher.matches(rawPassword, dummyHash);
            return false;
        }
        return hasher.matches(rawPassword, user.passwordHash());
    }

    @Override
    public boolean exists(String username) {
        return username != null && users.containsKey(username);
    }
}
