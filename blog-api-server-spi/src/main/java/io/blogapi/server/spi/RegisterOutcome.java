package io.blogapi.server.spi;

import java.util.Objects;

/**
 * Result of a registration.
 */
public final class RegisterOutcome {

    public enum Status {
        CREATED,
        USERNAME_TAKEN
    }

    private final Status status;
    private final User user;

    private RegisterOutcome(Status status, User user) {
        this.status = Objects.requireNonNull(status, "status");
        this.user = user;
    }

    public static RegisterOutcome created(User user) {
        return new RegisterOutcome(Status.CREATED, Objects.requireNonNull(user, "user"));
    }

    public static RegisterOutcome usernameTaken() {
        return new RegisterOutcome(Status.USERNAME_TAKEN, null);
    }

    public Status status() {
        return status;
    }

    /**
     * The new user; null unless {@link Status#CREATED}.
     */
    public User user() {
        return user;
    }
}
