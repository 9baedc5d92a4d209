package io.blogapi.server.spi;

import java.util.Objects;

/**
 * Result of an ownership-checked post mutation (update or delete).
 */
public final class PostOutcome {

    public enum Status {
        OK,
        NOT_FOUND,
        FORBIDDEN
    }

    private final Status status;
    private final PostView view;

    public PostOutcome(Status status, PostView view) {
        this.status = Objects.requireNonNull(status, "status");
        this.view = view;
    }

    public static PostOutcome ok(PostView view) {
        return new PostOutcome(Status.OK, view);
    }

    public static PostOutcome notFound() {
        return new PostOutcome(Status.NOT_FOUND, null);
    }

    public static PostOutcome forbidden() {
        return new PostOutcome(Status.FORBIDDEN, null);
    }

    public Status status() {
        return status;
    }

    /**
     * Updated post for updates, removed post for deletes, with the counts it had at that moment;
     * null unless {@link Status#OK}.
     */
    public PostView view() {
        return view;
    }
}
