package io.blogapi.server.spi;

import java.util.Objects;

/**
 * Result of adding a comment.
 */
public final class CommentOutcome {

    public enum Status {
        ADDED,
        NOT_FOUND
    }

    private final Status status;
    private final Comment comment;

    public CommentOutcome(Status status, Comment comment) {
        this.status = Objects.requireNonNull(status, "status");
        this.comment = comment;
    }

    public Status status() {
        return status;
    }

    public Comment comment() {
        return comment;
    }
}
