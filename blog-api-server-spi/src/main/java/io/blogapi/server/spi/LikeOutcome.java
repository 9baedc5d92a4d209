package io.blogapi.server.spi;

import java.util.Objects;

/**
 * Result of a like or unlike.
 */
public final class LikeOutcome {

    public enum Status {
        LIKED,
        UNLIKED,
        NOT_FOUND,
        ALREADY_LIKED,
        NOT_LIKED
    }

    private final Status status;
    private final int likesCount;

    public LikeOutcome(Status status, int likesCount) {
        this.status = Objects.requireNonNull(status, "status");
        this.likesCount = likesCount;
    }

    public Status status() {
        return status;
    }

    /**
     * Size of the like-set after the operation; 0 when the post was not found.
     */
    public int likesCount() {
        return likesCount;
    }
}
