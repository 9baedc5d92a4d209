package io.blogapi.server.spi;

import java.util.Objects;

/**
 * A post together with its like and comment counts, all read at the same instant.
 */
public record PostView(Post post, int likesCount, int commentsCount) {
    public PostView {
        Objects.requireNonNull(post, "post");
    }
}
