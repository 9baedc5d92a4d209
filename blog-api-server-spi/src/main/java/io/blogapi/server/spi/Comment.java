package io.blogapi.server.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable comment on a post. Ids come from one counter shared by all posts.
 */
public record Comment(long id, String content, String author, long postId, Instant createdAt) {
    public Comment {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
