package io.blogapi.server.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a blog post.
 */
public record Post(long id, String title, String content, String author, Instant createdAt, Instant updatedAt) {
    public Post {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    /**
     * Returns a copy with the present fields of {@code patch} applied and {@code updatedAt} set to {@code now}.
     */
    public Post apply(PostPatch patch, Instant now) {
        return new Post(
                id,
                patch.title().orElse(title),
                patch.content().orElse(content),
                author,
                createdAt,
                now
        );
    }
}
