package io.blogapi.server.core.dto;

import io.blogapi.server.spi.Post;
import io.blogapi.server.spi.PostView;

import java.time.Instant;

/**
 * A post composed with its like and comment counts.
 */
public record PostResponse(
        long id,
        String title,
        String content,
        String author,
        Instant createdAt,
        Instant updatedAt,
        int likesCount,
        int commentsCount
) {
    public static PostResponse of(PostView view) {
        Post post = view.post();
        return new PostResponse(
                post.id(),
                post.title(),
                post.content(),
                post.author(),
                post.createdAt(),
                post.updatedAt(),
                view.likesCount(),
                view.commentsCount()
        );
    }
}
