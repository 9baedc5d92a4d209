package io.blogapi.server.core.dto;

import io.blogapi.server.spi.Comment;

import java.time.Instant;

public record CommentResponse(long id, String content, String author, long postId, Instant createdAt) {
    public static CommentResponse of(Comment comment) {
        return new CommentResponse(comment.id(), comment.content(), comment.author(), comment.postId(), comment.createdAt());
    }
}
