package io.blogapi.server.spi;

import java.util.List;
import java.util.Optional;

/**
 * Holds, per post, an append-only sequence of comments.
 */
public interface CommentStore {

    /**
     * Append a comment with the next global comment id.
     */
    CommentOutcome add(long postId, String content, String author);

    /**
     * Comments of a post, oldest first; empty when the post does not exist.
     */
    Optional<List<Comment>> listFor(long postId);

    /**
     * Number of comments; 0 when the post has none or does not exist.
     */
    int count(long postId);
}
