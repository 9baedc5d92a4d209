package io.blogapi.server.spi;

/**
 * Holds, per post, the set of usernames that liked it.
 */
public interface LikeStore {

    LikeOutcome like(long postId, String username);

    LikeOutcome unlike(long postId, String username);

    /**
     * Number of likes; 0 when the post has none or does not exist.
     */
    int count(long postId);
}
