package io.blogapi.server.spi;

import java.util.List;
import java.util.Optional;

/**
 * Holds posts keyed by a strictly increasing id.
 */
public interface PostStore {

    /**
     * Create a post with the next id; {@code createdAt} and {@code updatedAt} are both set to now.
     */
    Post create(String title, String content, String author);

    /**
     * The post with its current like and comment counts, read atomically.
     */
    Optional<PostView> get(long id);

    /**
     * All posts with their counts, newest first. Posts created at the same instant are ordered by id
     * descending. The whole list is one consistent snapshot.
     */
    List<PostView> listAll();

    /**
     * Apply a partial update if {@code requester} is the author. {@code updatedAt} is refreshed even when
     * the patch changes nothing.
     */
    PostOutcome update(long id, PostPatch patch, String requester);

    /**
     * Delete a post if {@code requester} is the author, together with its likes and comments.
     * The cascade is atomic: no reader observes the post without its likes or comments or vice versa.
     */
    PostOutcome delete(long id, String requester);
}
