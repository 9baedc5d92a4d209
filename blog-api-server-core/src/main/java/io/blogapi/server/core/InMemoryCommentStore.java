package io.blogapi.server.core;

import io.blogapi.server.spi.Comment;
import io.blogapi.server.spi.CommentOutcome;
import io.blogapi.server.spi.CommentStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory {@link CommentStore}. See {@link InMemoryBlogState} for the locking model.
 */
public final class InMemoryCommentStore implements CommentStore {

    private final InMemoryBlogState state;

    public InMemoryCommentStore(InMemoryBlogState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    @Override
    public CommentOutcome add(long postId, String content, String author) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(author, "author");
        return state.write(() -> {
            if (!state.posts.containsKey(postId)) return new CommentOutcome(CommentOutcome.Status.NOT_FOUND, null);

            Comment comment = new Comment(state.commentIds.next(), content, author, postId, state.clock.instant());
            state.comments.computeIfAbsent(postId, k -> new ArrayList<>()).add(comment);
            return new CommentOutcome(CommentOutcome.Status.ADDED, comment);
        });
    }

    @Override
    public Optional<List<Comment>> listFor(long postId) {
        return state.read(() -> {
            if (!state.posts.containsKey(postId)) return Optional.empty();
            List<Comment> list = state.comments.get(postId);
            return Optional.of(list == null ? List.of() : List.copyOf(list));
        });
    }

    @Override
    public int count(long postId) {
        return state.read(() -> {
            List<Comment> list = state.comments.get(postId);
            return list == null ? 0 : list.size();
        });
    }
}
