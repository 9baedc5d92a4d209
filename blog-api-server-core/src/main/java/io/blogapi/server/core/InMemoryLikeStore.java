package io.blogapi.server.core;

import io.blogapi.server.spi.LikeOutcome;
import io.blogapi.server.spi.LikeStore;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory {@link LikeStore}. See {@link InMemoryBlogState} for the locking model.
 */
public final class InMemoryLikeStore implements LikeStore {

    private final InMemoryBlogState state;

    public InMemoryLikeStore(InMemoryBlogState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    @Override
    public LikeOutcome like(long postId, String username) {
        Objects.requireNonNull(username, "username");
        return state.write(() -> {
            if (!state.posts.containsKey(postId)) return new LikeOutcome(LikeOutcome.Status.NOT_FOUND, 0);

            Set<String> set = state.likes.computeIfAbsent(postId, k -> new LinkedHashSet<>());
            if (!set.add(username)) return new LikeOutcome(LikeOutcome.Status.ALREADY_LIKED, set.size());
            return new LikeOutcome(LikeOutcome.Status.LIKED, set.size());
        });
    }

    @Override
    public LikeOutcome unlike(long postId, String username) {
        Objects.requireNonNull(username, "username");
        return state.write(() -> {
            if (!state.posts.containsKey(postId)) return new LikeOutcome(LikeOutcome.Status.NOT_FOUND, 0);

            Set<String> set = state.likes.get(postId);
            if (set == null || !set.remove(username)) {
                return new LikeOutcome(LikeOutcome.Status.NOT_LIKED, set == null ? 0 : set.size());
            }
            return new LikeOutcome(LikeOutcome.Status.UNLIKED, set.size());
        });
    }

    @Override
    public int count(long postId) {
        return state.read(() -> {
            Set<String> set = state.likes.get(postId);
            return set == null ? 0 : set.size();
        });
    }
}
