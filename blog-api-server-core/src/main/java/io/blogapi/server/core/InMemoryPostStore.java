package io.blogapi.server.core;

import io.blogapi.server.spi.Post;
import io.blogapi.server.spi.PostOutcome;
import io.blogapi.server.spi.PostPatch;
import io.blogapi.server.spi.PostStore;
import io.blogapi.server.spi.PostView;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory {@link PostStore}. See {@link InMemoryBlogState} for the locking model.
 */
public final class InMemoryPostStore implements PostStore {

    private static final Comparator<PostView> NEWEST_FIRST = Comparator
            .comparing((PostView v) -> v.post().createdAt())
            .thenComparingLong(v -> v.post().id())
            .reversed();

    private final InMemoryBlogState state;

    public InMemoryPostStore(InMemoryBlogState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    @Override
    public Post create(String title, String content, String author) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(author, "author");
        return state.write(() -> {
            Instant now = state.clock.instant();
            Post post = new Post(state.postIds.next(), title, content, author, now, now);
            state.insert(post);
            return post;
        });
    }

    @Override
    public Optional<PostView> get(long id) {
        return state.read(() -> Optional.ofNullable(state.posts.get(id)).map(state::view));
    }

    @Override
    public List<PostView> listAll() {
        List<PostView> all = state.read(() -> {
            List<PostView> views = new ArrayList<>(state.posts.size());
            for (Post post : state.posts.values()) {
                views.add(state.view(post));
            }
            return views;
        });
        all.sort(NEWEST_FIRST);
        return List.copyOf(all);
    }

    @Override
    public PostOutcome update(long id, PostPatch patch, String requester) {
        Objects.requireNonNull(patch, "patch");
        return state.write(() -> {
            Post post = state.posts.get(id);
            if (post == null) return PostOutcome.notFound();
            if (!post.author().equals(requester)) return PostOutcome.forbidden();

            Post updated = post.apply(patch, state.clock.instant());
            state.posts.put(id, updated);
            return PostOutcome.ok(state.view(updated));
        });
    }

    @Override
    public PostOutcome delete(long id, String requester) {
        return state.write(() -> {
            Post post = state.posts.get(id);
            if (post == null) return PostOutcome.notFound();
            if (!post.author().equals(requester)) return PostOutcome.forbidden();

            PostView removed = state.view(post);
            state.cascadeDelete(id);
            return PostOutcome.ok(removed);
        });
    }
}
