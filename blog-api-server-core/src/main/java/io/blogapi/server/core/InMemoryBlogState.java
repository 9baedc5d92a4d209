package io.blogapi.server.core;

import io.blogapi.server.spi.Comment;
import io.blogapi.server.spi.IdSequence;
import io.blogapi.server.spi.Post;
import io.blogapi.server.spi.PostView;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Shared state behind {@link InMemoryPostStore}, {@link InMemoryLikeStore} and {@link InMemoryCommentStore}.
 *
 * <p>One read/write lock guards posts, like-sets and comment sequences together, so that existence
 * checks, ownership checks and the delete cascade happen atomically across all three. Readers get
 * immutable snapshots.
 *
 * <pre>{@code
 * InMemoryBlogState state = new InMemoryBlogState();
 * PostStore posts = new InMemoryPostStore(state);
 * LikeStore likes = new InMemoryLikeStore(state);
 * CommentStore comments = new InMemoryCommentStore(state);
 * }</pre>
 */
public final class InMemoryBlogState {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // guarded by lock
    final Map<Long, Post> posts = new HashMap<>();
    final Map<Long, Set<String>> likes = new HashMap<>();
    final Map<Long, List<Comment>> comments = new HashMap<>();

    final IdSequence postIds;
    final IdSequence commentIds;
    final Clock clock;

    public InMemoryBlogState() {
        this(Clock.systemUTC());
    }

    public InMemoryBlogState(Clock clock) {
        this(new AtomicIdSequence(), new AtomicIdSequence(), clock);
    }

    public InMemoryBlogState(IdSequence postIds, IdSequence commentIds, Clock clock) {
        this.postIds = Objects.requireNonNull(postIds, "postIds");
        this.commentIds = Objects.requireNonNull(commentIds, "commentIds");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // callers hold the write lock
    void insert(Post post) {
        posts.put(post.id(), post);
        likes.put(post.id(), new LinkedHashSet<>());
        comments.put(post.id(), new ArrayList<>());
    }

    // callers hold the read or write lock
    PostView view(Post post) {
        Set<String> set = likes.get(post.id());
        List<Comment> list = comments.get(post.id());
        return new PostView(post, set == null ? 0 : set.size(), list == null ? 0 : list.size());
    }

    // callers hold the write lock
    void cascadeDelete(long postId) {
        comments.remove(postId);
        likes.remove(postId);
        posts.remove(postId);
    }
}
