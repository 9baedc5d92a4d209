package io.blogapi.server.spi;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class PostTest {

    private final Instant created = Instant.parse("2024-01-01T10:00:00Z");
    private final Post post = new Post(1, "hello", "world", "alice", created, created);

    @Test
    void applyOverwritesOnlyPresentFields() {
        Instant later = created.plusSeconds(60);

        Post updated = post.apply(new PostPatch("new title", null), later);

        assertThat(updated.title()).isEqualTo("new title");
        assertThat(updated.content()).isEqualTo("world");
        assertThat(updated.author()).isEqualTo("alice");
        assertThat(updated.createdAt()).isEqualTo(created);
        assertThat(updated.updatedAt()).isEqualTo(later);
    }

    @Test
    void emptyPatchStillRefreshesUpdatedAt() {
        Instant later = created.plusSeconds(5);

        Post updated = post.apply(new PostPatch(null, null), later);

        assertThat(updated.title()).isEqualTo("hello");
        assertThat(updated.content()).isEqualTo("world");
        assertThat(updated.updatedAt()).isEqualTo(later);
    }

    @Test
    void userToStringHidesPasswordHash() {
        User user = new User("alice", "a@x.com", "$2a$10$secret");
        assertThat(user.toString()).doesNotContain("secret");
    }
}
