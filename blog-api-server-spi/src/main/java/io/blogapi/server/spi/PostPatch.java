package io.blogapi.server.spi;

import java.util.Optional;

/**
 * Partial post update. Absent fields keep their current value.
 */
public final class PostPatch {
    private final Optional<String> title;
    private final Optional<String> content;

    public PostPatch(String title, String content) {
        this.title = Optional.ofNullable(title);
        this.content = Optional.ofNullable(content);
    }

    public Optional<String> title() {
        return title;
    }

    public Optional<String> content() {
        return content;
    }
}
