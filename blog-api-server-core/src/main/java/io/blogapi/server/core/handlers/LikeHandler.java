package io.blogapi.server.core.handlers;

import io.blogapi.core.BlogApiException;
import io.blogapi.server.core.ApiSupport;
import io.blogapi.server.core.PathParams;
import io.blogapi.server.core.ServerRequest;
import io.blogapi.server.core.ServerResponse;
import io.blogapi.server.core.dto.LikeResponse;
import io.blogapi.server.spi.LikeOutcome;
import io.blogapi.server.spi.LikeStore;

import java.util.Objects;

/**
 * {@code POST} and {@code DELETE /api/posts/{id}/like}.
 */
public final class LikeHandler {
    private final ApiSupport api;
    private final LikeStore likes;

    public LikeHandler(ApiSupport api, LikeStore likes) {
        this.api = Objects.requireNonNull(api, "api");
        this.likes = Objects.requireNonNull(likes, "likes");
    }

    public ServerResponse like(ServerRequest request, PathParams params) throws Exception {
        String user = api.authenticate(request);
        long id = api.postId(params);
        return respond(likes.like(id, user));
    }

    public ServerResponse unlike(ServerRequest request, PathParams params) throws Exception {
        String user = api.authenticate(request);
        long id = api.postId(params);
        return respond(likes.unlike(id, user));
    }

    private ServerResponse respond(LikeOutcome out) throws Exception {
        return switch (out.status()) {
            case NOT_FOUND -> throw new BlogApiException.NotFoundError(PostHandler.POST_NOT_FOUND);
            case ALREADY_LIKED -> throw new BlogApiException.ConflictError("You have already liked this post");
            case NOT_LIKED -> throw new BlogApiException.ConflictError("You haven't liked this post");
            case LIKED -> api.ok(new LikeResponse("Post liked successfully", out.likesCount()));
            case UNLIKED -> api.ok(new LikeResponse("Post unliked successfully", out.likesCount()));
        };
    }
}
