package io.blogapi.server.core.handlers;

import io.blogapi.core.BlogApiException;
import io.blogapi.server.core.ApiSupport;
import io.blogapi.server.core.PathParams;
import io.blogapi.server.core.RequestValidation;
import io.blogapi.server.core.ServerRequest;
import io.blogapi.server.core.ServerResponse;
import io.blogapi.server.core.dto.CommentRequest;
import io.blogapi.server.core.dto.CommentResponse;
import io.blogapi.server.spi.Comment;
import io.blogapi.server.spi.CommentOutcome;
import io.blogapi.server.spi.CommentStore;

import java.util.List;
import java.util.Objects;

/**
 * {@code POST /api/posts/{id}/comment} and {@code GET /api/posts/{id}/comments}.
 */
public final class CommentHandler {

    static final int MAX_CONTENT_LENGTH = 1000;

    private final ApiSupport api;
    private final CommentStore comments;

    public CommentHandler(ApiSupport api, CommentStore comments) {
        this.api = Objects.requireNonNull(api, "api");
        this.comments = Objects.requireNonNull(comments, "comments");
    }

    public ServerResponse add(ServerRequest request, PathParams params) throws Exception {
        String user = api.authenticate(request);
        long id = api.postId(params);
        CommentRequest body = api.readBody(request, CommentRequest.class);
        RequestValidation.start()
                .required("content", body.content())
                .length("content", body.content(), 1, MAX_CONTENT_LENGTH)
                .check();

        CommentOutcome out = comments.add(id, body.content(), user);
        if (out.status() == CommentOutcome.Status.NOT_FOUND) {
            throw new BlogApiException.NotFoundError(PostHandler.POST_NOT_FOUND);
        }
        return api.ok(CommentResponse.of(out.comment()));
    }

    public ServerResponse list(ServerRequest request, PathParams params) throws Exception {
        long id = api.postId(params);
        List<Comment> list = comments.listFor(id)
                .orElseThrow(() -> new BlogApiException.NotFoundError(PostHandler.POST_NOT_FOUND));
        return api.ok(list.stream().map(CommentResponse::of).toList());
    }
}
