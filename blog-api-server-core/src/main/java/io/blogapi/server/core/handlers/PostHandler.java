package io.blogapi.server.core.handlers;

import io.blogapi.core.BlogApiException;
import io.blogapi.server.core.ApiSupport;
import io.blogapi.server.core.PathParams;
import io.blogapi.server.core.RequestValidation;
import io.blogapi.server.core.ServerRequest;
import io.blogapi.server.core.ServerResponse;
import io.blogapi.server.core.dto.MessageResponse;
import io.blogapi.server.core.dto.PostRequest;
import io.blogapi.server.core.dto.PostResponse;
import io.blogapi.server.spi.Post;
import io.blogapi.server.spi.PostOutcome;
import io.blogapi.server.spi.PostPatch;
import io.blogapi.server.spi.PostStore;
import io.blogapi.server.spi.PostView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Post CRUD under {@code /api/posts}. Every post in a response carries its like and comment counts.
 */
public final class PostHandler {

    private static final Logger LOG = LoggerFactory.getLogger(PostHandler.class);

    static final String POST_NOT_FOUND = "Post not found";
    static final int MAX_TITLE_LENGTH = 200;

    private final ApiSupport api;
    private final PostStore posts;

    public PostHandler(ApiSupport api, PostStore posts) {
        this.api = Objects.requireNonNull(api, "api");
        this.posts = Objects.requireNonNull(posts, "posts");
    }

    public ServerResponse create(ServerRequest request, PathParams params) throws Exception {
        String user = api.authenticate(request);
        PostRequest body = api.readBody(request, PostRequest.class);
        RequestValidation.start()
                .required("title", body.title())
                .length("title", body.title(), 1, MAX_TITLE_LENGTH)
                .required("content", body.content())
                .length("content", body.content(), 1, RequestValidation.NO_MAX)
                .check();

        Post post = posts.create(body.title(), body.content(), user);
        return api.ok(PostResponse.of(new PostView(post, 0, 0)));
    }

    public ServerResponse list(ServerRequest request, PathParams params) throws Exception {
        List<PostResponse> out = posts.listAll().stream()
                .map(PostResponse::of)
                .toList();
        return api.ok(out);
    }

    public ServerResponse get(ServerRequest request, PathParams params) throws Exception {
        long id = api.postId(params);
        PostView view = posts.get(id).orElseThrow(() -> new BlogApiException.NotFoundError(POST_NOT_FOUND));
        return api.ok(PostResponse.of(view));
    }

    public ServerResponse update(ServerRequest request, PathParams params) throws Exception {
        String user = api.authenticate(request);
        long id = api.postId(params);
        PostRequest body = api.readBody(request, PostRequest.class);
        RequestValidation.start()
                .length("title", body.title(), 1, MAX_TITLE_LENGTH)
                .length("content", body.content(), 1, RequestValidation.NO_MAX)
                .check();

        PostOutcome out = posts.update(id, new PostPatch(body.title(), body.content()), user);
        return switch (out.status()) {
            case NOT_FOUND -> throw new BlogApiException.NotFoundError(POST_NOT_FOUND);
            case FORBIDDEN -> throw new BlogApiException.AuthorizationError("Not authorized to update this post");
            case OK -> api.ok(PostResponse.of(out.view()));
        };
    }

    public ServerResponse delete(ServerRequest request, PathParams params) throws Exception {
        String user = api.authenticate(request);
        long id = api.postId(params);

        PostOutcome out = posts.delete(id, user);
        return switch (out.status()) {
            case NOT_FOUND -> throw new BlogApiException.NotFoundError(POST_NOT_FOUND);
            case FORBIDDEN -> throw new BlogApiException.AuthorizationError("Not authorized to delete this post");
            case OK -> {
                LOG.info("Post {} deleted by {}", id, user);
                yield api.ok(new MessageResponse("Post deleted successfully"));
            }
        };
    }
}
