package io.blogapi.server.core;

import io.blogapi.core.BlogApiException;
import io.blogapi.core.Protocol;
import io.blogapi.json.spi.JsonCodec;
import io.blogapi.server.core.dto.ErrorResponse;
import io.blogapi.server.core.handlers.AuthHandler;
import io.blogapi.server.core.handlers.CommentHandler;
import io.blogapi.server.core.handlers.HealthHandler;
import io.blogapi.server.core.handlers.LikeHandler;
import io.blogapi.server.core.handlers.PostHandler;
import io.blogapi.server.spi.BodySizeLimiter;
import io.blogapi.server.spi.CommentStore;
import io.blogapi.server.spi.LikeStore;
import io.blogapi.server.spi.PostStore;
import io.blogapi.server.spi.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Framework-neutral HTTP handler implementing the Blog API.
 *
 * <p>Authentication is delegated to {@link AuthService}; persistence to {@link PostStore},
 * {@link LikeStore} and {@link CommentStore}. Every mutating endpoint authenticates first, then
 * resolves the target and checks ownership, and only then mutates, so a rejected request never
 * changes state.
 *
 * <p>Use {@link #builder(AuthService, PostStore, LikeStore, CommentStore)} to create instances:
 * <pre>{@code
 * BlogApiHandler handler = BlogApiHandler.builder(auth, posts, likes, comments)
 *     .maxBodySize(1024 * 1024)
 *     .allowedOrigin("https://blog.example.com")
 *     .rateLimiter(new TokenBucketRateLimiter())
 *     .build();
 * }</pre>
 */
public final class BlogApiHandler {

    private static final Logger LOG = LoggerFactory.getLogger(BlogApiHandler.class);

    /** Default request body limit: 1 MB. */
    public static final long DEFAULT_MAX_BODY_SIZE = 1024 * 1024;

    /** Allows cross-origin requests from any origin. */
    public static final String ANY_ORIGIN = "*";

    private static final String ALLOWED_HEADERS = "Authorization, Content-Type";

    private final Router router = new Router();
    private final JsonCodec json;
    private final RateLimiter rateLimiter;
    private final String allowedOrigin;

    /**
     * Creates a new builder for configuring a handler.
     */
    public static Builder builder(AuthService auth, PostStore posts, LikeStore likes, CommentStore comments) {
        return new Builder(auth, posts, likes, comments);
    }

    private BlogApiHandler(Builder builder) {
        this.json = builder.jsonCodec != null ? builder.jsonCodec : ServiceLoaderJsonCodecs.load();
        this.rateLimiter = builder.rateLimiter != null ? builder.rateLimiter : RateLimiter.permitAll();
        this.allowedOrigin = builder.allowedOrigin != null ? builder.allowedOrigin : ANY_ORIGIN;
        long maxBodySize = builder.maxBodySize > 0 ? builder.maxBodySize : DEFAULT_MAX_BODY_SIZE;

        ApiSupport api = new ApiSupport(json, builder.auth, builder.clock, maxBodySize);
        AuthHandler auth = new AuthHandler(api);
        PostHandler posts = new PostHandler(api, builder.posts);
        LikeHandler likes = new LikeHandler(api, builder.likes);
        CommentHandler comments = new CommentHandler(api, builder.comments);
        HealthHandler health = new HealthHandler(api);

        router.add(HttpMethod.POST, Protocol.PATH_REGISTER, auth::register)
                .add(HttpMethod.POST, Protocol.PATH_LOGIN, auth::login)
                .add(HttpMethod.POST, Protocol.PATH_POSTS, posts::create)
                .add(HttpMethod.GET, Protocol.PATH_POSTS, posts::list)
                .add(HttpMethod.GET, Protocol.PATH_POST, posts::get)
                .add(HttpMethod.PUT, Protocol.PATH_POST, posts::update)
                .add(HttpMethod.DELETE, Protocol.PATH_POST, posts::delete)
                .add(HttpMethod.POST, Protocol.PATH_POST_LIKE, likes::like)
                .add(HttpMethod.DELETE, Protocol.PATH_POST_LIKE, likes::unlike)
                .add(HttpMethod.POST, Protocol.PATH_POST_COMMENT, comments::add)
                .add(HttpMethod.GET, Protocol.PATH_POST_COMMENTS, comments::list)
                .add(HttpMethod.GET, Protocol.PATH_HEALTH, health::health);
    }

    /**
     * Builder for {@link BlogApiHandler}.
     */
    public static final class Builder {
        private final AuthService auth;
        private final PostStore posts;
        private final LikeStore likes;
        private final CommentStore comments;
        private JsonCodec jsonCodec;
        private RateLimiter rateLimiter;
        private Clock clock = Clock.systemUTC();
        private long maxBodySize;
        private String allowedOrigin;

        private Builder(AuthService auth, PostStore posts, LikeStore likes, CommentStore comments) {
            this.auth = Objects.requireNonNull(auth, "auth");
            this.posts = Objects.requireNonNull(posts, "posts");
            this.likes = Objects.requireNonNull(likes, "likes");
            this.comments = Objects.requireNonNull(comments, "comments");
        }

        /** Sets the JSON codec. Default: the first codec found by {@link ServiceLoaderJsonCodecs}. */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /**
         * Sets the rate limiter. Default: {@link RateLimiter#permitAll()} (disabled).
         */
        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        /** Sets the clock used for health timestamps. Default: system UTC. */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Sets the maximum request body size in bytes. Default: {@link BlogApiHandler#DEFAULT_MAX_BODY_SIZE}.
         * Use {@link BodySizeLimiter#UNLIMITED} to disable limiting.
         */
        public Builder maxBodySize(long maxBodySize) {
            this.maxBodySize = maxBodySize;
            return this;
        }

        /** Sets the {@code Access-Control-Allow-Origin} value. Default: {@value BlogApiHandler#ANY_ORIGIN}. */
        public Builder allowedOrigin(String allowedOrigin) {
            this.allowedOrigin = allowedOrigin;
            return this;
        }

        /** Builds the handler with the configured settings. */
        public BlogApiHandler build() {
            return new BlogApiHandler(this);
        }
    }

    public ServerResponse handle(ServerRequest req) {
        return handle(req, null);
    }

    /**
     * Handle a request with optional client identifier for rate limiting.
     *
     * @param req the incoming request
     * @param clientId optional client identifier (e.g., IP address) for rate limiting
     * @return the response
     */
    public ServerResponse handle(ServerRequest req, String clientId) {
        return withCors(dispatch(req, clientId));
    }

    private ServerResponse dispatch(ServerRequest req, String clientId) {
        String path = req.path();
        try {
            RateLimiter.Result rateResult = rateLimiter.tryAcquire(path, clientId);
            if (rateResult instanceof RateLimiter.Result.Rejected rejected) {
                ServerResponse resp = message(429, "Too many requests");
                rejected.retryAfter().ifPresent(d ->
                        resp.header(Protocol.H_RETRY_AFTER, Long.toString(d.getSeconds())));
                return resp;
            }

            if (req.method() == HttpMethod.OPTIONS && router.knows(path)) {
                return preflight(path);
            }

            Router.Match match = router.match(req.method(), path);
            if (match instanceof Router.Match.Found found) {
                return found.route().handle(req, found.params());
            }
            if (match instanceof Router.Match.MethodNotAllowed notAllowed) {
                return message(405, "Method Not Allowed").header(Protocol.H_ALLOW, allowHeader(notAllowed.allowed()));
            }
            return message(404, "Not Found");
        } catch (BlogApiException.ValidationError ve) {
            return error(ve.status(), new ErrorResponse.Fields(ve.errors()));
        } catch (BlogApiException.AuthenticationError ae) {
            return message(ae.status(), ae.getMessage()).header(Protocol.H_WWW_AUTHENTICATE, Protocol.SCHEME_BEARER);
        } catch (BlogApiException be) {
            return message(be.status(), be.getMessage());
        } catch (BodySizeLimiter.PayloadTooLargeException ptle) {
            return message(413, ptle.getMessage());
        } catch (Exception e) {
            LOG.error("Unhandled error for {} {}", req.method(), path, e);
            return message(500, "Internal server error");
        }
    }

    private ServerResponse preflight(String path) {
        Set<HttpMethod> allowed = new TreeSet<>();
        for (HttpMethod m : HttpMethod.values()) {
            if (router.match(m, path) instanceof Router.Match.Found) allowed.add(m);
        }
        allowed.add(HttpMethod.OPTIONS);
        return ServerResponse.noContent(204)
                .header(Protocol.H_ACCESS_CONTROL_ALLOW_METHODS, allowHeader(allowed))
                .header(Protocol.H_ACCESS_CONTROL_ALLOW_HEADERS, ALLOWED_HEADERS);
    }

    private ServerResponse withCors(ServerResponse resp) {
        resp.header(Protocol.H_ACCESS_CONTROL_ALLOW_ORIGIN, allowedOrigin);
        if (!ANY_ORIGIN.equals(allowedOrigin)) {
            resp.header(Protocol.H_ACCESS_CONTROL_ALLOW_CREDENTIALS, "true");
        }
        return resp;
    }

    private ServerResponse message(int status, String detail) {
        return error(status, new ErrorResponse.Message(detail));
    }

    private ServerResponse error(int status, Object body) {
        byte[] bytes;
        try {
            bytes = json.writeBytes(body);
        } catch (Exception e) {
            LOG.error("Failed to encode error body", e);
            bytes = "{\"detail\":\"Internal server error\"}".getBytes(StandardCharsets.UTF_8);
        }
        return ServerResponse.json(status, bytes);
    }

    private static String allowHeader(Set<HttpMethod> methods) {
        return methods.stream().map(Enum::name).collect(Collectors.joining(", "));
    }
}
