package io.blogapi.core;

/**
 * Blog API wire constants (paths, header names, and well-known values).
 *
 * <p>This module intentionally contains no HTTP server bindings and no JSON library dependencies.
 * It only models wire-level concerns shared by the server core and its framework adapters.
 */
public final class Protocol {
    private Protocol() {}

    // Paths
    public static final String API_PREFIX = "/api";
    public static final String PATH_REGISTER = API_PREFIX + "/auth/register";
    public static final String PATH_LOGIN = API_PREFIX + "/auth/login";
    public static final String PATH_POSTS = API_PREFIX + "/posts";
    public static final String PATH_POST = PATH_POSTS + "/{id}";
    public static final String PATH_POST_LIKE = PATH_POST + "/like";
    public static final String PATH_POST_COMMENT = PATH_POST + "/comment";
    public static final String PATH_POST_COMMENTS = PATH_POST + "/comments";
    public static final String PATH_HEALTH = API_PREFIX + "/health";

    // Path parameters
    public static final String P_ID = "id";

    // HTTP headers
    public static final String H_AUTHORIZATION = "Authorization";
    public static final String H_WWW_AUTHENTICATE = "WWW-Authenticate";
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_ALLOW = "Allow";
    public static final String H_RETRY_AFTER = "Retry-After";

    // CORS headers
    public static final String H_ACCESS_CONTROL_ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    public static final String H_ACCESS_CONTROL_ALLOW_METHODS = "Access-Control-Allow-Methods";
    public static final String H_ACCESS_CONTROL_ALLOW_HEADERS = "Access-Control-Allow-Headers";
    public static final String H_ACCESS_CONTROL_ALLOW_CREDENTIALS = "Access-Control-Allow-Credentials";

    // Content types
    public static final String CT_JSON = "application/json";

    /** Authorization scheme carried by every authenticated request. */
    public static final String SCHEME_BEARER = "Bearer";

    /** Value of {@code token_type} in login responses. */
    public static final String TOKEN_TYPE_BEARER = "bearer";

    /** Value of {@code status} in health responses. */
    public static final String STATUS_HEALTHY = "healthy";
}
