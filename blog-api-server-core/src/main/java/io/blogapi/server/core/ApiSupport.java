package io.blogapi.server.core;

import io.blogapi.core.BlogApiException;
import io.blogapi.core.Headers;
import io.blogapi.core.Protocol;
import io.blogapi.json.spi.JsonCodec;
import io.blogapi.json.spi.JsonException;
import io.blogapi.server.spi.AuthResult;
import io.blogapi.server.spi.BodySizeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Request plumbing shared by the endpoint handlers: body decoding, bearer authentication, path ids
 * and JSON responses.
 */
public final class ApiSupport {

    private static final Logger LOG = LoggerFactory.getLogger(ApiSupport.class);

    static final String NOT_AUTHENTICATED = "Not authenticated";
    static final String INVALID_CREDENTIALS = "Could not validate credentials";

    private final JsonCodec json;
    private final AuthService auth;
    private final Clock clock;
    private final long maxBodySize;

    ApiSupport(JsonCodec json, AuthService auth, Clock clock, long maxBodySize) {
        this.json = Objects.requireNonNull(json, "json");
        this.auth = Objects.requireNonNull(auth, "auth");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxBodySize = maxBodySize;
    }

    public AuthService auth() {
        return auth;
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Decode the JSON body.
     *
     * @throws BlogApiException.ValidationError if the body is missing or not valid JSON for {@code type}
     * @throws BodySizeLimiter.PayloadTooLargeException if the body exceeds the configured limit
     */
    public <T> T readBody(ServerRequest request, Class<T> type) throws IOException {
        byte[] bytes = BodySizeLimiter.readAll(request.body(), maxBodySize);
        if (bytes.length == 0) throw new BlogApiException.ValidationError("body", "Field required");
        T value;
        try {
            value = json.readValue(bytes, type);
        } catch (JsonException e) {
            LOG.debug("Rejected request body: {}", e.getMessage());
            throw new BlogApiException.ValidationError("body", "Invalid JSON body");
        }
        if (value == null) throw new BlogApiException.ValidationError("body", "Field required");
        return value;
    }

    /**
     * Resolve the caller from the {@code Authorization: Bearer} header.
     *
     * @return the authenticated username
     * @throws BlogApiException.AuthenticationError if the header is missing or the token is not valid
     */
    public String authenticate(ServerRequest request) {
        Optional<String> token = Headers.bearerToken(request.headers());
        if (token.isEmpty()) throw new BlogApiException.AuthenticationError(NOT_AUTHENTICATED);

        AuthResult result = auth.authenticate(token.get());
        if (result instanceof AuthResult.Valid valid) {
            return valid.username();
        }
        LOG.debug("Rejected bearer token: {}", ((AuthResult.Invalid) result).reason());
        throw new BlogApiException.AuthenticationError(INVALID_CREDENTIALS);
    }

    /**
     * @throws BlogApiException.ValidationError if the {@code id} segment is not an integer
     */
    public long postId(PathParams params) {
        String raw = params.get(Protocol.P_ID);
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new BlogApiException.ValidationError(Protocol.P_ID, "Input should be a valid integer");
        }
    }

    public ServerResponse json(int status, Object body) throws JsonException {
        return ServerResponse.json(status, json.writeBytes(body));
    }

    public ServerResponse ok(Object body) throws JsonException {
        return json(200, body);
    }
}
