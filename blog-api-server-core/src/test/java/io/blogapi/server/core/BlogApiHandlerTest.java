package io.blogapi.server.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.blogapi.core.Protocol;
import io.blogapi.json.jackson.JacksonJsonCodec;
import io.blogapi.server.spi.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class BlogApiHandlerTest {

    private static final ObjectMapper MAPPER = JacksonJsonCodec.defaultMapper();

    private MutableClock clock;
    private BlogApiHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T10:00:00Z"));
        handler = builder().build();
    }

    private BlogApiHandler.Builder builder() {
        InMemoryBlogState state = new InMemoryBlogState(clock);
        return BlogApiHandler.builder(
                        authService(),
                        new InMemoryPostStore(state),
                        new InMemoryLikeStore(state),
                        new InMemoryCommentStore(state))
                .jsonCodec(new JacksonJsonCodec())
                .clock(clock);
    }

    private AuthService authService() {
        return new AuthService(
                new InMemoryCredentialStore(new BCryptPasswordHasher(4)),
                JwtTokenService.builder(JwtTokenServiceTest.SECRET).clock(clock).build());
    }

    @Test
    void fullBlogScenario() throws Exception {
        assertThat(register("alice").status()).isEqualTo(201);
        assertThat(register("bob").status()).isEqualTo(201);
        String alice = login("alice");
        String bob = login("bob");

        ServerResponse created = call(HttpMethod.POST, "/api/posts", alice, "{\"title\":\"T\",\"content\":\"C\"}");
        assertThat(created.status()).isEqualTo(200);
        JsonNode post = json(created);
        assertThat(post.get("id").asLong()).isEqualTo(1);
        assertThat(post.get("author").asText()).isEqualTo("alice");
        assertThat(post.get("likes_count").asInt()).isZero();
        assertThat(post.get("comments_count").asInt()).isZero();
        assertThat(post.get("created_at").asText()).isEqualTo("2024-01-01T10:00:00Z");

        ServerResponse liked = call(HttpMethod.POST, "/api/posts/1/like", bob, null);
        assertThat(liked.status()).isEqualTo(200);
        assertThat(json(liked).get("likes_count").asInt()).isEqualTo(1);
        assertThat(json(liked).get("message").asText()).isEqualTo("Post liked successfully");

        ServerResponse again = call(HttpMethod.POST, "/api/posts/1/like", bob, null);
        assertThat(again.status()).isEqualTo(400);
        assertThat(detail(again)).isEqualTo("You have already liked this post");

        ServerResponse commented = call(HttpMethod.POST, "/api/posts/1/comment", bob, "{\"content\":\"Nice\"}");
        assertThat(commented.status()).isEqualTo(200);
        assertThat(json(commented).get("id").asLong()).isEqualTo(1);
        assertThat(json(commented).get("post_id").asLong()).isEqualTo(1);

        JsonNode fetched = json(call(HttpMethod.GET, "/api/posts/1", null, null));
        assertThat(fetched.get("likes_count").asInt()).isEqualTo(1);
        assertThat(fetched.get("comments_count").asInt()).isEqualTo(1);

        ServerResponse deleted = call(HttpMethod.DELETE, "/api/posts/1", alice, null);
        assertThat(deleted.status()).isEqualTo(200);
        assertThat(json(deleted).get("message").asText()).isEqualTo("Post deleted successfully");

        ServerResponse gone = call(HttpMethod.GET, "/api/posts/1", null, null);
        assertThat(gone.status()).isEqualTo(404);
        assertThat(detail(gone)).isEqualTo("Post not found");
        assertThat(call(HttpMethod.GET, "/api/posts/1/comments", null, null).status()).isEqualTo(404);
        assertThat(call(HttpMethod.POST, "/api/posts/1/like", bob, null).status()).isEqualTo(404);
        assertThat(call(HttpMethod.POST, "/api/posts/1/comment", bob, "{\"content\":\"late\"}").status())
                .isEqualTo(404);
    }

    @Test
    void registerResponseOmitsPassword() throws Exception {
        ServerResponse resp = register("alice");

        JsonNode body = json(resp);
        assertThat(body.get("username").asText()).isEqualTo("alice");
        assertThat(body.get("email").asText()).isEqualTo("alice@example.com");
        assertThat(body.has("password")).isFalse();
        assertThat(body.has("password_hash")).isFalse();
    }

    @Test
    void duplicateRegistrationIsBadRequest() throws Exception {
        register("alice");
        ServerResponse resp = register("alice");

        assertThat(resp.status()).isEqualTo(400);
        assertThat(detail(resp)).isEqualTo("Username already registered");
    }

    @Test
    void missingFieldsAreReportedTogether() throws Exception {
        ServerResponse resp = call(HttpMethod.POST, "/api/auth/register", null, "{\"username\":\"alice\"}");

        assertThat(resp.status()).isEqualTo(422);
        JsonNode detail = json(resp).get("detail");
        assertThat(detail.isArray()).isTrue();
        assertThat(detail.findValuesAsText("field")).containsExactly("email", "password");
    }

    @Test
    void malformedJsonIsValidationError() throws Exception {
        ServerResponse resp = call(HttpMethod.POST, "/api/auth/login", null, "{not json");

        assertThat(resp.status()).isEqualTo(422);
        assertThat(json(resp).get("detail").get(0).get("message").asText()).isEqualTo("Invalid JSON body");
    }

    @Test
    void wrongPasswordIsUnauthorized() throws Exception {
        register("alice");
        ServerResponse resp = call(HttpMethod.POST, "/api/auth/login", null,
                "{\"username\":\"alice\",\"password\":\"wrong\"}");

        assertThat(resp.status()).isEqualTo(401);
        assertThat(detail(resp)).isEqualTo("Incorrect username or password");
        assertThat(header(resp, Protocol.H_WWW_AUTHENTICATE)).isEqualTo("Bearer");
    }

    @Test
    void mutationsRequireBearerToken() throws Exception {
        ServerResponse missing = call(HttpMethod.POST, "/api/posts", null, "{\"title\":\"T\",\"content\":\"C\"}");
        assertThat(missing.status()).isEqualTo(401);
        assertThat(detail(missing)).isEqualTo("Not authenticated");
        assertThat(header(missing, Protocol.H_WWW_AUTHENTICATE)).isEqualTo("Bearer");

        ServerResponse forged = call(HttpMethod.POST, "/api/posts", "garbage", "{\"title\":\"T\",\"content\":\"C\"}");
        assertThat(forged.status()).isEqualTo(401);
        assertThat(detail(forged)).isEqualTo("Could not validate credentials");

        assertThat(json(call(HttpMethod.GET, "/api/posts", null, null)).size()).isZero();
    }

    @Test
    void expiredTokenIsRejected() throws Exception {
        register("alice");
        String token = login("alice");
        clock.advance(Duration.ofMinutes(31));

        assertThat(call(HttpMethod.POST, "/api/posts", token, "{\"title\":\"T\",\"content\":\"C\"}").status())
                .isEqualTo(401);
    }

    @Test
    void onlyAuthorMayEditOrDelete() throws Exception {
        register("alice");
        register("bob");
        String alice = login("alice");
        String bob = login("bob");
        call(HttpMethod.POST, "/api/posts", alice, "{\"title\":\"T\",\"content\":\"C\"}");

        ServerResponse update = call(HttpMethod.PUT, "/api/posts/1", bob, "{\"title\":\"Hacked\"}");
        assertThat(update.status()).isEqualTo(403);
        assertThat(detail(update)).isEqualTo("Not authorized to update this post");
        assertThat(call(HttpMethod.DELETE, "/api/posts/1", bob, null).status()).isEqualTo(403);
        assertThat(json(call(HttpMethod.GET, "/api/posts/1", null, null)).get("title").asText()).isEqualTo("T");

        clock.advance(Duration.ofSeconds(5));
        ServerResponse own = call(HttpMethod.PUT, "/api/posts/1", alice, "{\"content\":\"C2\"}");
        assertThat(own.status()).isEqualTo(200);
        assertThat(json(own).get("title").asText()).isEqualTo("T");
        assertThat(json(own).get("content").asText()).isEqualTo("C2");
        assertThat(json(own).get("updated_at").asText()).isEqualTo("2024-01-01T10:00:05Z");
    }

    @Test
    void titleLengthIsValidated() throws Exception {
        register("alice");
        String alice = login("alice");
        String longTitle = "x".repeat(201);

        ServerResponse resp = call(HttpMethod.POST, "/api/posts", alice,
                "{\"title\":\"" + longTitle + "\",\"content\":\"C\"}");
        assertThat(resp.status()).isEqualTo(422);
        assertThat(json(resp).get("detail").get(0).get("field").asText()).isEqualTo("title");

        ServerResponse empty = call(HttpMethod.POST, "/api/posts", alice, "{\"title\":\"\",\"content\":\"C\"}");
        assertThat(empty.status()).isEqualTo(422);
    }

    @Test
    void nonStringFieldsAreValidationErrors() throws Exception {
        register("alice");
        String alice = login("alice");

        ServerResponse resp = call(HttpMethod.POST, "/api/posts", alice, "{\"title\":123,\"content\":true}");

        assertThat(resp.status()).isEqualTo(422);
        assertThat(json(resp).get("detail").get(0).get("message").asText()).isEqualTo("Invalid JSON body");
        assertThat(json(call(HttpMethod.GET, "/api/posts", null, null)).size()).isZero();

        ServerResponse login = call(HttpMethod.POST, "/api/auth/login", null,
                "{\"username\":\"alice\",\"password\":false}");
        assertThat(login.status()).isEqualTo(422);
    }

    @Test
    void commentContentLengthIsBounded() throws Exception {
        register("alice");
        String alice = login("alice");
        call(HttpMethod.POST, "/api/posts", alice, "{\"title\":\"T\",\"content\":\"C\"}");

        // 1000 code points, 2000 UTF-16 units
        String longest = "\uD83D\uDE00".repeat(1000);
        ServerResponse accepted = call(HttpMethod.POST, "/api/posts/1/comment", alice,
                "{\"content\":\"" + longest + "\"}");
        assertThat(accepted.status()).isEqualTo(200);
        assertThat(json(accepted).get("content").asText()).isEqualTo(longest);

        ServerResponse tooLong = call(HttpMethod.POST, "/api/posts/1/comment", alice,
                "{\"content\":\"" + "x".repeat(1001) + "\"}");
        assertThat(tooLong.status()).isEqualTo(422);
        assertThat(json(tooLong).get("detail").get(0).get("field").asText()).isEqualTo("content");
        assertThat(json(tooLong).get("detail").get(0).get("message").asText())
                .isEqualTo("String should have at most 1000 characters");

        ServerResponse empty = call(HttpMethod.POST, "/api/posts/1/comment", alice, "{\"content\":\"\"}");
        assertThat(empty.status()).isEqualTo(422);
        assertThat(json(empty).get("detail").get(0).get("field").asText()).isEqualTo("content");

        assertThat(json(call(HttpMethod.GET, "/api/posts/1", null, null)).get("comments_count").asInt())
                .isEqualTo(1);
    }

    @Test
    void unlikeWithoutLikeIsBadRequest() throws Exception {
        register("alice");
        String alice = login("alice");
        call(HttpMethod.POST, "/api/posts", alice, "{\"title\":\"T\",\"content\":\"C\"}");

        ServerResponse resp = call(HttpMethod.DELETE, "/api/posts/1/like", alice, null);
        assertThat(resp.status()).isEqualTo(400);
        assertThat(detail(resp)).isEqualTo("You haven't liked this post");
        assertThat(call(HttpMethod.POST, "/api/posts/9/like", alice, null).status()).isEqualTo(404);
    }

    @Test
    void nonNumericIdIsValidationError() throws Exception {
        assertThat(call(HttpMethod.GET, "/api/posts/abc", null, null).status()).isEqualTo(422);
    }

    @Test
    void unknownPathAndWrongMethod() throws Exception {
        ServerResponse missing = call(HttpMethod.GET, "/api/users", null, null);
        assertThat(missing.status()).isEqualTo(404);
        assertThat(detail(missing)).isEqualTo("Not Found");

        ServerResponse wrong = call(HttpMethod.PATCH, "/api/posts", null, null);
        assertThat(wrong.status()).isEqualTo(405);
        assertThat(header(wrong, Protocol.H_ALLOW)).isEqualTo("GET, POST");
    }

    @Test
    void healthReportsTimestamp() throws Exception {
        JsonNode body = json(call(HttpMethod.GET, "/api/health", null, null));

        assertThat(body.get("status").asText()).isEqualTo("healthy");
        assertThat(body.get("timestamp").asText()).isEqualTo("2024-01-01T10:00:00Z");
    }

    @Test
    void corsHeadersAndPreflight() {
        ServerResponse resp = call(HttpMethod.GET, "/api/health", null, null);
        assertThat(header(resp, Protocol.H_ACCESS_CONTROL_ALLOW_ORIGIN)).isEqualTo("*");

        ServerResponse preflight = call(HttpMethod.OPTIONS, "/api/posts/1", null, null);
        assertThat(preflight.status()).isEqualTo(204);
        assertThat(header(preflight, Protocol.H_ACCESS_CONTROL_ALLOW_METHODS)).isEqualTo("GET, PUT, DELETE, OPTIONS");
        assertThat(header(preflight, Protocol.H_ACCESS_CONTROL_ALLOW_ORIGIN)).isEqualTo("*");
    }

    @Test
    void specificOriginAllowsCredentials() {
        BlogApiHandler scoped = builder().allowedOrigin("https://blog.example.com").build();
        ServerResponse resp = scoped.handle(request(HttpMethod.GET, "/api/health", null, null));

        assertThat(header(resp, Protocol.H_ACCESS_CONTROL_ALLOW_ORIGIN)).isEqualTo("https://blog.example.com");
        assertThat(header(resp, Protocol.H_ACCESS_CONTROL_ALLOW_CREDENTIALS)).isEqualTo("true");
    }

    @Test
    void oversizedBodyIsRejected() throws Exception {
        BlogApiHandler small = builder().maxBodySize(16).build();
        ServerResponse resp = small.handle(request(HttpMethod.POST, "/api/auth/register", null,
                "{\"username\":\"alice\",\"email\":\"a@x.io\",\"password\":\"pw\"}"));

        assertThat(resp.status()).isEqualTo(413);
    }

    @Test
    void rateLimitedRequestsGetRetryAfter() {
        RateLimiter limiter = (path, clientId) -> "10.0.0.1".equals(clientId)
                ? new RateLimiter.Result.Rejected(Optional.of(Duration.ofSeconds(3)))
                : new RateLimiter.Result.Allowed();
        BlogApiHandler limited = builder().rateLimiter(limiter).build();

        ServerResponse rejected = limited.handle(request(HttpMethod.GET, "/api/health", null, null), "10.0.0.1");
        assertThat(rejected.status()).isEqualTo(429);
        assertThat(header(rejected, Protocol.H_RETRY_AFTER)).isEqualTo("3");

        assertThat(limited.handle(request(HttpMethod.GET, "/api/health", null, null), "10.0.0.2").status())
                .isEqualTo(200);
    }

    private ServerResponse register(String username) {
        return call(HttpMethod.POST, "/api/auth/register", null,
                "{\"username\":\"" + username + "\",\"email\":\"" + username + "@example.com\",\"password\":\"pw-" + username + "\"}");
    }

    private String login(String username) throws IOException {
        ServerResponse resp = call(HttpMethod.POST, "/api/auth/login", null,
                "{\"username\":\"" + username + "\",\"password\":\"pw-" + username + "\"}");
        assertThat(resp.status()).isEqualTo(200);
        JsonNode body = json(resp);
        assertThat(body.get("token_type").asText()).isEqualTo("bearer");
        return body.get("access_token").asText();
    }

    private ServerResponse call(HttpMethod method, String path, String token, String body) {
        return handler.handle(request(method, path, token, body));
    }

    private static ServerRequest request(HttpMethod method, String path, String token, String body) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        if (body != null) headers.put(Protocol.H_CONTENT_TYPE, List.of(Protocol.CT_JSON));
        if (token != null) headers.put(Protocol.H_AUTHORIZATION, List.of("Bearer " + token));
        return new ServerRequest(
                method,
                URI.create("http://localhost" + path),
                headers,
                body == null ? null : new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
    }

    private static JsonNode json(ServerResponse resp) throws IOException {
        assertThat(resp.body()).isInstanceOf(ResponseBody.Bytes.class);
        return MAPPER.readTree(((ResponseBody.Bytes) resp.body()).bytes());
    }

    private static String detail(ServerResponse resp) throws IOException {
        return json(resp).get("detail").asText();
    }

    private static String header(ServerResponse resp, String name) {
        return resp.firstHeader(name).orElse(null);
    }
}
