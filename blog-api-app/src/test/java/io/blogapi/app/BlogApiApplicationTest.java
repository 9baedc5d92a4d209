package io.blogapi.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "blog-api.auth.bcrypt-strength=4")
class BlogApiApplicationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @LocalServerPort
    int port;

    private final HttpClient client = HttpClient.newHttpClient();

    @Test
    void registerLoginPostLikeCommentDelete() throws Exception {
        assertThat(send("POST", "/api/auth/register", null,
                "{\"username\":\"alice\",\"email\":\"alice@example.com\",\"password\":\"secret1\"}").statusCode())
                .isEqualTo(201);
        assertThat(send("POST", "/api/auth/register", null,
                "{\"username\":\"bob\",\"email\":\"bob@example.com\",\"password\":\"secret2\"}").statusCode())
                .isEqualTo(201);
        String alice = token("alice", "secret1");
        String bob = token("bob", "secret2");

        HttpResponse<String> created = send("POST", "/api/posts", alice, "{\"title\":\"Hello\",\"content\":\"World\"}");
        assertThat(created.statusCode()).isEqualTo(200);
        long id = MAPPER.readTree(created.body()).get("id").asLong();

        HttpResponse<String> liked = send("POST", "/api/posts/" + id + "/like", bob, null);
        assertThat(MAPPER.readTree(liked.body()).get("likes_count").asInt()).isEqualTo(1);
        assertThat(send("POST", "/api/posts/" + id + "/like", bob, null).statusCode()).isEqualTo(400);

        HttpResponse<String> comment = send("POST", "/api/posts/" + id + "/comment", bob, "{\"content\":\"Nice\"}");
        assertThat(comment.statusCode()).isEqualTo(200);

        JsonNode post = MAPPER.readTree(send("GET", "/api/posts/" + id, null, null).body());
        assertThat(post.get("comments_count").asInt()).isEqualTo(1);

        assertThat(send("DELETE", "/api/posts/" + id, bob, null).statusCode()).isEqualTo(403);
        assertThat(send("DELETE", "/api/posts/" + id, alice, null).statusCode()).isEqualTo(200);
        assertThat(send("GET", "/api/posts/" + id, null, null).statusCode()).isEqualTo(404);
    }

    @Test
    void healthAndUnauthenticatedWrites() throws Exception {
        HttpResponse<String> health = send("GET", "/api/health", null, null);
        assertThat(health.statusCode()).isEqualTo(200);
        assertThat(MAPPER.readTree(health.body()).get("status").asText()).isEqualTo("healthy");
        assertThat(health.headers().firstValue("Access-Control-Allow-Origin")).contains("*");

        HttpResponse<String> denied = send("POST", "/api/posts", null, "{\"title\":\"T\",\"content\":\"C\"}");
        assertThat(denied.statusCode()).isEqualTo(401);
        assertThat(denied.headers().firstValue("WWW-Authenticate")).contains("Bearer");
    }

    private String token(String username, String password) throws Exception {
        HttpResponse<String> resp = send("POST", "/api/auth/login", null,
                "{\"username\":\"" + username + "\",\"password\":\"" + password + "\"}");
        assertThat(resp.statusCode()).isEqualTo(200);
        return MAPPER.readTree(resp.body()).get("access_token").asText();
    }

    private HttpResponse<String> send(String method, String path, String token, String body) throws Exception {
        HttpRequest.Builder req = HttpRequest.newBuilder(URI.create("http://localhost:" + port + path))
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        if (body != null) req.header("Content-Type", "application/json");
        if (token != null) req.header("Authorization", "Bearer " + token);
        return client.send(req.build(), HttpResponse.BodyHandlers.ofString());
    }
}
