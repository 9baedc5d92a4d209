package io.blogapi.server.core;

import io.blogapi.core.Protocol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Status, headers and body produced by {@link BlogApiHandler}, independent of any servlet or HTTP server.
 *
 * <p>Header names keep the case they were added with; {@link #firstHeader(String)} matches them
 * case-insensitively. Every API response that carries a body is JSON and is never cached.
 */
public final class ServerResponse {
    private final int status;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final ResponseBody body;

    public ServerResponse(int status, ResponseBody body) {
        this.status = status;
        this.body = body;
    }

    /** A JSON body with {@code Content-Type: application/json} and {@code Cache-Control: no-store}. */
    public static ServerResponse json(int status, byte[] body) {
        return new ServerResponse(status, new ResponseBody.Bytes(body))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON)
                .header(Protocol.H_CACHE_CONTROL, "no-store");
    }

    /** No body; {@code Cache-Control: no-store}. */
    public static ServerResponse noContent(int status) {
        return new ServerResponse(status, new ResponseBody.Empty())
                .header(Protocol.H_CACHE_CONTROL, "no-store");
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public ResponseBody body() {
        return body;
    }

    public Optional<String> firstHeader(String name) {
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                return Optional.of(e.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    public ServerResponse header(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }
}
