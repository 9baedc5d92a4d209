package io.blogapi.server.core.handlers;

import io.blogapi.core.Protocol;
import io.blogapi.server.core.ApiSupport;
import io.blogapi.server.core.PathParams;
import io.blogapi.server.core.ServerRequest;
import io.blogapi.server.core.ServerResponse;
import io.blogapi.server.core.dto.HealthResponse;

import java.util.Objects;

/** {@code GET /api/health}. */
public final class HealthHandler {
    private final ApiSupport api;

    public HealthHandler(ApiSupport api) {
        this.api = Objects.requireNonNull(api, "api");
    }

    public ServerResponse health(ServerRequest request, PathParams params) throws Exception {
        return api.ok(new HealthResponse(Protocol.STATUS_HEALTHY, api.clock().instant()));
    }
}
