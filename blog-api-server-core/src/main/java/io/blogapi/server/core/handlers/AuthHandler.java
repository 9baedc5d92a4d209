package io.blogapi.server.core.handlers;

import io.blogapi.core.Protocol;
import io.blogapi.server.core.ApiSupport;
import io.blogapi.server.core.BCryptPasswordHasher;
import io.blogapi.server.core.PathParams;
import io.blogapi.server.core.RequestValidation;
import io.blogapi.server.core.ServerRequest;
import io.blogapi.server.core.ServerResponse;
import io.blogapi.server.core.dto.LoginRequest;
import io.blogapi.server.core.dto.RegisterRequest;
import io.blogapi.server.core.dto.TokenResponse;
import io.blogapi.server.core.dto.UserResponse;
import io.blogapi.server.spi.IssuedToken;
import io.blogapi.server.spi.User;

import java.util.Objects;

/**
 * {@code POST /api/auth/register} and {@code POST /api/auth/login}.
 */
public final class AuthHandler {
    private final ApiSupport api;

    public AuthHandler(ApiSupport api) {
        this.api = Objects.requireNonNull(api, "api");
    }

    public ServerResponse register(ServerRequest request, PathParams params) throws Exception {
        RegisterRequest body = api.readBody(request, RegisterRequest.class);
        RequestValidation.start()
                .required("username", body.username())
                .length("username", body.username(), 1, RequestValidation.NO_MAX)
                .required("email", body.email())
                .required("password", body.password())
                .length("password", body.password(), 1, RequestValidation.NO_MAX)
                .maxBytes("password", body.password(), BCryptPasswordHasher.MAX_PASSWORD_BYTES)
                .check();

        User user = api.auth().register(body.username(), body.email(), body.password());
        return api.json(201, UserResponse.of(user));
    }

    public ServerResponse login(ServerRequest request, PathParams params) throws Exception {
        LoginRequest body = api.readBody(request, LoginRequest.class);
        RequestValidation.start()
                .required("username", body.username())
                .required("password", body.password())
                .check();

        IssuedToken token = api.auth().login(body.username(), body.password());
        return api.ok(new TokenResponse(token.value(), Protocol.TOKEN_TYPE_BEARER));
    }
}
