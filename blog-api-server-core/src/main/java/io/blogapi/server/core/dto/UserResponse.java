package io.blogapi.server.core.dto;

import io.blogapi.server.spi.User;

public record UserResponse(String username, String email) {
    public static UserResponse of(User user) {
        return new UserResponse(user.username(), user.email());
    }
}
