package io.blogapi.server.core.dto;

public record TokenResponse(String accessToken, String tokenType) {
    @Override
    public String toString() {
        return "TokenResponse[tokenType=" + tokenType + "]";
    }
}
