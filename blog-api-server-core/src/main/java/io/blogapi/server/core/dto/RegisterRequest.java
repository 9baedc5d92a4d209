package io.blogapi.server.core.dto;

public record RegisterRequest(String username, String email, String password) {
    @Override
    public String toString() {
        return "RegisterRequest[username=" + username + ", email=" + email + "]";
    }
}
