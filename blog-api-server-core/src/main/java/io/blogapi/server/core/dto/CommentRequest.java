package io.blogapi.server.core.dto;

public record CommentRequest(String content) {}
