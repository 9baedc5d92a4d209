package io.blogapi.server.core.dto;

public record LikeResponse(String message, int likesCount) {}
