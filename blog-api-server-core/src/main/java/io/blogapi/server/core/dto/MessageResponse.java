package io.blogapi.server.core.dto;

public record MessageResponse(String message) {}
