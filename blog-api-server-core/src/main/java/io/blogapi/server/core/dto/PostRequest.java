package io.blogapi.server.core.dto;

/**
 * Body of post creation and update. For updates both fields are optional.
 */
public record PostRequest(String title, String content) {}
