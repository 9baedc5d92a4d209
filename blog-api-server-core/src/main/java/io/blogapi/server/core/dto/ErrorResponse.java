package io.blogapi.server.core.dto;

import io.blogapi.core.BlogApiException.FieldError;

import java.util.List;

/**
 * Error bodies. {@code detail} is a message, or a list of field errors for validation failures.
 */
public final class ErrorResponse {
    private ErrorResponse() {}

    public record Message(String detail) {}

    public record Fields(List<FieldError> detail) {}
}
