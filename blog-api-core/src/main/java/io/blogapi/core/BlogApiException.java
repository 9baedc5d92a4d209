package io.blogapi.core;

import java.util.List;
import java.util.Objects;

/**
 * Base class for errors surfaced to API callers.
 *
 * <p>Every subclass maps to exactly one HTTP status. None of them is retried internally: they describe
 * caller-supplied state, not transient faults.
 */
public abstract class BlogApiException extends RuntimeException {

    protected BlogApiException(String message) {
        super(message);
    }

    /**
     * HTTP status code reported to the caller.
     */
    public abstract int status();

    /**
     * Malformed or out-of-range input. Carries one entry per offending field.
     */
    public static class ValidationError extends BlogApiException {
        private final List<FieldError> errors;

        public ValidationError(List<FieldError> errors) {
            super(summarize(errors));
            this.errors = List.copyOf(errors);
        }

        public ValidationError(String field, String message) {
            this(List.of(new FieldError(field, message)));
        }

        public List<FieldError> errors() {
            return errors;
        }

        @Override
        public int status() {
            return 422;
        }

        private static String summarize(List<FieldError> errors) {
            if (errors == null || errors.isEmpty()) throw new IllegalArgumentException("errors must not be empty");
            StringBuilder sb = new StringBuilder();
            for (FieldError e : errors) {
                if (sb.length() > 0) sb.append("; ");
                sb.append(e.field()).append(": ").append(e.message());
            }
            return sb.toString();
        }
    }

    /**
     * Missing, malformed, or expired bearer token, unknown token subject, or bad login credentials.
     */
    public static class AuthenticationError extends BlogApiException {
        public AuthenticationError(String message) {
            super(message);
        }

        @Override
        public int status() {
            return 401;
        }
    }

    /**
     * Authenticated caller is not the owner of the resource it tries to mutate.
     */
    public static class AuthorizationError extends BlogApiException {
        public AuthorizationError(String message) {
            super(message);
        }

        @Override
        public int status() {
            return 403;
        }
    }

    /**
     * Resource id is unknown.
     */
    public static class NotFoundError extends BlogApiException {
        public NotFoundError(String message) {
            super(message);
        }

        @Override
        public int status() {
            return 404;
        }
    }

    /**
     * Duplicate username, duplicate like, or unlike of a post that was never liked.
     */
    public static class ConflictError extends BlogApiException {
        public ConflictError(String message) {
            super(message);
        }

        @Override
        public int status() {
            return 400;
        }
    }

    /**
     * A single field-level validation failure.
     *
     * @param field name of the offending request field (or {@code body} for the whole payload)
     * @param message human-readable reason
     */
    public record FieldError(String field, String message) {
        public FieldError {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(message, "message");
        }
    }
}
