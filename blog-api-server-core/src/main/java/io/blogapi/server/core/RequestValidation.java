package io.blogapi.server.core;

import io.blogapi.core.BlogApiException;
import io.blogapi.core.BlogApiException.FieldError;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects field-level problems in a request body and reports them all at once.
 *
 * <pre>{@code
 * RequestValidation.start()
 *     .required("title", body.title())
 *     .length("title", body.title(), 1, 200)
 *     .check();
 * }</pre>
 *
 * <p>Lengths count Unicode code points, not UTF-16 units.
 */
public final class RequestValidation {

    /** Passed as {@code max} to {@link #length} when there is no upper bound. */
    public static final int NO_MAX = Integer.MAX_VALUE;

    private final List<FieldError> errors = new ArrayList<>();

    private RequestValidation() {}

    public static RequestValidation start() {
        return new RequestValidation();
    }

    public RequestValidation required(String field, Object value) {
        if (value == null) errors.add(new FieldError(field, "Field required"));
        return this;
    }

    /**
     * Checks the length of a present value; null values are left to {@link #required}.
     */
    public RequestValidation length(String field, String value, int min, int max) {
        if (value == null) return this;
        int n = value.codePointCount(0, value.length());
        if (n < min) {
            errors.add(new FieldError(field, "String should have at least " + min + " character" + (min == 1 ? "" : "s")));
        } else if (n > max) {
            errors.add(new FieldError(field, "String should have at most " + max + " characters"));
        }
        return this;
    }

    public RequestValidation maxBytes(String field, String value, int maxBytes) {
        if (value == null) return this;
        if (value.getBytes(StandardCharsets.UTF_8).length > maxBytes) {
            errors.add(new FieldError(field, "String should have at most " + maxBytes + " bytes"));
        }
        return this;
    }

    /**
     * @throws BlogApiException.ValidationError if any check failed
     */
    public void check() {
        if (!errors.isEmpty()) throw new BlogApiException.ValidationError(errors);
    }
}
