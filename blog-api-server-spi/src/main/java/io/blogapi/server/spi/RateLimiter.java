package io.blogapi.server.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Rate limiting SPI for the Blog API.
 *
 * <p>Implementations control request rate limiting. When a request is rejected,
 * the server returns 429 Too Many Requests with an optional Retry-After header.
 */
public interface RateLimiter {

    /**
     * Check if a request should be allowed.
     *
     * @param path the request path being accessed
     * @param clientId optional client identifier (e.g., IP address)
     * @return result indicating whether the request is allowed
     */
    Result tryAcquire(String path, String clientId);

    /**
     * Result of a rate limit check.
     */
    sealed interface Result permits Result.Allowed, Result.Rejected {

        /**
         * Request is allowed to proceed.
         */
        record Allowed() implements Result {}

        /**
         * Request is rejected due to rate limiting.
         *
         * @param retryAfter optional duration after which the client may retry
         */
        record Rejected(Optional<Duration> retryAfter) implements Result {}
    }

    /**
     * No-op rate limiter that allows all requests.
     */
    static RateLimiter permitAll() {
        return (path, clientId) -> new Result.Allowed();
    }
}
