package io.blogapi.server.core;

import io.blogapi.server.spi.RateLimiter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-client token bucket {@link RateLimiter}.
 *
 * <p>Each client starts with {@code capacity} tokens; tokens refill continuously at
 * {@code refillPerSecond}. Requests without a client id share one bucket. Suitable for a single
 * process only.
 */
public final class TokenBucketRateLimiter implements RateLimiter {

    private static final String ANONYMOUS = "anonymous";

    private final int capacity;
    private final double refillPerNano;
    private final Clock clock;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    /**
     * Creates a limiter allowing bursts of 100 requests and 10 requests/second sustained.
     */
    public TokenBucketRateLimiter() {
        this(100, 10.0, Clock.systemUTC());
    }

    public TokenBucketRateLimiter(int capacity, double refillPerSecond, Clock clock) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        if (refillPerSecond <= 0) throw new IllegalArgumentException("refillPerSecond must be positive");
        this.capacity = capacity;
        this.refillPerNano = refillPerSecond / 1_000_000_000.0;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Result tryAcquire(String path, String clientId) {
        String key = clientId == null || clientId.isBlank() ? ANONYMOUS : clientId;
        long now = nanos();
        return buckets.computeIfAbsent(key, k -> new Bucket(capacity, now)).take(now);
    }

    /**
     * Forget all clients.
     */
    public void reset() {
        buckets.clear();
    }

    private long nanos() {
        Instant i = clock.instant();
        return i.getEpochSecond() * 1_000_000_000L + i.getNano();
    }

    private final class Bucket {
        private double tokens;
        private long refilledAt;

        Bucket(double tokens, long now) {
            this.tokens = tokens;
            this.refilledAt = now;
        }

        synchronized Result take(long now) {
            if (now > refilledAt) {
                tokens = Math.min(capacity, tokens + (now - refilledAt) * refillPerNano);
                refilledAt = now;
            }
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return new Result.Allowed();
            }
            long waitNanos = (long) Math.ceil((1.0 - tokens) / refillPerNano);
            // Retry-After is whole seconds; never advertise 0
            long seconds = Math.max(1, (waitNanos + 999_999_999L) / 1_000_000_000L);
            return new Result.Rejected(Optional.of(Duration.ofSeconds(seconds)));
        }
    }
}
