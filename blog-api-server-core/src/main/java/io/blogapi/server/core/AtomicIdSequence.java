package io.blogapi.server.core;

import io.blogapi.server.spi.IdSequence;

import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link IdSequence} backed by an {@link AtomicLong}. The first id handed out is {@code initial + 1}.
 */
public final class AtomicIdSequence implements IdSequence {
    private final AtomicLong last;

    public AtomicIdSequence() {
        this(0);
    }

    public AtomicIdSequence(long initial) {
        if (initial < 0) throw new IllegalArgumentException("initial must be >= 0");
        this.last = new AtomicLong(initial);
    }

    @Override
    public long next() {
        long id = last.incrementAndGet();
        if (id <= 0) throw new IllegalStateException("id sequence exhausted");
        return id;
    }
}
