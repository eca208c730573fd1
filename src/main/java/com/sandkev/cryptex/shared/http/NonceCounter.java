package com.sandkev.cryptex.shared.http;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Strictly increasing nonce source for one API key. Seed it with the next
 * unused value when resuming a key that has already been used elsewhere.
 * Values handed out are never returned, even when the request fails.
 */
public final class NonceCounter {

    private final AtomicLong next;

    public NonceCounter() {
        this(0L);
    }

    public NonceCounter(long seed) {
        if (seed < 0) throw new IllegalArgumentException("nonce seed must not be negative: " + seed);
        this.next = new AtomicLong(seed);
    }

    public long next() {
        return next.getAndIncrement();
    }

    /** The value the following {@link #next()} will return. */
    public long peek() {
        return next.get();
    }
}
