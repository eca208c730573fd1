package com.sandkev.cryptex.domain;

import java.util.Locale;
import java.util.Objects;

/** Ordered currency pair, e.g. BTC/USD: amounts in base, prices in counter. */
public record Market(String base, String counter) {

    public Market {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(counter, "counter");
        base = base.trim().toUpperCase(Locale.ROOT);
        counter = counter.trim().toUpperCase(Locale.ROOT);
        if (base.isEmpty() || counter.isEmpty()) {
            throw new IllegalArgumentException("currency codes must not be blank");
        }
    }

    public static Market of(String base, String counter) {
        return new Market(base, counter);
    }

    @Override
    public String toString() {
        return base + "/" + counter;
    }
}
