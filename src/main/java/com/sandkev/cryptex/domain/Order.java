package com.sandkev.cryptex.domain;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/** Snapshot of a resting, not yet filled order. */
@Builder
public record Order(
        String orderId,
        Side side,
        String baseCurrency,
        String counterCurrency,
        Instant datetime,
        BigDecimal amount,
        BigDecimal price
) {

    public Order {
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(baseCurrency, "baseCurrency");
        Objects.requireNonNull(counterCurrency, "counterCurrency");
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(price, "price");
    }

    public Market market() {
        return new Market(baseCurrency, counterCurrency);
    }
}
