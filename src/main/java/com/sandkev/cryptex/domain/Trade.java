package com.sandkev.cryptex.domain;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * An executed fill. When no fee currency is given it defaults to the base
 * currency for buys and the counter currency for sells.
 */
@Builder
public record Trade(
        String tradeId,
        Side side,
        String baseCurrency,
        String counterCurrency,
        Instant datetime,
        String orderId,
        BigDecimal amount,
        BigDecimal price,
        BigDecimal fee,
        String feeCurrency
) {

    public Trade {
        Objects.requireNonNull(tradeId, "tradeId");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(baseCurrency, "baseCurrency");
        Objects.requireNonNull(counterCurrency, "counterCurrency");
        Objects.requireNonNull(datetime, "datetime");
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(price, "price");
        if (amount.signum() <= 0) throw new IllegalArgumentException("amount must be positive: " + amount);
        if (price.signum() <= 0) throw new IllegalArgumentException("price must be positive: " + price);
        if (fee == null) fee = BigDecimal.ZERO;
        if (fee.signum() < 0) throw new IllegalArgumentException("fee must not be negative: " + fee);
        if (feeCurrency == null) {
            feeCurrency = side == Side.BUY ? baseCurrency : counterCurrency;
        } else if (!feeCurrency.equals(baseCurrency) && !feeCurrency.equals(counterCurrency)) {
            throw new IllegalArgumentException("fee currency " + feeCurrency + " is not part of " + baseCurrency + "/" + counterCurrency);
        }
    }

    public Market market() {
        return new Market(baseCurrency, counterCurrency);
    }

    /** Counter-currency value before fees. */
    public BigDecimal grossValue() {
        return amount.multiply(price);
    }
}
