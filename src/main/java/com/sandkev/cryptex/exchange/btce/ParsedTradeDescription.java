package com.sandkev.cryptex.exchange.btce;

import com.sandkev.cryptex.domain.Side;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;

/**
 * Fields recovered from a trade description.
 *
 * @param amountText the amount exactly as written, compared digit by digit against the trade-history feed
 * @param total      counter-currency proceeds, only present on sells
 */
public record ParsedTradeDescription(
        Side side,
        String amountText,
        BigDecimal amount,
        String baseCurrency,
        BigDecimal feePercent,
        String orderId,
        BigDecimal price,
        String counterCurrency,
        @Nullable BigDecimal total
) {}
