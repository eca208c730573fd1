package com.sandkev.cryptex.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TradeTest {

    private static Trade.TradeBuilder base(Side side) {
        return Trade.builder()
                .tradeId("t1")
                .side(side)
                .baseCurrency("BTC")
                .counterCurrency("USD")
                .datetime(Instant.parse("2014-01-01T00:00:00Z"))
                .orderId("123")
                .amount(new BigDecimal("0.5"))
                .price(new BigDecimal("100"))
                .fee(new BigDecimal("0.001"));
    }

    @Test
    void feeCurrencyDefaultsBySide() {
        assertThat(base(Side.BUY).build().feeCurrency()).isEqualTo("BTC");
        assertThat(base(Side.SELL).build().feeCurrency()).isEqualTo("USD");
    }

    @Test
    void explicitFeeCurrencyMustBelongToTheMarket() {
        assertThat(base(Side.BUY).feeCurrency("USD").build().feeCurrency()).isEqualTo("USD");
        assertThatThrownBy(() -> base(Side.BUY).feeCurrency("LTC").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void grossValueIsAmountTimesPrice() {
        Trade trade = base(Side.SELL).build();
        assertThat(trade.grossValue()).isEqualByComparingTo("50");
        assertThat(trade.market()).isEqualTo(Market.of("btc", "usd"));
    }

    @Test
    void rejectsNonPositiveAmountAndPriceAndNegativeFee() {
        assertThatThrownBy(() -> base(Side.BUY).amount(BigDecimal.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base(Side.BUY).price(new BigDecimal("-1")).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base(Side.BUY).fee(new BigDecimal("-0.1")).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingFeeMeansZero() {
        assertThat(base(Side.BUY).fee(null).build().fee()).isEqualByComparingTo("0");
    }
}
