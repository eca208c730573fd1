package com.sandkev.cryptex.exchange.btce;

import com.fasterxml.jackson.databind.JsonNode;
import com.sandkev.cryptex.domain.Side;
import com.sandkev.cryptex.domain.Trade;
import com.sandkev.cryptex.domain.Transaction;
import com.sandkev.cryptex.shared.http.ExchangeJson;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class BtceHistoryReconcilerTest {

    private static final long T = 1388534400L;

    private final BtceHistoryReconciler reconciler = new BtceHistoryReconciler();

    private static JsonNode json(String s) throws Exception {
        return ExchangeJson.newMapper().readTree(s);
    }

    @Test
    void buyDescriptionBecomesTradeWithRecoveredId() throws Exception {
        JsonNode history = json("""
                {"900": {"type": 4, "amount": 0.499, "currency": "BTC", "status": 2,
                         "desc": "0.5 BTC (-0.2%%) :order:123: ... 100 USD", "timestamp": %d}}
                """.formatted(T));
        JsonNode trades = json("""
                {"t1": {"pair": "btc_usd", "type": "buy", "amount": "0.5", "rate": 100,
                        "order_id": 123, "is_your_order": 1, "timestamp": %d}}
                """.formatted(T));

        ReconciliationResult result = reconciler.reconcile(history, trades, false, true);

        assertThat(result.failures()).isEmpty();
        assertThat(result.transactions()).isEmpty();
        assertThat(result.trades()).singleElement().satisfies(t -> {
            assertThat(t.tradeId()).isEqualTo("t1");
            assertThat(t.side()).isEqualTo(Side.BUY);
            assertThat(t.orderId()).isEqualTo("123");
            assertThat(t.datetime()).isEqualTo(Instant.ofEpochSecond(T));
            assertThat(t.amount()).isEqualByComparingTo("0.5");
            assertThat(t.price()).isEqualByComparingTo("100");
            assertThat(t.fee()).isEqualTo(new BigDecimal("0.00100000"));
            assertThat(t.feeCurrency()).isEqualTo("BTC");
        });
    }

    @Test
    void sellFeeIsChargedInCounterCurrency() throws Exception {
        JsonNode history = json("""
                {"901": {"type": 5, "amount": 49.9, "currency": "USD",
                         "desc": "Sell 0.5 BTC from your order :order:456: by price 100 USD total 50 USD (-0.2%%)",
                         "timestamp": %d}}
                """.formatted(T));
        JsonNode trades = json("""
                {"t9": {"order_id": 456, "amount": 0.5, "timestamp": %d}}
                """.formatted(T));

        Trade trade = reconciler.reconcile(history, trades, false, true).trades().get(0);

        assertThat(trade.side()).isEqualTo(Side.SELL);
        assertThat(trade.tradeId()).isEqualTo("t9");
        assertThat(trade.fee()).isEqualTo(new BigDecimal("0.10000000"));
        assertThat(trade.feeCurrency()).isEqualTo("USD");
    }

    @Test
    void unmatchedTradeIsReportedWithoutAbortingTheBatch() throws Exception {
        JsonNode history = json("""
                {"1": {"type": 4, "amount": 1, "currency": "BTC",
                       "desc": "Buy 1 BTC (-0.2%%) from your order :order:777: by price 90 USD", "timestamp": %d},
                 "2": {"type": 4, "amount": 0.5, "currency": "BTC",
                       "desc": "Buy 0.5 BTC (-0.2%%) from your order :order:123: by price 100 USD", "timestamp": %d},
                 "3": {"type": 4, "amount": 3, "currency": "BTC", "desc": "Bonus credit", "timestamp": %d}}
                """.formatted(T, T, T));
        JsonNode trades = json("""
                {"t1": {"order_id": 123, "amount": 0.5, "timestamp": %d}}
                """.formatted(T));

        ReconciliationResult result = reconciler.reconcile(history, trades, true, true);

        assertThat(result.trades()).extracting(Trade::tradeId).containsExactly("t1");
        assertThat(result.failures()).singleElement().satisfies(f -> {
            assertThat(f.recordId()).isEqualTo("1");
            assertThat(f.reason()).contains("777");
        });
        assertThat(result.hasFailures()).isTrue();
    }

    @Test
    void depositsAndWithdrawalsKeepFeedOrder() throws Exception {
        JsonNode history = json("""
                {"30": {"type": 2, "amount": 1.5, "currency": "btc",
                        "desc": "Withdrawal to address 1A2b3C4d", "timestamp": %d},
                 "10": {"type": 1, "amount": 2, "currency": "BTC", "desc": "BTC Deposit", "timestamp": %d},
                 "20": {"type": 4, "amount": 0.5, "currency": "BTC",
                        "desc": "Buy 0.5 BTC (-0.2%%) from your order :order:123: by price 100 USD", "timestamp": %d}}
                """.formatted(T, T + 1, T + 2));

        ReconciliationResult result = reconciler.reconcile(history, json("{}"), true, false);

        assertThat(result.trades()).isEmpty();
        assertThat(result.failures()).isEmpty();
        assertThat(result.transactions()).extracting(Transaction::transactionId).containsExactly("30", "10");

        Transaction withdrawal = result.transactions().get(0);
        assertThat(withdrawal.kind()).isEqualTo(Transaction.Kind.WITHDRAWAL);
        assertThat(withdrawal.currency()).isEqualTo("BTC");
        assertThat(withdrawal.address()).isEqualTo("1A2b3C4d");
        assertThat(withdrawal.fee()).isNull();
        assertThat(withdrawal.netAmount()).isEqualByComparingTo("1.5");

        Transaction deposit = result.transactions().get(1);
        assertThat(deposit.kind()).isEqualTo(Transaction.Kind.DEPOSIT);
        assertThat(deposit.fee()).isEqualByComparingTo("0");
        assertThat(deposit.address()).isEmpty();
        assertThat(deposit.datetime()).isEqualTo(Instant.ofEpochSecond(T + 1));
    }

    @Test
    void malformedRecordIsReported() throws Exception {
        JsonNode history = json("""
                {"5": {"type": 1, "amount": "n/a", "currency": "BTC", "desc": "", "timestamp": %d},
                 "6": {"type": 1, "amount": 1, "currency": "BTC", "desc": "", "timestamp": %d}}
                """.formatted(T, T));

        ReconciliationResult result = reconciler.reconcile(history, json("{}"), true, false);

        assertThat(result.transactions()).extracting(Transaction::transactionId).containsExactly("6");
        assertThat(result.failures()).extracting(ReconciliationFailure::recordId).containsExactly("5");
    }

    @Test
    void withdrawalAddressExtraction() {
        assertThat(BtceHistoryReconciler.withdrawalAddress("Withdrawal to address 1A2b3C...")).isEqualTo("1A2b3C...");
        assertThat(BtceHistoryReconciler.withdrawalAddress("Withdrawal of 1 BTC")).isEmpty();
        // a marker at the very start is found too; a plain truthiness test on the index would miss it
        assertThat(BtceHistoryReconciler.withdrawalAddress("address 1A2b3C...")).isEqualTo("1A2b3C...");
    }

    @Test
    void feeIsQuantized() {
        var buy = new ParsedTradeDescription(Side.BUY, "0.33333333", new BigDecimal("0.33333333"), "BTC",
                new BigDecimal("0.2"), "1", new BigDecimal("777.777"), "USD", null);
        var sell = new ParsedTradeDescription(Side.SELL, "0.33333333", new BigDecimal("0.33333333"), "BTC",
                new BigDecimal("0.2"), "1", new BigDecimal("777.777"), "USD", new BigDecimal("259.259"));

        assertThat(BtceHistoryReconciler.fee(buy).toPlainString()).isEqualTo("0.00066667");
        assertThat(BtceHistoryReconciler.fee(sell).toPlainString()).isEqualTo("0.51851799");
    }
}
