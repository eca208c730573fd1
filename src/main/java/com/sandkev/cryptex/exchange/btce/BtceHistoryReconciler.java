package com.sandkev.cryptex.exchange.btce;

import com.fasterxml.jackson.databind.JsonNode;
import com.sandkev.cryptex.domain.Side;
import com.sandkev.cryptex.domain.Trade;
import com.sandkev.cryptex.domain.Transaction;
import com.sandkev.cryptex.exception.ReconciliationException;
import com.sandkev.cryptex.shared.Decimals;
import com.sandkev.cryptex.shared.http.ExchangeJson;
import com.sandkev.cryptex.shared.time.ExchangeTimestamps;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns BTC-e's TransHistory feed into transactions and trades.
 * <p>
 * TransHistory mixes deposits, withdrawals and trades. Trades only appear as a
 * prose {@code desc} and lack their trade id, which has to be looked up in the
 * TradeHistory feed by timestamp and order id.
 */
@Slf4j
public class BtceHistoryReconciler {

    static final int TYPE_DEPOSIT = 1;
    static final int TYPE_WITHDRAWAL = 2;
    static final int TYPE_TRADE_CREDIT = 4;
    static final int TYPE_TRADE_DEBIT = 5;

    private static final String ADDRESS_MARKER = "address ";

    /**
     * @param historyFeed TransHistory payload, {@code {id: {type, amount, currency, desc, timestamp}}}
     * @param tradeFeed   TradeHistory payload; only read when trades are wanted
     */
    public ReconciliationResult reconcile(JsonNode historyFeed, JsonNode tradeFeed,
                                          boolean wantTransactions, boolean wantTrades) {
        var transactions = new ArrayList<Transaction>();
        var trades = new ArrayList<Trade>();
        var failures = new ArrayList<ReconciliationFailure>();

        for (Iterator<Map.Entry<String, JsonNode>> it = historyFeed.fields(); it.hasNext(); ) {
            var e = it.next();
            String id = e.getKey();
            JsonNode entry = e.getValue();
            try {
                int type = entry.path("type").asInt(-1);
                switch (type) {
                    case TYPE_DEPOSIT -> {
                        if (wantTransactions) transactions.add(toDeposit(id, entry));
                    }
                    case TYPE_WITHDRAWAL -> {
                        if (wantTransactions) transactions.add(toWithdrawal(id, entry));
                    }
                    case TYPE_TRADE_CREDIT, TYPE_TRADE_DEBIT -> {
                        if (wantTrades) toTrade(id, entry, tradeFeed).ifPresent(trades::add);
                    }
                    default -> log.debug("Skipping history record {} of type {}", id, type);
                }
            } catch (ReconciliationException ex) {
                failures.add(new ReconciliationFailure(ex.getRecordId(), ex.getMessage()));
            } catch (IllegalArgumentException ex) {
                failures.add(new ReconciliationFailure(id, "Malformed history record: " + ex.getMessage()));
            }
        }
        return new ReconciliationResult(transactions, trades, failures);
    }

    private static Transaction toDeposit(String id, JsonNode entry) {
        // deposit fees are not reported
        return Transaction.builder()
                .transactionId(id)
                .kind(Transaction.Kind.DEPOSIT)
                .datetime(ExchangeTimestamps.fromEpochSeconds(entry.get("timestamp")))
                .currency(currency(entry))
                .amount(ExchangeJson.decimal(entry, "amount"))
                .address("")
                .fee(BigDecimal.ZERO)
                .build();
    }

    private static Transaction toWithdrawal(String id, JsonNode entry) {
        // withdrawal fees are not reported either, so fee stays unknown
        return Transaction.builder()
                .transactionId(id)
                .kind(Transaction.Kind.WITHDRAWAL)
                .datetime(ExchangeTimestamps.fromEpochSeconds(entry.get("timestamp")))
                .currency(currency(entry))
                .amount(ExchangeJson.decimal(entry, "amount"))
                .address(withdrawalAddress(entry.path("desc").asText("")))
                .build();
    }

    /** Text after {@code "address "}, or empty when the marker is absent. A marker at position 0 counts. */
    static String withdrawalAddress(String desc) {
        int idx = desc.indexOf(ADDRESS_MARKER);
        return idx >= 0 ? desc.substring(idx + ADDRESS_MARKER.length()) : "";
    }

    private static Optional<Trade> toTrade(String id, JsonNode entry, JsonNode tradeFeed) {
        String desc = entry.path("desc").asText("");
        var parsed = TradeDescriptionParser.parse(desc);
        if (parsed.isEmpty()) {
            log.debug("History record {} is not a recognisable trade: '{}'", id, desc);
            return Optional.empty();
        }
        ParsedTradeDescription p = parsed.get();
        Instant datetime = ExchangeTimestamps.fromEpochSeconds(entry.get("timestamp"));
        long timestamp = datetime.getEpochSecond();

        String tradeId = TradeIdMatcher.match(tradeFeed, timestamp, p.orderId(), p.amountText())
                .orElseThrow(() -> new ReconciliationException(id,
                        "No trade in TradeHistory for order " + p.orderId() + " at " + timestamp
                                + " with amount " + p.amountText()));

        return Optional.of(Trade.builder()
                .tradeId(tradeId)
                .side(p.side())
                .baseCurrency(p.baseCurrency())
                .counterCurrency(p.counterCurrency())
                .datetime(datetime)
                .orderId(p.orderId())
                .amount(p.amount())
                .price(p.price())
                .fee(fee(p))
                .feeCurrency(p.side() == Side.BUY ? p.baseCurrency() : p.counterCurrency())
                .build());
    }

    /** Buys pay in base currency, sells in counter currency. */
    static BigDecimal fee(ParsedTradeDescription p) {
        BigDecimal charged = p.side() == Side.BUY
                ? p.feePercent().multiply(p.amount())
                : p.feePercent().multiply(p.amount()).multiply(p.price());
        return Decimals.quantize(charged.divide(BigDecimal.valueOf(100)));
    }

    private static String currency(JsonNode entry) {
        String currency = ExchangeJson.text(entry, "currency");
        if (currency == null) throw new IllegalArgumentException("missing field 'currency'");
        return currency.toUpperCase(Locale.ROOT);
    }
}
