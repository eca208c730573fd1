package com.sandkev.cryptex.exchange.btce;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.sandkev.cryptex.domain.Market;
import com.sandkev.cryptex.domain.Order;
import com.sandkev.cryptex.domain.Side;
import com.sandkev.cryptex.domain.Trade;
import com.sandkev.cryptex.domain.Transaction;
import com.sandkev.cryptex.exception.ApiException;
import com.sandkev.cryptex.exception.MarketNotFoundException;
import com.sandkev.cryptex.exchange.ExchangeAdapter;
import com.sandkev.cryptex.shared.http.ExchangeJson;
import com.sandkev.cryptex.shared.http.SignedClient;
import com.sandkev.cryptex.shared.time.ExchangeTimestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * BTC-e trade API (https://btc-e.com/tapi) plus the public {@code info} call for
 * the market list.
 */
@Slf4j
@RequiredArgsConstructor
public class BtceAdapter implements ExchangeAdapter {

    public static final String NAME = "btce";

    private static final int DEFAULT_TRANSACTION_LIMIT = 1000;

    private final SignedClient client;
    private final BtcePairs pairs = new BtcePairs();
    private final BtceHistoryReconciler reconciler = new BtceHistoryReconciler();

    // pairs listed by public info; loaded on the first order
    private volatile Set<Market> listed;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Market> getMarkets() {
        JsonNode info = client.getPublic("info", Map.of());
        var markets = new ArrayList<Market>();
        info.path("pairs").fieldNames().forEachRemaining(pair -> markets.add(pairs.toMarket(pair)));
        listed = Set.copyOf(markets);
        return markets;
    }

    private String listedPair(Market market) {
        Set<Market> known = listed;
        if (known == null) {
            synchronized (this) {
                known = listed;
                if (known == null) {
                    getMarkets();
                    known = listed;
                }
            }
        }
        if (!known.contains(market)) {
            throw new MarketNotFoundException(market.toString());
        }
        return pairs.toNative(market);
    }

    @Override
    public List<Order> getMyOpenOrders() {
        JsonNode orders = client.post("ActiveOrders", Map.of());
        var out = new ArrayList<Order>();
        for (Iterator<Map.Entry<String, JsonNode>> it = orders.fields(); it.hasNext(); ) {
            var e = it.next();
            out.add(toOrder(e.getKey(), e.getValue()));
        }
        return out;
    }

    private Order toOrder(String orderId, JsonNode o) {
        Market market = pairs.toMarket(o.path("pair").asText());
        return Order.builder()
                .orderId(orderId)
                .side(side(o))
                .baseCurrency(market.base())
                .counterCurrency(market.counter())
                .datetime(ExchangeTimestamps.fromEpochSeconds(o.get("timestamp_created")))
                .amount(ExchangeJson.decimal(o, "amount"))
                .price(ExchangeJson.decimal(o, "rate"))
                .build();
    }

    /**
     * Trades are rebuilt from TransHistory, the only feed that carries the fee
     * actually charged. Records that could not be reconciled are logged and left out;
     * use {@link #reconcileHistory(Integer)} to see them.
     */
    @Override
    public List<Trade> getMyTrades(@Nullable Integer limit) {
        ReconciliationResult result = reconciler.reconcile(
                transHistory(limit), tradeHistory(limit), false, true);
        logFailures(result);
        return result.trades();
    }

    @Override
    public List<Transaction> getMyTransactions(@Nullable Integer limit) {
        int count = limit != null ? limit : DEFAULT_TRANSACTION_LIMIT;
        ReconciliationResult result = reconciler.reconcile(
                transHistory(count), JsonNodeFactory.instance.objectNode(), true, false);
        logFailures(result);
        return result.transactions();
    }

    /** Transactions, trades and every record that failed to reconcile, in one pass. */
    public ReconciliationResult reconcileHistory(@Nullable Integer limit) {
        return reconciler.reconcile(transHistory(limit), tradeHistory(limit), true, true);
    }

    @Override
    public void cancelOrder(String orderId) {
        client.post("CancelOrder", Map.of("order_id", orderId));
    }

    @Override
    public String buy(Market market, BigDecimal quantity, BigDecimal price) {
        return createOrder(market, "buy", quantity, price);
    }

    @Override
    public String sell(Market market, BigDecimal quantity, BigDecimal price) {
        return createOrder(market, "sell", quantity, price);
    }

    private String createOrder(Market market, String type, BigDecimal quantity, BigDecimal price) {
        var params = new LinkedHashMap<String, Object>();
        params.put("pair", listedPair(market));
        params.put("type", type);
        params.put("amount", quantity);
        params.put("rate", price);
        JsonNode response = client.post("Trade", params);
        JsonNode orderId = response.get("order_id");
        if (orderId == null || orderId.isNull()) {
            throw new ApiException("Trade response carries no order_id: " + response);
        }
        log.info("Placed {} order {} on {}: {} @ {}", type, orderId.asText(), market, quantity, price);
        return orderId.asText();
    }

    @Override
    public Map<String, BigDecimal> getMyFunds() {
        JsonNode funds = client.post("getInfo", Map.of()).path("funds");
        var out = new LinkedHashMap<String, BigDecimal>();
        for (Iterator<Map.Entry<String, JsonNode>> it = funds.fields(); it.hasNext(); ) {
            var e = it.next();
            out.put(e.getKey().toUpperCase(Locale.ROOT), ExchangeJson.decimal(e.getValue()));
        }
        return out;
    }

    // ---------- Impl details ----------

    private JsonNode transHistory(@Nullable Integer count) {
        return client.post("TransHistory", countParam(count));
    }

    private JsonNode tradeHistory(@Nullable Integer count) {
        return client.post("TradeHistory", countParam(count));
    }

    private static Map<String, Object> countParam(@Nullable Integer count) {
        return count == null ? Map.of() : Map.of("count", count);
    }

    private static Side side(JsonNode node) {
        return "buy".equalsIgnoreCase(node.path("type").asText()) ? Side.BUY : Side.SELL;
    }

    private void logFailures(ReconciliationResult result) {
        for (ReconciliationFailure f : result.failures()) {
            log.warn("[{}] history record {} not reconciled: {}", NAME, f.recordId(), f.reason());
        }
    }
}
