package com.sandkev.cryptex.exchange.cryptsy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sandkev.cryptex.domain.Market;
import com.sandkev.cryptex.domain.Order;
import com.sandkev.cryptex.domain.Side;
import com.sandkev.cryptex.domain.Trade;
import com.sandkev.cryptex.domain.Transaction;
import com.sandkev.cryptex.exception.ApiException;
import com.sandkev.cryptex.exchange.ExchangeAdapter;
import com.sandkev.cryptex.shared.http.ExchangeJson;
import com.sandkev.cryptex.shared.http.SignedClient;
import com.sandkev.cryptex.shared.time.ExchangeTimestamps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Cryptsy authenticated API (https://api.cryptsy.com/api). Markets are numeric
 * ids resolved through {@link CryptsyMarketRegistry}; timestamps are wall-clock
 * strings in the server's timezone.
 */
@Slf4j
public class CryptsyAdapter implements ExchangeAdapter {

    public static final String NAME = "cryptsy";

    private static final int DEFAULT_TRADE_LIMIT = 200;
    private static final String POINTS_CURRENCY = "Points";

    private final SignedClient client;
    private final CryptsyMarketRegistry markets;
    private volatile ZoneId serverZone;

    /**
     * @param serverZone timezone of Cryptsy's timestamps; null to ask {@code getinfo} on first use
     */
    public CryptsyAdapter(SignedClient client, CryptsyMarketRegistry markets, @Nullable ZoneId serverZone) {
        this.client = client;
        this.markets = markets;
        this.serverZone = serverZone;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Market> getMarkets() {
        return markets.markets();
    }

    // ---------- trades ----------

    @Override
    public List<Trade> getMyTrades(@Nullable Integer limit) {
        return getMyTrades(limit, null);
    }

    /** Trades of one market, or of all markets when {@code market} is null. */
    public List<Trade> getMyTrades(@Nullable Integer limit, @Nullable Market market) {
        var params = new LinkedHashMap<String, Object>();
        params.put("limit", limit != null ? limit : DEFAULT_TRADE_LIMIT);

        JsonNode trades;
        String marketId = null;
        if (market == null) {
            trades = client.post("allmytrades", params);
        } else {
            marketId = markets.toNative(market);
            params.put("marketid", marketId);
            trades = client.post("mytrades", params);
        }

        var out = new ArrayList<Trade>();
        for (JsonNode t : trades) {
            // mytrades leaves out the market id it was asked for
            String id = t.hasNonNull("marketid") ? t.get("marketid").asText() : marketId;
            out.add(toTrade(t, markets.toMarket(id)));
        }
        return out;
    }

    private Trade toTrade(JsonNode t, Market market) {
        return Trade.builder()
                .tradeId(t.path("tradeid").asText())
                .side(side(t.path("tradetype")))
                .baseCurrency(market.base())
                .counterCurrency(market.counter())
                .datetime(toInstant(t.path("datetime").asText()))
                .orderId(t.path("order_id").asText())
                .amount(ExchangeJson.decimal(t, "quantity"))
                .price(ExchangeJson.decimal(t, "tradeprice"))
                .fee(ExchangeJson.decimal(t, "fee"))
                // Cryptsy always takes its fee from the counter currency
                .feeCurrency(market.counter())
                .build();
    }

    // ---------- orders ----------

    @Override
    public List<Order> getMyOpenOrders() {
        return getMyOpenOrders(null);
    }

    public List<Order> getMyOpenOrders(@Nullable Market market) {
        JsonNode orders;
        String marketId = null;
        if (market == null) {
            orders = client.post("allmyorders", Map.of());
        } else {
            marketId = markets.toNative(market);
            orders = client.post("myorders", Map.of("marketid", marketId));
        }

        var out = new ArrayList<Order>();
        for (JsonNode o : orders) {
            String id = o.hasNonNull("marketid") ? o.get("marketid").asText() : marketId;
            Market m = markets.toMarket(id);
            out.add(Order.builder()
                    .orderId(o.path("orderid").asText())
                    .side(side(o.path("ordertype")))
                    .baseCurrency(m.base())
                    .counterCurrency(m.counter())
                    .datetime(toInstant(o.path("created").asText()))
                    .amount(ExchangeJson.decimal(o, "quantity"))
                    .price(ExchangeJson.decimal(o, "price"))
                    .build());
        }
        return out;
    }

    /** Order book of one market as Cryptsy returns it ({@code sellorders}, {@code buyorders}). */
    public JsonNode getMarketOrders(Market market) {
        return client.post("marketorders", Map.of("marketid", markets.toNative(market)));
    }

    /** Recent trades of one market; {@code datetime} is rewritten as an ISO-8601 UTC instant. */
    public JsonNode getMarketTrades(Market market) {
        JsonNode trades = client.post("markettrades", Map.of("marketid", markets.toNative(market)));
        if (trades instanceof ArrayNode array) {
            for (JsonNode t : array) {
                if (t instanceof ObjectNode o && o.hasNonNull("datetime")) {
                    o.put("datetime", toInstant(o.get("datetime").asText()).toString());
                }
            }
        }
        return trades;
    }

    @Override
    public void cancelOrder(String orderId) {
        client.post("cancelorder", Map.of("orderid", orderId));
    }

    @Override
    public String buy(Market market, BigDecimal quantity, BigDecimal price) {
        return createOrder(market, "Buy", quantity, price);
    }

    @Override
    public String sell(Market market, BigDecimal quantity, BigDecimal price) {
        return createOrder(market, "Sell", quantity, price);
    }

    private String createOrder(Market market, String orderType, BigDecimal quantity, BigDecimal price) {
        var params = new LinkedHashMap<String, Object>();
        params.put("marketid", markets.toNative(market));
        params.put("ordertype", orderType);
        params.put("quantity", quantity);
        params.put("price", price);
        JsonNode response = client.post("createorder", params);
        JsonNode orderId = response.get("orderid");
        if (orderId == null || orderId.isNull()) {
            throw new ApiException("createorder response carries no orderid: " + response);
        }
        log.info("Placed {} order {} on {}: {} @ {} ({})", orderType, orderId.asText(), market, quantity, price,
                response.path("moreinfo").asText(""));
        return orderId.asText();
    }

    // ---------- funds ----------

    /**
     * Deposits, withdrawals and processed internal transfers. Cryptsy offers no
     * limit on these calls, so {@code limit} is not used.
     */
    @Override
    public List<Transaction> getMyTransactions(@Nullable Integer limit) {
        var out = new ArrayList<Transaction>();
        for (JsonNode t : client.post("mytransactions", Map.of())) {
            Transaction.Kind kind = transactionKind(t);
            if (kind == null) {
                log.debug("Skipping Cryptsy transaction {} of type {}", t.path("trxid").asText(), t.path("type").asText());
                continue;
            }
            out.add(Transaction.builder()
                    .transactionId(t.path("trxid").asText())
                    .kind(kind)
                    .datetime(toInstant(t.path("datetime").asText()))
                    .currency(t.path("currency").asText())
                    .amount(ExchangeJson.decimal(t, "amount"))
                    .address(t.path("address").asText(""))
                    .fee(t.hasNonNull("fee") ? ExchangeJson.decimal(t, "fee") : null)
                    .build());
        }
        out.addAll(getMyTransfers());
        return out;
    }

    @Nullable
    private static Transaction.Kind transactionKind(JsonNode t) {
        String type = t.path("type").asText();
        if ("Withdrawal".equals(type)) return Transaction.Kind.WITHDRAWAL;
        if ("Deposit".equals(type)) {
            // CryptsyPoints credits are not real deposits
            return POINTS_CURRENCY.equals(t.path("currency").asText()) ? Transaction.Kind.GENERIC : Transaction.Kind.DEPOSIT;
        }
        return null;
    }

    /** Internal transfers between Cryptsy accounts, as deposits (in) and withdrawals (out). */
    List<Transaction> getMyTransfers() {
        var out = new ArrayList<Transaction>();
        for (JsonNode t : client.post("mytransfers", Map.of())) {
            if (t.path("processed").asInt(0) != 1) {
                continue;
            }
            String direction = t.path("direction").asText();
            Transaction.Kind kind = switch (direction) {
                case "in" -> Transaction.Kind.DEPOSIT;
                case "out" -> Transaction.Kind.WITHDRAWAL;
                default -> Transaction.Kind.GENERIC;
            };
            out.add(Transaction.builder()
                    .transactionId(transferId(t))
                    .kind(kind)
                    .datetime(toInstant(t.path("processed_timestamp").asText()))
                    .currency(t.path("currency").asText())
                    .amount(ExchangeJson.decimal(t, "quantity"))
                    .address(t.path("to").asText(""))
                    .build());
        }
        return out;
    }

    /** Transfers have no id of their own; derive a stable one from their content. */
    static String transferId(JsonNode transfer) {
        var fields = new TreeMap<String, String>();
        for (Iterator<Map.Entry<String, JsonNode>> it = transfer.fields(); it.hasNext(); ) {
            var e = it.next();
            fields.put(e.getKey(), ExchangeJson.plainText(e.getValue()));
        }
        return UUID.nameUUIDFromBytes(fields.toString().getBytes(StandardCharsets.UTF_8)).toString();
    }

    @Override
    public Map<String, BigDecimal> getMyFunds() {
        JsonNode available = getInfo().path("balances_available");
        var out = new LinkedHashMap<String, BigDecimal>();
        for (Iterator<Map.Entry<String, JsonNode>> it = available.fields(); it.hasNext(); ) {
            var e = it.next();
            out.put(e.getKey().toUpperCase(Locale.ROOT), ExchangeJson.decimal(e.getValue()));
        }
        return out;
    }

    // ---------- Impl details ----------

    private JsonNode getInfo() {
        return client.post("getinfo", Map.of());
    }

    Instant toInstant(String cryptsyTime) {
        return ExchangeTimestamps.fromLocal(cryptsyTime, serverZone());
    }

    private ZoneId serverZone() {
        ZoneId zone = serverZone;
        if (zone == null) {
            String reported = getInfo().path("servertimezone").asText("");
            if (reported.isBlank()) {
                throw new ApiException("getinfo reports no servertimezone");
            }
            zone = ExchangeTimestamps.zone(reported);
            serverZone = zone;
            log.info("Cryptsy server timezone is {}", zone);
        }
        return zone;
    }

    private static Side side(JsonNode type) {
        return "Buy".equalsIgnoreCase(type.asText()) ? Side.BUY : Side.SELL;
    }
}
