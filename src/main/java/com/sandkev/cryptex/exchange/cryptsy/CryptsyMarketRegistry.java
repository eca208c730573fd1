package com.sandkev.cryptex.exchange.cryptsy;

import com.fasterxml.jackson.databind.JsonNode;
import com.sandkev.cryptex.domain.Market;
import com.sandkev.cryptex.exception.MarketNotFoundException;
import com.sandkev.cryptex.exchange.MarketIdMapper;
import com.sandkev.cryptex.shared.http.SignedClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cryptsy refers to markets by numeric id. The id map comes from
 * {@code getmarkets} once and is kept until {@link #refresh()}.
 */
@Slf4j
@RequiredArgsConstructor
public class CryptsyMarketRegistry implements MarketIdMapper {

    private final SignedClient client;

    private volatile Map<String, Market> byId;

    public List<Market> markets() {
        return new ArrayList<>(loaded().values());
    }

    @Override
    public String toNative(Market market) {
        for (var e : loaded().entrySet()) {
            if (e.getValue().equals(market)) return e.getKey();
        }
        throw new MarketNotFoundException(market.toString());
    }

    @Override
    public Market toMarket(String marketId) {
        Market market = loaded().get(marketId);
        if (market == null) throw new MarketNotFoundException(marketId);
        return market;
    }

    /** Re-reads the market list from the exchange. */
    public synchronized void refresh() {
        byId = fetch();
    }

    private Map<String, Market> loaded() {
        Map<String, Market> current = byId;
        if (current == null) {
            synchronized (this) {
                current = byId;
                if (current == null) {
                    current = fetch();
                    byId = current;
                }
            }
        }
        return current;
    }

    private Map<String, Market> fetch() {
        JsonNode markets = client.post("getmarkets", Map.of());
        var out = new LinkedHashMap<String, Market>();
        for (JsonNode m : markets) {
            out.put(m.path("marketid").asText(),
                    new Market(m.path("primary_currency_code").asText(), m.path("secondary_currency_code").asText()));
        }
        log.info("Loaded {} Cryptsy markets", out.size());
        return Collections.unmodifiableMap(out);
    }
}
