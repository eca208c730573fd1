package com.sandkev.cryptex.exchange.btce;

import com.fasterxml.jackson.databind.JsonNode;
import com.sandkev.cryptex.shared.http.ExchangeJson;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the TradeHistory id behind a trade seen in TransHistory. Entries are
 * matched on timestamp and order id; fills of the same order in the same second
 * are told apart by their amount.
 */
final class TradeIdMatcher {

    private TradeIdMatcher() {}

    /**
     * @param tradeFeed  TradeHistory payload, {@code {tradeId: {timestamp, order_id, amount, ...}}}
     * @param amountText amount as written in the description
     */
    static Optional<String> match(JsonNode tradeFeed, long timestamp, String orderId, String amountText) {
        List<Map.Entry<String, JsonNode>> candidates = new ArrayList<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = tradeFeed.fields(); it.hasNext(); ) {
            var e = it.next();
            JsonNode t = e.getValue();
            JsonNode ts = t.get("timestamp");
            JsonNode order = t.get("order_id");
            if (ts == null || order == null) continue;
            if (ts.asLong() == timestamp && orderId.equals(order.asText())) {
                candidates.add(e);
            }
        }

        if (candidates.isEmpty()) return Optional.empty();
        if (candidates.size() == 1) return Optional.of(candidates.get(0).getKey());

        for (var c : candidates) {
            if (amountText.equals(ExchangeJson.plainText(c.getValue().get("amount")))) {
                return Optional.of(c.getKey());
            }
        }

        // Descriptions may show a display-rounded amount: prefer the longest shared
        // leading run of characters. First candidate to reach a new best keeps it.
        String best = null;
        int bestScore = 0;
        for (var c : candidates) {
            int score = commonPrefixLength(amountText, ExchangeJson.plainText(c.getValue().get("amount")));
            if (score > bestScore) {
                best = c.getKey();
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    static int commonPrefixLength(String a, String b) {
        int n = Math.min(a.length(), b.length());
        int i = 0;
        while (i < n && a.charAt(i) == b.charAt(i)) i++;
        return i;
    }
}
