package com.sandkev.cryptex.shared.time;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/** Converts exchange-native time representations to UTC instants. */
public final class ExchangeTimestamps {

    private static final DateTimeFormatter LOCAL_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private ExchangeTimestamps() {}

    /** Epoch seconds, either numeric or as a numeric string. */
    public static Instant fromEpochSeconds(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("missing timestamp");
        }
        long seconds = node.isNumber() ? node.longValue() : Long.parseLong(node.asText().trim());
        return Instant.ofEpochSecond(seconds);
    }

    /**
     * Zone from an id as exchanges report it. Three-letter abbreviations such as
     * "EST" go through {@link ZoneId#SHORT_IDS}.
     */
    public static ZoneId zone(String id) {
        return ZoneId.of(id.trim(), ZoneId.SHORT_IDS);
    }

    /** "yyyy-MM-dd HH:mm:ss" wall-clock time in the exchange's zone. */
    public static Instant fromLocal(String text, ZoneId exchangeZone) {
        return LocalDateTime.parse(text.trim(), LOCAL_FORMAT).atZone(exchangeZone).toInstant();
    }
}
