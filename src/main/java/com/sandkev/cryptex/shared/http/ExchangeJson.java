package com.sandkev.cryptex.shared.http;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.math.BigDecimal;

/**
 * JSON decoding for exchange payloads. Every number is read as an exact
 * {@link BigDecimal}; prices and amounts never pass through a double.
 */
public final class ExchangeJson {

    private ExchangeJson() {}

    public static ObjectMapper newMapper() {
        return JsonMapper.builder()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .nodeFactory(JsonNodeFactory.withExactBigDecimals(true))
                .build();
    }

    /** Numeric node or numeric string as a decimal. */
    public static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("missing decimal value");
        }
        return node.isNumber() ? node.decimalValue() : new BigDecimal(node.asText().trim());
    }

    public static BigDecimal decimal(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null) {
            throw new IllegalArgumentException("missing field '" + field + "'");
        }
        return decimal(node);
    }

    /**
     * Number as it would be written, without exponent. Used where the textual
     * form itself carries meaning (comparing amounts digit by digit).
     */
    public static String plainText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return "";
        return node.isNumber() ? node.decimalValue().toPlainString() : node.asText();
    }

    public static String text(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
