package com.sandkev.cryptex.exchange.btce;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.sandkev.cryptex.shared.http.EndpointQuirks;

import java.util.Optional;

/** BTC-e reports an empty order list as the error "no orders". */
public class BtceQuirks implements EndpointQuirks {

    static final String NO_ORDERS = "no orders";

    @Override
    public Optional<JsonNode> translateError(String method, String message) {
        if (NO_ORDERS.equals(message)) {
            return Optional.of(JsonNodeFactory.instance.objectNode());
        }
        return Optional.empty();
    }
}
