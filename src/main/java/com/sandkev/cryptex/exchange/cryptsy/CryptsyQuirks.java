package com.sandkev.cryptex.exchange.cryptsy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sandkev.cryptex.shared.http.EndpointQuirks;

/**
 * Cryptsy's createorder answers with {@code orderid} and {@code moreinfo} at the
 * top level instead of under {@code return}.
 */
public class CryptsyQuirks implements EndpointQuirks {

    static final String CREATE_ORDER = "createorder";

    @Override
    public JsonNode normalizeResponse(String method, JsonNode body) {
        if (!CREATE_ORDER.equals(method) || !body.isObject() || body.has("return")) {
            return body;
        }
        ObjectNode fixed = ((ObjectNode) body).deepCopy();
        ObjectNode ret = fixed.putObject("return");
        ret.set("orderid", body.get("orderid"));
        ret.set("moreinfo", body.get("moreinfo"));
        return fixed;
    }
}
