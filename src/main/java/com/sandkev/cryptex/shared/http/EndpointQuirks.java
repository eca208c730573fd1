package com.sandkev.cryptex.shared.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Per-exchange deviations from the common envelope, applied by
 * {@link SignedClientImpl} so the protocol code never branches on exchange identity.
 */
public interface EndpointQuirks {

    EndpointQuirks NONE = new EndpointQuirks() {};

    /**
     * Turns a known benign error into a result. An empty optional lets the
     * error propagate as an exception.
     */
    default Optional<JsonNode> translateError(String method, String message) {
        return Optional.empty();
    }

    /** Reshapes a successful response body before its payload is unwrapped. */
    default JsonNode normalizeResponse(String method, JsonNode body) {
        return body;
    }
}
