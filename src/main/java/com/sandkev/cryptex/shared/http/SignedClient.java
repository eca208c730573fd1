package com.sandkev.cryptex.shared.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Single-endpoint exchange API: every private action is a signed POST selected
 * by a {@code method} field; public data is a plain GET.
 */
public interface SignedClient {

    /** Signed POST; returns the unwrapped payload. */
    JsonNode post(String method, Map<String, Object> params);

    /** Unsigned GET against the public API; returns the unwrapped payload. */
    JsonNode getPublic(String path, Map<String, Object> params);
}
