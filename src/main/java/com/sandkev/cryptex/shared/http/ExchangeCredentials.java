package com.sandkev.cryptex.shared.http;

import java.util.Objects;

/** API key and shared secret. Kept out of logs: {@link #toString()} masks both. */
public record ExchangeCredentials(String apiKey, String secretKey) {

    public ExchangeCredentials {
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(secretKey, "secretKey");
    }

    @Override
    public String toString() {
        return "ExchangeCredentials[apiKey=***, secretKey=***]";
    }
}
