package com.sandkev.cryptex.exception;

public class MarketNotFoundException extends ApiException {

    public MarketNotFoundException(String market) {
        super("Market not found: " + market);
    }
}
