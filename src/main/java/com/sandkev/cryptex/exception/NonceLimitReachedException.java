package com.sandkev.cryptex.exception;

import lombok.Getter;

/** The nonce we sent is at or below what the exchange has already seen for this key. */
@Getter
public class NonceLimitReachedException extends InvalidNonceException {

    private final long expectedNonce;

    public NonceLimitReachedException(String message, long expectedNonce) {
        super(message);
        this.expectedNonce = expectedNonce;
    }
}
