package com.sandkev.cryptex.exception;

/**
 * The exchange rejected the nonce of a signed request. Minimum-nonce state lives
 * on the exchange side per API key, so this is fatal for the credential set.
 */
public class InvalidNonceException extends ApiException {

    public InvalidNonceException(String message) {
        super(message);
    }
}
