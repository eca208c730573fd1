package com.sandkev.cryptex.exception;

/**
 * Remote failure reported by an exchange: a falsy {@code success} flag, an empty
 * or malformed body, or an HTTP error status.
 */
public class ApiException extends RuntimeException {

    public ApiException(String message) {
        super(message);
    }

    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
