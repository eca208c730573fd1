package com.sandkev.cryptex.exception;

import lombok.Getter;

/**
 * A history record matched a trade description but no trade id could be
 * recovered from the trade-history feed.
 */
@Getter
public class ReconciliationException extends RuntimeException {

    private final String recordId;

    public ReconciliationException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }
}
