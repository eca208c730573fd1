package com.sandkev.cryptex.exchange.btce;

import com.sandkev.cryptex.domain.Trade;
import com.sandkev.cryptex.domain.Transaction;

import java.util.List;

/** Outcome of one pass over the history feed, in feed order. */
public record ReconciliationResult(
        List<Transaction> transactions,
        List<Trade> trades,
        List<ReconciliationFailure> failures
) {

    public ReconciliationResult {
        transactions = List.copyOf(transactions);
        trades = List.copyOf(trades);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
