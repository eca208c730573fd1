package com.sandkev.cryptex.domain;

import com.sandkev.cryptex.shared.Decimals;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Funds moving in or out of the account. Withdrawal fees are charged on top of
 * the requested amount, deposit fees are taken out of it.
 */
@Builder
public record Transaction(
        String transactionId,
        Kind kind,
        Instant datetime,
        String currency,
        BigDecimal amount,
        String address,
        BigDecimal fee
) {

    public enum Kind {
        DEPOSIT,
        WITHDRAWAL,
        /** Neither deposit nor withdrawal, e.g. exchange loyalty point credits. */
        GENERIC
    }

    public Transaction {
        Objects.requireNonNull(transactionId, "transactionId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(amount, "amount");
        if (address == null) address = "";
    }

    public BigDecimal netAmount() {
        switch (kind) {
            case DEPOSIT:
                return hasFee() ? Decimals.quantize(amount.subtract(fee)) : amount;
            case WITHDRAWAL:
                return hasFee() ? Decimals.quantize(amount.add(fee)) : amount;
            default:
                throw new UnsupportedOperationException("no net amount for " + kind + " transaction " + transactionId);
        }
    }

    private boolean hasFee() {
        return fee != null && fee.signum() != 0;
    }
}
