package com.sandkev.cryptex.shared;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Monetary rounding shared by every exchange. Fees and net amounts are always
 * handed out with exactly eight fraction digits.
 */
public final class Decimals {

    public static final int SCALE = 8;

    private Decimals() {}

    public static BigDecimal quantize(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_EVEN);
    }
}
