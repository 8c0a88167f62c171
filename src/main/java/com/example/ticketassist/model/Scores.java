package com.example.ticketassist.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Scores {

    private Scores() {
    }

    /** Rounds to three decimals, half-even. */
    public static double round3(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_EVEN).doubleValue();
    }
}
