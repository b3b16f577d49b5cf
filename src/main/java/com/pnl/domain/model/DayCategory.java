package com.pnl.domain.model;

import java.math.BigDecimal;

/**
 * Calendar colour category of a day
 */
public enum DayCategory {
    NO_TRANSACTIONS,
    NEUTRAL,
    POSITIVE,
    NEGATIVE;

    public static DayCategory of(boolean hasTransactions, BigDecimal netPL, BigDecimal threshold) {
        if (!hasTransactions) {
            return NO_TRANSACTIONS;
        }
        if (netPL.abs().compareTo(threshold) <= 0) {
            return NEUTRAL;
        }
        return netPL.signum() > 0 ? POSITIVE : NEGATIVE;
    }
}
