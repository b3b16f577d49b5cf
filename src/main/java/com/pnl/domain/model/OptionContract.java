package com.pnl.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Parsed option symbol, e.g. {@code AAPL250117C00150000}
 */
public record OptionContract(
        String underlying,
        LocalDate expirationDate,
        OptionType optionType,
        BigDecimal strike
) {

    public boolean isExpiredOn(LocalDate today) {
        return expirationDate.isBefore(today);
    }
}
