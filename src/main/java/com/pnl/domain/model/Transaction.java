package com.pnl.domain.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable ledger record. Quantity is always a positive magnitude, the kind carries the direction.
 * A {@code null} fee means the fee was not reported and is derived from the asset class.
 */
@Builder(toBuilder = true)
public record Transaction(
        UUID id,
        UUID portfolioId,
        UUID assetId,
        String symbol,
        AssetClass assetClass,
        TransactionKind kind,
        BigDecimal quantity,
        BigDecimal price,
        BigDecimal fees,
        Currency currency,
        Instant occurredAt,
        String strategyTag
) {

    public static final String COVERED_CALL = "covered_call";

    public boolean isOption() {
        return assetClass != null && assetClass.isOption();
    }

    public boolean hasStrategyTag() {
        return strategyTag != null && !strategyTag.isBlank();
    }

    public BigDecimal grossAmount() {
        return quantity.multiply(price);
    }
}
