package com.pnl.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Position domain entity derived from the full transaction history of one asset.
 * Quantity is signed, a negative value is a net short option position.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public class Position {
    private final UUID portfolioId;
    private final UUID assetId;
    private final String symbol;
    private final AssetClass assetClass;
    private final Currency currency;
    private final BigDecimal quantity;
    private final BigDecimal averageCostBasis;
    private final BigDecimal totalCostBasis;
    private final BigDecimal realizedPL;
    private final Boolean isActive;
    private final Instant lastTransactionAt;

    public static Position fromLedger(Transaction reference, LedgerSnapshot snapshot, Instant lastTransactionAt) {
        return Position.builder()
                .portfolioId(reference.portfolioId())
                .assetId(reference.assetId())
                .symbol(reference.symbol())
                .assetClass(reference.assetClass())
                .currency(reference.currency())
                .quantity(snapshot.quantity())
                .averageCostBasis(snapshot.averageCost())
                .totalCostBasis(snapshot.totalCostBasis())
                .realizedPL(snapshot.realizedPL())
                .isActive(!snapshot.isFlat())
                .lastTransactionAt(lastTransactionAt)
                .build();
    }

    public boolean hasQuantity() {
        return quantity != null && quantity.signum() != 0;
    }

    public boolean isShort() {
        return quantity != null && quantity.signum() < 0;
    }

    public Position markAsInactive() {
        return toBuilder()
                .quantity(BigDecimal.ZERO)
                .averageCostBasis(BigDecimal.ZERO)
                .totalCostBasis(BigDecimal.ZERO)
                .isActive(false)
                .build();
    }
}
