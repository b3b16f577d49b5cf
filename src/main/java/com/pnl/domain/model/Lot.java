package com.pnl.domain.model;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Open quantity left from one transaction. Quantity is a positive magnitude, see {@link LotSide}.
 */
public record Lot(BigDecimal remainingQuantity, BigDecimal unitCost, UUID originatingTransactionId) {

    public BigDecimal costBasis() {
        return remainingQuantity.multiply(unitCost);
    }

    public Lot reduceBy(BigDecimal quantity) {
        return new Lot(remainingQuantity.subtract(quantity), unitCost, originatingTransactionId);
    }
}
