package com.pnl.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * State of a {@code CostBasisLedger} at a point in the stream
 */
public record LedgerSnapshot(
        List<LotSide> openLots,
        BigDecimal quantity,
        BigDecimal realizedPL,
        BigDecimal totalCostBasis,
        BigDecimal averageCost,
        List<OrphanTransaction> orphans
) {

    public boolean isFlat() {
        return quantity.signum() == 0;
    }
}
