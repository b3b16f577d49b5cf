package com.pnl.domain.model;

import java.math.BigDecimal;

/**
 * Effect of a single transaction on a {@code CostBasisLedger}.
 *
 * @param realizedPL   realized P&L recognized by this transaction
 * @param feesApplied  fees already deducted inside {@code realizedPL}
 * @param fees         effective fees of the transaction, reported or derived
 * @param orphan       set when the transaction was quarantined
 */
public record LedgerEntry(
        Transaction transaction,
        BigDecimal realizedPL,
        BigDecimal feesApplied,
        BigDecimal fees,
        OrphanTransaction orphan
) {

    public boolean isOrphan() {
        return orphan != null;
    }

    public BigDecimal unappliedFees() {
        return fees.subtract(feesApplied);
    }

    public BigDecimal dividendIncome() {
        return transaction.kind() == TransactionKind.DIVIDEND ? realizedPL : BigDecimal.ZERO;
    }
}
