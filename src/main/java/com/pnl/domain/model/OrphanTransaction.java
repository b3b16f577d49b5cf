package com.pnl.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A transaction that could not be matched against known lots. Kept for diagnostics, excluded from totals.
 */
public record OrphanTransaction(
        UUID transactionId,
        UUID portfolioId,
        UUID assetId,
        String symbol,
        TransactionKind kind,
        BigDecimal requestedQuantity,
        BigDecimal availableQuantity,
        Instant occurredAt,
        String reason
) {

    public static OrphanTransaction of(Transaction transaction, BigDecimal availableQuantity, String reason) {
        return new OrphanTransaction(
                transaction.id(),
                transaction.portfolioId(),
                transaction.assetId(),
                transaction.symbol(),
                transaction.kind(),
                transaction.quantity(),
                availableQuantity,
                transaction.occurredAt(),
                reason
        );
    }
}
