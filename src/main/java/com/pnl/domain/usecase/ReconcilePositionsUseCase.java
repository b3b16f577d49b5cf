package com.pnl.domain.usecase;

import com.pnl.domain.model.OrphanTransaction;
import com.pnl.domain.model.Position;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.UUID;

/**
 * Use case for rebuilding every position of a portfolio from its full transaction history
 */
public interface ReconcilePositionsUseCase {

    /**
     * Recompute all positions in memory, then write them
     */
    Uni<Result> execute(Command command);

    /**
     * Result of a reconciliation pass
     */
    sealed interface Result {
        record Succeeded(List<Position> positions, List<UUID> removedAssetIds) implements Result {}
        record Degraded(List<Position> positions,
                        List<UUID> removedAssetIds,
                        List<OrphanTransaction> orphans,
                        List<String> warnings) implements Result {}
        record Failed(com.pnl.domain.exception.Error error, String message) implements Result {}
    }

    record Command(UUID portfolioId) {}
}
