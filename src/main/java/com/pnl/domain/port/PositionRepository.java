package com.pnl.domain.port;

import com.pnl.domain.model.Position;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.UUID;

public interface PositionRepository {

    Uni<List<Position>> listPositions(UUID portfolioId);

    Uni<Position> upsertPosition(Position position);

    Uni<Void> deletePosition(UUID portfolioId, UUID assetId);
}
