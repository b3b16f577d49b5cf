package com.pnl.infrastructure.persistence.adapter;

import com.pnl.domain.model.Position;
import com.pnl.domain.port.PositionRepository;
import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@DefaultBean
@ApplicationScoped
public class InMemoryPositionRepository implements PositionRepository {

    private final Map<UUID, Map<UUID, Position>> positionsByPortfolio = new ConcurrentHashMap<>();

    @Override
    public Uni<List<Position>> listPositions(UUID portfolioId) {
        return Uni.createFrom().item(() -> positionsByPortfolio.getOrDefault(portfolioId, Map.of()).values().stream()
                .sorted(Comparator.comparing(Position::getSymbol))
                .toList());
    }

    @Override
    public Uni<Position> upsertPosition(Position position) {
        return Uni.createFrom().item(() -> {
            positionsByPortfolio.computeIfAbsent(position.getPortfolioId(), ignored -> new ConcurrentHashMap<>())
                    .put(position.getAssetId(), position);
            log.debug("Position upserted: portfolioId={}, symbol={}, quantity={}",
                    position.getPortfolioId(), position.getSymbol(), position.getQuantity());
            return position;
        });
    }

    @Override
    public Uni<Void> deletePosition(UUID portfolioId, UUID assetId) {
        return Uni.createFrom().item(() -> {
            Map<UUID, Position> positions = positionsByPortfolio.get(portfolioId);
            if (positions != null) {
                positions.remove(assetId);
            }
            return (Void) null;
        });
    }
}
