package com.pnl.application.usecase.position;

import com.pnl.domain.exception.Errors;
import com.pnl.domain.exception.ServiceException;
import com.pnl.domain.model.LedgerSnapshot;
import com.pnl.domain.model.OrphanTransaction;
import com.pnl.domain.model.Position;
import com.pnl.domain.model.Transaction;
import com.pnl.domain.port.PositionRepository;
import com.pnl.domain.port.TransactionRepository;
import com.pnl.domain.service.CostBasisLedger;
import com.pnl.domain.service.LedgerFactory;
import com.pnl.domain.service.OptionExpirationSynthesizer;
import com.pnl.domain.service.StrategyClassifier;
import com.pnl.domain.usecase.ReconcilePositionsUseCase;
import com.pnl.infrastructure.config.EngineConfig;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Rebuilds every position of a portfolio from its full transaction history.
 * All positions are computed in memory first; writes start only once every asset computed successfully.
 */
@Slf4j
@ApplicationScoped
public class ReconcilePositionsService implements ReconcilePositionsUseCase {

    private final TransactionRepository transactionRepository;
    private final PositionRepository positionRepository;
    private final LedgerFactory ledgerFactory;
    private final OptionExpirationSynthesizer expirationSynthesizer;
    private final StrategyClassifier.Factory strategyClassifierFactory;
    private final EngineConfig config;
    private final Clock clock;

    public ReconcilePositionsService(TransactionRepository transactionRepository,
                                     PositionRepository positionRepository,
                                     LedgerFactory ledgerFactory,
                                     OptionExpirationSynthesizer expirationSynthesizer,
                                     StrategyClassifier.Factory strategyClassifierFactory,
                                     EngineConfig config,
                                     Clock clock) {
        this.transactionRepository = transactionRepository;
        this.positionRepository = positionRepository;
        this.ledgerFactory = ledgerFactory;
        this.expirationSynthesizer = expirationSynthesizer;
        this.strategyClassifierFactory = strategyClassifierFactory;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<Result> execute(Command command) {
        if (command == null || command.portfolioId() == null) {
            return Uni.createFrom().item(new Result.Failed(Errors.Reconciliation.INVALID_INPUT, "Portfolio id is required"));
        }

        UUID portfolioId = command.portfolioId();
        log.info("Reconciling positions: portfolioId={}", portfolioId);

        return Uni.combine().all()
                .unis(transactionRepository.listTransactions(portfolioId), positionRepository.listPositions(portfolioId))
                .asTuple()
                .onFailure().transform(throwable -> new ServiceException(
                        Errors.Reconciliation.PERSISTENCE_ERROR, "Failed to read portfolio history: " + throwable.getMessage(), throwable))
                .map(history -> plan(portfolioId, history.getItem1(), history.getItem2()))
                .flatMap(plan -> write(plan).replaceWith(plan))
                .map(plan -> toResult(portfolioId, plan))
                .onFailure().recoverWithItem(throwable -> toFailure(portfolioId, throwable));
    }

    private Plan plan(UUID portfolioId, List<Transaction> transactions, List<Position> existingPositions) {
        ZoneId zone = config.zone();
        LocalDate today = clock.instant().atZone(zone).toLocalDate();
        StrategyClassifier strategyClassifier = strategyClassifierFactory.forHistory(transactions);

        Map<UUID, List<Transaction>> byAsset = groupByAsset(transactions);
        Map<UUID, Position> existingByAsset = existingPositions.stream()
                .collect(Collectors.toMap(Position::getAssetId, position -> position, (first, second) -> first, LinkedHashMap::new));

        List<Position> upserts = new ArrayList<>();
        List<Position> removals = new ArrayList<>();
        List<OrphanTransaction> orphans = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        byAsset.forEach((assetId, assetStream) -> {
            OptionExpirationSynthesizer.Outcome outcome =
                    expirationSynthesizer.synthesize(assetStream, strategyClassifier, today, zone);
            outcome.configurationWarning().ifPresent(warnings::add);

            List<Transaction> stream = outcome.transactions();
            CostBasisLedger ledger = ledgerFactory.open(stream.get(0), strategyClassifier);
            ledger.applyAll(stream);
            LedgerSnapshot snapshot = ledger.snapshot();
            orphans.addAll(snapshot.orphans());

            if (!snapshot.isFlat()) {
                Transaction last = stream.get(stream.size() - 1);
                upserts.add(Position.fromLedger(stream.get(0), snapshot, last.occurredAt()));
                log.debug("Position computed: portfolioId={}, symbol={}, quantity={}, realizedPL={}",
                        portfolioId, ledger.getSymbol(), snapshot.quantity(), snapshot.realizedPL());
            } else if (existingByAsset.containsKey(assetId) && needsRemoval(existingByAsset.get(assetId))) {
                removals.add(existingByAsset.get(assetId));
            }
        });

        existingByAsset.forEach((assetId, position) -> {
            if (!byAsset.containsKey(assetId) && needsRemoval(position)) {
                log.warn("Stored position has no transactions: portfolioId={}, symbol={}, quantity={}",
                        portfolioId, position.getSymbol(), position.getQuantity());
                removals.add(position);
            }
        });

        return new Plan(List.copyOf(upserts), List.copyOf(removals), List.copyOf(orphans), List.copyOf(warnings));
    }

    private Map<UUID, List<Transaction>> groupByAsset(List<Transaction> transactions) {
        Map<UUID, List<Transaction>> byAsset = new LinkedHashMap<>();
        for (Transaction transaction : transactions) {
            if (transaction.assetId() == null) {
                throw new ServiceException(Errors.Ledger.INVALID_TRANSACTION,
                        "Asset id is required, transactionId=" + transaction.id());
            }
            byAsset.computeIfAbsent(transaction.assetId(), ignored -> new ArrayList<>()).add(transaction);
        }
        return byAsset;
    }

    private Uni<Void> write(Plan plan) {
        List<Supplier<Uni<Void>>> writes = new ArrayList<>();
        plan.upserts().forEach(position -> writes.add(() -> positionRepository.upsertPosition(position).replaceWithVoid()));
        plan.removals().forEach(position -> writes.add(() -> remove(position)));

        return Multi.createFrom().iterable(writes)
                .onItem().transformToUniAndConcatenate(Supplier::get)
                .collect().asList()
                .replaceWithVoid()
                .onFailure().transform(throwable -> new ServiceException(
                        Errors.Reconciliation.PERSISTENCE_ERROR, "Failed to write positions: " + throwable.getMessage(), throwable));
    }

    private boolean needsRemoval(Position position) {
        return switch (config.reconciliation().zeroQuantityPolicy()) {
            case DELETE -> true;
            case DEACTIVATE -> !Boolean.FALSE.equals(position.getIsActive()) || position.hasQuantity();
        };
    }

    private Uni<Void> remove(Position position) {
        return switch (config.reconciliation().zeroQuantityPolicy()) {
            case DELETE -> positionRepository.deletePosition(position.getPortfolioId(), position.getAssetId());
            case DEACTIVATE -> positionRepository.upsertPosition(position.markAsInactive()).replaceWithVoid();
        };
    }

    private Result toResult(UUID portfolioId, Plan plan) {
        List<UUID> removedAssetIds = plan.removals().stream().map(Position::getAssetId).toList();

        log.info("Reconciliation finished: portfolioId={}, positions={}, removed={}, orphans={}, warnings={}",
                portfolioId, plan.upserts().size(), removedAssetIds.size(), plan.orphans().size(), plan.warnings().size());

        if (plan.orphans().isEmpty() && plan.warnings().isEmpty()) {
            return new Result.Succeeded(plan.upserts(), removedAssetIds);
        }
        return new Result.Degraded(plan.upserts(), removedAssetIds, plan.orphans(), plan.warnings());
    }

    private Result toFailure(UUID portfolioId, Throwable throwable) {
        log.error("Reconciliation failed: portfolioId={}", portfolioId, throwable);

        if (throwable instanceof ServiceException serviceException
                && serviceException.getErrorCode().startsWith(Errors.Reconciliation.errorCode)) {
            return new Result.Failed(serviceException.getError(), serviceException.getMessage());
        }
        if (throwable instanceof ServiceException serviceException) {
            return new Result.Failed(Errors.Reconciliation.CALCULATION_ERROR, serviceException.getMessage());
        }
        return new Result.Failed(Errors.Reconciliation.CALCULATION_ERROR,
                "Failed to reconcile positions: " + throwable.getMessage());
    }

    private record Plan(List<Position> upserts,
                        List<Position> removals,
                        List<OrphanTransaction> orphans,
                        List<String> warnings) {
    }
}
