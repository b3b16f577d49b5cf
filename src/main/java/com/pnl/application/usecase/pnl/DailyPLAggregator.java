package com.pnl.application.usecase.pnl;

import com.pnl.domain.exception.Errors;
import com.pnl.domain.exception.ServiceException;
import com.pnl.domain.model.DailyPLRecord;
import com.pnl.domain.model.LedgerEntry;
import com.pnl.domain.model.MonthlyPLSummary;
import com.pnl.domain.model.Transaction;
import com.pnl.domain.port.TransactionRepository;
import com.pnl.domain.service.CostBasisLedger;
import com.pnl.domain.service.LedgerFactory;
import com.pnl.domain.service.MonthlyPLSummaries;
import com.pnl.domain.service.OptionExpirationSynthesizer;
import com.pnl.domain.service.StrategyClassifier;
import com.pnl.infrastructure.config.EngineConfig;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Computes the daily P&L calendar of one portfolio for one month.
 * <p>
 * Each asset is replayed through its own ledger: transactions before the month seed the open lots,
 * transactions within the month are applied in date order and their ledger entries are grouped by local day.
 */
@Slf4j
@ApplicationScoped
public class DailyPLAggregator {

    private final TransactionRepository transactionRepository;
    private final LedgerFactory ledgerFactory;
    private final OptionExpirationSynthesizer expirationSynthesizer;
    private final StrategyClassifier.Factory strategyClassifierFactory;
    private final EngineConfig config;
    private final Clock clock;

    public DailyPLAggregator(TransactionRepository transactionRepository,
                             LedgerFactory ledgerFactory,
                             OptionExpirationSynthesizer expirationSynthesizer,
                             StrategyClassifier.Factory strategyClassifierFactory,
                             EngineConfig config,
                             Clock clock) {
        this.transactionRepository = transactionRepository;
        this.ledgerFactory = ledgerFactory;
        this.expirationSynthesizer = expirationSynthesizer;
        this.strategyClassifierFactory = strategyClassifierFactory;
        this.config = config;
        this.clock = clock;
    }

    public Uni<MonthlyPLSummary> aggregate(UUID portfolioId, YearMonth month) {
        if (portfolioId == null || month == null) {
            return Uni.createFrom().failure(new ServiceException(Errors.DailyPL.INVALID_INPUT, "Portfolio id and month are required"));
        }

        log.debug("Aggregating daily P&L: portfolioId={}, month={}", portfolioId, month);

        return transactionRepository.listTransactions(portfolioId)
                .onFailure().transform(throwable -> new ServiceException(
                        Errors.DailyPL.PERSISTENCE_ERROR, "Failed to read transactions: " + throwable.getMessage(), throwable))
                .map(transactions -> summarize(portfolioId, month, transactions));
    }

    /**
     * @param transactions the full history of the portfolio, in ledger order
     */
    public MonthlyPLSummary summarize(UUID portfolioId, YearMonth month, List<Transaction> transactions) {
        ZoneId zone = config.zone();
        LocalDate today = clock.instant().atZone(zone).toLocalDate();
        StrategyClassifier strategyClassifier = strategyClassifierFactory.forHistory(transactions);

        Map<LocalDate, List<LedgerEntry>> entriesByDay = new LinkedHashMap<>();
        groupByAsset(transactions).values().forEach(assetStream ->
                replayMonth(assetStream, month, strategyClassifier, today, zone)
                        .forEach(entry -> entriesByDay
                                .computeIfAbsent(localDate(entry.transaction(), zone), ignored -> new ArrayList<>())
                                .add(entry)));

        List<DailyPLRecord> days = new ArrayList<>();
        for (LocalDate date = month.atDay(1); !date.isAfter(month.atEndOfMonth()); date = date.plusDays(1)) {
            List<LedgerEntry> entries = entriesByDay.getOrDefault(date, List.of());
            days.add(MonthlyPLSummaries.dayOf(date, entries, config.daily().neutralThreshold()));
        }

        MonthlyPLSummary summary = MonthlyPLSummaries.summarize(Set.of(portfolioId), month, days);
        log.info("Daily P&L aggregated: portfolioId={}, month={}, transactions={}, netPL={}, orphans={}",
                portfolioId, month, summary.totalTransactions(), summary.totalNetPL(), summary.orphans().size());
        return summary;
    }

    private List<LedgerEntry> replayMonth(List<Transaction> assetStream,
                                          YearMonth month,
                                          StrategyClassifier strategyClassifier,
                                          LocalDate today,
                                          ZoneId zone) {
        List<Transaction> stream = expirationSynthesizer.synthesize(assetStream, strategyClassifier, today, zone)
                .transactions();

        List<Transaction> before = new ArrayList<>();
        List<Transaction> within = new ArrayList<>();
        for (Transaction transaction : stream) {
            YearMonth transactionMonth = YearMonth.from(localDate(transaction, zone));
            if (transactionMonth.isBefore(month)) {
                before.add(transaction);
            } else if (transactionMonth.equals(month)) {
                within.add(transaction);
            }
        }
        if (within.isEmpty()) {
            return List.of();
        }

        Transaction reference = stream.get(0);
        CostBasisLedger opening = ledgerFactory.open(reference, strategyClassifier);
        opening.applyAll(before);

        // stable sort keeps ledger order within a day
        within.sort(Comparator.comparing(transaction -> localDate(transaction, zone)));
        CostBasisLedger ledger = ledgerFactory.open(reference, strategyClassifier, opening.openLots());
        return ledger.applyAll(within);
    }

    private Map<UUID, List<Transaction>> groupByAsset(List<Transaction> transactions) {
        Map<UUID, List<Transaction>> byAsset = new LinkedHashMap<>();
        for (Transaction transaction : transactions) {
            if (transaction.assetId() == null || transaction.occurredAt() == null) {
                throw new ServiceException(Errors.Ledger.INVALID_TRANSACTION,
                        "Asset id and date are required, transactionId=" + transaction.id());
            }
            byAsset.computeIfAbsent(transaction.assetId(), ignored -> new ArrayList<>()).add(transaction);
        }
        return byAsset;
    }

    private static LocalDate localDate(Transaction transaction, ZoneId zone) {
        return transaction.occurredAt().atZone(zone).toLocalDate();
    }
}
