package com.pnl.application.usecase.pnl;

import com.pnl.application.service.AggregationCache;
import com.pnl.domain.exception.Errors;
import com.pnl.domain.exception.ServiceException;
import com.pnl.domain.model.DailyPLRecord;
import com.pnl.domain.model.MonthlyPLSummary;
import com.pnl.domain.service.MonthlyPLSummaries;
import com.pnl.domain.usecase.GetPortfolioPLUseCase;
import com.pnl.infrastructure.config.EngineConfig;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@ApplicationScoped
public class PortfolioPLQueryService implements GetPortfolioPLUseCase {

    private final AggregationCache aggregationCache;
    private final EngineConfig config;
    private final Clock clock;

    public PortfolioPLQueryService(AggregationCache aggregationCache, EngineConfig config, Clock clock) {
        this.aggregationCache = aggregationCache;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<MonthlyPLSummary> getMonthlyPL(UUID portfolioId, YearMonth month) {
        if (portfolioId == null || month == null) {
            return Uni.createFrom().failure(new ServiceException(Errors.DailyPL.INVALID_INPUT, "Portfolio id and month are required"));
        }
        return aggregationCache.get(portfolioId, month);
    }

    @Override
    public Uni<MonthlyPLSummary> getCurrentMonthPL(UUID portfolioId) {
        return getMonthlyPL(portfolioId, YearMonth.now(clock.withZone(config.zone())));
    }

    @Override
    public Uni<DailyPLRecord> getDayDetails(UUID portfolioId, LocalDate date) {
        if (date == null) {
            return Uni.createFrom().failure(new ServiceException(Errors.DailyPL.INVALID_INPUT, "Date is required"));
        }
        return getMonthlyPL(portfolioId, YearMonth.from(date))
                .map(summary -> summary.day(date)
                        .orElseThrow(() -> new ServiceException(Errors.DailyPL.NOT_FOUND, "No record for date " + date)));
    }

    @Override
    public Uni<List<MonthlyPLSummary>> getMultiMonthTrend(UUID portfolioId, YearMonth from, YearMonth to) {
        if (from == null || to == null || from.isAfter(to)) {
            return Uni.createFrom().failure(new ServiceException(Errors.DailyPL.INVALID_INPUT,
                    "Invalid month range: from=" + from + ", to=" + to));
        }

        List<YearMonth> months = new ArrayList<>();
        for (YearMonth month = from; !month.isAfter(to); month = month.plusMonths(1)) {
            months.add(month);
        }

        return Multi.createFrom().iterable(months)
                .onItem().transformToUniAndConcatenate(month -> getMonthlyPL(portfolioId, month))
                .collect().asList();
    }

    @Override
    public Uni<AggregatedResult> getAggregatedMonthlyPL(Set<UUID> portfolioIds, YearMonth month) {
        if (portfolioIds == null || portfolioIds.isEmpty() || month == null) {
            return Uni.createFrom().item(new AggregatedResult.Failed(Errors.AggregatedPL.INVALID_INPUT,
                    "At least one portfolio id and a month are required"));
        }

        List<UUID> ids = List.copyOf(new LinkedHashSet<>(portfolioIds));
        List<Uni<PortfolioOutcome>> outcomes = ids.stream()
                .map(portfolioId -> getMonthlyPL(portfolioId, month)
                        .map(summary -> new PortfolioOutcome(portfolioId, summary))
                        .onFailure().recoverWithItem(throwable -> {
                            log.warn("Portfolio excluded from aggregated P&L: portfolioId={}, month={}, error={}",
                                    portfolioId, month, throwable.getMessage());
                            return new PortfolioOutcome(portfolioId, null);
                        }))
                .toList();

        return Uni.join().all(outcomes).andFailFast()
                .map(results -> toAggregatedResult(month, results));
    }

    private AggregatedResult toAggregatedResult(YearMonth month, List<PortfolioOutcome> results) {
        List<MonthlyPLSummary> summaries = results.stream()
                .filter(PortfolioOutcome::succeeded)
                .map(PortfolioOutcome::summary)
                .toList();
        Set<UUID> failed = new LinkedHashSet<>();
        results.stream()
                .filter(result -> !result.succeeded())
                .forEach(result -> failed.add(result.portfolioId()));

        if (summaries.isEmpty()) {
            return new AggregatedResult.Failed(Errors.AggregatedPL.ALL_PORTFOLIOS_FAILED,
                    "No portfolio could be aggregated for " + month);
        }

        MonthlyPLSummary merged = MonthlyPLSummaries.mergeByDate(month, summaries, config.daily().neutralThreshold());
        log.info("Aggregated P&L computed: portfolios={}, failed={}, month={}, netPL={}",
                summaries.size(), failed.size(), month, merged.totalNetPL());

        if (failed.isEmpty()) {
            return new AggregatedResult.Succeeded(merged);
        }
        return new AggregatedResult.Degraded(merged, Set.copyOf(failed));
    }

    private record PortfolioOutcome(UUID portfolioId, MonthlyPLSummary summary) {

        boolean succeeded() {
            return summary != null;
        }
    }
}
