package com.pnl.domain.usecase;

import com.pnl.domain.model.DailyPLRecord;
import com.pnl.domain.model.MonthlyPLSummary;
import io.smallrye.mutiny.Uni;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Read side of the daily P&L calendar
 */
public interface GetPortfolioPLUseCase {

    Uni<MonthlyPLSummary> getMonthlyPL(UUID portfolioId, YearMonth month);

    Uni<MonthlyPLSummary> getCurrentMonthPL(UUID portfolioId);

    Uni<DailyPLRecord> getDayDetails(UUID portfolioId, LocalDate date);

    /**
     * One summary per month from {@code from} to {@code to}, both inclusive
     */
    Uni<List<MonthlyPLSummary>> getMultiMonthTrend(UUID portfolioId, YearMonth from, YearMonth to);

    /**
     * Sums independently computed portfolio summaries by date
     */
    Uni<AggregatedResult> getAggregatedMonthlyPL(Set<UUID> portfolioIds, YearMonth month);

    sealed interface AggregatedResult {
        record Succeeded(MonthlyPLSummary summary) implements AggregatedResult {}
        record Degraded(MonthlyPLSummary summary, Set<UUID> failedPortfolioIds) implements AggregatedResult {}
        record Failed(com.pnl.domain.exception.Error error, String message) implements AggregatedResult {}
    }
}
