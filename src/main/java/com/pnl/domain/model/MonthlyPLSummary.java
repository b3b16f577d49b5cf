package com.pnl.domain.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Month of daily records plus totals. Always recomputed as a whole.
 */
@Builder(toBuilder = true)
public record MonthlyPLSummary(
        Set<UUID> portfolioIds,
        YearMonth month,
        List<DailyPLRecord> days,
        BigDecimal totalRealizedPL,
        BigDecimal totalDividends,
        BigDecimal totalFees,
        BigDecimal totalVolume,
        BigDecimal totalNetPL,
        int totalTransactions,
        int daysWithTransactions,
        int profitableDays,
        int lossDays,
        List<OrphanTransaction> orphans
) {

    public Optional<DailyPLRecord> day(LocalDate date) {
        return days.stream()
                .filter(day -> day.date().equals(date))
                .findFirst();
    }
}
