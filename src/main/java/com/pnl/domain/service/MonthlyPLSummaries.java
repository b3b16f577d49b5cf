package com.pnl.domain.service;

import com.pnl.domain.model.DailyPLRecord;
import com.pnl.domain.model.DayCategory;
import com.pnl.domain.model.LedgerEntry;
import com.pnl.domain.model.MonthlyPLSummary;
import com.pnl.domain.model.OrphanTransaction;
import com.pnl.domain.model.Transaction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Builds daily records from ledger entries and rolls them up into monthly summaries
 */
public final class MonthlyPLSummaries {

    private MonthlyPLSummaries() {
    }

    public static DailyPLRecord dayOf(LocalDate date, List<LedgerEntry> entries, BigDecimal neutralThreshold) {
        if (entries.isEmpty()) {
            return DailyPLRecord.empty(date);
        }

        List<LedgerEntry> matched = entries.stream()
                .filter(entry -> !entry.isOrphan())
                .toList();

        BigDecimal realizedPL = sum(matched, LedgerEntry::realizedPL);
        BigDecimal netPL = realizedPL.subtract(sum(matched, LedgerEntry::unappliedFees));

        return DailyPLRecord.builder()
                .date(date)
                .dayOfMonth(date.getDayOfMonth())
                .realizedPL(realizedPL)
                .dividendIncome(sum(matched, LedgerEntry::dividendIncome))
                .fees(sum(matched, LedgerEntry::fees))
                .tradeVolume(sum(matched, MonthlyPLSummaries::tradeVolume))
                .netCashFlow(sum(matched, MonthlyPLSummaries::cashFlow))
                .netPL(netPL)
                .transactionCount(entries.size())
                .category(DayCategory.of(true, netPL, neutralThreshold))
                .transactionIds(entries.stream().map(entry -> entry.transaction().id()).toList())
                .orphans(entries.stream().map(LedgerEntry::orphan).filter(Objects::nonNull).toList())
                .build();
    }

    public static MonthlyPLSummary summarize(Set<UUID> portfolioIds, YearMonth month, List<DailyPLRecord> days) {
        List<OrphanTransaction> orphans = days.stream()
                .flatMap(day -> day.orphans().stream())
                .toList();

        return MonthlyPLSummary.builder()
                .portfolioIds(Set.copyOf(portfolioIds))
                .month(month)
                .days(List.copyOf(days))
                .totalRealizedPL(sumDays(days, DailyPLRecord::realizedPL))
                .totalDividends(sumDays(days, DailyPLRecord::dividendIncome))
                .totalFees(sumDays(days, DailyPLRecord::fees))
                .totalVolume(sumDays(days, DailyPLRecord::tradeVolume))
                .totalNetPL(sumDays(days, DailyPLRecord::netPL))
                .totalTransactions(days.stream().mapToInt(DailyPLRecord::transactionCount).sum())
                .daysWithTransactions((int) days.stream().filter(DailyPLRecord::hasTransactions).count())
                .profitableDays((int) days.stream().filter(day -> day.category() == DayCategory.POSITIVE).count())
                .lossDays((int) days.stream().filter(day -> day.category() == DayCategory.NEGATIVE).count())
                .orphans(orphans)
                .build();
    }

    /**
     * Sums summaries of the same month by date. Each summary must have been computed on its own portfolio.
     */
    public static MonthlyPLSummary mergeByDate(YearMonth month, List<MonthlyPLSummary> summaries, BigDecimal neutralThreshold) {
        Set<UUID> portfolioIds = new LinkedHashSet<>();
        summaries.forEach(summary -> portfolioIds.addAll(summary.portfolioIds()));

        List<DailyPLRecord> days = new ArrayList<>();
        for (LocalDate date = month.atDay(1); !date.isAfter(month.atEndOfMonth()); date = date.plusDays(1)) {
            LocalDate current = date;
            List<DailyPLRecord> sameDay = summaries.stream()
                    .map(summary -> summary.day(current).orElseGet(() -> DailyPLRecord.empty(current)))
                    .toList();
            days.add(combine(current, sameDay, neutralThreshold));
        }
        return summarize(portfolioIds, month, days);
    }

    private static DailyPLRecord combine(LocalDate date, List<DailyPLRecord> records, BigDecimal neutralThreshold) {
        int transactionCount = records.stream().mapToInt(DailyPLRecord::transactionCount).sum();
        BigDecimal netPL = sumDays(records, DailyPLRecord::netPL);

        return DailyPLRecord.builder()
                .date(date)
                .dayOfMonth(date.getDayOfMonth())
                .realizedPL(sumDays(records, DailyPLRecord::realizedPL))
                .dividendIncome(sumDays(records, DailyPLRecord::dividendIncome))
                .fees(sumDays(records, DailyPLRecord::fees))
                .tradeVolume(sumDays(records, DailyPLRecord::tradeVolume))
                .netCashFlow(sumDays(records, DailyPLRecord::netCashFlow))
                .netPL(netPL)
                .transactionCount(transactionCount)
                .category(DayCategory.of(transactionCount > 0, netPL, neutralThreshold))
                .transactionIds(records.stream().flatMap(record -> record.transactionIds().stream()).toList())
                .orphans(records.stream().flatMap(record -> record.orphans().stream()).toList())
                .build();
    }

    private static BigDecimal tradeVolume(LedgerEntry entry) {
        return switch (entry.transaction().kind()) {
            case BUY, SELL -> entry.transaction().grossAmount();
            case DIVIDEND, OPTION_EXPIRED -> BigDecimal.ZERO;
        };
    }

    private static BigDecimal cashFlow(LedgerEntry entry) {
        Transaction transaction = entry.transaction();
        return switch (transaction.kind()) {
            case BUY -> transaction.grossAmount().add(entry.fees()).negate();
            case SELL, DIVIDEND -> transaction.grossAmount().subtract(entry.fees());
            case OPTION_EXPIRED -> entry.fees().negate();
        };
    }

    private static BigDecimal sum(List<LedgerEntry> entries, Function<LedgerEntry, BigDecimal> field) {
        return entries.stream().map(field).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal sumDays(List<DailyPLRecord> days, Function<DailyPLRecord, BigDecimal> field) {
        return days.stream().map(field).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
