package com.pnl.domain.service;

import com.pnl.domain.model.DailyPLRecord;
import com.pnl.domain.model.DayCategory;
import com.pnl.domain.model.LedgerEntry;
import com.pnl.domain.model.MonthlyPLSummary;
import com.pnl.domain.model.OrphanTransaction;
import com.pnl.domain.model.Transaction;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static com.pnl.domain.model.TransactionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MonthlyPLSummariesTest {

    private static final BigDecimal THRESHOLD = new BigDecimal("0.01");
    private static final LocalDate DAY = LocalDate.of(2024, 3, 15);

    private final UUID assetId = UUID.randomUUID();

    @Test
    void testDayOf_NoEntries_EmptyDay() {
        // When
        DailyPLRecord day = MonthlyPLSummaries.dayOf(DAY, List.of(), THRESHOLD);

        // Then
        assertEquals(DayCategory.NO_TRANSACTIONS, day.category());
        assertEquals(15, day.dayOfMonth());
        assertEquals(0, day.transactionCount());
    }

    @Test
    void testDayOf_SellWithFees_NetPLDeductsUnappliedFees() {
        // Given
        Transaction sell = stockSell(assetId, "AAPL", "10", "15", "2024-03-15").toBuilder()
                .fees(new BigDecimal("1.00"))
                .build();
        LedgerEntry entry = new LedgerEntry(sell, new BigDecimal("50"), BigDecimal.ZERO, new BigDecimal("1.00"), null);

        // When
        DailyPLRecord day = MonthlyPLSummaries.dayOf(DAY, List.of(entry), THRESHOLD);

        // Then
        assertEquals(0, new BigDecimal("50").compareTo(day.realizedPL()));
        assertEquals(0, new BigDecimal("49.00").compareTo(day.netPL()));
        assertEquals(0, new BigDecimal("150").compareTo(day.tradeVolume()));
        assertEquals(0, new BigDecimal("149.00").compareTo(day.netCashFlow()));
        assertEquals(DayCategory.POSITIVE, day.category());
    }

    @Test
    void testDayOf_BuyOnly_NegativeFromFees() {
        // Given
        Transaction buy = stockBuy(assetId, "AAPL", "10", "15", "2024-03-15").toBuilder()
                .fees(new BigDecimal("1.00"))
                .build();
        LedgerEntry entry = new LedgerEntry(buy, BigDecimal.ZERO, BigDecimal.ZERO, new BigDecimal("1.00"), null);

        // When
        DailyPLRecord day = MonthlyPLSummaries.dayOf(DAY, List.of(entry), THRESHOLD);

        // Then
        assertEquals(0, new BigDecimal("-1.00").compareTo(day.netPL()));
        assertEquals(0, new BigDecimal("-151.00").compareTo(day.netCashFlow()));
        assertEquals(DayCategory.NEGATIVE, day.category());
    }

    @Test
    void testDayOf_ZeroFeeBuy_Neutral() {
        // Given
        Transaction buy = stockBuy(assetId, "AAPL", "10", "15", "2024-03-15");
        LedgerEntry entry = new LedgerEntry(buy, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, null);

        // When
        DailyPLRecord day = MonthlyPLSummaries.dayOf(DAY, List.of(entry), THRESHOLD);

        // Then
        assertEquals(DayCategory.NEUTRAL, day.category());
        assertEquals(1, day.transactionCount());
    }

    @Test
    void testDayOf_Orphan_CountedButExcludedFromTotals() {
        // Given
        Transaction oversell = stockSell(assetId, "AAPL", "10", "15", "2024-03-15");
        OrphanTransaction orphan = OrphanTransaction.of(oversell, BigDecimal.ZERO, "Sell quantity exceeds open long quantity");
        LedgerEntry entry = new LedgerEntry(oversell, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, orphan);

        // When
        DailyPLRecord day = MonthlyPLSummaries.dayOf(DAY, List.of(entry), THRESHOLD);

        // Then
        assertEquals(1, day.transactionCount());
        assertEquals(0, BigDecimal.ZERO.compareTo(day.tradeVolume()));
        assertEquals(List.of(orphan), day.orphans());
        assertEquals(DayCategory.NEUTRAL, day.category());
    }

    @Test
    void testSummarize_TotalsEqualSumOfDays() {
        // Given
        YearMonth month = YearMonth.of(2024, 2);
        List<DailyPLRecord> days = new ArrayList<>();
        for (LocalDate date = month.atDay(1); !date.isAfter(month.atEndOfMonth()); date = date.plusDays(1)) {
            days.add(DailyPLRecord.empty(date));
        }
        days.set(4, days.get(4).toBuilder()
                .realizedPL(new BigDecimal("100")).netPL(new BigDecimal("99")).fees(BigDecimal.ONE)
                .transactionCount(2).category(DayCategory.POSITIVE).build());
        days.set(9, days.get(9).toBuilder()
                .realizedPL(new BigDecimal("-30")).netPL(new BigDecimal("-30")).transactionCount(1)
                .category(DayCategory.NEGATIVE).build());

        // When
        MonthlyPLSummary summary = MonthlyPLSummaries.summarize(Set.of(PORTFOLIO_ID), month, days);

        // Then
        assertEquals(29, summary.days().size());
        assertEquals(0, new BigDecimal("70").compareTo(summary.totalRealizedPL()));
        assertEquals(0, new BigDecimal("69").compareTo(summary.totalNetPL()));
        assertEquals(0, BigDecimal.ONE.compareTo(summary.totalFees()));
        assertEquals(3, summary.totalTransactions());
        assertEquals(2, summary.daysWithTransactions());
        assertEquals(1, summary.profitableDays());
        assertEquals(1, summary.lossDays());
    }

    @Test
    void testMergeByDate_SumsSameDayAcrossPortfolios() {
        // Given
        YearMonth month = YearMonth.of(2024, 4);
        UUID otherPortfolio = UUID.randomUUID();
        MonthlyPLSummary first = summaryWithDay(PORTFOLIO_ID, month, 3, "40");
        MonthlyPLSummary second = summaryWithDay(otherPortfolio, month, 3, "-45");

        // When
        MonthlyPLSummary merged = MonthlyPLSummaries.mergeByDate(month, List.of(first, second), THRESHOLD);

        // Then
        DailyPLRecord day = merged.day(month.atDay(3)).orElseThrow();
        assertEquals(0, new BigDecimal("-5").compareTo(day.netPL()));
        assertEquals(2, day.transactionCount());
        assertEquals(DayCategory.NEGATIVE, day.category());
        assertEquals(Set.of(PORTFOLIO_ID, otherPortfolio), merged.portfolioIds());
        assertEquals(30, merged.days().size());
        assertEquals(0, new BigDecimal("-5").compareTo(merged.totalNetPL()));
    }

    private MonthlyPLSummary summaryWithDay(UUID portfolioId, YearMonth month, int dayOfMonth, String netPL) {
        List<DailyPLRecord> days = new ArrayList<>();
        for (LocalDate date = month.atDay(1); !date.isAfter(month.atEndOfMonth()); date = date.plusDays(1)) {
            DailyPLRecord day = DailyPLRecord.empty(date);
            if (date.getDayOfMonth() == dayOfMonth) {
                day = day.toBuilder()
                        .realizedPL(new BigDecimal(netPL))
                        .netPL(new BigDecimal(netPL))
                        .transactionCount(1)
                        .category(DayCategory.of(true, new BigDecimal(netPL), THRESHOLD))
                        .build();
            }
            days.add(day);
        }
        return MonthlyPLSummaries.summarize(Set.of(portfolioId), month, days);
    }
}
