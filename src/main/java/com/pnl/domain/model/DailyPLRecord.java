package com.pnl.domain.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * P&L of one calendar day. {@code netPL} is realized P&L minus the fees not already deducted from it.
 */
@Builder(toBuilder = true)
public record DailyPLRecord(
        LocalDate date,
        int dayOfMonth,
        BigDecimal realizedPL,
        BigDecimal dividendIncome,
        BigDecimal fees,
        BigDecimal tradeVolume,
        BigDecimal netCashFlow,
        BigDecimal netPL,
        int transactionCount,
        DayCategory category,
        List<UUID> transactionIds,
        List<OrphanTransaction> orphans
) {

    public static DailyPLRecord empty(LocalDate date) {
        return DailyPLRecord.builder()
                .date(date)
                .dayOfMonth(date.getDayOfMonth())
                .realizedPL(BigDecimal.ZERO)
                .dividendIncome(BigDecimal.ZERO)
                .fees(BigDecimal.ZERO)
                .tradeVolume(BigDecimal.ZERO)
                .netCashFlow(BigDecimal.ZERO)
                .netPL(BigDecimal.ZERO)
                .transactionCount(0)
                .category(DayCategory.NO_TRANSACTIONS)
                .transactionIds(List.of())
                .orphans(List.of())
                .build();
    }

    public boolean hasTransactions() {
        return transactionCount > 0;
    }
}
