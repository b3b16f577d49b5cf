package com.pnl.application.usecase.pnl;

import com.pnl.domain.exception.Errors;
import com.pnl.domain.exception.ServiceException;
import com.pnl.domain.model.DailyPLRecord;
import com.pnl.domain.model.DayCategory;
import com.pnl.domain.model.MonthlyPLSummary;
import com.pnl.domain.model.Transaction;
import com.pnl.domain.port.TransactionRepository;
import com.pnl.domain.service.CostBasisLedger;
import com.pnl.domain.service.FeeCalculator;
import com.pnl.domain.service.LedgerFactory;
import com.pnl.domain.service.OptionExpirationSynthesizer;
import com.pnl.domain.service.StrategyClassifier;
import com.pnl.infrastructure.config.EngineConfig;
import com.pnl.infrastructure.config.EngineConfigFixtures;
import com.pnl.infrastructure.metadata.OccOptionSymbolResolver;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static com.pnl.domain.model.TransactionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DailyPLAggregatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    private TransactionRepository transactionRepository;
    private LedgerFactory ledgerFactory;
    private UUID stockId;

    @BeforeEach
    void setUp() {
        transactionRepository = mock(TransactionRepository.class);
        ledgerFactory = new LedgerFactory(new FeeCalculator(new BigDecimal("0.75")));
        stockId = UUID.randomUUID();
    }

    private DailyPLAggregator aggregatorWith(EngineConfig config) {
        return new DailyPLAggregator(
                transactionRepository,
                ledgerFactory,
                new OptionExpirationSynthesizer(new OccOptionSymbolResolver(), ledgerFactory),
                history -> StrategyClassifier.TAGGED_ONLY,
                config,
                CLOCK);
    }

    private MonthlyPLSummary summarize(List<Transaction> history, YearMonth month) {
        return aggregatorWith(EngineConfigFixtures.defaults()).summarize(PORTFOLIO_ID, month, history);
    }

    @Test
    void testSummarize_EmptyHistory_EveryDayPresent() {
        // When
        MonthlyPLSummary summary = summarize(List.of(), YearMonth.of(2024, 3));

        // Then
        assertEquals(31, summary.days().size());
        assertTrue(summary.days().stream().allMatch(day -> day.category() == DayCategory.NO_TRANSACTIONS));
        assertEquals(0, summary.totalTransactions());
        assertEquals(0, BigDecimal.ZERO.compareTo(summary.totalNetPL()));
    }

    @Test
    void testSummarize_SellAgainstLotsFromEarlierMonth() {
        // Given
        List<Transaction> history = List.of(
                stockBuy(stockId, "AAPL", "10", "10", "2024-02-10"),
                stockSell(stockId, "AAPL", "10", "15", "2024-03-05"));

        // When
        MonthlyPLSummary summary = summarize(history, YearMonth.of(2024, 3));

        // Then
        DailyPLRecord day = summary.day(LocalDate.of(2024, 3, 5)).orElseThrow();
        assertEquals(0, new BigDecimal("50").compareTo(day.realizedPL()));
        assertEquals(DayCategory.POSITIVE, day.category());
        assertEquals(1, summary.totalTransactions());
        assertEquals(1, summary.profitableDays());
        assertTrue(summary.orphans().isEmpty());
    }

    @Test
    void testSummarize_BuyWithFees_NegativeDay() {
        // Given
        List<Transaction> history = List.of(
                stockBuy(stockId, "AAPL", "10", "10", "2024-03-01").toBuilder().fees(BigDecimal.ONE).build());

        // When
        MonthlyPLSummary summary = summarize(history, YearMonth.of(2024, 3));

        // Then
        DailyPLRecord day = summary.day(LocalDate.of(2024, 3, 1)).orElseThrow();
        assertEquals(0, new BigDecimal("-1").compareTo(day.netPL()));
        assertEquals(DayCategory.NEGATIVE, day.category());
        assertEquals(0, new BigDecimal("100").compareTo(summary.totalVolume()));
        assertEquals(1, summary.lossDays());
    }

    @Test
    void testSummarize_MonthlyRealizedAddsUpToLedgerTotal() {
        // Given
        List<Transaction> history = List.of(
                stockBuy(stockId, "AAPL", "10", "10", "2024-01-10"),
                stockBuy(stockId, "AAPL", "10", "12", "2024-01-20"),
                stockSell(stockId, "AAPL", "5", "14", "2024-02-10"),
                stockSell(stockId, "AAPL", "10", "11", "2024-03-10"),
                dividend(stockId, "AAPL", "3.20", "2024-03-15"));
        CostBasisLedger ledger = ledgerFactory.open(history.get(0), StrategyClassifier.TAGGED_ONLY);
        ledger.applyAll(history);

        // When
        BigDecimal monthlyTotal = List.of(YearMonth.of(2024, 1), YearMonth.of(2024, 2), YearMonth.of(2024, 3)).stream()
                .map(month -> summarize(history, month).totalRealizedPL())
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        // Then
        assertEquals(0, ledger.snapshot().realizedPL().compareTo(monthlyTotal));
        assertEquals(0, new BigDecimal("23.20").compareTo(monthlyTotal));
    }

    @Test
    void testSummarize_SynthesizedExpirationOnExpirationDay() {
        // Given
        UUID optionId = UUID.randomUUID();
        List<Transaction> history = List.of(optionBuy(optionId, "AAPL240119C00150000", "200", "1.50", "2024-01-05"));

        // When
        MonthlyPLSummary summary = summarize(history, YearMonth.of(2024, 1));

        // Then
        DailyPLRecord expirationDay = summary.day(LocalDate.of(2024, 1, 19)).orElseThrow();
        assertEquals(0, new BigDecimal("-300").compareTo(expirationDay.realizedPL()));
        assertEquals(DayCategory.NEGATIVE, expirationDay.category());
        assertEquals(List.of(OptionExpirationSynthesizer.expirationTransactionId(optionId)), expirationDay.transactionIds());
        assertEquals(2, summary.totalTransactions());
    }

    @Test
    void testSummarize_ConfiguredZoneDecidesCalendarDay() {
        // Given
        ZoneId newYork = ZoneId.of("America/New_York");
        Transaction lateSell = stockSell(stockId, "AAPL", "10", "15", "2024-03-01").toBuilder()
                .occurredAt(at("2024-03-01", "03:00"))
                .build();
        List<Transaction> history = List.of(stockBuy(stockId, "AAPL", "10", "10", "2024-02-01"), lateSell);

        // When
        MonthlyPLSummary february = aggregatorWith(EngineConfigFixtures.withZone(newYork))
                .summarize(PORTFOLIO_ID, YearMonth.of(2024, 2), history);

        // Then
        assertEquals(0, new BigDecimal("50").compareTo(february.day(LocalDate.of(2024, 2, 29)).orElseThrow().realizedPL()));
    }

    @Test
    void testSummarize_Oversell_CountedAndReported() {
        // Given
        Transaction oversell = stockSell(stockId, "AAPL", "8", "15", "2024-03-05");
        List<Transaction> history = List.of(stockBuy(stockId, "AAPL", "5", "10", "2024-03-01"), oversell);

        // When
        MonthlyPLSummary summary = summarize(history, YearMonth.of(2024, 3));

        // Then
        DailyPLRecord day = summary.day(LocalDate.of(2024, 3, 5)).orElseThrow();
        assertEquals(1, day.transactionCount());
        assertEquals(DayCategory.NEUTRAL, day.category());
        assertEquals(1, summary.orphans().size());
        assertEquals(oversell.id(), summary.orphans().get(0).transactionId());
    }

    @Test
    void testAggregate_ReadFailure_PersistenceError() {
        // Given
        when(transactionRepository.listTransactions(PORTFOLIO_ID))
                .thenReturn(Uni.createFrom().failure(new IllegalStateException("timeout")));

        // When
        Throwable failure = aggregatorWith(EngineConfigFixtures.defaults()).aggregate(PORTFOLIO_ID, YearMonth.of(2024, 3))
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .assertFailedWith(ServiceException.class)
                .getFailure();

        // Then
        assertEquals(Errors.DailyPL.PERSISTENCE_ERROR, ((ServiceException) failure).getError());
    }

    @Test
    void testAggregate_ReadsThroughRepository() {
        // Given
        when(transactionRepository.listTransactions(PORTFOLIO_ID)).thenReturn(Uni.createFrom().item(List.of(
                stockBuy(stockId, "AAPL", "10", "10", "2024-03-01"))));

        // When
        MonthlyPLSummary summary = aggregatorWith(EngineConfigFixtures.defaults()).aggregate(PORTFOLIO_ID, YearMonth.of(2024, 3))
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .assertCompleted()
                .getItem();

        // Then
        assertEquals(1, summary.totalTransactions());
        verify(transactionRepository).listTransactions(PORTFOLIO_ID);
    }
}
