package com.pnl.infrastructure.persistence.adapter;

import com.pnl.domain.model.Transaction;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static com.pnl.domain.model.TransactionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryTransactionRepositoryTest {

    private final InMemoryTransactionRepository repository = new InMemoryTransactionRepository();

    @Test
    void testListTransactions_SortedByDateInsertionOrderBreaksTies() {
        // Given
        UUID assetId = UUID.randomUUID();
        Transaction later = stockSell(assetId, "AAPL", "5", "12", "2024-01-05");
        Transaction sameDayFirst = stockBuy(assetId, "AAPL", "5", "10", "2024-01-02");
        Transaction sameDaySecond = stockBuy(assetId, "AAPL", "5", "11", "2024-01-02");
        repository.append(later).await().indefinitely();
        repository.append(sameDayFirst).await().indefinitely();
        repository.append(sameDaySecond).await().indefinitely();

        // When
        List<Transaction> transactions = repository.listTransactions(PORTFOLIO_ID)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .assertCompleted()
                .getItem();

        // Then
        assertEquals(List.of(sameDayFirst, sameDaySecond, later), transactions);
    }

    @Test
    void testListTransactions_UnknownPortfolio_Empty() {
        List<Transaction> transactions = repository.listTransactions(UUID.randomUUID()).await().indefinitely();

        assertTrue(transactions.isEmpty());
    }
}
