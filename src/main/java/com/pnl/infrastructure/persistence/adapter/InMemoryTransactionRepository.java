package com.pnl.infrastructure.persistence.adapter;

import com.pnl.domain.model.Transaction;
import com.pnl.domain.port.TransactionRepository;
import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only transaction store. Listing sorts by occurredAt; the sort is stable so insertion order breaks ties.
 */
@DefaultBean
@ApplicationScoped
public class InMemoryTransactionRepository implements TransactionRepository {

    private final Map<UUID, List<Transaction>> transactionsByPortfolio = new ConcurrentHashMap<>();

    @Override
    public Uni<List<Transaction>> listTransactions(UUID portfolioId) {
        return Uni.createFrom().item(() -> {
            List<Transaction> stored = transactionsByPortfolio.get(portfolioId);
            if (stored == null) {
                return List.<Transaction>of();
            }
            synchronized (stored) {
                return stored.stream()
                        .sorted(Comparator.comparing(Transaction::occurredAt))
                        .toList();
            }
        });
    }

    public Uni<Transaction> append(Transaction transaction) {
        return Uni.createFrom().item(() -> {
            List<Transaction> stored = transactionsByPortfolio.computeIfAbsent(
                    transaction.portfolioId(), ignored -> new ArrayList<>());
            synchronized (stored) {
                stored.add(transaction);
            }
            return transaction;
        });
    }
}
