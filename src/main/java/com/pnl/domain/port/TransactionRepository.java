package com.pnl.domain.port;

import com.pnl.domain.model.Transaction;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.UUID;

public interface TransactionRepository {

    /**
     * All transactions of a portfolio, ascending by occurredAt and stable on ties
     */
    Uni<List<Transaction>> listTransactions(UUID portfolioId);
}
