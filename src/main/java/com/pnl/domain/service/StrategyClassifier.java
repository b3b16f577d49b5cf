package com.pnl.domain.service;

import com.pnl.domain.model.Transaction;

import java.util.List;

/**
 * Decides whether an option buy closes a covered call. Older history carries no strategy tag, so implementations
 * may guess; callers must not treat the answer as authoritative.
 */
@FunctionalInterface
public interface StrategyClassifier {

    StrategyClassifier TAGGED_ONLY = buy -> buy.hasStrategyTag()
            && Transaction.COVERED_CALL.equalsIgnoreCase(buy.strategyTag());

    boolean isCoveredCallBuyback(Transaction buy);

    /**
     * Builds a classifier for one portfolio's history
     */
    @FunctionalInterface
    interface Factory {
        StrategyClassifier forHistory(List<Transaction> portfolioHistory);
    }
}
