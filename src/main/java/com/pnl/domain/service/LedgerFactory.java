package com.pnl.domain.service;

import com.pnl.domain.model.LotSide;
import com.pnl.domain.model.Transaction;

import java.util.List;

/**
 * Opens {@link CostBasisLedger}s keyed by the portfolio and asset of a reference transaction
 */
public class LedgerFactory {

    private final FeeCalculator feeCalculator;

    public LedgerFactory(FeeCalculator feeCalculator) {
        this.feeCalculator = feeCalculator;
    }

    public CostBasisLedger open(Transaction reference, StrategyClassifier strategyClassifier) {
        return open(reference, strategyClassifier, List.of());
    }

    public CostBasisLedger open(Transaction reference, StrategyClassifier strategyClassifier, List<LotSide> seed) {
        return new CostBasisLedger(
                reference.portfolioId(),
                reference.assetId(),
                reference.symbol(),
                reference.assetClass(),
                feeCalculator,
                strategyClassifier,
                seed
        );
    }
}
