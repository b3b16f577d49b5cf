package com.pnl.domain.service;

import com.pnl.domain.model.AssetClass;

import java.math.BigDecimal;

/**
 * Derives the fee of a transaction whose fee was not reported.
 * Option quantities are share-denominated, one contract covers {@value #SHARES_PER_CONTRACT} shares.
 */
public class FeeCalculator {

    public static final int SHARES_PER_CONTRACT = 100;

    private static final BigDecimal CONTRACT_MULTIPLIER = BigDecimal.valueOf(SHARES_PER_CONTRACT);

    private final BigDecimal perContractFee;

    public FeeCalculator(BigDecimal perContractFee) {
        if (perContractFee == null || perContractFee.signum() < 0) {
            throw new IllegalArgumentException("Per contract fee must be zero or positive");
        }
        this.perContractFee = perContractFee;
    }

    public BigDecimal feeFor(AssetClass assetClass, BigDecimal quantity) {
        if (assetClass != AssetClass.OPTION || quantity == null) {
            return BigDecimal.ZERO;
        }
        return contractsFor(quantity).multiply(perContractFee);
    }

    public static BigDecimal contractsFor(BigDecimal shareQuantity) {
        // dividing by 100 always terminates
        return shareQuantity.divide(CONTRACT_MULTIPLIER);
    }
}
