package com.pnl.domain.model;

public enum AssetClass {
    STOCK,
    ETF,
    REIT,
    CRYPTO,
    FOREX,
    OPTION;

    public boolean isOption() {
        return this == OPTION;
    }
}
