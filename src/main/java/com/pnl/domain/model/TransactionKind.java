package com.pnl.domain.model;

public enum TransactionKind {
    BUY,
    SELL,
    DIVIDEND,
    OPTION_EXPIRED
}
