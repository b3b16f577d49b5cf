package com.pnl.domain.model;

public enum Currency {
    USD,
    CAD,
    EUR,
    GBP
}
