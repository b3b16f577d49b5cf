package com.pnl.domain.model;

public enum OptionType {
    CALL,
    PUT
}
