package com.jay.valuation.model.enums;

public enum Recommendation {
    BUY,
    HOLD,
    SELL
}
