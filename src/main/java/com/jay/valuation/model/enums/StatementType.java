package com.jay.valuation.model.enums;

public enum StatementType {
    BALANCE_SHEET("balance_sheet"),
    INCOME_STATEMENT("income_statement"),
    CASH_FLOW("cash_flow"),
    RATIOS("ratios");

    private final String wireName;

    StatementType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
