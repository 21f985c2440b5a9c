package com.jay.valuation.model.enums;

import java.util.Locale;

public enum ReportingPeriod {
    ANNUAL("year"),
    QUARTERLY("quarter");

    private final String wireName;

    ReportingPeriod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Accepts "year"/"annual" and "quarter"/"quarterly"; anything else is rejected. */
    public static ReportingPeriod parse(String raw) {
        if (raw == null || raw.isBlank()) return ANNUAL;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "year", "annual", "yearly" -> ANNUAL;
            case "quarter", "quarterly" -> QUARTERLY;
            default -> throw new IllegalArgumentException("Unknown reporting period: " + raw);
        };
    }
}
