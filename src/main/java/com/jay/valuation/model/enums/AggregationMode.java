package com.jay.valuation.model.enums;

/** How a field is read across period rows. */
public enum AggregationMode {
    /** Most recent period only. */
    LATEST,
    /** Sum of the four most recent periods; unavailable with fewer than four. */
    TRAILING_SUM
}
