package com.jay.valuation.model.enums;

public enum ModelStatus {
    /** Value computed from fundamentals. */
    OK,
    /** Growth not below the discount rate (or ROE); the documented conservative multiple was used. */
    FALLBACK_MULTIPLE,
    /** Terminal growth not below the discount rate; no value produced. */
    ILL_CONDITIONED,
    /** Required inputs absent. */
    INSUFFICIENT_DATA,
    /** Unexpected error while computing. */
    FAILED
}
