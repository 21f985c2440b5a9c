package com.jay.valuation.model.enums;

/**
 * Where a metric value came from, in decreasing order of reliability.
 * A present value is never replaced by a derivation.
 */
public enum Provenance {
    REPORTED,
    DERIVED
}
