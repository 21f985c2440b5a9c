package com.jay.valuation.model;

import com.jay.valuation.model.enums.ModelStatus;
import com.jay.valuation.model.enums.ModelType;

/**
 * Per-share value produced by one model. Unavailable outcomes carry the sentinel 0.
 */
public record ModelValuation(ModelType model, double value, ModelStatus status, String detail) {

    public static final double SENTINEL = 0.0;

    public ModelValuation {
        detail = detail == null ? "" : detail;
    }

    public static ModelValuation ok(ModelType model, double value, String detail) {
        return new ModelValuation(model, value, ModelStatus.OK, detail);
    }

    public static ModelValuation fallback(ModelType model, double value, String detail) {
        return new ModelValuation(model, value, ModelStatus.FALLBACK_MULTIPLE, detail);
    }

    public static ModelValuation unavailable(ModelType model, ModelStatus status, String detail) {
        return new ModelValuation(model, SENTINEL, status, detail);
    }

    /** Finite and strictly positive: eligible for the weighted average. */
    public boolean isUsable() {
        return Double.isFinite(value) && value > 0;
    }
}
