package com.jay.valuation.layer4_models;

import com.jay.valuation.model.ModelValuation;
import com.jay.valuation.model.NormalizedMetrics;
import com.jay.valuation.model.ValuationAssumptions;
import com.jay.valuation.model.enums.ModelType;

/**
 * One per-share valuation model. Implementations are stateless and never throw for
 * missing or ill-conditioned inputs; they report those through the outcome status.
 */
public interface ValuationModel {

    ModelType type();

    ModelValuation value(NormalizedMetrics metrics, ValuationAssumptions assumptions);
}
