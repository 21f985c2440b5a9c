package com.jay.valuation.layer4_models;

import com.jay.valuation.model.NormalizedMetrics;
import com.jay.valuation.model.ValuationAssumptions;
import com.jay.valuation.model.enums.MetricKey;

import java.util.OptionalDouble;

/** ROE selection and the dividend growth rate g = roe × (1 − payout). */
final class SustainableGrowth {

    private SustainableGrowth() {}

    /** A target ROE in the assumptions wins over the company's own. */
    static OptionalDouble roe(NormalizedMetrics m, ValuationAssumptions a) {
        if (a.getTargetRoe() != null) return OptionalDouble.of(a.getTargetRoe());
        return m.get(MetricKey.ROE);
    }

    static double growth(double roe, double payoutRatio) {
        return roe * (1 - payoutRatio);
    }
}
