package com.jay.valuation.model;

import com.jay.valuation.model.enums.ModelType;
import lombok.Builder;
import lombok.Value;

import java.util.EnumMap;
import java.util.Map;

/**
 * Scenario inputs for one valuation. Rates are fractions (0.05 = 5%).
 * Weights need not sum to 1; the aggregator renormalises them.
 */
@Value
@Builder(toBuilder = true)
public class ValuationAssumptions {

    double shortTermGrowth;
    double terminalGrowth;
    double costOfEquity;
    double wacc;
    double taxRate;
    int forecastYears;
    /** Null means "use the company's own ROE". */
    Double targetRoe;
    double payoutRatio;
    Map<ModelType, Double> modelWeights;

    public double weight(ModelType model) {
        if (modelWeights == null) return 0;
        Double w = modelWeights.get(model);
        return w == null ? 0 : w;
    }

    public static Map<ModelType, Double> equalWeights() {
        Map<ModelType, Double> weights = new EnumMap<>(ModelType.class);
        for (ModelType t : ModelType.values()) weights.put(t, 0.25);
        return weights;
    }

    /**
     * Rejects values no model can work with. Growth at or above a discount rate is
     * accepted here; each model handles that case itself.
     */
    public ValuationAssumptions validate() {
        requireRate("short_term_growth", shortTermGrowth);
        requireRate("terminal_growth", terminalGrowth);
        requireRate("cost_of_equity", costOfEquity);
        requireRate("wacc", wacc);
        requireRate("payout_ratio", payoutRatio);
        if (!Double.isFinite(taxRate) || taxRate < 0 || taxRate >= 1) {
            throw new IllegalArgumentException("tax_rate must be in [0, 1): " + taxRate);
        }
        if (targetRoe != null) requireRate("target_roe", targetRoe);
        if (forecastYears < 0) {
            throw new IllegalArgumentException("forecast_years must not be negative: " + forecastYears);
        }
        if (modelWeights != null) {
            modelWeights.forEach((model, w) -> {
                if (w == null || !Double.isFinite(w) || w < 0) {
                    throw new IllegalArgumentException("Weight for " + model.wireName() + " must be a non-negative number: " + w);
                }
            });
        }
        return this;
    }

    private static void requireRate(String name, double value) {
        if (!Double.isFinite(value) || value <= -1 || value > 1) {
            throw new IllegalArgumentException(name + " must be a fraction in (-1, 1]: " + value);
        }
    }
}
