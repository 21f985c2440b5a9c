package com.jay.valuation.model;

import com.jay.valuation.model.enums.ModelType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

/**
 * Assumption overrides as sent by the UI. Every rate is in percent (5 = 5%);
 * fields left null keep the configured default.
 */
@Data
public class ValuationRequest {

    @DecimalMin(value = "-99", message = "revenue_growth must be > -99%")
    @DecimalMax(value = "100", message = "revenue_growth must be <= 100%")
    private Double revenueGrowth;

    @DecimalMin(value = "-99", message = "terminal_growth must be > -99%")
    @DecimalMax(value = "100", message = "terminal_growth must be <= 100%")
    private Double terminalGrowth;

    @DecimalMin(value = "-99", message = "wacc must be > -99%")
    @DecimalMax(value = "100", message = "wacc must be <= 100%")
    private Double wacc;

    /** Cost of equity. */
    @DecimalMin(value = "-99", message = "required_return must be > -99%")
    @DecimalMax(value = "100", message = "required_return must be <= 100%")
    private Double requiredReturn;

    @DecimalMin(value = "0", message = "tax_rate must be >= 0%")
    @DecimalMax(value = "99", message = "tax_rate must be < 100%")
    private Double taxRate;

    @Min(value = 0, message = "projection_years must be >= 0")
    @Max(value = 50, message = "projection_years must be <= 50")
    private Integer projectionYears;

    /** Target ROE; null uses the company's own. */
    @DecimalMin(value = "-99", message = "roe must be > -99%")
    @DecimalMax(value = "100", message = "roe must be <= 100%")
    private Double roe;

    @DecimalMin(value = "0", message = "payout_ratio must be >= 0%")
    @DecimalMax(value = "100", message = "payout_ratio must be <= 100%")
    private Double payoutRatio;

    @Valid
    private ModelWeights modelWeights;

    @Data
    public static class ModelWeights {
        @PositiveOrZero private Double fcfe;
        @PositiveOrZero private Double fcff;
        @PositiveOrZero private Double justifiedPe;
        @PositiveOrZero private Double justifiedPb;
    }

    /** Applies the overrides on top of {@code defaults}, converting percent to fractions. */
    public ValuationAssumptions toAssumptions(ValuationAssumptions defaults) {
        ValuationAssumptions.ValuationAssumptionsBuilder b = defaults.toBuilder();
        if (revenueGrowth != null)   b.shortTermGrowth(revenueGrowth / 100);
        if (terminalGrowth != null)  b.terminalGrowth(terminalGrowth / 100);
        if (wacc != null)            b.wacc(wacc / 100);
        if (requiredReturn != null)  b.costOfEquity(requiredReturn / 100);
        if (taxRate != null)         b.taxRate(taxRate / 100);
        if (projectionYears != null) b.forecastYears(projectionYears);
        if (roe != null)             b.targetRoe(roe / 100);
        if (payoutRatio != null)     b.payoutRatio(payoutRatio / 100);

        if (modelWeights != null) {
            Map<ModelType, Double> weights = new EnumMap<>(ModelType.class);
            if (defaults.getModelWeights() != null) weights.putAll(defaults.getModelWeights());
            putPercent(weights, ModelType.FCFE, modelWeights.getFcfe());
            putPercent(weights, ModelType.FCFF, modelWeights.getFcff());
            putPercent(weights, ModelType.JUSTIFIED_PE, modelWeights.getJustifiedPe());
            putPercent(weights, ModelType.JUSTIFIED_PB, modelWeights.getJustifiedPb());
            b.modelWeights(weights);
        }
        return b.build().validate();
    }

    private static void putPercent(Map<ModelType, Double> weights, ModelType model, Double percent) {
        if (percent != null) weights.put(model, percent / 100);
    }
}
