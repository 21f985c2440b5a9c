package com.jay.valuation.model;

import com.jay.valuation.model.enums.ModelType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of all four models plus their weighted average. {@code summary} is null
 * when no model produced a usable value.
 */
public record ValuationResult(
    Map<ModelType, ModelValuation> models,
    double weightedAverage,
    ValuationSummary summary
) {

    public ValuationResult {
        EnumMap<ModelType, ModelValuation> copy = new EnumMap<>(ModelType.class);
        if (models != null) copy.putAll(models);
        models = Collections.unmodifiableMap(copy);
    }

    public Optional<ValuationSummary> summaryIfAny() {
        return Optional.ofNullable(summary);
    }

    public boolean hasValue() {
        return weightedAverage > 0 && Double.isFinite(weightedAverage);
    }

    public double value(ModelType model) {
        ModelValuation v = models.get(model);
        return v == null ? ModelValuation.SENTINEL : v.value();
    }

    /** Model name → per-share value, plus {@code weighted_average}. */
    public Map<String, Double> toFlatMap() {
        Map<String, Double> flat = new LinkedHashMap<>();
        for (ModelType type : ModelType.values()) {
            flat.put(type.wireName(), value(type));
        }
        flat.put("weighted_average", weightedAverage);
        return flat;
    }
}
