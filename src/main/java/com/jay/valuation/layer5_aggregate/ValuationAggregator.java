package com.jay.valuation.layer5_aggregate;

import com.jay.valuation.model.ModelValuation;
import com.jay.valuation.model.ValuationResult;
import com.jay.valuation.model.ValuationSummary;
import com.jay.valuation.model.enums.ModelType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Layer 5: aggregation.
 * Combines the per-model values into one weighted average. Only finite, strictly positive
 * values take part; their weights are renormalised over the surviving subset. When every
 * surviving weight is zero they count equally.
 */
@Slf4j
@Component
public class ValuationAggregator {

    public ValuationResult aggregate(Map<ModelType, ModelValuation> results, Map<ModelType, Double> weights) {
        int total = results.size();
        int used = 0;
        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double weightSum = 0;
        double weighted = 0;

        for (Map.Entry<ModelType, ModelValuation> e : results.entrySet()) {
            ModelValuation v = e.getValue();
            if (v == null || !v.isUsable()) continue;
            double value = v.value();
            used++;
            sum += value;
            min = Math.min(min, value);
            max = Math.max(max, value);

            double w = weightOf(weights, e.getKey());
            weightSum += w;
            weighted += w * value;
        }

        if (used == 0) {
            log.info("No model produced a usable value; weighted average unavailable");
            return new ValuationResult(results, ModelValuation.SENTINEL, null);
        }

        ValuationSummary summary = new ValuationSummary(sum / used, min, max, used, total);
        if (weightSum <= 0) {
            log.warn("All {} qualifying models carry zero weight; weighting them equally", used);
            return new ValuationResult(results, summary.average(), summary);
        }

        double average = weighted / weightSum;
        log.debug("Aggregated {} of {} models: weighted={} range=[{}, {}]", used, total, average, min, max);
        return new ValuationResult(results, average, summary);
    }

    private static double weightOf(Map<ModelType, Double> weights, ModelType model) {
        if (weights == null) return 0;
        Double w = weights.get(model);
        return w == null || !Double.isFinite(w) || w < 0 ? 0 : w;
    }
}
