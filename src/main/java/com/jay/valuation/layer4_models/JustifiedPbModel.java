package com.jay.valuation.layer4_models;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.ModelValuation;
import com.jay.valuation.model.NormalizedMetrics;
import com.jay.valuation.model.ValuationAssumptions;
import com.jay.valuation.model.enums.ModelStatus;
import com.jay.valuation.model.enums.ModelType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

import static com.jay.valuation.model.enums.MetricKey.BOOK_VALUE_PER_SHARE;

/**
 * Justified P/B = (roe − g) / (r − g), applied to book value per share.
 * A reported book value per share wins over equity / shares, which the normalizer derives.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JustifiedPbModel implements ValuationModel {

    private final ValuationConfig config;

    @Override
    public ModelType type() {
        return ModelType.JUSTIFIED_PB;
    }

    @Override
    public ModelValuation value(NormalizedMetrics m, ValuationAssumptions a) {
        OptionalDouble bvps = m.get(BOOK_VALUE_PER_SHARE);
        if (bvps.isEmpty()) {
            return ModelValuation.unavailable(type(), ModelStatus.INSUFFICIENT_DATA, "book value per share unavailable");
        }
        OptionalDouble roeValue = SustainableGrowth.roe(m, a);
        if (roeValue.isEmpty()) {
            return ModelValuation.unavailable(type(), ModelStatus.INSUFFICIENT_DATA, "ROE unavailable");
        }

        double r = a.getCostOfEquity();
        double roe = roeValue.getAsDouble();
        double g = SustainableGrowth.growth(roe, a.getPayoutRatio());

        if (r <= g || roe <= g) {
            double multiple = config.models().getFallbackPbMultiple();
            log.warn("justified_pb: r={} roe={} g={}; using fallback multiple {}", r, roe, g, multiple);
            return ModelValuation.fallback(type(), multiple * bvps.getAsDouble(),
                String.format("fallback P/B %.1f (%s)", multiple, r <= g ? "r <= g" : "roe <= g"));
        }

        double pb = (roe - g) / (r - g);
        return ModelValuation.ok(type(), pb * bvps.getAsDouble(),
            String.format("justified P/B %.2f, g %.4f", pb, g));
    }
}
