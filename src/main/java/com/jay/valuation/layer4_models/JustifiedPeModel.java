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

import static com.jay.valuation.model.enums.MetricKey.EPS;

/**
 * Justified P/E = payout × (1 + g) / (r − g), applied to current EPS.
 * A reported EPS is used as is; the normalizer derives one from net income / shares otherwise.
 * When r ≤ g the configured conservative multiple is used instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JustifiedPeModel implements ValuationModel {

    private final ValuationConfig config;

    @Override
    public ModelType type() {
        return ModelType.JUSTIFIED_PE;
    }

    @Override
    public ModelValuation value(NormalizedMetrics m, ValuationAssumptions a) {
        OptionalDouble eps = m.get(EPS);
        if (eps.isEmpty()) {
            return ModelValuation.unavailable(type(), ModelStatus.INSUFFICIENT_DATA, "EPS unavailable");
        }
        OptionalDouble roe = SustainableGrowth.roe(m, a);
        if (roe.isEmpty()) {
            return ModelValuation.unavailable(type(), ModelStatus.INSUFFICIENT_DATA, "ROE unavailable");
        }

        double r = a.getCostOfEquity();
        double payout = a.getPayoutRatio();
        double g = SustainableGrowth.growth(roe.getAsDouble(), payout);

        if (r <= g) {
            double multiple = config.models().getFallbackPeMultiple();
            log.warn("justified_pe: cost_of_equity {} <= growth {}; using fallback multiple {}", r, g, multiple);
            return ModelValuation.fallback(type(), multiple * eps.getAsDouble(),
                String.format("fallback P/E %.1f (r %.4f <= g %.4f)", multiple, r, g));
        }

        double pe = payout * (1 + g) / (r - g);
        return ModelValuation.ok(type(), pe * eps.getAsDouble(),
            String.format("justified P/E %.2f, g %.4f", pe, g));
    }
}
