package com.jay.valuation.layer4_models;

import com.jay.valuation.model.ModelValuation;
import com.jay.valuation.model.NormalizedMetrics;
import com.jay.valuation.model.ValuationAssumptions;
import com.jay.valuation.model.enums.ModelStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Shared skeleton of FCFE and FCFF: build the base-year cash flow, project it over the
 * forecast horizon, add a terminal value, discount, divide by shares outstanding.
 */
@Slf4j
abstract class DiscountedCashFlowModel implements ValuationModel {

    /** Base-year cash flow, or empty when net income is unavailable. */
    protected abstract OptionalDouble baseCashFlow(NormalizedMetrics metrics, ValuationAssumptions assumptions);

    protected abstract double discountRate(ValuationAssumptions assumptions);

    protected abstract String discountRateName();

    @Override
    public ModelValuation value(NormalizedMetrics metrics, ValuationAssumptions assumptions) {
        double r = discountRate(assumptions);
        double g = assumptions.getTerminalGrowth();
        if (r <= g) {
            log.warn("{}: {}={} does not exceed terminal growth {}; model excluded",
                type().wireName(), discountRateName(), r, g);
            return ModelValuation.unavailable(type(), ModelStatus.ILL_CONDITIONED,
                String.format("%s %.4f <= terminal growth %.4f", discountRateName(), r, g));
        }

        OptionalDouble shares = CashFlowInputs.shares(metrics);
        OptionalDouble base = baseCashFlow(metrics, assumptions);
        if (shares.isEmpty() || base.isEmpty()) {
            return ModelValuation.unavailable(type(), ModelStatus.INSUFFICIENT_DATA,
                shares.isEmpty() ? "shares outstanding unavailable" : "net income unavailable");
        }

        Optional<CashFlowProjection.Result> pv = CashFlowProjection.presentValue(
            base.getAsDouble(), assumptions.getShortTermGrowth(), g, r, assumptions.getForecastYears());
        if (pv.isEmpty()) {
            return ModelValuation.unavailable(type(), ModelStatus.ILL_CONDITIONED, "projection not finite");
        }

        double perShare = pv.get().total() / shares.getAsDouble();
        log.debug("{}: base={} pvExplicit={} pvTerminal={} perShare={}", type().wireName(),
            base.getAsDouble(), pv.get().presentValueExplicit(), pv.get().presentValueTerminal(), perShare);
        return ModelValuation.ok(type(), perShare, String.format("base cash flow %.2f, %s %.4f",
            base.getAsDouble(), discountRateName(), r));
    }
}
