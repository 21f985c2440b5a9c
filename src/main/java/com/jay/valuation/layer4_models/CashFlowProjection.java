package com.jay.valuation.layer4_models;

import java.util.Optional;

/**
 * Two-stage discounted cash flow: an explicit horizon growing at the short-term rate,
 * then a Gordon-growth terminal value on the final projected flow.
 */
final class CashFlowProjection {

    record Result(double presentValueExplicit, double presentValueTerminal) {
        double total() {
            return presentValueExplicit + presentValueTerminal;
        }
    }

    private CashFlowProjection() {}

    /**
     * Present value of {@code baseCashFlow} projected {@code years} periods at
     * {@code shortTermGrowth}, plus a terminal value {@code cf_N × (1 + g) / (r − g)}
     * discounted from period N. Empty when {@code discountRate <= terminalGrowth}.
     */
    static Optional<Result> presentValue(double baseCashFlow, double shortTermGrowth,
                                         double terminalGrowth, double discountRate, int years) {
        if (discountRate <= terminalGrowth || discountRate <= -1) return Optional.empty();

        double explicit = 0;
        double cashFlow = baseCashFlow;
        double discount = 1;
        for (int t = 1; t <= years; t++) {
            cashFlow *= 1 + shortTermGrowth;
            discount *= 1 + discountRate;
            explicit += cashFlow / discount;
        }
        double terminalValue = cashFlow * (1 + terminalGrowth) / (discountRate - terminalGrowth);
        double terminal = terminalValue / discount;

        if (!Double.isFinite(explicit) || !Double.isFinite(terminal)) return Optional.empty();
        return Optional.of(new Result(explicit, terminal));
    }
}
