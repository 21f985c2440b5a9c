package com.jay.valuation.layer4_models;

import com.jay.valuation.model.NormalizedMetrics;

import java.util.OptionalDouble;

import static com.jay.valuation.layer2_resolution.Fallbacks.orZero;
import static com.jay.valuation.layer2_resolution.Fallbacks.sumOfPresent;
import static com.jay.valuation.model.enums.MetricKey.*;

/**
 * Cash-flow building blocks shared by FCFE and FCFF. Optional lines that a statement
 * does not report count as zero; only net income and the share count are required.
 */
final class CashFlowInputs {

    private CashFlowInputs() {}

    static OptionalDouble netIncome(NormalizedMetrics m) {
        return m.get(NET_INCOME_TTM);
    }

    /** Positive share count, or empty. */
    static OptionalDouble shares(NormalizedMetrics m) {
        OptionalDouble s = m.get(SHARES_OUTSTANDING);
        return s.isPresent() && s.getAsDouble() > 0 ? s : OptionalDouble.empty();
    }

    /** Depreciation and amortisation plus provisions. */
    static double nonCashCharges(NormalizedMetrics m) {
        return orZero(sumOfPresent(m.get(DEPRECIATION), m.get(PROVISIONS)));
    }

    /** Increase in net working capital (positive absorbs cash). */
    static double workingCapitalChange(NormalizedMetrics m) {
        return orZero(m.get(WORKING_CAPITAL_CHANGE));
    }

    /**
     * Purchase and disposal of fixed assets combined into one signed line: purchases
     * are an outflow and disposals an inflow whatever sign the provider used.
     */
    static double fixedCapitalInvestment(NormalizedMetrics m) {
        double purchases = Math.abs(orZero(m.get(CAPITAL_EXPENDITURE)));
        double disposals = Math.abs(orZero(m.get(ASSET_DISPOSAL_PROCEEDS)));
        return disposals - purchases;
    }

    static double netBorrowing(NormalizedMetrics m) {
        return orZero(m.get(NET_BORROWING));
    }

    static double afterTaxInterest(NormalizedMetrics m, double taxRate) {
        return Math.abs(orZero(m.get(INTEREST_EXPENSE))) * (1 - taxRate);
    }
}
