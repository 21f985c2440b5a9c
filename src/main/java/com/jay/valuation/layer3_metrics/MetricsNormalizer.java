package com.jay.valuation.layer3_metrics;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.NormalizedMetrics;
import com.jay.valuation.model.RawMetrics;
import com.jay.valuation.model.enums.MetricKey;
import com.jay.valuation.model.enums.Provenance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.Supplier;

import static com.jay.valuation.layer2_resolution.Fallbacks.both;
import static com.jay.valuation.layer2_resolution.Fallbacks.firstPresent;
import static com.jay.valuation.layer2_resolution.Fallbacks.ratio;
import static com.jay.valuation.layer2_resolution.Fallbacks.sumOfPresent;
import static com.jay.valuation.model.enums.MetricKey.*;

/**
 * Turns extracted primitives into a complete metrics set.
 *
 * Ingestion reconciles units once: fractions reported as percentages are divided by 100,
 * and implausibly large share counts are rescaled. Derivation then fills each missing
 * metric from formulas, in a fixed order, and never replaces a value that is present.
 * Normalizing an already-normalized set changes nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsNormalizer {

    private final ValuationConfig config;

    public NormalizedMetrics normalize(RawMetrics primitives) {
        NormalizedMetrics.Builder b = NormalizedMetrics.builder();
        for (Map.Entry<MetricKey, Double> e : primitives.asMap().entrySet()) {
            b.putIfAbsent(e.getKey(), reconcile(e.getKey(), e.getValue()), Provenance.REPORTED);
        }
        return derive(b);
    }

    /** Re-runs derivation only; values already present, and their units, are left alone. */
    public NormalizedMetrics normalize(NormalizedMetrics metrics) {
        return derive(metrics.toBuilder());
    }

    // ── Ingestion ─────────────────────────────────────────────────────────────

    double reconcile(MetricKey key, double value) {
        if (key.isFraction() && Math.abs(value) >= 1) {
            log.debug("{}={} looks like a percentage; storing {}", key.canonicalName(), value, value / 100);
            return value / 100;
        }
        if (key == SHARES_OUTSTANDING) {
            ValuationConfig.Normalizer cfg = config.normalizer();
            if (value > cfg.getSharesImplausibilityThreshold()) {
                double rescaled = value / cfg.getSharesRescaleFactor();
                log.warn("shares_outstanding={} exceeds plausibility threshold {}; rescaled to {}",
                    value, cfg.getSharesImplausibilityThreshold(), rescaled);
                return rescaled;
            }
        }
        return value;
    }

    // ── Derivation ────────────────────────────────────────────────────────────

    private NormalizedMetrics derive(NormalizedMetrics.Builder b) {
        // Balance-sheet identities and composite cash-flow lines
        derive(b, TOTAL_EQUITY, () -> both(b.get(TOTAL_ASSETS), b.get(TOTAL_LIABILITIES), (a, l) -> a - l));
        derive(b, TOTAL_LIABILITIES, () -> both(b.get(TOTAL_ASSETS), b.get(TOTAL_EQUITY), (a, e) -> a - e));
        derive(b, TOTAL_DEBT, () -> sumOfPresent(b.get(SHORT_TERM_DEBT), b.get(LONG_TERM_DEBT)));
        derive(b, NET_BORROWING, () -> sumOfPresent(b.get(BORROWING_PROCEEDS), b.get(BORROWING_REPAYMENTS)));
        // Cash effects are signed as reported: an increase in receivables is a negative cash effect.
        derive(b, WORKING_CAPITAL_CHANGE, () -> negate(sumOfPresent(
            b.get(RECEIVABLES_CHANGE), b.get(INVENTORIES_CHANGE), b.get(PAYABLES_CHANGE))));

        // Margins
        derive(b, GROSS_MARGIN, () -> ratio(b.get(GROSS_PROFIT), b.get(REVENUE_TTM)));
        derive(b, EBIT_MARGIN, () -> ratio(b.get(EBIT), b.get(REVENUE_TTM)));
        derive(b, NET_PROFIT_MARGIN, () -> ratio(b.get(NET_INCOME_TTM), b.get(REVENUE_TTM)));

        // Profitability
        derive(b, ROA, () -> ratio(b.get(NET_INCOME_TTM), b.get(TOTAL_ASSETS)));
        derive(b, ROE, () -> ratio(b.get(NET_INCOME_TTM), b.get(TOTAL_EQUITY)));

        // Turnover
        derive(b, ASSET_TURNOVER, () -> ratio(b.get(REVENUE_TTM), b.get(TOTAL_ASSETS)));
        derive(b, INVENTORY_TURNOVER, () -> ratio(b.get(REVENUE_TTM), b.get(INVENTORY)));
        derive(b, FIXED_ASSET_TURNOVER, () -> ratio(b.get(REVENUE_TTM), b.get(FIXED_ASSETS)));
        derive(b, RECEIVABLES_TURNOVER, () -> ratio(b.get(REVENUE_TTM), b.get(ACCOUNTS_RECEIVABLE)));

        // Liquidity
        derive(b, CURRENT_RATIO, () -> ratio(b.get(CURRENT_ASSETS), b.get(CURRENT_LIABILITIES)));
        derive(b, QUICK_RATIO, () -> ratio(
            both(b.get(CURRENT_ASSETS), b.get(INVENTORY), (ca, inv) -> ca - inv), b.get(CURRENT_LIABILITIES)));
        derive(b, CASH_RATIO, () -> ratio(b.get(CASH), b.get(CURRENT_LIABILITIES)));

        // Leverage
        derive(b, DEBT_TO_EQUITY, () -> ratio(b.get(TOTAL_DEBT), b.get(TOTAL_EQUITY)));
        derive(b, EQUITY_MULTIPLIER, () -> ratio(b.get(TOTAL_ASSETS), b.get(TOTAL_EQUITY)));

        // EBITDA: ebit + D&A, else bottom-up from net income
        derive(b, EBITDA, () -> firstPresent(
            () -> both(b.get(EBIT), b.get(DEPRECIATION), Double::sum),
            () -> bottomUpEbitda(b)));

        // Per share and valuation
        derive(b, EPS, () -> ratio(b.get(NET_INCOME_TTM), b.get(SHARES_OUTSTANDING)));
        derive(b, BOOK_VALUE_PER_SHARE, () -> ratio(b.get(TOTAL_EQUITY), b.get(SHARES_OUTSTANDING)));
        derive(b, MARKET_CAP, () -> both(b.get(CURRENT_PRICE), b.get(SHARES_OUTSTANDING), (p, s) -> p * s));
        derive(b, PE_RATIO, () -> ratio(b.get(CURRENT_PRICE), positive(b.get(EPS))));
        derive(b, PB_RATIO, () -> ratio(b.get(CURRENT_PRICE), positive(b.get(BOOK_VALUE_PER_SHARE))));
        derive(b, PS_RATIO, () -> ratio(b.get(CURRENT_PRICE), ratio(b.get(REVENUE_TTM), b.get(SHARES_OUTSTANDING))));

        // Coverage
        derive(b, INTEREST_COVERAGE, () -> ratio(b.get(EBIT), abs(b.get(INTEREST_EXPENSE))));

        // Enterprise value
        derive(b, ENTERPRISE_VALUE, () -> both(
            both(b.get(MARKET_CAP), b.get(TOTAL_DEBT), Double::sum), b.get(CASH), (v, c) -> v - c));
        derive(b, EV_TO_EBITDA, () -> ratio(b.get(ENTERPRISE_VALUE), positive(b.get(EBITDA))));

        return b.build();
    }

    private static void derive(NormalizedMetrics.Builder b, MetricKey target, Supplier<OptionalDouble> formula) {
        if (b.has(target)) return;
        OptionalDouble v = formula.get();
        if (b.putIfAbsent(target, v, Provenance.DERIVED)) {
            log.debug("Derived {}={}", target.canonicalName(), v.getAsDouble());
        }
    }

    /** Net income + |tax| + |interest| + D&A; all four are required. */
    private static OptionalDouble bottomUpEbitda(NormalizedMetrics.Builder b) {
        OptionalDouble ni = b.get(NET_INCOME_TTM);
        OptionalDouble tax = abs(b.get(INCOME_TAX));
        OptionalDouble interest = abs(b.get(INTEREST_EXPENSE));
        OptionalDouble dep = b.get(DEPRECIATION);
        return both(both(ni, tax, Double::sum), both(interest, dep, Double::sum), Double::sum);
    }

    private static OptionalDouble positive(OptionalDouble v) {
        return v.isPresent() && v.getAsDouble() > 0 ? v : OptionalDouble.empty();
    }

    private static OptionalDouble abs(OptionalDouble v) {
        return v.isPresent() ? OptionalDouble.of(Math.abs(v.getAsDouble())) : v;
    }

    private static OptionalDouble negate(OptionalDouble v) {
        return v.isPresent() ? OptionalDouble.of(-v.getAsDouble()) : v;
    }
}
