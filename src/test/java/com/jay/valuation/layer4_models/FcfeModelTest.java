package com.jay.valuation.layer4_models;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.ModelValuation;
import com.jay.valuation.model.NormalizedMetrics;
import com.jay.valuation.model.ValuationAssumptions;
import com.jay.valuation.model.enums.MetricKey;
import com.jay.valuation.model.enums.ModelStatus;
import com.jay.valuation.model.enums.Provenance;
import org.junit.jupiter.api.Test;

import static com.jay.valuation.model.enums.MetricKey.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FcfeModelTest {

    private final FcfeModel model = new FcfeModel();

    @Test
    void terminalValueOnlyWhenHorizonIsZero() {
        // fcfe = 100 + 20 + 10 − 5 − 30 = 95; TV = 95 × 1.02 / 0.10 = 969; per share 96.9
        ModelValuation v = model.value(metrics(CAPITAL_EXPENDITURE, -30), assumptions(0, 0.05, 0.02, 0.12));

        assertThat(v.status()).isEqualTo(ModelStatus.OK);
        assertThat(v.value()).isCloseTo(96.9, within(1e-9));
    }

    @Test
    void projectsExplicitHorizonThenDiscountsTerminalValue() {
        ModelValuation v = model.value(metrics(CAPITAL_EXPENDITURE, -30), assumptions(2, 0.05, 0.02, 0.12));

        double cf1 = 95 * 1.05;
        double cf2 = cf1 * 1.05;
        double pv = cf1 / 1.12 + cf2 / (1.12 * 1.12) + cf2 * 1.02 / 0.10 / (1.12 * 1.12);
        assertThat(v.value()).isCloseTo(pv / 10, within(1e-9));
    }

    @Test
    void capexSignConventionDoesNotMatter() {
        ValuationAssumptions a = assumptions(3, 0.05, 0.02, 0.12);

        double negative = model.value(metrics(CAPITAL_EXPENDITURE, -30), a).value();
        double positive = model.value(metrics(CAPITAL_EXPENDITURE, 30), a).value();

        assertThat(positive).isCloseTo(negative, within(1e-9));
    }

    @Test
    void discountRateNotAboveTerminalGrowthIsExcluded() {
        ModelValuation v = model.value(metrics(CAPITAL_EXPENDITURE, -30), assumptions(5, 0.05, 0.12, 0.12));

        assertThat(v.status()).isEqualTo(ModelStatus.ILL_CONDITIONED);
        assertThat(v.value()).isEqualTo(ModelValuation.SENTINEL);
    }

    @Test
    void missingShareCountYieldsSentinel() {
        NormalizedMetrics.Builder b = NormalizedMetrics.builder();
        b.putIfAbsent(NET_INCOME_TTM, 100, Provenance.REPORTED);

        ModelValuation v = model.value(b.build(), assumptions(5, 0.05, 0.02, 0.12));

        assertThat(v.status()).isEqualTo(ModelStatus.INSUFFICIENT_DATA);
        assertThat(v.isUsable()).isFalse();
    }

    @Test
    void missingOptionalLinesCountAsZero() {
        NormalizedMetrics.Builder b = NormalizedMetrics.builder();
        b.putIfAbsent(NET_INCOME_TTM, 100, Provenance.REPORTED);
        b.putIfAbsent(SHARES_OUTSTANDING, 10, Provenance.REPORTED);

        ModelValuation v = model.value(b.build(), assumptions(0, 0.05, 0.02, 0.12));

        assertThat(v.value()).isCloseTo(100 * 1.02 / 0.10 / 10, within(1e-9));
    }

    static NormalizedMetrics metrics(MetricKey capexKey, double capex) {
        NormalizedMetrics.Builder b = NormalizedMetrics.builder();
        b.putIfAbsent(NET_INCOME_TTM, 100, Provenance.REPORTED);
        b.putIfAbsent(DEPRECIATION, 20, Provenance.REPORTED);
        b.putIfAbsent(NET_BORROWING, 10, Provenance.REPORTED);
        b.putIfAbsent(WORKING_CAPITAL_CHANGE, 5, Provenance.REPORTED);
        b.putIfAbsent(INTEREST_EXPENSE, -10, Provenance.REPORTED);
        b.putIfAbsent(capexKey, capex, Provenance.REPORTED);
        b.putIfAbsent(SHARES_OUTSTANDING, 10, Provenance.REPORTED);
        return b.build();
    }

    static ValuationAssumptions assumptions(int years, double shortGrowth, double terminalGrowth, double rate) {
        return new ValuationConfig().defaultAssumptions().toBuilder()
            .forecastYears(years)
            .shortTermGrowth(shortGrowth)
            .terminalGrowth(terminalGrowth)
            .costOfEquity(rate)
            .wacc(rate)
            .taxRate(0.2)
            .build();
    }
}
