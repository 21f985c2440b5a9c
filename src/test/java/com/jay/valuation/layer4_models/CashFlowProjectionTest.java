package com.jay.valuation.layer4_models;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CashFlowProjectionTest {

    @Test
    void splitsExplicitAndTerminalPresentValue() {
        CashFlowProjection.Result r = CashFlowProjection.presentValue(100, 0.10, 0.02, 0.10, 1).orElseThrow();

        assertThat(r.presentValueExplicit()).isCloseTo(100.0, within(1e-9));
        assertThat(r.presentValueTerminal()).isCloseTo(110 * 1.02 / 0.08 / 1.10, within(1e-9));
        assertThat(r.total()).isCloseTo(r.presentValueExplicit() + r.presentValueTerminal(), within(1e-12));
    }

    @Test
    void refusesGrowthAtOrAboveTheDiscountRate() {
        assertThat(CashFlowProjection.presentValue(100, 0.05, 0.10, 0.10, 5)).isEmpty();
        assertThat(CashFlowProjection.presentValue(100, 0.05, 0.11, 0.10, 5)).isEmpty();
    }

    @Test
    void negativeBaseCashFlowProducesNegativeValue() {
        assertThat(CashFlowProjection.presentValue(-50, 0.05, 0.02, 0.10, 3).orElseThrow().total()).isNegative();
    }
}
