package com.jay.valuation.layer5_aggregate;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.MarketComparison;
import com.jay.valuation.model.enums.Recommendation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MarketComparatorTest {

    private final MarketComparator comparator = new MarketComparator(new ValuationConfig());

    @Test
    void upsideAboveThresholdIsBuy() {
        MarketComparison c = comparator.compare(100.0, 125.0).orElseThrow();

        assertThat(c.upsideDownsidePct()).isCloseTo(25.0, within(1e-9));
        assertThat(c.recommendation()).isEqualTo(Recommendation.BUY);
    }

    @Test
    void downsideBelowThresholdIsSell() {
        MarketComparison c = comparator.compare(100.0, 80.0).orElseThrow();

        assertThat(c.upsideDownsidePct()).isCloseTo(-20.0, within(1e-9));
        assertThat(c.recommendation()).isEqualTo(Recommendation.SELL);
    }

    @Test
    void smallGapIsHold() {
        assertThat(comparator.compare(100.0, 110.0).orElseThrow().recommendation()).isEqualTo(Recommendation.HOLD);
        assertThat(comparator.compare(100.0, 90.0).orElseThrow().recommendation()).isEqualTo(Recommendation.HOLD);
    }

    @Test
    void noComparisonWithoutPriceOrValuation() {
        assertThat(comparator.compare(null, 100.0)).isEmpty();
        assertThat(comparator.compare(0.0, 100.0)).isEmpty();
        assertThat(comparator.compare(100.0, 0.0)).isEmpty();
    }
}
