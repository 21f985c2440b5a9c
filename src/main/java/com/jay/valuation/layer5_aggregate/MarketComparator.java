package com.jay.valuation.layer5_aggregate;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.MarketComparison;
import com.jay.valuation.model.enums.Recommendation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Compares the weighted valuation with the market price.
 * Upside above the BUY threshold → BUY, below the SELL threshold → SELL, otherwise HOLD.
 */
@Component
@RequiredArgsConstructor
public class MarketComparator {

    private final ValuationConfig config;

    /** Empty unless both the price and the valuation are positive. */
    public Optional<MarketComparison> compare(Double currentPrice, double valuation) {
        if (currentPrice == null || !(currentPrice > 0) || !(valuation > 0) || !Double.isFinite(valuation)) {
            return Optional.empty();
        }
        double upsidePct = (valuation - currentPrice) / currentPrice * 100;
        return Optional.of(new MarketComparison(currentPrice, valuation, upsidePct, classify(upsidePct)));
    }

    Recommendation classify(double upsidePct) {
        ValuationConfig.MarketComparison t = config.marketComparison();
        if (upsidePct > t.getBuyAbovePct()) return Recommendation.BUY;
        if (upsidePct < t.getSellBelowPct()) return Recommendation.SELL;
        return Recommendation.HOLD;
    }
}
