package com.jay.valuation.model;

import com.jay.valuation.model.enums.Recommendation;

public record MarketComparison(
    double currentPrice,
    double averageValuation,
    double upsideDownsidePct,
    Recommendation recommendation
) {}
