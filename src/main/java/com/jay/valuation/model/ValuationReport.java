package com.jay.valuation.model;

import com.jay.valuation.model.enums.ModelStatus;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Full valuation response for a single symbol.
 * Returned by ValuationService and served by POST /api/valuation/{symbol}.
 */
@Data
@Builder
public class ValuationReport {

    private String symbol;
    private String sector;
    private String dataPeriod;          // year / quarter

    // ── Model outputs ─────────────────────────────────────────────────────────
    private Map<String, Double>      valuations;     // model name → per-share value, + weighted_average
    private Map<String, ModelStatus> modelStatus;
    private Map<String, String>      modelDetail;
    private ValuationSummary         summary;        // null when no model qualified

    // ── Inputs echoed back ────────────────────────────────────────────────────
    private Map<String, Double> financialData;      // eps, bvps, net_income, equity, shares_outstanding
    private ValuationAssumptions assumptionsUsed;

    // ── Price comparison ──────────────────────────────────────────────────────
    private MarketComparison marketComparison;      // null without a price or a valuation

    private boolean       success;
    private LocalDateTime timestamp;
}
