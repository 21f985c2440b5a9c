package com.jay.valuation.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Normalized metrics for a symbol, served by GET /api/metrics/{symbol}.
 */
@Data
@Builder
public class MetricsReport {

    public record DataQuality(boolean hasRealPrice, boolean hasFinancials, boolean peReliable, boolean pbReliable) {}

    private String symbol;
    private String sector;
    private String dataPeriod;
    private Map<String, Double> metrics;
    private DataQuality dataQuality;
    private LocalDateTime retrievedAt;
}
