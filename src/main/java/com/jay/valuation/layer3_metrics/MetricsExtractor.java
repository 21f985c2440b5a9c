package com.jay.valuation.layer3_metrics;

import com.jay.valuation.layer2_resolution.FieldCandidateTable;
import com.jay.valuation.layer2_resolution.FieldCandidateTable.CandidateSource;
import com.jay.valuation.layer2_resolution.FieldResolver;
import com.jay.valuation.model.FinancialStatements;
import com.jay.valuation.model.RawMetrics;
import com.jay.valuation.model.enums.AggregationMode;
import com.jay.valuation.model.enums.MetricKey;
import com.jay.valuation.model.enums.ReportingPeriod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Reads every canonical metric the candidate table knows about out of a statement bundle.
 *
 * Flow metrics (income and cash-flow items) are summed over the trailing four periods when
 * the bundle is quarterly and read from the latest period when it is annual. Balance-sheet
 * stocks, per-share figures and ratios are always point-in-time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsExtractor {

    private final FieldCandidateTable candidateTable;
    private final FieldResolver resolver;

    public RawMetrics extract(FinancialStatements statements) {
        RawMetrics.Builder raw = RawMetrics.builder();
        if (statements.currentPrice() != null) {
            raw.put(MetricKey.CURRENT_PRICE, statements.currentPrice());
        }
        for (MetricKey key : MetricKey.values()) {
            if (key == MetricKey.CURRENT_PRICE && statements.currentPrice() != null) continue;
            raw.put(key, resolve(statements, key));
        }
        RawMetrics result = raw.build();
        log.debug("Extracted {} primitives for {} ({})", result.asMap().size(),
            statements.symbol(), statements.period().wireName());
        return result;
    }

    OptionalDouble resolve(FinancialStatements statements, MetricKey key) {
        AggregationMode mode = aggregationFor(key, statements.period());
        for (CandidateSource source : candidateTable.sourcesFor(key)) {
            OptionalDouble v = resolver.resolve(statements.statement(source.statement()), source.candidates(), mode);
            if (v.isPresent()) return v;
        }
        return OptionalDouble.empty();
    }

    public static AggregationMode aggregationFor(MetricKey key, ReportingPeriod period) {
        return key.isFlow() && period == ReportingPeriod.QUARTERLY
            ? AggregationMode.TRAILING_SUM
            : AggregationMode.LATEST;
    }
}
