package com.jay.valuation.model;

import com.jay.valuation.model.enums.ReportingPeriod;
import com.jay.valuation.model.enums.StatementType;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * The statement bundle for one symbol: up to four named tabular statements plus an
 * optional quoted price. Created per request and discarded afterwards.
 */
public record FinancialStatements(
    String symbol,
    ReportingPeriod period,
    Map<StatementType, TabularRecord> statements,
    Double currentPrice
) {

    public FinancialStatements {
        symbol = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        period = period == null ? ReportingPeriod.ANNUAL : period;
        EnumMap<StatementType, TabularRecord> copy = new EnumMap<>(StatementType.class);
        if (statements != null) {
            statements.forEach((type, record) -> {
                if (type != null && record != null) copy.put(type, record);
            });
        }
        statements = Map.copyOf(copy);
    }

    public TabularRecord statement(StatementType type) {
        return statements.getOrDefault(type, TabularRecord.empty());
    }

    public boolean isEmpty() {
        return statements.values().stream().allMatch(TabularRecord::isEmpty);
    }
}
