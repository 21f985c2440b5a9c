package com.jay.valuation.layer1_data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.valuation.model.FinancialStatements;
import com.jay.valuation.model.TabularRecord;
import com.jay.valuation.model.enums.ReportingPeriod;
import com.jay.valuation.model.enums.StatementType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the provider's statement payload into {@link FinancialStatements}.
 *
 * Payload format:
 *   { "symbol": "VNM", "current_price": 61200,
 *     "balance_sheet": [ { "yearReport": 2024, "lengthReport": 4, "Assets|TOTAL ASSETS": 5.3e13, ... } ],
 *     "income_statement": [...], "cash_flow": [...], "ratios": [...] }
 *
 * Rows carrying {@code yearReport}/{@code lengthReport} are ordered most-recent-first;
 * otherwise the provider order is kept.
 */
@Slf4j
@Component
public class StatementJsonParser {

    static final String YEAR_KEY = "yearReport";
    static final String LENGTH_KEY = "lengthReport";

    private final ObjectMapper objectMapper = new ObjectMapper();

    public FinancialStatements parse(String json, String requestedSymbol, ReportingPeriod period) throws IOException {
        return parse(objectMapper.readTree(json), requestedSymbol, period);
    }

    public FinancialStatements parse(JsonNode root, String requestedSymbol, ReportingPeriod period) {
        String symbol = root.path("symbol").asText(requestedSymbol);
        Double price = positiveOrNull(root.path("current_price"));

        Map<StatementType, TabularRecord> statements = new EnumMap<>(StatementType.class);
        for (StatementType type : StatementType.values()) {
            JsonNode rows = root.path(type.wireName());
            if (!rows.isArray()) continue;
            List<Map<String, Object>> parsed = new ArrayList<>();
            for (JsonNode row : rows) {
                if (row.isObject()) parsed.add(toRow(row));
            }
            statements.put(type, TabularRecord.ofRows(sortMostRecentFirst(parsed)));
            log.debug("{} {}: {} period rows", symbol, type.wireName(), parsed.size());
        }
        return new FinancialStatements(symbol, period, statements, price);
    }

    /** Builds the bundle from rows already decoded into maps (offline valuation requests). */
    public FinancialStatements fromRows(String symbol, ReportingPeriod period, Double currentPrice,
                                        Map<StatementType, List<Map<String, Object>>> rowsByStatement) {
        Map<StatementType, TabularRecord> statements = new EnumMap<>(StatementType.class);
        if (rowsByStatement != null) {
            rowsByStatement.forEach((type, rows) -> {
                if (rows != null) statements.put(type, TabularRecord.ofRows(sortMostRecentFirst(new ArrayList<>(rows))));
            });
        }
        Double price = currentPrice != null && currentPrice > 0 ? currentPrice : null;
        return new FinancialStatements(symbol, period, statements, price);
    }

    private static Map<String, Object> toRow(JsonNode node) {
        Map<String, Object> row = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            JsonNode v = f.getValue();
            if (v.isNumber())        row.put(f.getKey(), v.asDouble());
            else if (v.isTextual())  row.put(f.getKey(), v.asText());
            else if (v.isBoolean())  row.put(f.getKey(), v.asBoolean());
            else                     row.put(f.getKey(), null);
        }
        return row;
    }

    static List<Map<String, Object>> sortMostRecentFirst(List<Map<String, Object>> rows) {
        boolean keyed = !rows.isEmpty() && rows.stream().allMatch(r -> r != null && periodNumber(r.get(YEAR_KEY)) != null);
        if (!keyed) return rows;
        Comparator<Map<String, Object>> byYear = Comparator.comparingDouble(r -> periodNumber(r.get(YEAR_KEY)));
        Comparator<Map<String, Object>> byLength = Comparator.comparingDouble(r -> {
            Double len = periodNumber(r.get(LENGTH_KEY));
            return len == null ? 0 : len;
        });
        List<Map<String, Object>> sorted = new ArrayList<>(rows);
        sorted.sort(byYear.thenComparing(byLength).reversed());
        return sorted;
    }

    private static Double periodNumber(Object v) {
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Double positiveOrNull(JsonNode node) {
        if (node == null || !node.isNumber()) return null;
        double v = node.asDouble();
        return v > 0 && Double.isFinite(v) ? v : null;
    }
}
