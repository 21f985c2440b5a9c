package com.jay.valuation.model;

import com.jay.valuation.model.enums.StatementType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Body of POST /api/valuation: statements supplied by the caller in the provider's
 * row format, plus optional assumption overrides.
 */
@Data
public class OfflineValuationRequest {

    @NotBlank(message = "symbol must not be blank")
    private String symbol;

    /** year | quarter; blank means year. */
    private String period;

    private Double currentPrice;

    private List<Map<String, Object>> balanceSheet;
    private List<Map<String, Object>> incomeStatement;
    private List<Map<String, Object>> cashFlow;
    private List<Map<String, Object>> ratios;

    @Valid
    private ValuationRequest assumptions;

    public Map<StatementType, List<Map<String, Object>>> rowsByStatement() {
        Map<StatementType, List<Map<String, Object>>> rows = new EnumMap<>(StatementType.class);
        if (balanceSheet != null)    rows.put(StatementType.BALANCE_SHEET, balanceSheet);
        if (incomeStatement != null) rows.put(StatementType.INCOME_STATEMENT, incomeStatement);
        if (cashFlow != null)        rows.put(StatementType.CASH_FLOW, cashFlow);
        if (ratios != null)          rows.put(StatementType.RATIOS, ratios);
        return rows;
    }
}
