package com.jay.valuation.layer1_data;

import com.jay.valuation.exception.StatementSourceException;
import com.jay.valuation.model.FinancialStatements;
import com.jay.valuation.model.enums.ReportingPeriod;

/**
 * Supplier of raw statement tables for a symbol.
 */
public interface StatementSource {

    /**
     * @throws StatementSourceException when the provider cannot be reached or answers with an error
     */
    FinancialStatements fetch(String symbol, ReportingPeriod period);

    /** Same as {@link #fetch} but never served from a cache. */
    default FinancialStatements fetchFresh(String symbol, ReportingPeriod period) {
        return fetch(symbol, period);
    }
}
