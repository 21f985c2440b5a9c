package com.jay.valuation.model.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Canonical metric names. The kind decides how a metric is read from period rows
 * (flows are summed over a trailing window for quarterly data, everything else is
 * point-in-time) and whether it is a fraction subject to percentage normalisation.
 */
public enum MetricKey {

    // ── Income statement (flows) ──────────────────────────────────────────────
    REVENUE_TTM("revenue_ttm", Kind.FLOW),
    GROSS_PROFIT("gross_profit", Kind.FLOW),
    EBIT("ebit", Kind.FLOW),
    EBITDA("ebitda", Kind.FLOW),
    NET_INCOME_TTM("net_income_ttm", Kind.FLOW),
    INTEREST_EXPENSE("interest_expense", Kind.FLOW),
    INCOME_TAX("income_tax", Kind.FLOW),

    // ── Cash flow statement (flows) ───────────────────────────────────────────
    DEPRECIATION("depreciation", Kind.FLOW),
    PROVISIONS("provisions", Kind.FLOW),
    OPERATING_CASH_FLOW("operating_cash_flow", Kind.FLOW),
    CAPITAL_EXPENDITURE("capital_expenditure", Kind.FLOW),
    ASSET_DISPOSAL_PROCEEDS("asset_disposal_proceeds", Kind.FLOW),
    BORROWING_PROCEEDS("borrowing_proceeds", Kind.FLOW),
    BORROWING_REPAYMENTS("borrowing_repayments", Kind.FLOW),
    NET_BORROWING("net_borrowing", Kind.FLOW),
    RECEIVABLES_CHANGE("receivables_change", Kind.FLOW),
    INVENTORIES_CHANGE("inventories_change", Kind.FLOW),
    PAYABLES_CHANGE("payables_change", Kind.FLOW),
    WORKING_CAPITAL_CHANGE("working_capital_change", Kind.FLOW),

    // ── Balance sheet (stocks) ────────────────────────────────────────────────
    TOTAL_ASSETS("total_assets", Kind.STOCK),
    TOTAL_LIABILITIES("total_liabilities", Kind.STOCK),
    TOTAL_EQUITY("total_equity", Kind.STOCK),
    TOTAL_DEBT("total_debt", Kind.STOCK),
    SHORT_TERM_DEBT("short_term_debt", Kind.STOCK),
    LONG_TERM_DEBT("long_term_debt", Kind.STOCK),
    CASH("cash", Kind.STOCK),
    CURRENT_ASSETS("current_assets", Kind.STOCK),
    CURRENT_LIABILITIES("current_liabilities", Kind.STOCK),
    INVENTORY("inventory", Kind.STOCK),
    FIXED_ASSETS("fixed_assets", Kind.STOCK),
    ACCOUNTS_RECEIVABLE("accounts_receivable", Kind.STOCK),
    SHARES_OUTSTANDING("shares_outstanding", Kind.STOCK),

    // ── Market / per share ────────────────────────────────────────────────────
    CURRENT_PRICE("current_price", Kind.RATIO),
    EPS("eps", Kind.RATIO),
    BOOK_VALUE_PER_SHARE("book_value_per_share", Kind.RATIO),
    DIVIDEND_PER_SHARE("dividend_per_share", Kind.RATIO),
    MARKET_CAP("market_cap", Kind.RATIO),
    ENTERPRISE_VALUE("enterprise_value", Kind.RATIO),

    // ── Margins and returns (fractions) ───────────────────────────────────────
    GROSS_MARGIN("gross_margin", Kind.FRACTION),
    EBIT_MARGIN("ebit_margin", Kind.FRACTION),
    NET_PROFIT_MARGIN("net_profit_margin", Kind.FRACTION),
    ROA("roa", Kind.FRACTION),
    ROE("roe", Kind.FRACTION),

    // ── Turnover, liquidity, leverage, valuation multiples ────────────────────
    ASSET_TURNOVER("asset_turnover", Kind.RATIO),
    INVENTORY_TURNOVER("inventory_turnover", Kind.RATIO),
    FIXED_ASSET_TURNOVER("fixed_asset_turnover", Kind.RATIO),
    RECEIVABLES_TURNOVER("receivables_turnover", Kind.RATIO),
    CURRENT_RATIO("current_ratio", Kind.RATIO),
    QUICK_RATIO("quick_ratio", Kind.RATIO),
    CASH_RATIO("cash_ratio", Kind.RATIO),
    DEBT_TO_EQUITY("debt_to_equity", Kind.RATIO),
    EQUITY_MULTIPLIER("equity_multiplier", Kind.RATIO),
    INTEREST_COVERAGE("interest_coverage", Kind.RATIO),
    PE_RATIO("pe_ratio", Kind.RATIO),
    PB_RATIO("pb_ratio", Kind.RATIO),
    PS_RATIO("ps_ratio", Kind.RATIO),
    EV_TO_EBITDA("ev_to_ebitda", Kind.RATIO);

    public enum Kind { FLOW, STOCK, RATIO, FRACTION }

    private static final Map<String, MetricKey> BY_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(MetricKey::canonicalName, Function.identity()));

    private final String canonicalName;
    private final Kind kind;

    MetricKey(String canonicalName, Kind kind) {
        this.canonicalName = canonicalName;
        this.kind = kind;
    }

    public String canonicalName() {
        return canonicalName;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isFlow() {
        return kind == Kind.FLOW;
    }

    public boolean isFraction() {
        return kind == Kind.FRACTION;
    }

    public static Optional<MetricKey> fromCanonicalName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }
}
