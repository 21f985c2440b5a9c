package com.jay.valuation.controller;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.layer1_data.StatementJsonParser;
import com.jay.valuation.model.FinancialStatements;
import com.jay.valuation.model.MetricsReport;
import com.jay.valuation.model.OfflineValuationRequest;
import com.jay.valuation.model.ValuationAssumptions;
import com.jay.valuation.model.ValuationReport;
import com.jay.valuation.model.ValuationRequest;
import com.jay.valuation.model.enums.ReportingPeriod;
import com.jay.valuation.service.ValuationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API: valuation endpoints.
 *
 * Endpoints:
 *   POST /api/valuation/{symbol}  : value a symbol from provider statements
 *   POST /api/valuation           : value caller-supplied statements
 *   GET  /api/metrics/{symbol}    : normalized metrics and data-quality flags
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ValuationController {

    private final ValuationService valuationService;
    private final StatementJsonParser statementParser;
    private final ValuationConfig config;

    // ── POST /api/valuation/{symbol} ───────────────────────────────────────────

    @PostMapping("/valuation/{symbol}")
    public ResponseEntity<ValuationReport> valueSymbol(
            @PathVariable String symbol,
            @RequestParam(defaultValue = "year") String period,
            @RequestParam(defaultValue = "false") boolean fresh,
            @Valid @RequestBody(required = false) ValuationRequest request) {
        ValuationAssumptions assumptions = assumptionsFrom(request);
        return ResponseEntity.ok(
            valuationService.value(symbol, ReportingPeriod.parse(period), assumptions, fresh));
    }

    // ── POST /api/valuation ────────────────────────────────────────────────────

    @PostMapping("/valuation")
    public ResponseEntity<ValuationReport> valueStatements(@Valid @RequestBody OfflineValuationRequest request) {
        FinancialStatements statements = statementParser.fromRows(
            request.getSymbol(), ReportingPeriod.parse(request.getPeriod()),
            request.getCurrentPrice(), request.rowsByStatement());
        return ResponseEntity.ok(valuationService.value(statements, assumptionsFrom(request.getAssumptions())));
    }

    // ── GET /api/metrics/{symbol} ──────────────────────────────────────────────

    @GetMapping("/metrics/{symbol}")
    public ResponseEntity<MetricsReport> metrics(
            @PathVariable String symbol,
            @RequestParam(defaultValue = "year") String period) {
        return ResponseEntity.ok(valuationService.metrics(symbol, ReportingPeriod.parse(period)));
    }

    private ValuationAssumptions assumptionsFrom(ValuationRequest request) {
        ValuationAssumptions defaults = config.defaultAssumptions();
        return request == null ? defaults : request.toAssumptions(defaults);
    }
}
