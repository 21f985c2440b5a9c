package com.jay.valuation.controller;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.exception.StatementSourceException;
import com.jay.valuation.exception.ValuationUnavailableException;
import com.jay.valuation.layer1_data.StatementJsonParser;
import com.jay.valuation.model.FinancialStatements;
import com.jay.valuation.model.MetricsReport;
import com.jay.valuation.model.ValuationAssumptions;
import com.jay.valuation.model.ValuationReport;
import com.jay.valuation.model.enums.ModelType;
import com.jay.valuation.model.enums.ReportingPeriod;
import com.jay.valuation.model.enums.StatementType;
import com.jay.valuation.service.ValuationService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ValuationController.class)
@Import({StatementJsonParser.class, ValuationConfig.class})
class ValuationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ValuationService valuationService;

    private static ValuationReport report(String symbol) {
        return ValuationReport.builder()
            .symbol(symbol)
            .dataPeriod("year")
            .valuations(Map.of("weighted_average", 42.5))
            .success(true)
            .build();
    }

    @Test
    void valuesASymbolWithDefaultAssumptions() throws Exception {
        when(valuationService.value(eq("VNM"), eq(ReportingPeriod.ANNUAL), any(), eq(false)))
            .thenReturn(report("VNM"));

        mockMvc.perform(post("/api/valuation/VNM"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.symbol").value("VNM"))
            .andExpect(jsonPath("$.data_period").value("year"))
            .andExpect(jsonPath("$.valuations.weighted_average").value(42.5))
            .andExpect(jsonPath("$.success").value(true));

        ArgumentCaptor<ValuationAssumptions> captor = ArgumentCaptor.forClass(ValuationAssumptions.class);
        verify(valuationService).value(eq("VNM"), eq(ReportingPeriod.ANNUAL), captor.capture(), eq(false));
        assertThat(captor.getValue().getCostOfEquity()).isEqualTo(0.12);
    }

    @Test
    void percentOverridesBecomeFractions() throws Exception {
        when(valuationService.value(any(String.class), any(), any(), eq(true))).thenReturn(report("FPT"));

        mockMvc.perform(post("/api/valuation/FPT")
                .param("period", "quarter")
                .param("fresh", "true")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"required_return": 10, "terminal_growth": 3, "roe": 18,
                     "model_weights": {"fcfe": 0, "justified_pe": 50}}
                    """))
            .andExpect(status().isOk());

        ArgumentCaptor<ValuationAssumptions> captor = ArgumentCaptor.forClass(ValuationAssumptions.class);
        verify(valuationService).value(eq("FPT"), eq(ReportingPeriod.QUARTERLY), captor.capture(), eq(true));
        ValuationAssumptions a = captor.getValue();
        assertThat(a.getCostOfEquity()).isEqualTo(0.10);
        assertThat(a.getTerminalGrowth()).isEqualTo(0.03);
        assertThat(a.getTargetRoe()).isEqualTo(0.18);
        assertThat(a.getWacc()).isEqualTo(0.10);
        assertThat(a.weight(ModelType.FCFE)).isZero();
        assertThat(a.weight(ModelType.JUSTIFIED_PE)).isEqualTo(0.5);
        assertThat(a.weight(ModelType.FCFF)).isEqualTo(0.25);
    }

    @Test
    void outOfRangeTaxRateIsRejected() throws Exception {
        mockMvc.perform(post("/api/valuation/VNM")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tax_rate\": 150}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_error"))
            .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("tax_rate")));

        verify(valuationService, never()).value(any(String.class), any(), any(), any(Boolean.class));
    }

    @Test
    void unknownPeriodIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/valuation/VNM").param("period", "decade"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void unvaluableSymbolIsUnprocessable() throws Exception {
        when(valuationService.value(eq("XYZ"), any(), any(), eq(false)))
            .thenThrow(new ValuationUnavailableException("XYZ", "No share count available for XYZ"));

        mockMvc.perform(post("/api/valuation/XYZ"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("valuation_unavailable"))
            .andExpect(jsonPath("$.message").value("No share count available for XYZ"));
    }

    @Test
    void providerFailureIsABadGateway() throws Exception {
        when(valuationService.metrics(eq("VNM"), any()))
            .thenThrow(new StatementSourceException("VNM", "provider returned HTTP 503", 503, null));

        mockMvc.perform(get("/api/metrics/VNM"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("provider_error"));
    }

    @Test
    void metricsEndpointServesTheReport() throws Exception {
        when(valuationService.metrics("HPG", ReportingPeriod.QUARTERLY)).thenReturn(MetricsReport.builder()
            .symbol("HPG")
            .dataPeriod("quarter")
            .metrics(Map.of("eps", 2500.0))
            .dataQuality(new MetricsReport.DataQuality(true, true, true, false))
            .build());

        mockMvc.perform(get("/api/metrics/HPG").param("period", "quarter"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.metrics.eps").value(2500.0))
            .andExpect(jsonPath("$.data_quality.has_real_price").value(true))
            .andExpect(jsonPath("$.data_quality.pb_reliable").value(false));
    }

    @Test
    void suppliedStatementsAreParsedAndValued() throws Exception {
        when(valuationService.value(any(FinancialStatements.class), any())).thenReturn(report("ACME"));

        mockMvc.perform(post("/api/valuation")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"symbol": "acme", "period": "year", "current_price": 25.0,
                     "income_statement": [{"Net income": 150, "yearReport": 2023}],
                     "balance_sheet": [{"Total equity": 800, "Shares outstanding": 100, "yearReport": 2023}],
                     "assumptions": {"payout_ratio": 30}}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.symbol").value("ACME"));

        ArgumentCaptor<FinancialStatements> statements = ArgumentCaptor.forClass(FinancialStatements.class);
        ArgumentCaptor<ValuationAssumptions> assumptions = ArgumentCaptor.forClass(ValuationAssumptions.class);
        verify(valuationService).value(statements.capture(), assumptions.capture());
        assertThat(statements.getValue().symbol()).isEqualTo("ACME");
        assertThat(statements.getValue().currentPrice()).isEqualTo(25.0);
        assertThat(statements.getValue().statement(StatementType.BALANCE_SHEET).isEmpty()).isFalse();
        assertThat(assumptions.getValue().getPayoutRatio()).isEqualTo(0.3);
    }

    @Test
    void suppliedStatementsNeedASymbol() throws Exception {
        mockMvc.perform(post("/api/valuation")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"income_statement\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_error"));
    }
}
