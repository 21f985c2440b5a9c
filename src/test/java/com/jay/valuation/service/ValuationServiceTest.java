package com.jay.valuation.service;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.exception.ValuationUnavailableException;
import com.jay.valuation.layer1_data.SectorDirectory;
import com.jay.valuation.layer1_data.StatementSource;
import com.jay.valuation.layer2_resolution.FieldCandidateTable;
import com.jay.valuation.layer2_resolution.FieldResolver;
import com.jay.valuation.layer3_metrics.MetricsExtractor;
import com.jay.valuation.layer3_metrics.MetricsNormalizer;
import com.jay.valuation.layer4_models.FcfeModel;
import com.jay.valuation.layer4_models.FcffModel;
import com.jay.valuation.layer4_models.JustifiedPbModel;
import com.jay.valuation.layer4_models.JustifiedPeModel;
import com.jay.valuation.layer4_models.ValuationModel;
import com.jay.valuation.layer5_aggregate.MarketComparator;
import com.jay.valuation.layer5_aggregate.ValuationAggregator;
import com.jay.valuation.model.FinancialStatements;
import com.jay.valuation.model.MetricsReport;
import com.jay.valuation.model.NormalizedMetrics;
import com.jay.valuation.model.TabularRecord;
import com.jay.valuation.model.ValuationReport;
import com.jay.valuation.model.enums.ModelStatus;
import com.jay.valuation.model.enums.ModelType;
import com.jay.valuation.model.enums.ReportingPeriod;
import com.jay.valuation.model.enums.StatementType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ValuationServiceTest {

    private final ValuationConfig config = new ValuationConfig();
    private final StatementSource source = mock(StatementSource.class);
    private ValuationService service;

    @AfterEach
    void tearDown() {
        if (service != null) service.shutdown();
    }

    private ValuationService serviceWith(List<ValuationModel> models) {
        SectorDirectory sectors = new SectorDirectory(config);
        sectors.load();
        ValuationService s = new ValuationService(
            source,
            new MetricsExtractor(new FieldCandidateTable(), new FieldResolver()),
            new MetricsNormalizer(config),
            models,
            new ValuationAggregator(),
            new MarketComparator(config),
            sectors,
            config);
        s.init();
        return s;
    }

    private List<ValuationModel> allModels() {
        return List.of(new FcfeModel(), new FcffModel(), new JustifiedPeModel(config), new JustifiedPbModel(config));
    }

    private static FinancialStatements vnm(Double price) {
        return new FinancialStatements("VNM", ReportingPeriod.ANNUAL, Map.of(
            StatementType.INCOME_STATEMENT, TabularRecord.ofRows(List.of(
                Map.of("Revenue (Bn. VND)", 1000.0, "Net Profit For the Year", 150.0))),
            StatementType.BALANCE_SHEET, TabularRecord.ofRows(List.of(
                Map.of("OWNER'S EQUITY(Bn.VND)", 800.0, "Shares outstanding", 100.0)))),
            price);
    }

    @Test
    void fetchesAndValuesASymbol() {
        when(source.fetch("VNM", ReportingPeriod.ANNUAL)).thenReturn(vnm(20.0));
        service = serviceWith(allModels());

        ValuationReport report = service.value(" vnm ", ReportingPeriod.ANNUAL, config.defaultAssumptions(), false);

        assertThat(report.getSymbol()).isEqualTo("VNM");
        assertThat(report.getSector()).isEqualTo("Food & Beverage");
        assertThat(report.getDataPeriod()).isEqualTo("year");
        assertThat(report.getValuations()).containsOnlyKeys("fcfe", "fcff", "justified_pe", "justified_pb", "weighted_average");
        assertThat(report.getModelStatus()).hasSize(4);
        assertThat(report.getValuations().get("justified_pe")).isPositive();
        assertThat(report.getValuations().get("weighted_average")).isPositive();
        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getSummary()).isNotNull();
        assertThat(report.getFinancialData()).containsEntry("eps", 1.5).containsEntry("bvps", 8.0)
            .containsEntry("current_price", 20.0);
        assertThat(report.getMarketComparison()).isNotNull();
        assertThat(report.getMarketComparison().currentPrice()).isEqualTo(20.0);
        verify(source, never()).fetchFresh(any(), any());
    }

    @Test
    void freshRequestsBypassTheCache() {
        when(source.fetchFresh("VNM", ReportingPeriod.ANNUAL)).thenReturn(vnm(null));
        service = serviceWith(allModels());

        ValuationReport report = service.value("VNM", ReportingPeriod.ANNUAL, config.defaultAssumptions(), true);

        assertThat(report.getMarketComparison()).isNull();
        verify(source, never()).fetch(any(), any());
    }

    @Test
    void symbolsWithoutSharesCannotBeValued() {
        FinancialStatements noShares = new FinancialStatements("XYZ", ReportingPeriod.ANNUAL, Map.of(
            StatementType.INCOME_STATEMENT, TabularRecord.ofRows(List.of(Map.of("Net income", 150.0)))),
            null);
        service = serviceWith(allModels());

        assertThatThrownBy(() -> service.value(noShares, config.defaultAssumptions()))
            .isInstanceOf(ValuationUnavailableException.class)
            .hasMessageContaining("XYZ");
    }

    @Test
    void aFailingModelIsReportedWithoutSinkingTheOthers() {
        ValuationModel broken = mock(ValuationModel.class);
        when(broken.type()).thenReturn(ModelType.FCFE);
        when(broken.value(any(), any())).thenThrow(new IllegalStateException("boom"));
        service = serviceWith(List.of(broken, new JustifiedPeModel(config), new JustifiedPbModel(config)));

        ValuationReport report = service.value(vnm(20.0), config.defaultAssumptions());

        assertThat(report.getModelStatus().get("fcfe")).isEqualTo(ModelStatus.FAILED);
        assertThat(report.getModelDetail().get("fcfe")).contains("boom");
        assertThat(report.getModelStatus().get("fcff")).isEqualTo(ModelStatus.FAILED);
        assertThat(report.getModelDetail().get("fcff")).isEqualTo("model not registered");
        assertThat(report.getValuations().get("fcfe")).isZero();
        assertThat(report.getValuations().get("weighted_average")).isPositive();
    }

    @Test
    void dataQualityReflectsPriceAndMultiples() {
        service = serviceWith(allModels());

        NormalizedMetrics priced = service.metricsFor(vnm(20.0));
        NormalizedMetrics unpriced = service.metricsFor(vnm(null));

        assertThat(ValuationService.dataQuality(priced))
            .isEqualTo(new MetricsReport.DataQuality(true, true, true, true));
        assertThat(ValuationService.dataQuality(unpriced))
            .isEqualTo(new MetricsReport.DataQuality(false, true, false, false));
    }

    @Test
    void metricsReportCarriesCanonicalNames() {
        when(source.fetch("VNM", ReportingPeriod.ANNUAL)).thenReturn(vnm(20.0));
        service = serviceWith(allModels());

        MetricsReport report = service.metrics("vnm", ReportingPeriod.ANNUAL);

        assertThat(report.getSymbol()).isEqualTo("VNM");
        assertThat(report.getMetrics()).containsEntry("net_income_ttm", 150.0).containsEntry("eps", 1.5);
        assertThat(report.getDataQuality().hasRealPrice()).isTrue();
    }
}
