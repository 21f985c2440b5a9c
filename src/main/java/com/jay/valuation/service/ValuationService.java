package com.jay.valuation.service;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.exception.ValuationUnavailableException;
import com.jay.valuation.layer1_data.SectorDirectory;
import com.jay.valuation.layer1_data.StatementSource;
import com.jay.valuation.layer3_metrics.MetricsExtractor;
import com.jay.valuation.layer3_metrics.MetricsNormalizer;
import com.jay.valuation.layer4_models.ValuationModel;
import com.jay.valuation.layer5_aggregate.MarketComparator;
import com.jay.valuation.layer5_aggregate.ValuationAggregator;
import com.jay.valuation.model.FinancialStatements;
import com.jay.valuation.model.MetricsReport;
import com.jay.valuation.model.ModelValuation;
import com.jay.valuation.model.NormalizedMetrics;
import com.jay.valuation.model.ValuationAssumptions;
import com.jay.valuation.model.ValuationReport;
import com.jay.valuation.model.ValuationResult;
import com.jay.valuation.model.enums.MetricKey;
import com.jay.valuation.model.enums.ModelStatus;
import com.jay.valuation.model.enums.ModelType;
import com.jay.valuation.model.enums.ReportingPeriod;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.jay.valuation.model.enums.MetricKey.*;

/**
 * Per-request valuation pipeline:
 * statements → primitives → normalized metrics → four models (in parallel) → aggregate → report.
 *
 * Used by POST /api/valuation/{symbol}, POST /api/valuation and GET /api/metrics/{symbol}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValuationService {

    private final StatementSource statementSource;
    private final MetricsExtractor extractor;
    private final MetricsNormalizer normalizer;
    private final List<ValuationModel> models;
    private final ValuationAggregator aggregator;
    private final MarketComparator marketComparator;
    private final SectorDirectory sectorDirectory;
    private final ValuationConfig config;

    private ExecutorService executor;

    @PostConstruct
    public void init() {
        int threads = Math.max(1, config.models().getExecutorThreads());
        this.executor = Executors.newFixedThreadPool(threads);
        log.info("ValuationService ready: {} models on {} worker threads", models.size(), threads);
    }

    @PreDestroy
    public void shutdown() {
        if (executor != null) executor.shutdownNow();
    }

    // ── Public API ─────────────────────────────────────────────────────────────

    /** Fetches statements from the provider and values the symbol. */
    public ValuationReport value(String rawSymbol, ReportingPeriod period, ValuationAssumptions assumptions,
                                 boolean fresh) {
        String symbol = rawSymbol.trim().toUpperCase(Locale.ROOT);
        log.info("Valuation requested for {} ({})", symbol, period.wireName());
        FinancialStatements statements = fresh
            ? statementSource.fetchFresh(symbol, period)
            : statementSource.fetch(symbol, period);
        return value(statements, assumptions);
    }

    /** Values a statement bundle the caller already holds. No provider call is made. */
    public ValuationReport value(FinancialStatements statements, ValuationAssumptions assumptions) {
        assumptions.validate();
        NormalizedMetrics metrics = metricsFor(statements);
        requireValuable(statements.symbol(), metrics);

        ValuationResult result = runModels(metrics, assumptions);
        Double price = metrics.get(CURRENT_PRICE).isPresent() ? metrics.get(CURRENT_PRICE).getAsDouble() : null;

        Map<String, ModelStatus> status = new LinkedHashMap<>();
        Map<String, String> detail = new LinkedHashMap<>();
        result.models().forEach((type, v) -> {
            status.put(type.wireName(), v.status());
            detail.put(type.wireName(), v.detail());
        });

        log.info("{}: weighted value {} from {} usable models", statements.symbol(),
            String.format("%.2f", result.weightedAverage()),
            result.summaryIfAny().map(s -> s.modelsUsed()).orElse(0));

        return ValuationReport.builder()
            .symbol(statements.symbol())
            .sector(sectorDirectory.industryOf(statements.symbol()))
            .dataPeriod(statements.period().wireName())
            .valuations(result.toFlatMap())
            .modelStatus(status)
            .modelDetail(detail)
            .summary(result.summary())
            .financialData(financialData(metrics))
            .assumptionsUsed(assumptions)
            .marketComparison(marketComparator.compare(price, result.weightedAverage()).orElse(null))
            .success(result.hasValue())
            .timestamp(LocalDateTime.now())
            .build();
    }

    /** Normalized metrics plus data-quality flags for a symbol. */
    public MetricsReport metrics(String rawSymbol, ReportingPeriod period) {
        String symbol = rawSymbol.trim().toUpperCase(Locale.ROOT);
        FinancialStatements statements = statementSource.fetch(symbol, period);
        NormalizedMetrics metrics = metricsFor(statements);
        return MetricsReport.builder()
            .symbol(statements.symbol())
            .sector(sectorDirectory.industryOf(statements.symbol()))
            .dataPeriod(period.wireName())
            .metrics(metrics.asCanonicalMap())
            .dataQuality(dataQuality(metrics))
            .retrievedAt(LocalDateTime.now())
            .build();
    }

    public NormalizedMetrics metricsFor(FinancialStatements statements) {
        return normalizer.normalize(extractor.extract(statements));
    }

    /** Runs every registered model concurrently and aggregates the outcomes. */
    public ValuationResult runModels(NormalizedMetrics metrics, ValuationAssumptions assumptions) {
        Map<ModelType, CompletableFuture<ModelValuation>> futures = new EnumMap<>(ModelType.class);
        for (ValuationModel model : models) {
            futures.put(model.type(), CompletableFuture.supplyAsync(() -> model.value(metrics, assumptions), executor));
        }

        Map<ModelType, ModelValuation> outcomes = new EnumMap<>(ModelType.class);
        int timeout = config.models().getTimeoutSeconds();
        for (ModelType type : ModelType.values()) {
            CompletableFuture<ModelValuation> future = futures.get(type);
            if (future == null) {
                outcomes.put(type, ModelValuation.unavailable(type, ModelStatus.FAILED, "model not registered"));
                continue;
            }
            outcomes.put(type, await(type, future, timeout));
        }
        outcomes.values().forEach(v -> log.debug("{} → {} [{}] {}", v.model().wireName(), v.value(), v.status(), v.detail()));
        return aggregator.aggregate(outcomes, assumptions.getModelWeights());
    }

    // ── Internals ──────────────────────────────────────────────────────────────

    private ModelValuation await(ModelType type, CompletableFuture<ModelValuation> future, int timeoutSeconds) {
        try {
            ModelValuation v = future.get(timeoutSeconds, TimeUnit.SECONDS);
            return v != null ? v : ModelValuation.unavailable(type, ModelStatus.FAILED, "model returned nothing");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Model {} failed: {}", type.wireName(), cause.toString());
            return ModelValuation.unavailable(type, ModelStatus.FAILED, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Model {} timed out after {}s", type.wireName(), timeoutSeconds);
            return ModelValuation.unavailable(type, ModelStatus.FAILED, "timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ModelValuation.unavailable(type, ModelStatus.FAILED, "interrupted");
        }
    }

    /** A symbol can be valued only with a share count and at least one income metric. */
    static void requireValuable(String symbol, NormalizedMetrics m) {
        OptionalDouble shares = m.get(SHARES_OUTSTANDING);
        if (shares.isEmpty() || shares.getAsDouble() <= 0) {
            throw new ValuationUnavailableException(symbol, "No share count available for " + symbol);
        }
        boolean anyIncome = m.has(NET_INCOME_TTM) || m.has(EBIT) || m.has(REVENUE_TTM) || m.has(EPS);
        if (!anyIncome) {
            throw new ValuationUnavailableException(symbol, "No income metric available for " + symbol);
        }
    }

    private static Map<String, Double> financialData(NormalizedMetrics m) {
        Map<String, Double> data = new LinkedHashMap<>();
        data.put("eps", valueOrNull(m, EPS));
        data.put("bvps", valueOrNull(m, BOOK_VALUE_PER_SHARE));
        data.put("net_income", valueOrNull(m, NET_INCOME_TTM));
        data.put("equity", valueOrNull(m, TOTAL_EQUITY));
        data.put("shares_outstanding", valueOrNull(m, SHARES_OUTSTANDING));
        data.put("current_price", valueOrNull(m, CURRENT_PRICE));
        return data;
    }

    static MetricsReport.DataQuality dataQuality(NormalizedMetrics m) {
        return new MetricsReport.DataQuality(
            positive(m, CURRENT_PRICE),
            m.has(NET_INCOME_TTM),
            positive(m, PE_RATIO),
            positive(m, PB_RATIO));
    }

    private static boolean positive(NormalizedMetrics m, MetricKey key) {
        OptionalDouble v = m.get(key);
        return v.isPresent() && v.getAsDouble() > 0;
    }

    private static Double valueOrNull(NormalizedMetrics m, MetricKey key) {
        OptionalDouble v = m.get(key);
        return v.isPresent() ? v.getAsDouble() : null;
    }
}
