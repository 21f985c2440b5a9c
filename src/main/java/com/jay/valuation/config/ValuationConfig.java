package com.jay.valuation.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.valuation.model.ValuationAssumptions;
import com.jay.valuation.model.enums.ModelType;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.InputStream;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads and exposes all configuration from valuation.yaml.
 * Values are read once at startup; compiled-in defaults apply when the file is absent.
 */
@Slf4j
@Component
public class ValuationConfig {

    @Value("${valuation.config-file:valuation.yaml}")
    private String configFile = "valuation.yaml";

    @Autowired(required = false)
    private Environment env;

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    /** Resolves ${VAR:default} placeholders using Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null || env == null) return value;
        return PLACEHOLDER_HELPER.replacePlaceholders(value, env::getProperty);
    }

    // ── Sections ──────────────────────────────────────────────────────────────
    private Defaults defaults = new Defaults();
    private Normalizer normalizer = new Normalizer();
    private Models models = new Models();
    private MarketComparison marketComparison = new MarketComparison();
    private Provider provider = new Provider();
    private Sectors sectors = new Sectors();

    @PostConstruct
    public void load() {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            try (InputStream is = getClass().getClassLoader().getResourceAsStream(configFile)) {
                if (is == null) {
                    log.warn("Config file '{}' not found on classpath, using defaults", configFile);
                    return;
                }
                ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
                if (root.getDefaults() != null)         this.defaults = root.getDefaults();
                if (root.getNormalizer() != null)       this.normalizer = root.getNormalizer();
                if (root.getModels() != null)           this.models = root.getModels();
                if (root.getMarketComparison() != null) this.marketComparison = root.getMarketComparison();
                if (root.getProvider() != null)         this.provider = root.getProvider();
                if (root.getSectors() != null)          this.sectors = root.getSectors();
            }

            // Resolve ${VAR:default} placeholders that Jackson reads as literal strings
            this.provider.setBaseUrl(resolve(this.provider.getBaseUrl()));
            this.provider.setApiKey(resolve(this.provider.getApiKey()));
            log.info("ValuationConfig loaded from '{}'. Provider: {}", configFile, provider.getBaseUrl());
        } catch (Exception e) {
            log.error("Failed to load {}, using defaults: {}", configFile, e.getMessage());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Defaults defaults()                 { return defaults; }
    public Normalizer normalizer()             { return normalizer; }
    public Models models()                     { return models; }
    public MarketComparison marketComparison() { return marketComparison; }
    public Provider provider()                 { return provider; }
    public Sectors sectors()                   { return sectors; }

    /** The configured default scenario as a validated assumptions object. */
    public ValuationAssumptions defaultAssumptions() {
        return ValuationAssumptions.builder()
            .shortTermGrowth(defaults.getShortTermGrowth())
            .terminalGrowth(defaults.getTerminalGrowth())
            .costOfEquity(defaults.getCostOfEquity())
            .wacc(defaults.getWacc())
            .taxRate(defaults.getTaxRate())
            .forecastYears(defaults.getForecastYears())
            .targetRoe(defaults.getTargetRoe())
            .payoutRatio(defaults.getPayoutRatio())
            .modelWeights(defaults.weightsByModel())
            .build()
            .validate();
    }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Defaults defaults;
        private Normalizer normalizer;
        private Models models;
        private MarketComparison marketComparison;
        private Provider provider;
        private Sectors sectors;
    }

    @Data public static class Defaults {
        private double shortTermGrowth = 0.05;
        private double terminalGrowth = 0.02;
        private double wacc = 0.10;
        private double costOfEquity = 0.12;
        private double taxRate = 0.20;
        private int forecastYears = 5;
        private Double targetRoe;            // unset → company ROE
        private double payoutRatio = 0.40;
        private Map<String, Double> modelWeights = new LinkedHashMap<>(Map.of(
            "fcfe", 0.25, "fcff", 0.25, "justified_pe", 0.25, "justified_pb", 0.25));

        public Map<ModelType, Double> weightsByModel() {
            Map<ModelType, Double> out = new EnumMap<>(ModelType.class);
            if (modelWeights != null) {
                modelWeights.forEach((name, w) -> out.put(ModelType.fromWireName(name), w));
            }
            return out;
        }
    }

    @Data public static class Normalizer {
        private double sharesImplausibilityThreshold = 1.0e11;
        private double sharesRescaleFactor = 1000;
    }

    @Data public static class Models {
        private double fallbackPeMultiple = 15.0;
        private double fallbackPbMultiple = 1.0;
        private int executorThreads = 4;
        private int timeoutSeconds = 30;
    }

    @Data public static class MarketComparison {
        private double buyAbovePct = 10;
        private double sellBelowPct = -10;
    }

    @Data public static class Provider {
        private String baseUrl = "http://localhost:8090";
        private String apiKey = "";
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 15;
        private int cacheTtlMinutes = 60;
    }

    @Data public static class Sectors {
        private String file = "sectors.csv";
    }
}
