package com.jay.valuation.layer1_data;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.exception.StatementSourceException;
import com.jay.valuation.model.FinancialStatements;
import com.jay.valuation.model.enums.ReportingPeriod;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Layer 1: market-data provider REST client.
 * Fetches the four statements for a symbol in one call via OkHttp.
 *
 * Endpoint: GET {base_url}/statements/{symbol}?period=year|quarter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpStatementSource implements StatementSource {

    static final String API_KEY_HEADER = "X-API-Key";

    private final ValuationConfig config;
    private final StatementJsonParser parser;

    private OkHttpClient http;

    @PostConstruct
    public void init() {
        ValuationConfig.Provider p = config.provider();
        this.http = new OkHttpClient.Builder()
            .connectTimeout(p.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
            .readTimeout(p.getReadTimeoutSeconds(), TimeUnit.SECONDS)
            .build();
    }

    @Override
    public FinancialStatements fetch(String symbol, ReportingPeriod period) {
        HttpUrl base = HttpUrl.parse(config.provider().getBaseUrl());
        if (base == null) {
            throw new StatementSourceException(symbol, "Invalid provider base URL: " + config.provider().getBaseUrl());
        }
        HttpUrl url = base.newBuilder()
            .addPathSegment("statements")
            .addPathSegment(symbol)
            .addQueryParameter("period", period.wireName())
            .build();

        Request.Builder builder = new Request.Builder()
            .url(url)
            .get()
            .addHeader("Accept", "application/json");
        String apiKey = config.provider().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.addHeader(API_KEY_HEADER, apiKey);
        }

        log.info("Fetching {} statements for {} from provider", period.wireName(), symbol);
        try (Response response = http.newCall(builder.build()).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.warn("Provider returned HTTP {} for {}", response.code(), symbol);
                throw new StatementSourceException(symbol,
                    "Provider returned HTTP " + response.code() + " for " + symbol, response.code(), null);
            }
            FinancialStatements statements = parser.parse(response.body().string(), symbol, period);
            log.debug("Fetched statements for {}: price={} empty={}",
                symbol, statements.currentPrice(), statements.isEmpty());
            return statements;
        } catch (IOException e) {
            log.warn("Provider call failed for {}: {}", symbol, e.getMessage());
            throw new StatementSourceException(symbol, "Provider call failed for " + symbol + ": " + e.getMessage(), null, e);
        }
    }
}
