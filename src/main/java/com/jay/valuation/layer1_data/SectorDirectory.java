package com.jay.valuation.layer1_data;

import com.jay.valuation.config.ValuationConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Symbol → industry lookup, loaded once from a classpath CSV with a
 * {@code symbol,industry} header.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SectorDirectory {

    public static final String UNKNOWN = "Unknown";

    private final ValuationConfig config;

    private volatile Map<String, String> industryBySymbol = Map.of();

    @PostConstruct
    public void load() {
        String file = config.sectors().getFile();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(file)) {
            if (is == null) {
                log.warn("Sector file '{}' not found on classpath; every symbol maps to {}", file, UNKNOWN);
                return;
            }
            industryBySymbol = parse(new InputStreamReader(is, StandardCharsets.UTF_8));
            log.info("Loaded industry mapping for {} symbols from '{}'", industryBySymbol.size(), file);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load sector file '{}': {}", file, e.getMessage());
        }
    }

    public String industryOf(String symbol) {
        if (symbol == null) return UNKNOWN;
        return industryBySymbol.getOrDefault(symbol.trim().toUpperCase(Locale.ROOT), UNKNOWN);
    }

    public int size() {
        return industryBySymbol.size();
    }

    static Map<String, String> parse(Reader reader) throws IOException {
        Map<String, String> mapping = new HashMap<>();
        try (CSVParser parser = CSVParser.parse(reader,
                CSVFormat.DEFAULT.withFirstRecordAsHeader().withIgnoreHeaderCase().withTrim())) {
            for (CSVRecord record : parser) {
                if (!record.isMapped("symbol") || !record.isMapped("industry")) {
                    throw new IllegalArgumentException("sector CSV needs 'symbol' and 'industry' columns");
                }
                String symbol = record.get("symbol").toUpperCase(Locale.ROOT);
                String industry = record.get("industry");
                if (symbol.isBlank() || industry.isBlank()) continue;
                mapping.putIfAbsent(symbol, industry);
            }
        }
        return Collections.unmodifiableMap(mapping);
    }
}
