package com.jay.valuation.layer1_data;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.model.FinancialStatements;
import com.jay.valuation.model.enums.ReportingPeriod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache in front of the provider, keyed by (symbol, period).
 * Entries expire after {@code provider.cache_ttl_minutes}; expired entries are swept
 * every ten minutes.
 */
@Slf4j
@Primary
@Component
public class CachingStatementSource implements StatementSource {

    private record Key(String symbol, ReportingPeriod period) {}

    private record Entry(FinancialStatements statements, Instant fetchedAt) {}

    private final StatementSource delegate;
    private final Duration ttl;
    private final Clock clock;
    private final Map<Key, Entry> cache = new ConcurrentHashMap<>();

    @Autowired
    public CachingStatementSource(HttpStatementSource delegate, ValuationConfig config) {
        this(delegate, Duration.ofMinutes(config.provider().getCacheTtlMinutes()), Clock.systemUTC());
    }

    CachingStatementSource(StatementSource delegate, Duration ttl, Clock clock) {
        this.delegate = delegate;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public FinancialStatements fetch(String symbol, ReportingPeriod period) {
        Key key = key(symbol, period);
        Entry cached = cache.get(key);
        if (cached != null && !isExpired(cached)) {
            log.debug("Cache hit for {} ({})", key.symbol(), period.wireName());
            return cached.statements();
        }
        return load(key);
    }

    /** Always calls the provider and replaces the cached entry. */
    @Override
    public FinancialStatements fetchFresh(String symbol, ReportingPeriod period) {
        Key key = key(symbol, period);
        cache.remove(key);
        return load(key);
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
        log.info("Statement cache cleared");
    }

    @Scheduled(fixedDelay = 600_000, initialDelay = 600_000)
    public void evictExpired() {
        int before = cache.size();
        cache.values().removeIf(this::isExpired);
        int evicted = before - cache.size();
        if (evicted > 0) {
            log.info("Evicted {} expired statement entries, {} remain", evicted, cache.size());
        }
    }

    private FinancialStatements load(Key key) {
        FinancialStatements statements = delegate.fetch(key.symbol(), key.period());
        cache.put(key, new Entry(statements, clock.instant()));
        return statements;
    }

    private boolean isExpired(Entry entry) {
        return !entry.fetchedAt().plus(ttl).isAfter(clock.instant());
    }

    private static Key key(String symbol, ReportingPeriod period) {
        return new Key(symbol.trim().toUpperCase(Locale.ROOT), period);
    }
}
