package com.jay.valuation.controller;

import com.jay.valuation.config.ValuationConfig;
import com.jay.valuation.layer1_data.CachingStatementSource;
import com.jay.valuation.layer1_data.SectorDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * REST API: service status.
 *
 * Endpoints:
 *   GET    /api/status : liveness plus provider and cache summary
 *   DELETE /api/cache  : drop all cached statements
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class StatusController {

    private final ValuationConfig config;
    private final CachingStatementSource statementCache;
    private final SectorDirectory sectorDirectory;

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
            "status", "RUNNING",
            "timestamp", LocalDateTime.now().toString(),
            "provider", config.provider().getBaseUrl(),
            "cached_statements", statementCache.size(),
            "cache_ttl_minutes", config.provider().getCacheTtlMinutes(),
            "sectors_loaded", sectorDirectory.size()
        ));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Object>> clearCache() {
        int dropped = statementCache.size();
        statementCache.clear();
        return ResponseEntity.ok(Map.of("cleared", dropped));
    }
}
