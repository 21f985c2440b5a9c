package com.jay.valuation.layer2_resolution;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.valuation.model.FieldCandidateList;
import com.jay.valuation.model.enums.MetricKey;
import com.jay.valuation.model.enums.StatementType;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Priority-ordered label candidates per canonical metric, loaded from
 * field-candidates.yaml. This is the only place vendor label drift is maintained.
 */
@Slf4j
@Component
public class FieldCandidateTable {

    public static final String DEFAULT_RESOURCE = "field-candidates.yaml";

    /** One statement to look in, and the labels to try there. */
    public record CandidateSource(StatementType statement, FieldCandidateList candidates) {}

    private final Map<MetricKey, List<CandidateSource>> sources;

    public FieldCandidateTable() {
        this(loadResource(DEFAULT_RESOURCE));
    }

    FieldCandidateTable(Map<MetricKey, List<CandidateSource>> sources) {
        if (sources.isEmpty()) {
            throw new IllegalStateException("Field candidate table is empty; no metric could ever resolve");
        }
        this.sources = Collections.unmodifiableMap(sources);
        log.info("Field candidate table loaded: {} metrics", sources.size());
    }

    public static FieldCandidateTable fromResource(String resource) {
        return new FieldCandidateTable(loadResource(resource));
    }

    public List<CandidateSource> sourcesFor(MetricKey key) {
        return sources.getOrDefault(key, List.of());
    }

    public Optional<FieldCandidateList> candidates(MetricKey key, StatementType statement) {
        return sourcesFor(key).stream()
            .filter(s -> s.statement() == statement)
            .map(CandidateSource::candidates)
            .findFirst();
    }

    public boolean covers(MetricKey key) {
        return sources.containsKey(key);
    }

    // ── Loading ───────────────────────────────────────────────────────────────

    @Data static class TableRoot {
        private Map<String, List<SourceSpec>> metrics = new LinkedHashMap<>();
    }

    @Data static class SourceSpec {
        private String statement;
        private List<String> labels;
    }

    private static Map<MetricKey, List<CandidateSource>> loadResource(String resource) {
        try (InputStream is = FieldCandidateTable.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException("Field candidate table '" + resource + "' not found on classpath");
            }
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return toSources(mapper.readValue(is, TableRoot.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read field candidate table '" + resource + "'", e);
        }
    }

    private static Map<MetricKey, List<CandidateSource>> toSources(TableRoot root) {
        Map<MetricKey, List<CandidateSource>> out = new EnumMap<>(MetricKey.class);
        if (root == null || root.getMetrics() == null) return out;
        root.getMetrics().forEach((name, specs) -> {
            Optional<MetricKey> key = MetricKey.fromCanonicalName(name);
            if (key.isEmpty()) {
                log.warn("Field candidate table: unknown metric '{}' ignored", name);
                return;
            }
            List<CandidateSource> list = new ArrayList<>();
            for (SourceSpec spec : specs == null ? List.<SourceSpec>of() : specs) {
                if (spec.getLabels() == null || spec.getLabels().isEmpty()) continue;
                list.add(new CandidateSource(statementOf(spec.getStatement(), name),
                    new FieldCandidateList(spec.getLabels())));
            }
            if (!list.isEmpty()) out.put(key.get(), List.copyOf(list));
        });
        return out;
    }

    private static StatementType statementOf(String raw, String metric) {
        for (StatementType type : StatementType.values()) {
            if (type.wireName().equalsIgnoreCase(raw == null ? "" : raw.trim())) return type;
        }
        throw new IllegalStateException("Field candidate table: metric '" + metric
            + "' names unknown statement '" + raw + "'");
    }
}
