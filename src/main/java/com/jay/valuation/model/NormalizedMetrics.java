package com.jay.valuation.model;

import com.jay.valuation.model.enums.MetricKey;
import com.jay.valuation.model.enums.Provenance;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Complete metrics set keyed by canonical metric. Every present value carries its
 * provenance; fractions are raw (0.15, not 15).
 */
public final class NormalizedMetrics {

    public record Entry(double value, Provenance provenance) {}

    private final Map<MetricKey, Entry> entries;

    private NormalizedMetrics(Map<MetricKey, Entry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static NormalizedMetrics empty() {
        return new NormalizedMetrics(new EnumMap<>(MetricKey.class));
    }

    public static Builder builder() {
        return new Builder(new EnumMap<>(MetricKey.class));
    }

    public Builder toBuilder() {
        EnumMap<MetricKey, Entry> copy = new EnumMap<>(MetricKey.class);
        copy.putAll(entries);
        return new Builder(copy);
    }

    public OptionalDouble get(MetricKey key) {
        Entry e = entries.get(key);
        return e == null ? OptionalDouble.empty() : OptionalDouble.of(e.value());
    }

    public boolean has(MetricKey key) {
        return entries.containsKey(key);
    }

    public Optional<Provenance> provenance(MetricKey key) {
        return Optional.ofNullable(entries.get(key)).map(Entry::provenance);
    }

    public int size() {
        return entries.size();
    }

    /** Flat canonical-name map covering every metric; missing ones map to null. */
    public Map<String, Double> asCanonicalMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        for (MetricKey key : MetricKey.values()) {
            Entry e = entries.get(key);
            out.put(key.canonicalName(), e == null ? null : e.value());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizedMetrics other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "NormalizedMetrics" + entries;
    }

    public static final class Builder {
        private final EnumMap<MetricKey, Entry> entries;

        private Builder(EnumMap<MetricKey, Entry> entries) {
            this.entries = entries;
        }

        public OptionalDouble get(MetricKey key) {
            Entry e = entries.get(key);
            return e == null ? OptionalDouble.empty() : OptionalDouble.of(e.value());
        }

        public boolean has(MetricKey key) {
            return entries.containsKey(key);
        }

        /**
         * Stores the value unless the metric is already present. Non-finite values are ignored.
         * Returns true when the value was stored.
         */
        public boolean putIfAbsent(MetricKey key, double value, Provenance provenance) {
            if (!Double.isFinite(value) || entries.containsKey(key)) return false;
            entries.put(key, new Entry(value, provenance));
            return true;
        }

        public boolean putIfAbsent(MetricKey key, OptionalDouble value, Provenance provenance) {
            return value != null && value.isPresent() && putIfAbsent(key, value.getAsDouble(), provenance);
        }

        public NormalizedMetrics build() {
            return new NormalizedMetrics(new EnumMap<>(entries));
        }
    }
}
