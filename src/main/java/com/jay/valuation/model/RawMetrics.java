package com.jay.valuation.model;

import com.jay.valuation.model.enums.MetricKey;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Primitives as extracted from statements, before any unit reconciliation or derivation.
 * Absent keys are unavailable quantities, not zeros.
 */
public final class RawMetrics {

    private final Map<MetricKey, Double> values;

    private RawMetrics(Map<MetricKey, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    public OptionalDouble get(MetricKey key) {
        Double v = values.get(key);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public Map<MetricKey, Double> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public static final class Builder {
        private final EnumMap<MetricKey, Double> values = new EnumMap<>(MetricKey.class);

        public Builder put(MetricKey key, OptionalDouble value) {
            if (value != null && value.isPresent()) put(key, value.getAsDouble());
            return this;
        }

        public Builder put(MetricKey key, double value) {
            if (Double.isFinite(value)) values.put(key, value);
            return this;
        }

        public RawMetrics build() {
            return new RawMetrics(new EnumMap<>(values));
        }
    }
}
