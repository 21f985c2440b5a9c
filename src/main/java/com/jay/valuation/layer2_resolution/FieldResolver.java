package com.jay.valuation.layer2_resolution;

import com.jay.valuation.model.ColumnLabel;
import com.jay.valuation.model.FieldCandidateList;
import com.jay.valuation.model.TabularRecord;
import com.jay.valuation.model.enums.AggregationMode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Extracts one numeric quantity from a statement by trying label candidates in priority order.
 *
 * <p>Labels match case-insensitively, by equality or by substring containment in either
 * direction. For one candidate, exactly equal columns are tried before containment
 * matches; among equally good matches the schema's column order decides.
 *
 * <p>An empty result means "unavailable", which is distinct from a reported zero.
 */
@Component
public class FieldResolver {

    public static final int TRAILING_PERIODS = 4;

    private static final Set<String> MISSING_TOKENS = Set.of("", "-", "--", "—", "n/a", "na", "nan", "null", "none");

    public OptionalDouble resolve(TabularRecord record, FieldCandidateList candidates, AggregationMode mode) {
        if (record == null || record.isEmpty() || candidates == null) return OptionalDouble.empty();
        return switch (mode) {
            case LATEST -> valueInPeriod(record, 0, candidates);
            case TRAILING_SUM -> trailingSum(record, candidates);
        };
    }

    public OptionalDouble resolveLatest(TabularRecord record, FieldCandidateList candidates) {
        return resolve(record, candidates, AggregationMode.LATEST);
    }

    /**
     * Sums the four most recent periods. Each period is resolved independently, so one
     * period may report the quantity under a different label than another. Fewer than
     * four periods, or no value in any of them, is unavailable.
     */
    private OptionalDouble trailingSum(TabularRecord record, FieldCandidateList candidates) {
        if (record.periodCount() < TRAILING_PERIODS) return OptionalDouble.empty();
        double total = 0;
        boolean any = false;
        for (int period = 0; period < TRAILING_PERIODS; period++) {
            OptionalDouble v = valueInPeriod(record, period, candidates);
            if (v.isPresent()) {
                total += v.getAsDouble();
                any = true;
            }
        }
        return any ? OptionalDouble.of(total) : OptionalDouble.empty();
    }

    private OptionalDouble valueInPeriod(TabularRecord record, int period, FieldCandidateList candidates) {
        for (String candidate : candidates.labels()) {
            for (ColumnLabel column : matchingColumns(record, candidate)) {
                OptionalDouble v = coerce(record.value(period, column));
                if (v.isPresent()) return v;
            }
        }
        return OptionalDouble.empty();
    }

    static List<ColumnLabel> matchingColumns(TabularRecord record, String candidate) {
        List<ColumnLabel> exact = new ArrayList<>();
        List<ColumnLabel> partial = new ArrayList<>();
        for (ColumnLabel column : record.columns()) {
            if (column.matchesExactly(candidate)) exact.add(column);
            else if (column.matches(candidate)) partial.add(column);
        }
        exact.addAll(partial);
        return exact;
    }

    /**
     * Numbers pass through; strings are parsed after removing thousands separators.
     * Accounting negatives "(1,234)" and a trailing "%" are understood. Anything else,
     * including NaN and infinities, is unavailable.
     */
    public static OptionalDouble coerce(Object raw) {
        if (raw == null || raw instanceof Boolean) return OptionalDouble.empty();
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
        }
        String s = raw.toString().trim();
        if (MISSING_TOKENS.contains(s.toLowerCase(Locale.ROOT))) return OptionalDouble.empty();

        boolean negative = false;
        if (s.startsWith("(") && s.endsWith(")")) {
            negative = true;
            s = s.substring(1, s.length() - 1);
        }
        if (s.endsWith("%")) s = s.substring(0, s.length() - 1);
        s = s.replace(",", "").replace(" ", "").replace("\u00A0", "");
        try {
            double d = Double.parseDouble(s);
            if (!Double.isFinite(d)) return OptionalDouble.empty();
            return OptionalDouble.of(negative ? -d : d);
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
