package com.jay.valuation.layer2_resolution;

import java.util.OptionalDouble;
import java.util.function.DoubleBinaryOperator;
import java.util.function.Supplier;

/**
 * Ordered-fallback combinator: "field A, else field B, else compute from C and D".
 * Suppliers are evaluated lazily, in order, until one yields a value.
 */
public final class Fallbacks {

    private Fallbacks() {}

    @SafeVarargs
    public static OptionalDouble firstPresent(Supplier<OptionalDouble>... attempts) {
        for (Supplier<OptionalDouble> attempt : attempts) {
            OptionalDouble v = attempt.get();
            if (v != null && v.isPresent() && Double.isFinite(v.getAsDouble())) return v;
        }
        return OptionalDouble.empty();
    }

    /** Both present → combined; otherwise empty. */
    public static OptionalDouble both(OptionalDouble a, OptionalDouble b, DoubleBinaryOperator op) {
        if (a.isEmpty() || b.isEmpty()) return OptionalDouble.empty();
        double r = op.applyAsDouble(a.getAsDouble(), b.getAsDouble());
        return Double.isFinite(r) ? OptionalDouble.of(r) : OptionalDouble.empty();
    }

    /** {@code numerator / denominator}; empty when either is missing or the denominator is zero. */
    public static OptionalDouble ratio(OptionalDouble numerator, OptionalDouble denominator) {
        if (denominator.isEmpty() || denominator.getAsDouble() == 0) return OptionalDouble.empty();
        return both(numerator, denominator, (n, d) -> n / d);
    }

    /** Sum of whichever operands are present; empty only when none are. */
    public static OptionalDouble sumOfPresent(OptionalDouble... parts) {
        boolean any = false;
        double total = 0;
        for (OptionalDouble p : parts) {
            if (p != null && p.isPresent()) {
                total += p.getAsDouble();
                any = true;
            }
        }
        return any ? OptionalDouble.of(total) : OptionalDouble.empty();
    }

    public static double orZero(OptionalDouble v) {
        return v.orElse(0.0);
    }
}
