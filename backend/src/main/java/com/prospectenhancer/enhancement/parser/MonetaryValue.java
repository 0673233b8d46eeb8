package com.prospectenhancer.enhancement.parser;

import java.math.BigDecimal;

/**
 * Parsed contract value: either {@code single}, or a {@code min}/{@code max} pair, or nothing.
 */
public record MonetaryValue(BigDecimal single, BigDecimal min, BigDecimal max, double confidence) {

    private static final MonetaryValue UNPARSED = new MonetaryValue(null, null, null, 0.0);

    public static MonetaryValue unparsed() {
        return UNPARSED;
    }

    /**
     * Applies the output contract to raw candidate numbers: negatives are dropped, a complete range wins over
     * a single value, a lone bound is ignored.
     */
    public static MonetaryValue normalize(BigDecimal single, BigDecimal min, BigDecimal max, double confidence) {
        BigDecimal s = nonNegative(single);
        BigDecimal lo = nonNegative(min);
        BigDecimal hi = nonNegative(max);
        if (lo != null && hi != null) {
            return new MonetaryValue(null, lo, hi, confidence);
        }
        if (s != null) {
            return new MonetaryValue(s, null, null, confidence);
        }
        return UNPARSED;
    }

    public boolean isRange() {
        return min != null && max != null;
    }

    public boolean isSingle() {
        return single != null;
    }

    public boolean isParsed() {
        return isRange() || isSingle();
    }

    private static BigDecimal nonNegative(BigDecimal v) {
        return v == null || v.signum() < 0 ? null : v;
    }
}
