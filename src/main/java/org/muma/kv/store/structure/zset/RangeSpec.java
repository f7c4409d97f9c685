package org.muma.kv.store.structure.zset;

import org.muma.kv.exception.InvalidArgumentException;

import java.util.Locale;

/**
 * Score interval, Redis zrangespec. Either end may be exclusive.
 */
public class RangeSpec {

    public final double min, max;
    public final boolean minex, maxex;

    public RangeSpec(double min, double max, boolean minex, boolean maxex) {
        this.min = min;
        this.max = max;
        this.minex = minex;
        this.maxex = maxex;
    }

    public static RangeSpec closed(double min, double max) {
        return new RangeSpec(min, max, false, false);
    }

    public boolean gteMin(double score) {
        return minex ? score > min : score >= min;
    }

    public boolean lteMax(double score) {
        return maxex ? score < max : score <= max;
    }

    public boolean contains(double score) {
        return gteMin(score) && lteMax(score);
    }

    public boolean isEmpty() {
        return min > max || (min == max && (minex || maxex));
    }

    /**
     * Parses Redis style bounds: {@code 1.5}, {@code (1.5}, {@code -inf}, {@code +inf}.
     */
    public static RangeSpec parse(String minStr, String maxStr) {
        boolean minex = minStr.startsWith("(");
        boolean maxex = maxStr.startsWith("(");
        double min = parseBound(minex ? minStr.substring(1) : minStr);
        double max = parseBound(maxex ? maxStr.substring(1) : maxStr);
        return new RangeSpec(min, max, minex, maxex);
    }

    private static double parseBound(String s) {
        switch (s.toLowerCase(Locale.ROOT)) {
            case "-inf":
                return Double.NEGATIVE_INFINITY;
            case "+inf":
            case "inf":
                return Double.POSITIVE_INFINITY;
            default:
                try {
                    double v = Double.parseDouble(s);
                    if (Double.isNaN(v)) break;
                    return v;
                } catch (NumberFormatException e) {
                    break;
                }
        }
        throw new InvalidArgumentException("min or max is not a float");
    }

    @Override
    public String toString() {
        return (minex ? "(" : "[") + min + ", " + max + (maxex ? ")" : "]");
    }
}
