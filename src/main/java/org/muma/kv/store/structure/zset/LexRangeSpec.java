package org.muma.kv.store.structure.zset;

import org.muma.kv.exception.InvalidArgumentException;

/**
 * Member interval for BYLEX queries, Redis zlexrangespec.
 * A null bound is open: {@code -} for min, {@code +} for max.
 */
public class LexRangeSpec {

    public final String min, max;
    public final boolean minex, maxex;

    public LexRangeSpec(String min, String max, boolean minex, boolean maxex) {
        this.min = min;
        this.max = max;
        this.minex = minex;
        this.maxex = maxex;
    }

    public boolean gteMin(String member) {
        if (min == null) return true;
        int c = ZSkipList.compareMembers(member, min);
        return minex ? c > 0 : c >= 0;
    }

    public boolean lteMax(String member) {
        if (max == null) return true;
        int c = ZSkipList.compareMembers(member, max);
        return maxex ? c < 0 : c <= 0;
    }

    public boolean contains(String member) {
        return gteMin(member) && lteMax(member);
    }

    public boolean isEmpty() {
        if (min == null || max == null) return false;
        int c = ZSkipList.compareMembers(min, max);
        return c > 0 || (c == 0 && (minex || maxex));
    }

    /**
     * Accepts {@code -}, {@code +}, {@code [value} (inclusive), {@code (value} (exclusive).
     * A value without prefix is taken as inclusive.
     */
    public static LexRangeSpec parse(String minStr, String maxStr) {
        if ("+".equals(minStr) || "-".equals(maxStr)) {
            // nothing sorts above + or below -
            return new LexRangeSpec("", "", true, true);
        }
        String min = null, max = null;
        boolean minex = false, maxex = false;
        if (!"-".equals(minStr)) {
            minex = minStr.startsWith("(");
            min = stripPrefix(minStr);
        }
        if (!"+".equals(maxStr)) {
            maxex = maxStr.startsWith("(");
            max = stripPrefix(maxStr);
        }
        return new LexRangeSpec(min, max, minex, maxex);
    }

    private static String stripPrefix(String s) {
        if (s.isEmpty()) {
            throw new InvalidArgumentException("min or max not valid string range item");
        }
        char c = s.charAt(0);
        return (c == '(' || c == '[') ? s.substring(1) : s;
    }

    @Override
    public String toString() {
        return (min == null ? "-" : (minex ? "(" : "[") + min) + ", " + (max == null ? "+" : (maxex ? "(" : "[") + max);
    }
}
