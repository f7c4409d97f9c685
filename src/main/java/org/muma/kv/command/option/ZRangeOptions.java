package org.muma.kv.command.option;

import org.muma.kv.exception.InvalidArgumentException;

/**
 * ZRANGE key start stop [BYSCORE | BYLEX] [REV] [LIMIT offset count] [WITHSCORES]
 */
public class ZRangeOptions extends CommandOptions {

    public static final String BYSCORE = "BYSCORE";
    public static final String BYLEX = "BYLEX";
    public static final String REV = "REV";
    public static final String LIMIT = "LIMIT";
    public static final String WITHSCORES = "WITHSCORES";

    public enum RangeType {
        RANK, SCORE, LEX
    }

    private long offset = 0;
    private long count = -1;

    public ZRangeOptions() {
        registry.register(BYSCORE, BYLEX)
                .register(BYLEX, BYSCORE, WITHSCORES)
                .register(REV)
                .register(LIMIT)
                .register(WITHSCORES, BYLEX);
    }

    /**
     * @param count negative means no limit
     */
    public void setLimit(long offset, long count) {
        if (offset < 0) {
            throw new InvalidArgumentException("LIMIT offset must be non-negative");
        }
        registry.activate(LIMIT);
        this.offset = offset;
        this.count = count;
    }

    public RangeType rangeType() {
        if (isSet(BYSCORE)) return RangeType.SCORE;
        if (isSet(BYLEX)) return RangeType.LEX;
        return RangeType.RANK;
    }

    public boolean isRev() {
        return isSet(REV);
    }

    public boolean isWithScores() {
        return isSet(WITHSCORES);
    }

    public boolean hasLimit() {
        return isSet(LIMIT);
    }

    public long getOffset() {
        return offset;
    }

    public long getCount() {
        return count;
    }
}
