package org.muma.kv.store;

/**
 * Outcome of ZADD: a count, or with INCR the member's new score.
 */
public record ZAddResult(long count, Double score) {

    public static ZAddResult ofCount(long count) {
        return new ZAddResult(count, null);
    }

    public static ZAddResult ofScore(double score) {
        return new ZAddResult(0, score);
    }

    public boolean isIncr() {
        return score != null;
    }
}
