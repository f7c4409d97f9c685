package org.muma.kv.common;

import org.muma.kv.exception.InvalidArgumentException;
import org.muma.kv.exception.NotFoundException;
import org.muma.kv.store.structure.zset.LexRangeSpec;
import org.muma.kv.store.structure.zset.RangeSpec;
import org.muma.kv.store.structure.zset.ZSkipList;
import org.muma.kv.store.structure.zset.ZSkipListNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Sorted set: a member -> score dict for O(1) lookups plus a skip list for order.
 * Every mutation goes through both, so the two always hold the same members with the same scores.
 * <p>
 * Not thread-safe, the storage engine's lock guards it.
 */
public class RedisZSet {

    public record ZSetEntry(String member, double score) {
    }

    private final Map<String, Double> dict = new HashMap<>();

    private final ZSkipList zsl;

    public RedisZSet(Random random) {
        this.zsl = new ZSkipList(random);
    }

    /**
     * Upsert.
     *
     * @return 1 when member is new, 0 when it existed (whether or not the score moved)
     */
    public int add(double score, String member) {
        boolean added = zsl.insert(score, member);
        dict.put(member, score);
        return added ? 1 : 0;
    }

    /**
     * ZADD ... INCR: adds increment to the score of an existing member.
     *
     * @return the new score
     * @throws NotFoundException        when member is not in the set
     * @throws InvalidArgumentException when the sum is NaN (inf + -inf)
     */
    public double incr(double increment, String member) {
        Double current = dict.get(member);
        if (current == null) {
            throw NotFoundException.noSuchMember();
        }
        double score = current + increment;
        if (Double.isNaN(score)) {
            throw new InvalidArgumentException("resulting score is not a number (NaN)");
        }
        add(score, member);
        return score;
    }

    public Double getScore(String member) {
        return dict.get(member);
    }

    public int size() {
        return dict.size();
    }

    // --- range queries ---

    public List<ZSetEntry> range(long start, long stop) {
        return toEntries(zsl.rangeByRank(start, stop));
    }

    /**
     * ZRANGE ... REV: start / stop count from the highest score.
     */
    public List<ZSetEntry> revRange(long start, long stop) {
        return toEntries(zsl.revRangeByRank(start, stop));
    }

    /**
     * @param count negative means unlimited
     */
    public List<ZSetEntry> rangeByScore(RangeSpec range, boolean rev, long offset, long count) {
        List<ZSetEntry> result = new ArrayList<>();
        ZSkipListNode node = rev ? zsl.lastInRange(range) : zsl.firstInRange(range);

        while (node != null && offset > 0) {
            node = step(node, rev);
            offset--;
        }
        while (node != null && count != 0 && range.contains(node.score)) {
            result.add(new ZSetEntry(node.member, node.score));
            node = step(node, rev);
            count--;
        }
        return result;
    }

    /**
     * Lex order only agrees with set order when all scores are equal; in that case the skip list is
     * seeked directly, otherwise every member is checked against the range.
     */
    public List<ZSetEntry> rangeByLex(LexRangeSpec range, boolean rev, long offset, long count) {
        List<ZSetEntry> result = new ArrayList<>();
        boolean bounded = hasUniformScore();
        ZSkipListNode node;
        if (bounded) {
            node = rev ? zsl.lastInLexRange(range) : zsl.firstInLexRange(range);
        } else {
            node = rev ? zsl.last() : zsl.first();
        }

        while (node != null && count != 0) {
            if (range.contains(node.member)) {
                if (offset > 0) {
                    offset--;
                } else {
                    result.add(new ZSetEntry(node.member, node.score));
                    count--;
                }
            } else if (bounded) {
                break;
            }
            node = step(node, rev);
        }
        return result;
    }

    private boolean hasUniformScore() {
        ZSkipListNode first = zsl.first();
        return first == null || first.score == zsl.last().score;
    }

    private static ZSkipListNode step(ZSkipListNode node, boolean rev) {
        return rev ? node.backward : node.level[0].forward;
    }

    private static List<ZSetEntry> toEntries(List<ZSkipListNode> nodes) {
        List<ZSetEntry> result = new ArrayList<>(nodes.size());
        for (ZSkipListNode node : nodes) {
            result.add(new ZSetEntry(node.member, node.score));
        }
        return result;
    }
}
