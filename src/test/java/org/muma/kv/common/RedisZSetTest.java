package org.muma.kv.common;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.kv.exception.InvalidArgumentException;
import org.muma.kv.exception.NotFoundException;
import org.muma.kv.store.structure.zset.LexRangeSpec;
import org.muma.kv.store.structure.zset.RangeSpec;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RedisZSetTest {

    private RedisZSet zset;

    @BeforeEach
    void setUp() {
        zset = new RedisZSet(new Random(7));
    }

    @Test
    void testAddAndScore() {
        assertEquals(1, zset.add(10.0, "Alice"));
        assertEquals(1, zset.add(20.0, "Bob"));

        assertEquals(10.0, zset.getScore("Alice"));
        assertEquals(20.0, zset.getScore("Bob"));
        assertNull(zset.getScore("Charlie"));

        // update moves the member
        assertEquals(0, zset.add(30.0, "Alice"));
        assertEquals(30.0, zset.getScore("Alice"));
        assertEquals(List.of("Bob", "Alice"), members(zset.range(0, -1)));

        // same score again is a no-op
        assertEquals(0, zset.add(30.0, "Alice"));
        assertEquals(2, zset.size());
    }

    @Test
    void testOrderFollowsScoreThenMember() {
        zset.add(20.0, "Bob");
        zset.add(10.0, "Alice");
        zset.add(30.0, "Charlie");
        zset.add(10.0, "Aaron");

        assertEquals(List.of("Aaron", "Alice", "Bob", "Charlie"), members(zset.range(0, -1)));
    }

    @Test
    void testIncr() {
        zset.add(5.0, "m");
        assertEquals(6.5, zset.incr(1.5, "m"));
        assertEquals(3.5, zset.incr(-3.0, "m"));
        assertEquals(3.5, zset.getScore("m"));
        assertEquals(1, zset.size());
    }

    @Test
    void testIncrMissingMember() {
        assertThrows(NotFoundException.class, () -> zset.incr(1.0, "ghost"));
        assertEquals(0, zset.size());
        assertNull(zset.getScore("ghost"));
    }

    @Test
    void testIncrToNaNLeavesScore() {
        zset.add(Double.POSITIVE_INFINITY, "m");
        assertThrows(InvalidArgumentException.class, () -> zset.incr(Double.NEGATIVE_INFINITY, "m"));
        assertEquals(Double.POSITIVE_INFINITY, zset.getScore("m"));
    }

    @Test
    void testRangeAndRevRange() {
        for (int i = 1; i <= 5; i++) {
            zset.add(i, "m" + i);
        }
        assertEquals(List.of("m1", "m2"), members(zset.range(0, 1)));
        assertEquals(List.of("m5", "m4"), members(zset.revRange(0, 1)));
        assertEquals(List.of("m4", "m5"), members(zset.range(-2, -1)));
        assertTrue(zset.range(3, 1).isEmpty());
    }

    @Test
    void testRangeByScoreWithLimit() {
        for (int i = 1; i <= 6; i++) {
            zset.add(i, "m" + i);
        }
        RangeSpec range = RangeSpec.parse("(1", "5");
        assertEquals(List.of("m2", "m3", "m4", "m5"), members(zset.rangeByScore(range, false, 0, -1)));
        assertEquals(List.of("m3", "m4"), members(zset.rangeByScore(range, false, 1, 2)));
        assertEquals(List.of("m5", "m4"), members(zset.rangeByScore(range, true, 0, 2)));
        assertTrue(zset.rangeByScore(range, false, 10, -1).isEmpty());
        assertTrue(zset.rangeByScore(range, false, 0, 0).isEmpty());
    }

    @Test
    void testRangeByLexUniformScores() {
        for (String m : new String[]{"a", "b", "c", "d", "e", "f", "g"}) {
            zset.add(0, m);
        }
        assertEquals(List.of("a", "b", "c"), members(zset.rangeByLex(LexRangeSpec.parse("-", "[c"), false, 0, -1)));
        assertEquals(List.of("a", "b"), members(zset.rangeByLex(LexRangeSpec.parse("-", "(c"), false, 0, -1)));
        assertEquals(List.of("b", "c", "d", "e", "f"), members(zset.rangeByLex(LexRangeSpec.parse("[aaa", "(g"), false, 0, -1)));
        assertEquals(List.of("e", "d"), members(zset.rangeByLex(LexRangeSpec.parse("(c", "(g"), true, 1, 2)));
    }

    @Test
    void testRangeByLexMixedScores() {
        zset.add(3, "a");
        zset.add(1, "c");
        zset.add(2, "b");
        zset.add(0, "z");

        // set order is c, b, a by score; lex filtering must still see every member
        List<RedisZSet.ZSetEntry> result = zset.rangeByLex(LexRangeSpec.parse("[a", "[c"), false, 0, -1);
        assertEquals(List.of("c", "b", "a"), members(result));
    }

    @Test
    void testDictAndListAgreeUnderChurn() {
        Random rnd = new Random(1);
        for (int i = 0; i < 5000; i++) {
            String member = "m" + rnd.nextInt(200);
            if (zset.getScore(member) != null && rnd.nextBoolean()) {
                zset.incr(rnd.nextInt(10) - 5, member);
            } else {
                zset.add(rnd.nextInt(100), member);
            }
        }
        List<RedisZSet.ZSetEntry> all = zset.range(0, -1);
        assertEquals(zset.size(), all.size());
        for (RedisZSet.ZSetEntry entry : all) {
            assertEquals(entry.score(), zset.getScore(entry.member()));
        }
    }

    private static List<String> members(List<RedisZSet.ZSetEntry> entries) {
        return entries.stream().map(RedisZSet.ZSetEntry::member).collect(Collectors.toList());
    }
}
