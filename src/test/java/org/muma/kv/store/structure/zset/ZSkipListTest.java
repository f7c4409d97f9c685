package org.muma.kv.store.structure.zset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class ZSkipListTest {

    private ZSkipList skipList;

    @BeforeEach
    void setUp() {
        skipList = new ZSkipList(new Random(42));
    }

    /**
     * Ascending by score.
     */
    @Test
    void testInsertOrder() {
        skipList.insert(30.0, "C");
        skipList.insert(10.0, "A");
        skipList.insert(20.0, "B");

        assertEquals(3, skipList.length());
        assertEquals("A", skipList.getNodeByRank(1).member);
        assertEquals("B", skipList.getNodeByRank(2).member);
        assertEquals("C", skipList.getNodeByRank(3).member);
        assertEquals("A", skipList.first().member);
        assertEquals("C", skipList.last().member);
    }

    /**
     * Equal scores fall back to member order.
     */
    @Test
    void testSameScoreOrder() {
        skipList.insert(100.0, "Bob");
        skipList.insert(100.0, "Alice");
        skipList.insert(100.0, "Cindy");

        assertEquals(List.of("Alice", "Bob", "Cindy"), members(skipList.rangeByRank(0, -1)));
    }

    @Test
    void testDuplicatePairIsRejected() {
        assertTrue(skipList.insert(1.0, "a"));
        assertFalse(skipList.insert(1.0, "a"));
        assertEquals(1, skipList.length());
    }

    /**
     * A known member inserted with a new score moves instead of appearing twice.
     */
    @Test
    void testInsertExistingMemberMovesIt() {
        assertTrue(skipList.insert(1.0, "a"));
        assertTrue(skipList.insert(3.0, "b"));

        assertFalse(skipList.insert(5.0, "a"));
        assertEquals(2, skipList.length());
        assertEquals(List.of("b", "a"), members(skipList.rangeByRank(0, -1)));
        assertEquals("a", skipList.last().member);
        assertEquals(5.0, skipList.last().score);
        assertEquals("b", skipList.last().backward.member);

        // old position is gone, the new one can be deleted
        assertFalse(skipList.delete(1.0, "a"));
        assertTrue(skipList.delete(5.0, "a"));
        assertTrue(skipList.insert(1.0, "a"));
        assertEquals(List.of("a", "b"), members(skipList.rangeByRank(0, -1)));
    }

    /**
     * Head, middle and tail deletes keep the chain and the tail pointer intact.
     */
    @Test
    void testDelete() {
        skipList.insert(1.0, "Head");
        skipList.insert(2.0, "Mid");
        skipList.insert(3.0, "Tail");

        assertTrue(skipList.delete(2.0, "Mid"));
        assertEquals(2, skipList.length());
        assertEquals(List.of("Head", "Tail"), members(skipList.rangeByRank(0, -1)));

        assertTrue(skipList.delete(1.0, "Head"));
        assertEquals("Tail", skipList.getNodeByRank(1).member);
        assertNull(skipList.last().backward);

        assertTrue(skipList.delete(3.0, "Tail"));
        assertNull(skipList.first());
        assertNull(skipList.last());

        assertFalse(skipList.delete(99.0, "Ghost"));
    }

    @Test
    void testDeleteNeedsExactScore() {
        skipList.insert(5.0, "m");
        assertFalse(skipList.delete(6.0, "m"));
        assertEquals(1, skipList.length());
    }

    /**
     * Spans are what rank lookups add up, a broken span shows up as the wrong node for a rank.
     */
    @Test
    void testSpanConsistency() {
        int n = 2000;
        for (int i = 0; i < n; i++) {
            skipList.insert(i, "user:" + i);
        }
        assertEquals(n, skipList.length());
        assertEquals("user:0", skipList.getNodeByRank(1).member);
        assertEquals("user:" + (n - 1), skipList.getNodeByRank(n).member);
        assertEquals("user:1000", skipList.getNodeByRank(1001).member);

        for (int i = 0; i < n; i += 2) {
            assertTrue(skipList.delete(i, "user:" + i));
        }
        assertEquals(n / 2, skipList.length());
        assertEquals("user:1", skipList.getNodeByRank(1).member);
        assertEquals("user:999", skipList.getNodeByRank(500).member);
        assertEquals("user:" + (n - 1), skipList.getNodeByRank(n / 2).member);
    }

    @Test
    void testGetNodeByRankOutOfRange() {
        skipList.insert(1.0, "a");
        assertNull(skipList.getNodeByRank(0));
        assertNull(skipList.getNodeByRank(2));
        assertEquals("a", skipList.getNodeByRank(1).member);
    }

    @Test
    void testRangeByRank() {
        for (int i = 0; i < 10; i++) {
            skipList.insert(i, "m" + i);
        }
        assertEquals(List.of("m0", "m1", "m2"), members(skipList.rangeByRank(0, 2)));
        assertEquals(List.of("m8", "m9"), members(skipList.rangeByRank(-2, -1)));
        assertEquals(10, skipList.rangeByRank(-100, 100).size());
        assertTrue(skipList.rangeByRank(5, 2).isEmpty());
        assertTrue(skipList.rangeByRank(10, 20).isEmpty());

        assertEquals(List.of("m9", "m8", "m7"), members(skipList.revRangeByRank(0, 2)));
        assertEquals(List.of("m1", "m0"), members(skipList.revRangeByRank(-2, -1)));
    }

    @Test
    void testScoreRange() {
        for (int i = 1; i <= 5; i++) {
            skipList.insert(i, "m" + i);
        }
        RangeSpec range = new RangeSpec(2, 4, true, false);
        assertEquals("m3", skipList.firstInRange(range).member);
        assertEquals("m4", skipList.lastInRange(range).member);

        assertNull(skipList.firstInRange(RangeSpec.closed(6, 10)));
        assertNull(skipList.firstInRange(RangeSpec.closed(2.1, 2.9)));
        assertNull(skipList.lastInRange(RangeSpec.closed(2.1, 2.9)));
        assertFalse(skipList.isInRange(new RangeSpec(3, 3, true, false)));
    }

    @Test
    void testLexRange() {
        for (String m : new String[]{"a", "b", "c", "d", "e"}) {
            skipList.insert(0, m);
        }
        LexRangeSpec range = LexRangeSpec.parse("(a", "[c");
        assertEquals("b", skipList.firstInLexRange(range).member);
        assertEquals("c", skipList.lastInLexRange(range).member);
        assertNull(skipList.firstInLexRange(LexRangeSpec.parse("[x", "+")));
    }

    /**
     * Code point order puts supplementary characters after the BMP, as UTF-8 bytes do.
     */
    @Test
    void testMemberOrderIsCodePointOrder() {
        String emoji = new String(Character.toChars(0x1F600));
        String bmpHigh = "\uFF61";
        assertTrue(emoji.compareTo(bmpHigh) < 0, "UTF-16 order disagrees");
        assertTrue(ZSkipList.compareMembers(emoji, bmpHigh) > 0);
        assertTrue(ZSkipList.compareMembers("ab", "abc") < 0);
        assertEquals(0, ZSkipList.compareMembers("x", "x"));
    }

    /**
     * Random insert / delete against a TreeMap-backed model, walking both directions.
     */
    @RepeatedTest(5)
    void testRandomOperationsAgainstModel() {
        Random rnd = new Random();
        TreeMap<String, Double> model = new TreeMap<>();
        ZSkipList list = new ZSkipList(new Random(rnd.nextLong()));

        for (int i = 0; i < 3000; i++) {
            String member = "k" + rnd.nextInt(500);
            double score = rnd.nextInt(50);
            Double existing = model.get(member);
            if (existing != null && rnd.nextBoolean()) {
                assertTrue(list.delete(existing, member));
                model.remove(member);
            } else {
                assertEquals(existing == null, list.insert(score, member));
                model.put(member, score);
            }
        }

        assertEquals(model.size(), list.length());

        List<ZSkipListNode> forward = list.rangeByRank(0, -1);
        for (int i = 1; i < forward.size(); i++) {
            ZSkipListNode a = forward.get(i - 1);
            ZSkipListNode b = forward.get(i);
            assertTrue(a.score < b.score || (a.score == b.score && ZSkipList.compareMembers(a.member, b.member) < 0));
            assertSame(b, list.getNodeByRank(i + 1));
        }

        List<ZSkipListNode> backward = list.revRangeByRank(0, -1);
        List<ZSkipListNode> reversed = new ArrayList<>(forward);
        Collections.reverse(reversed);
        assertEquals(reversed, backward);

        for (ZSkipListNode node : forward) {
            assertEquals(model.get(node.member), node.score);
        }
    }

    private static List<String> members(List<ZSkipListNode> nodes) {
        List<String> result = new ArrayList<>();
        for (ZSkipListNode node : nodes) {
            result.add(node.member);
        }
        return result;
    }
}
