package org.muma.kv.store.structure.zset;

import org.junit.jupiter.api.Test;
import org.muma.kv.exception.InvalidArgumentException;

import static org.junit.jupiter.api.Assertions.*;

class RangeSpecTest {

    @Test
    void testParseScoreBounds() {
        RangeSpec range = RangeSpec.parse("(1.5", "3");
        assertTrue(range.minex);
        assertFalse(range.maxex);
        assertFalse(range.contains(1.5));
        assertTrue(range.contains(2));
        assertTrue(range.contains(3));
        assertFalse(range.contains(3.01));
    }

    @Test
    void testParseInfinities() {
        RangeSpec range = RangeSpec.parse("-inf", "+inf");
        assertEquals(Double.NEGATIVE_INFINITY, range.min);
        assertEquals(Double.POSITIVE_INFINITY, range.max);
        assertEquals(Double.POSITIVE_INFINITY, RangeSpec.parse("0", "INF").max);
    }

    @Test
    void testParseRejectsGarbage() {
        InvalidArgumentException e = assertThrows(InvalidArgumentException.class, () -> RangeSpec.parse("abc", "1"));
        assertEquals("ERR min or max is not a float", e.toReply());
        assertThrows(InvalidArgumentException.class, () -> RangeSpec.parse("1", "NaN"));
        assertThrows(InvalidArgumentException.class, () -> RangeSpec.parse("(", "1"));
    }

    @Test
    void testEmptyScoreRanges() {
        assertTrue(RangeSpec.closed(5, 1).isEmpty());
        assertTrue(new RangeSpec(1, 1, true, false).isEmpty());
        assertFalse(RangeSpec.closed(1, 1).isEmpty());
    }

    @Test
    void testParseLexBounds() {
        LexRangeSpec range = LexRangeSpec.parse("[b", "(d");
        assertFalse(range.contains("a"));
        assertTrue(range.contains("b"));
        assertTrue(range.contains("c"));
        assertFalse(range.contains("d"));
    }

    @Test
    void testLexOpenEnds() {
        LexRangeSpec all = LexRangeSpec.parse("-", "+");
        assertNull(all.min);
        assertNull(all.max);
        assertTrue(all.contains(""));
        assertTrue(all.contains("zzz"));
        assertFalse(all.isEmpty());
    }

    @Test
    void testLexBareValueIsInclusive() {
        LexRangeSpec range = LexRangeSpec.parse("b", "c");
        assertTrue(range.contains("b"));
        assertTrue(range.contains("c"));
    }

    @Test
    void testLexInvertedSentinelsAreEmpty() {
        assertTrue(LexRangeSpec.parse("+", "[z").isEmpty());
        assertTrue(LexRangeSpec.parse("[a", "-").isEmpty());
        assertTrue(LexRangeSpec.parse("[c", "[a").isEmpty());
        assertTrue(LexRangeSpec.parse("(a", "[a").isEmpty());
    }

    @Test
    void testLexRejectsEmptyItem() {
        assertThrows(InvalidArgumentException.class, () -> LexRangeSpec.parse("", "+"));
    }
}
