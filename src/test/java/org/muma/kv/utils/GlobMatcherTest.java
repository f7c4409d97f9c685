package org.muma.kv.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GlobMatcherTest {

    @Test
    void testStar() {
        GlobMatcher m = GlobMatcher.compile("user:*");
        assertTrue(m.matches("user:"));
        assertTrue(m.matches("user:1001"));
        assertFalse(m.matches("users:1"));
        assertTrue(GlobMatcher.compile("*").matches(""));
        assertTrue(GlobMatcher.compile("a**b").matches("ab"));
    }

    @Test
    void testQuestionMark() {
        GlobMatcher m = GlobMatcher.compile("h?llo");
        assertTrue(m.matches("hello"));
        assertTrue(m.matches("hallo"));
        assertFalse(m.matches("hllo"));
        assertFalse(m.matches("heello"));
    }

    @Test
    void testCharacterClasses() {
        GlobMatcher set = GlobMatcher.compile("h[ae]llo");
        assertTrue(set.matches("hello"));
        assertTrue(set.matches("hallo"));
        assertFalse(set.matches("hillo"));

        GlobMatcher negated = GlobMatcher.compile("h[^e]llo");
        assertTrue(negated.matches("hallo"));
        assertFalse(negated.matches("hello"));

        GlobMatcher range = GlobMatcher.compile("h[a-b]llo");
        assertTrue(range.matches("hallo"));
        assertTrue(range.matches("hbllo"));
        assertFalse(range.matches("hcllo"));

        // reversed ranges are normalized
        assertTrue(GlobMatcher.compile("[z-x]").matches("y"));
    }

    @Test
    void testEscapes() {
        GlobMatcher m = GlobMatcher.compile("a\\*b");
        assertTrue(m.matches("a*b"));
        assertFalse(m.matches("axb"));
        assertTrue(GlobMatcher.compile("what\\?").matches("what?"));
        assertTrue(GlobMatcher.compile("[\\]]").matches("]"));
    }

    @Test
    void testRegexMetacharactersAreLiteral() {
        assertTrue(GlobMatcher.compile("a.b").matches("a.b"));
        assertFalse(GlobMatcher.compile("a.b").matches("axb"));
        assertTrue(GlobMatcher.compile("(x)+{1}|$").matches("(x)+{1}|$"));
    }

    @Test
    void testUnclosedBracketIsLiteral() {
        assertTrue(GlobMatcher.compile("a[b").matches("a[b"));
        assertFalse(GlobMatcher.compile("a[b").matches("ab"));
    }

    @Test
    void testMatchesAcrossNewlines() {
        assertTrue(GlobMatcher.compile("a*z").matches("a\nz"));
        assertTrue(GlobMatcher.compile("a?z").matches("a\nz"));
    }

    @Test
    void testToRegex() {
        assertEquals(".*", GlobMatcher.toRegex("**"));
        assertEquals("a.b", GlobMatcher.toRegex("a?b"));
        assertEquals("[^ab]", GlobMatcher.toRegex("[^ab]"));
    }
}
