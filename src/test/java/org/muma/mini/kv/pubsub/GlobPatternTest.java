package org.muma.mini.kv.pubsub;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GlobPatternTest {

    @Test
    void testWildcards() {
        assertTrue(GlobPattern.matches("news.*", "news.sports"));
        assertTrue(GlobPattern.matches("news.*", "news."));
        assertFalse(GlobPattern.matches("news.*", "weather.today"));
        assertTrue(GlobPattern.matches("*", "anything"));
        assertTrue(GlobPattern.matches("h?llo", "hello"));
        assertFalse(GlobPattern.matches("h?llo", "heello"));
    }

    @Test
    void testCharacterClasses() {
        assertTrue(GlobPattern.matches("h[ae]llo", "hallo"));
        assertFalse(GlobPattern.matches("h[ae]llo", "hillo"));
        assertTrue(GlobPattern.matches("h[^e]llo", "hallo"));
        assertFalse(GlobPattern.matches("h[^e]llo", "hello"));
        assertTrue(GlobPattern.matches("h[a-c]llo", "hbllo"));
    }

    @Test
    void testRegexCharactersAreLiteral() {
        assertTrue(GlobPattern.matches("a.b", "a.b"));
        assertFalse(GlobPattern.matches("a.b", "axb"));
        assertTrue(GlobPattern.matches("price$(usd)", "price$(usd)"));
        assertTrue(GlobPattern.matches("a\\*b", "a*b"));
        assertFalse(GlobPattern.matches("a\\*b", "axxb"));
    }

    @Test
    void testInvalidPatternNeverMatches() {
        GlobPattern pattern = GlobPattern.compile("news.[abc");
        assertFalse(pattern.isValid());
        assertFalse(pattern.matches("news.a"));
        assertEquals("news.[abc", pattern.glob());
    }
}
