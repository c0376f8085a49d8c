package me.golemcore.knowledge.domain.service;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextMatcherTest {

    @Test
    void shouldFindFirstOccurrenceCaseInsensitively() {
        Optional<TextMatcher.Match> match = TextMatcher.find("line one\nTOKEN here\ntoken again", "token", 50, 100);

        assertTrue(match.isPresent());
        assertEquals(2, match.get().line());
        assertEquals(2, match.get().occurrences());
        assertEquals(20, match.get().relevance());
    }

    @Test
    void shouldCapRelevanceAtHundred() {
        TextMatcher.Match match = TextMatcher.find("x ".repeat(12), "x", 50, 100).orElseThrow();

        assertEquals(12, match.occurrences());
        assertEquals(100, match.relevance());
    }

    @Test
    void shouldTreatQueryAsLiteralText() {
        assertTrue(TextMatcher.find("value a.b* here", "a.b*", 10, 10).isPresent());
        assertFalse(TextMatcher.find("value aXbbb here", "a.b*", 10, 10).isPresent());
    }

    @Test
    void shouldReturnEmptyForBlankQueryOrMissingContent() {
        assertFalse(TextMatcher.find("content", "  ", 10, 10).isPresent());
        assertFalse(TextMatcher.find(null, "q", 10, 10).isPresent());
        assertFalse(TextMatcher.find("content", "absent", 10, 10).isPresent());
    }

    @Test
    void shouldAddEllipsisOnlyWhereSnippetIsCut() {
        String content = "0123456789 needle 0123456789";

        assertEquals("...56789 needle 01...", TextMatcher.snippet(content, 11, 6, 9));
        assertEquals(content, TextMatcher.snippet(content, 11, 50, 100));
    }

    @Test
    void shouldCollapseWhitespaceInSnippet() {
        assertEquals("a b c", TextMatcher.snippet("a\n\n  b\tc", 0, 10, 10));
    }

    @Test
    void shouldMatchContainsIgnoringCase() {
        assertTrue(TextMatcher.containsIgnoreCase("Refresh Tokens", "token"));
        assertTrue(TextMatcher.containsIgnoreCase(null, null));
        assertFalse(TextMatcher.containsIgnoreCase(null, "token"));
    }
}
