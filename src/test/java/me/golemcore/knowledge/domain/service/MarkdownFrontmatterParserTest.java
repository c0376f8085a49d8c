package me.golemcore.knowledge.domain.service;

import me.golemcore.knowledge.domain.model.MarkdownDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarkdownFrontmatterParserTest {

    private MarkdownFrontmatterParser parser;

    @BeforeEach
    void setUp() {
        parser = new MarkdownFrontmatterParser();
    }

    // ==================== parse ====================

    @Test
    void shouldSplitFrontmatterAndBody() {
        MarkdownDocument document = parser.parse("---\ntitle: Auth\nstatus: ACTIVE\n---\n# Auth\n\nBody text\n");

        assertEquals("Auth", document.frontmatter().get("title"));
        assertEquals("ACTIVE", document.frontmatter().get("status"));
        assertTrue(document.body().startsWith("# Auth"));
        assertFalse(document.hasErrors());
    }

    @Test
    void shouldReturnWholeContentAsBodyWithoutFrontmatter() {
        MarkdownDocument document = parser.parse("# Just a heading\n\nText");

        assertTrue(document.frontmatter().isEmpty());
        assertEquals("# Just a heading\n\nText", document.body());
        assertFalse(document.hasErrors());
    }

    @Test
    void shouldAcceptEmptyFrontmatterBlock() {
        MarkdownDocument document = parser.parse("---\n---\nBody");

        assertTrue(document.frontmatter().isEmpty());
        assertEquals("Body", document.body());
        assertFalse(document.hasErrors());
    }

    @Test
    void shouldNormalizeWindowsLineEndingsAndByteOrderMark() {
        MarkdownDocument document = parser.parse("﻿---\r\ntitle: Windows\r\n---\r\nLine one\r\nLine two");

        assertEquals("Windows", document.frontmatter().get("title"));
        assertEquals("Line one\nLine two", document.body());
    }

    @Test
    void shouldReportMalformedYamlWithoutThrowing() {
        MarkdownDocument document = parser.parse("---\ntitle: [unclosed\n---\nBody");

        assertTrue(document.frontmatter().isEmpty());
        assertEquals("Body", document.body());
        assertTrue(document.hasErrors());
        assertTrue(document.errors().get(0).startsWith("Invalid YAML frontmatter"));
    }

    @Test
    void shouldHandleNullContent() {
        MarkdownDocument document = parser.parse(null);

        assertTrue(document.frontmatter().isEmpty());
        assertEquals("", document.body());
    }

    // ==================== accessors ====================

    @Test
    void shouldReadListsFromSequenceOrString() {
        Map<String, Object> frontmatter = parser.parse("---\na: [x, y]\nb: \"x, y\"\nc:\n  - z\n---\n").frontmatter();

        assertEquals(List.of("x", "y"), MarkdownFrontmatterParser.getStringList(frontmatter, "a"));
        assertEquals(List.of("x", "y"), MarkdownFrontmatterParser.getStringList(frontmatter, "b"));
        assertEquals(List.of("z"), MarkdownFrontmatterParser.getStringList(frontmatter, "c"));
        assertTrue(MarkdownFrontmatterParser.getStringList(frontmatter, "missing").isEmpty());
    }

    @Test
    void shouldReadDatesFromPlainValuesAndTimestamps() {
        Map<String, Object> frontmatter = parser
                .parse("---\ncreated: 2026-01-10\nupdated: \"2026-02-05T09:30:00Z\"\n---\n").frontmatter();

        assertEquals(Optional.of("2026-01-10"), MarkdownFrontmatterParser.getDate(frontmatter, "created"));
        assertEquals(Optional.of("2026-02-05"), MarkdownFrontmatterParser.getDate(frontmatter, "updated"));
    }

    @Test
    void shouldTreatBlankStringsAsMissing() {
        Map<String, Object> frontmatter = parser.parse("---\ntitle: \"  \"\n---\n").frontmatter();

        assertTrue(MarkdownFrontmatterParser.getString(frontmatter, "title").isEmpty());
    }

    // ==================== body conventions ====================

    @Test
    void shouldReadBoldFieldsAndFirstWord() {
        String body = "# Plan\n\n**Status:** 🎯 ACTIVE (phase 2)\n- **Created:** 2026-01-20 by alice\n";

        assertEquals(Optional.of("🎯 ACTIVE (phase 2)"), MarkdownFrontmatterParser.boldField(body, "Status"));
        assertEquals(Optional.of("ACTIVE"),
                MarkdownFrontmatterParser.firstWord(MarkdownFrontmatterParser.boldField(body, "Status").orElseThrow()));
        assertEquals(Optional.of("2026-01-20"), MarkdownFrontmatterParser.boldDate(body, "Created"));
        assertTrue(MarkdownFrontmatterParser.boldField(body, "Author").isEmpty());
    }

    @Test
    void shouldFindFirstHeadingOnly() {
        assertEquals(Optional.of("Title"), MarkdownFrontmatterParser.firstHeading("Intro\n# Title\n## Sub\n# Second"));
        assertTrue(MarkdownFrontmatterParser.firstHeading("## only level two").isEmpty());
    }

    @Test
    void shouldExtractMarkdownLink() {
        String[] link = MarkdownFrontmatterParser.markdownLink("see [Auth plan](../PLAN_auth.md) here").orElseThrow();

        assertArrayEquals(new String[] { "Auth plan", "../PLAN_auth.md" }, link);
        assertTrue(MarkdownFrontmatterParser.markdownLink("no link").isEmpty());
    }

    @Test
    void shouldCollectBulletsUnderHeadingUntilNextHeading() {
        String body = """
                # Skill

                ## Trigger Words
                - `chalk`
                * import error

                ## Resolution
                - not a trigger
                """;

        assertEquals(List.of("chalk", "import error"),
                MarkdownFrontmatterParser.sectionBullets(body, "trigger words"));
    }
}
