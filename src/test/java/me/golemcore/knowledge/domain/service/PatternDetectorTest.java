package me.golemcore.knowledge.domain.service;

import me.golemcore.knowledge.KnowledgeTestFixtures;
import me.golemcore.knowledge.domain.model.DetectedPattern;
import me.golemcore.knowledge.domain.model.PatternCandidate;
import me.golemcore.knowledge.domain.model.SessionFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static me.golemcore.knowledge.KnowledgeTestFixtures.writeFile;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternDetectorTest {

    static final String CHALK_FIXED = "chalk import error fixed by using default import";
    static final String CHALK_RESOLVED = "chalk import error resolved with default import syntax";
    static final String CHALK_NAMED = "chalk import error when using named import";
    static final String MIGRATIONS = "database migrations need explicit transaction boundaries";

    @TempDir
    Path workspace;

    private PatternDetector detector;

    @BeforeEach
    void setUp() {
        detector = new PatternDetector(KnowledgeTestFixtures.properties("json"), KnowledgeTestFixtures.fixedClock());
    }

    /**
     * Three related chalk learnings and one unrelated learning, all inside the
     * 30 day window ending 2026-02-11.
     */
    static void writeRecurringSessions(Path workspace) {
        writeFile(workspace, "sessions/2026-02-01-session.md",
                "# Session: Build fix (Feb 1)\n\n**Key Learning:** " + CHALK_FIXED + "\n");
        writeFile(workspace, "sessions/2026-02-03-session.md",
                "# Session: Upgrade (Feb 3)\n\n- Key Learning: " + CHALK_RESOLVED + "\n");
        writeFile(workspace, "sessions/2026-02-05-session.md",
                "# Session: Lint (Feb 5)\n\n**Key Learning**: " + CHALK_NAMED + "\n");
        writeFile(workspace, "sessions/2026-02-07-session.md",
                "# Session: Schema (Feb 7)\n\nKey learning: " + MIGRATIONS + "\n");
    }

    // ==================== similarity ====================

    @Test
    void shouldComputeJaccardSimilarity() {
        assertEquals(1.0, PatternDetector.jaccardSimilarity(Set.of("a", "b"), Set.of("a", "b")));
        assertEquals(0.0, PatternDetector.jaccardSimilarity(Set.of("a"), Set.of("b")));
        assertEquals(0.0, PatternDetector.jaccardSimilarity(Set.of(), Set.of()));
        assertEquals(3.0 / 7.0, PatternDetector.jaccardSimilarity(
                PatternDetector.extractKeywords(CHALK_FIXED, 5),
                PatternDetector.extractKeywords(CHALK_RESOLVED, 5)), 1e-9);
    }

    @Test
    void shouldExtractFirstDistinctLongWordsWithoutStopWords() {
        assertEquals(List.of("chalk", "import", "error", "resolved", "default"),
                new ArrayList<>(PatternDetector.extractKeywords(CHALK_RESOLVED, 5)));
        assertEquals(List.of("always"), new ArrayList<>(PatternDetector.extractKeywords("We should ALWAYS do it", 5)));
        assertTrue(PatternDetector.extractKeywords("a to be or not", 5).isEmpty());
    }

    // ==================== clustering ====================

    @Test
    void shouldLinkPairsAtExactlyTheThreshold() {
        List<DetectedPattern> patterns = detector.cluster(List.of(
                candidate("first", Set.of("alpha", "bravo"), 1),
                candidate("second", Set.of("alpha", "bravo", "charlie", "delta", "echo"), 2)), 0.4);

        assertEquals(1, patterns.size());
        assertEquals(2, patterns.get(0).getFrequency());
    }

    @Test
    void shouldLinkSimilarCandidatesTransitively() {
        PatternCandidate a = candidate("a", Set.of("one", "two", "three"), 1);
        PatternCandidate b = candidate("b", Set.of("two", "three", "four"), 2);
        PatternCandidate c = candidate("c", Set.of("three", "four", "five"), 3);

        List<DetectedPattern> patterns = detector.cluster(List.of(a, b, c), 0.4);

        assertEquals(1, patterns.size());
        assertEquals(List.of("a", "b", "c"), patterns.get(0).getExamples());
    }

    @Test
    void shouldNotDependOnCandidateOrder() {
        List<PatternCandidate> candidates = new ArrayList<>(List.of(
                candidate("a", Set.of("one", "two", "three"), 1),
                candidate("b", Set.of("two", "three", "four"), 2),
                candidate("c", Set.of("three", "four", "five"), 3),
                candidate("d", Set.of("zulu", "yankee"), 4)));

        List<DetectedPattern> forward = detector.cluster(candidates, 0.4);
        Collections.reverse(candidates);
        List<DetectedPattern> reversed = detector.cluster(candidates, 0.4);

        assertEquals(forward, reversed);
    }

    // ==================== detection ====================

    @Test
    void shouldDetectRecurringLearningAtDefaultThreshold() {
        writeRecurringSessions(workspace);

        List<DetectedPattern> patterns = detector.detectPatterns(workspace);

        assertEquals(1, patterns.size());
        DetectedPattern chalk = patterns.get(0);
        assertEquals(3, chalk.getFrequency());
        assertEquals(CHALK_FIXED, chalk.getError());
        assertEquals(LocalDate.parse("2026-02-01"), chalk.getFirstSeen());
        assertEquals(LocalDate.parse("2026-02-05"), chalk.getLastSeen());
        assertEquals(List.of(CHALK_FIXED, CHALK_RESOLVED, CHALK_NAMED), chalk.getExamples());
        assertTrue(chalk.getKeywords().containsAll(List.of("chalk", "import", "error")));
    }

    @Test
    void shouldIncludeSingletonsAtThresholdOne() {
        writeRecurringSessions(workspace);

        List<DetectedPattern> patterns = detector.detectPatterns(workspace, 1);

        assertEquals(2, patterns.size());
        assertEquals(3, patterns.get(0).getFrequency());
        assertEquals(MIGRATIONS, patterns.get(1).getError());
        assertEquals(1, patterns.get(1).getFrequency());
    }

    @Test
    void shouldIgnoreSessionsOutsideWindowAndDateUndatedOnesToday() {
        writeRecurringSessions(workspace);
        writeFile(workspace, "sessions/2025-12-01-session.md", "**Key Learning:** " + CHALK_FIXED + "\n");
        writeFile(workspace, "sessions/notes.md", "**Key Learning:** " + CHALK_NAMED + "\n");

        DetectedPattern chalk = detector.detectPatterns(workspace).get(0);

        assertEquals(4, chalk.getFrequency());
        assertEquals(LocalDate.parse("2026-02-11"), chalk.getLastSeen());
    }

    @Test
    void shouldReturnNothingWithoutSessions() {
        assertTrue(detector.detectPatterns(workspace).isEmpty());
    }

    @Test
    void shouldExtractEveryKeyLearningInSession() {
        SessionFile session = new SessionFile("2026-02-01.md", LocalDate.parse("2026-02-01"),
                "Key Learning: first thing learned today\r\nnoise\n* **Key Learning:** second lesson about caching\n");

        List<PatternCandidate> candidates = detector.extractCandidates(List.of(session));

        assertEquals(List.of("first thing learned today", "second lesson about caching"),
                candidates.stream().map(PatternCandidate::text).toList());
        assertEquals("2026-02-01.md", candidates.get(0).sourceFile());
    }

    private static PatternCandidate candidate(String text, Set<String> keywords, int day) {
        return new PatternCandidate(text, keywords, LocalDate.of(2026, 2, day), "2026-02-0" + day + ".md");
    }
}
