package me.golemcore.knowledge.domain.service;

import me.golemcore.knowledge.KnowledgeTestFixtures;
import me.golemcore.knowledge.domain.exception.KnowledgeValidationException;
import me.golemcore.knowledge.domain.model.DatabaseStats;
import me.golemcore.knowledge.domain.model.LearnedPattern;
import me.golemcore.knowledge.domain.model.LearnedPatternFilters;
import me.golemcore.knowledge.domain.model.PlanFilters;
import me.golemcore.knowledge.domain.model.PlanRecord;
import me.golemcore.knowledge.domain.model.SearchContextResult;
import me.golemcore.knowledge.domain.model.SearchResult;
import me.golemcore.knowledge.domain.model.SessionFilters;
import me.golemcore.knowledge.domain.model.SessionRecord;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import me.golemcore.knowledge.port.outbound.KnowledgeStorageProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static me.golemcore.knowledge.KnowledgeTestFixtures.writeFile;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class SqliteQueryServiceTest {

    @TempDir
    Path tempDir;

    private Path workspace;
    private Path dbPath;
    private SqliteQueryService service;

    @BeforeEach
    void setUp() throws IOException {
        workspace = Files.createDirectories(tempDir.resolve("workspace"));
        dbPath = tempDir.resolve("knowledge.db");
        KnowledgeTestFixtures.writeStandardWorkspace(workspace);
        KnowledgeProperties properties = KnowledgeTestFixtures.properties("sqlite");
        service = new SqliteQueryService(KnowledgeTestFixtures.factory(properties, dbPath, tempDir), properties);
    }

    @Test
    void shouldReturnContentOnlyWhenRequested() {
        PlanFilters filters = PlanFilters.builder().author("alice").build();

        List<PlanRecord> metadata = service.queryPlans(filters, false, workspace);
        List<PlanRecord> full = service.queryPlans(filters, true, workspace);

        assertEquals(1, metadata.size());
        assertNull(metadata.get(0).getContent());
        assertTrue(full.get(0).getContent().contains("rotating secrets"));
        assertEquals("workspace", full.get(0).getProjectId());
    }

    @Test
    void shouldQuerySessionsWithContent() {
        List<SessionRecord> sessions = service.querySessions(
                SessionFilters.builder().dateAfter("2026-02-01").build(), true, workspace);

        assertEquals(List.of("2026-02-06-session", "2026-02-05-session"),
                sessions.stream().map(SessionRecord::getId).toList());
        assertTrue(sessions.get(1).getContent().contains("Wired refresh endpoints"));
    }

    @Test
    void shouldValidateDatesInFilters() {
        SessionFilters filters = SessionFilters.builder().dateBefore("yesterday").build();

        assertThrows(KnowledgeValidationException.class, () -> service.querySessions(filters, false, workspace));
    }

    @Test
    void shouldFindLearnedPatternsByKeyword() {
        List<LearnedPattern> patterns = service.queryLearnedPatterns(
                LearnedPatternFilters.builder().keywords(List.of("chalk")).build(), false, workspace);

        assertEquals(1, patterns.size());
        assertEquals("errors-chalk-import-error", patterns.get(0).getId());
        assertEquals("errors", patterns.get(0).getCategory());
    }

    @Test
    void shouldTruncateSearchResultsToLimit() {
        for (int i = 1; i <= 5; i++) {
            writeFile(workspace, "PLAN_cache_" + i + ".md", "# Cache " + i + "\n\n" + "cache ".repeat(i));
        }

        SearchContextResult limited = service.searchContext("cache", "plans", 2, workspace);
        SearchContextResult all = service.searchContext("cache", "plans", null, workspace);

        assertEquals(2, limited.count());
        assertEquals(List.of("PLAN_cache_5.md", "PLAN_cache_4.md"),
                limited.results().stream().map(SearchResult::getFile).toList());
        assertEquals(5, all.count());
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        KnowledgeStorageProvider provider = mock(KnowledgeStorageProvider.class);
        SqliteQueryService guarded = new SqliteQueryService(provider, KnowledgeTestFixtures.properties("sqlite"));

        assertThrows(KnowledgeValidationException.class, () -> guarded.searchContext("cache", "all", 0, workspace));
        verify(provider, never()).openRelational(any());
    }

    @Test
    void shouldReportDatabaseStats() {
        DatabaseStats stats = service.getStats(workspace);

        assertEquals(3, stats.plans());
        assertEquals(3, stats.sessions());
        assertEquals(1, stats.patterns());
        assertEquals(1, stats.projects());
        assertEquals(dbPath.toAbsolutePath().normalize().toString(), stats.dbPath());
        assertTrue(stats.dbSizeBytes() > 0);
    }
}
