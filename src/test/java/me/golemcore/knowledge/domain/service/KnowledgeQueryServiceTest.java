package me.golemcore.knowledge.domain.service;

import me.golemcore.knowledge.KnowledgeTestFixtures;
import me.golemcore.knowledge.domain.exception.KnowledgeValidationException;
import me.golemcore.knowledge.domain.model.PlanFilters;
import me.golemcore.knowledge.domain.model.PlanMetadata;
import me.golemcore.knowledge.domain.model.PlanQueryOptions;
import me.golemcore.knowledge.domain.model.PlanQueryResult;
import me.golemcore.knowledge.domain.model.PlanStatus;
import me.golemcore.knowledge.domain.model.SearchContextResult;
import me.golemcore.knowledge.domain.model.SearchResult;
import me.golemcore.knowledge.domain.model.SearchResultType;
import me.golemcore.knowledge.domain.model.SearchScope;
import me.golemcore.knowledge.domain.model.SessionFilters;
import me.golemcore.knowledge.domain.model.SessionMetadata;
import me.golemcore.knowledge.domain.model.SessionQueryOptions;
import me.golemcore.knowledge.domain.model.SessionQueryResult;
import me.golemcore.knowledge.port.outbound.KnowledgeStoragePort;
import me.golemcore.knowledge.port.outbound.KnowledgeStorageProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KnowledgeQueryServiceTest {

    @TempDir
    Path workspace;

    private KnowledgeStorageProvider storageProvider;
    private KnowledgeStoragePort storage;
    private KnowledgeQueryService service;

    @BeforeEach
    void setUp() {
        storageProvider = mock(KnowledgeStorageProvider.class);
        storage = mock(KnowledgeStoragePort.class);
        when(storageProvider.open(any(Path.class))).thenReturn(storage);
        service = new KnowledgeQueryService(storageProvider, KnowledgeTestFixtures.fixedClock());
    }

    // ==================== validation ====================

    @Test
    void shouldRejectInvalidStatusBeforeOpeningStorage() {
        PlanQueryOptions options = PlanQueryOptions.builder().status("DONE").build();

        KnowledgeValidationException error = assertThrows(KnowledgeValidationException.class,
                () -> service.queryPlans(options, workspace));

        assertEquals("Invalid plan status: DONE. Valid statuses: ACTIVE, PAUSED, PLANNED, COMPLETE, CANCELLED",
                error.getMessage());
        verify(storageProvider, never()).open(any());
    }

    @Test
    void shouldRejectMalformedAndImpossibleDates() {
        for (String bad : List.of("02/05/2026", "2026-13-01", "2026-02-30", "2026-2-5")) {
            SessionQueryOptions options = SessionQueryOptions.builder().dateAfter(bad).build();
            KnowledgeValidationException error = assertThrows(KnowledgeValidationException.class,
                    () -> service.querySessions(options, workspace));
            assertEquals("Invalid date format: " + bad + ". Expected YYYY-MM-DD", error.getMessage());
        }
        verify(storageProvider, never()).open(any());
    }

    @Test
    void shouldRejectEmptyQueryAndUnknownScope() {
        KnowledgeValidationException empty = assertThrows(KnowledgeValidationException.class,
                () -> service.searchContext("  ", "all", workspace));
        KnowledgeValidationException scope = assertThrows(KnowledgeValidationException.class,
                () -> service.searchContext("token", "everything", workspace));

        assertEquals("Search query cannot be empty", empty.getMessage());
        assertEquals("Invalid scope: everything. Must be one of: all, plans, sessions, learned", scope.getMessage());
        verify(storageProvider, never()).open(any());
    }

    @Test
    void shouldRejectNegativeDays() {
        SessionQueryOptions options = SessionQueryOptions.builder().days(-1).build();

        assertThrows(KnowledgeValidationException.class, () -> service.querySessions(options, workspace));
    }

    // ==================== queryPlans ====================

    @Test
    void shouldTranslateOptionsIntoFilters() {
        when(storage.queryPlans(any())).thenReturn(List.of(PlanMetadata.builder().id("auth_jwt").build()));

        PlanQueryResult result = service.queryPlans(PlanQueryOptions.builder()
                .status("active")
                .author("alice")
                .topic("  ")
                .updatedAfter("2026-01-01")
                .build(), workspace);

        ArgumentCaptor<PlanFilters> captor = ArgumentCaptor.forClass(PlanFilters.class);
        verify(storage).queryPlans(captor.capture());
        PlanFilters filters = captor.getValue();
        assertEquals(PlanStatus.ACTIVE, filters.getStatus());
        assertEquals("alice", filters.getAuthor());
        assertNull(filters.getTopic());
        assertEquals("2026-01-01", filters.getUpdatedAfter());
        assertEquals(1, result.count());
        verify(storageProvider).open(workspace.toAbsolutePath().normalize());
        verify(storage).close();
    }

    @Test
    void shouldCloseStorageWhenQueryFails() {
        when(storage.queryPlans(any())).thenThrow(new IllegalStateException("boom"));

        assertThrows(IllegalStateException.class, () -> service.queryPlans(null, workspace));

        verify(storage).close();
    }

    // ==================== querySessions ====================

    @Test
    void shouldConvertDaysIntoDateAfter() {
        when(storage.querySessions(any())).thenReturn(List.of());

        service.querySessions(SessionQueryOptions.builder().days(7).build(), workspace);

        ArgumentCaptor<SessionFilters> captor = ArgumentCaptor.forClass(SessionFilters.class);
        verify(storage).querySessions(captor.capture());
        assertEquals("2026-02-04", captor.getValue().getDateAfter());
    }

    @Test
    void shouldPreferExplicitDateAfterOverDays() {
        when(storage.querySessions(any())).thenReturn(List.of());

        service.querySessions(SessionQueryOptions.builder().days(7).dateAfter("2026-01-01").build(), workspace);

        ArgumentCaptor<SessionFilters> captor = ArgumentCaptor.forClass(SessionFilters.class);
        verify(storage).querySessions(captor.capture());
        assertEquals("2026-01-01", captor.getValue().getDateAfter());
    }

    @Test
    void shouldSortSessionsNewestFirst() {
        when(storage.querySessions(any())).thenReturn(List.of(
                session("2026-01-15"), session("2026-02-06"), session("2026-02-05")));

        SessionQueryResult result = service.querySessions(new SessionQueryOptions(), workspace);

        assertEquals(List.of("2026-02-06", "2026-02-05", "2026-01-15"),
                result.sessions().stream().map(SessionMetadata::getDate).toList());
        assertEquals(3, result.count());
        verify(storage).close();
    }

    // ==================== searchContext ====================

    @Test
    void shouldDefaultScopeToAll() {
        SearchResult hit = SearchResult.builder().file("PLAN_a.md").line(1).context("token").relevance(10)
                .type(SearchResultType.PLAN).build();
        when(storage.search(eq("token"), eq(SearchScope.ALL))).thenReturn(List.of(hit));

        SearchContextResult result = service.searchContext(" token ", null, workspace);

        assertEquals("token", result.query());
        assertEquals(SearchScope.ALL, result.scope());
        assertEquals(1, result.count());
        assertEquals(List.of(hit), result.results());
        verify(storage).close();
    }

    // ==================== end to end ====================

    @Test
    void shouldQueryRecentSessionsFromMarkdownWorkspace() {
        KnowledgeTestFixtures.writeStandardWorkspace(workspace);
        KnowledgeQueryService realService = new KnowledgeQueryService(
                KnowledgeTestFixtures.factory(KnowledgeTestFixtures.properties("json"), null, workspace),
                KnowledgeTestFixtures.fixedClock());

        SessionQueryResult result = realService.querySessions(
                SessionQueryOptions.builder().dateAfter("2026-02-01").build(), workspace);
        PlanQueryResult active = realService.queryPlans(PlanQueryOptions.builder().status("ACTIVE").build(),
                workspace);

        assertEquals(List.of("2026-02-06", "2026-02-05"),
                result.sessions().stream().map(SessionMetadata::getDate).toList());
        assertEquals(List.of("auth_jwt"), active.plans().stream().map(PlanMetadata::getId).toList());
    }

    private static SessionMetadata session(String date) {
        return SessionMetadata.builder().id(date).date(date).build();
    }
}
