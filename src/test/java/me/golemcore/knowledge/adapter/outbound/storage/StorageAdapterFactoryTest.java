package me.golemcore.knowledge.adapter.outbound.storage;

import me.golemcore.knowledge.KnowledgeTestFixtures;
import me.golemcore.knowledge.domain.model.PlanFilters;
import me.golemcore.knowledge.domain.model.PlanMetadata;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import me.golemcore.knowledge.port.outbound.KnowledgeStoragePort;
import me.golemcore.knowledge.port.outbound.RelationalKnowledgeStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static me.golemcore.knowledge.KnowledgeTestFixtures.writeFile;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageAdapterFactoryTest {

    private static final FileTime LONG_AGO = FileTime.from(Instant.parse("2020-01-01T00:00:00Z"));
    private static final FileTime INDEXED = FileTime.from(Instant.parse("2020-02-01T00:00:00Z"));

    @TempDir
    Path tempDir;

    private Path workspace;
    private Path home;
    private Path dbPath;

    @BeforeEach
    void setUp() throws IOException {
        workspace = Files.createDirectories(tempDir.resolve("workspace"));
        home = Files.createDirectories(tempDir.resolve("home"));
        dbPath = tempDir.resolve("shared").resolve("knowledge.db");
        KnowledgeTestFixtures.writeStandardWorkspace(workspace);
    }

    @Test
    void shouldCreateJsonAdapterAndBuildMissingIndex() {
        try (KnowledgeStoragePort storage = factory("json").open(workspace)) {
            assertInstanceOf(JsonIndexStorageAdapter.class, storage);
            assertEquals(3, storage.queryPlans(PlanFilters.none()).size());
        }
        assertTrue(Files.exists(workspace.resolve(".aiknowsys/context-index.json")));
    }

    @Test
    void shouldNotRebuildWhenAutoRebuildIsDisabled() {
        KnowledgeProperties properties = KnowledgeTestFixtures.properties("json");
        properties.getStorage().setAutoRebuild(false);

        try (KnowledgeStoragePort storage = KnowledgeTestFixtures.factory(properties, dbPath, home)
                .open(workspace)) {
            assertTrue(storage.queryPlans(PlanFilters.none()).isEmpty());
        }
    }

    @Test
    void shouldRebuildJsonIndexOnlyWhenStale() throws IOException {
        StorageAdapterFactory factory = factory("json");
        factory.open(workspace).close();

        Path added = writeFile(workspace, "PLAN_added.md", "# Added plan\n");
        Files.setLastModifiedTime(added, LONG_AGO);
        Files.setLastModifiedTime(added.getParent(), LONG_AGO);
        try (KnowledgeStoragePort storage = factory.open(workspace)) {
            assertEquals(3, storage.queryPlans(PlanFilters.none()).size());
        }

        Files.setLastModifiedTime(added, FileTime.from(Instant.now().plusSeconds(60)));
        try (KnowledgeStoragePort storage = factory.open(workspace)) {
            assertEquals(4, storage.queryPlans(PlanFilters.none()).size());
        }
    }

    @Test
    void shouldRebuildJsonIndexAfterCorruption() throws IOException {
        StorageAdapterFactory factory = factory("json");
        factory.open(workspace).close();
        Path indexPath = workspace.resolve(".aiknowsys/context-index.json");

        Files.writeString(indexPath, "{not json");
        try (KnowledgeStoragePort storage = factory.open(workspace)) {
            assertEquals(3, storage.queryPlans(PlanFilters.none()).size());
        }
        try (KnowledgeStoragePort storage = factory.open(workspace)) {
            assertEquals(3, storage.queryPlans(PlanFilters.none()).size());
        }
    }

    @Test
    void shouldRebuildJsonIndexAfterMarkdownFileIsDeleted() throws IOException {
        StorageAdapterFactory factory = factory("json");
        factory.open(workspace).close();
        backdateKnowledgeTree();

        Files.delete(workspace.resolve(".aiknowsys/PLAN_legacy_cleanup.md"));
        try (KnowledgeStoragePort storage = factory.open(workspace)) {
            List<String> ids = storage.queryPlans(PlanFilters.none()).stream().map(PlanMetadata::getId).toList();
            assertEquals(List.of("auth_jwt", "search_index"), ids);
        }
    }

    @Test
    void shouldCreateSqliteAdapterAndRefreshRows() {
        try (KnowledgeStoragePort storage = factory("sqlite").open(workspace)) {
            SqliteStorageAdapter sqlite = assertInstanceOf(SqliteStorageAdapter.class, storage);
            assertEquals(dbPath.toAbsolutePath().normalize(), sqlite.getDbPath());
            assertEquals("workspace", sqlite.getProjectId());
            assertEquals(3, storage.queryPlans(PlanFilters.none()).size());
        }
    }

    @Test
    void shouldPickJsonInAutoModeWithoutDatabase() {
        try (KnowledgeStoragePort storage = factory("auto").open(workspace)) {
            assertInstanceOf(JsonIndexStorageAdapter.class, storage);
        }
        assertFalse(Files.exists(dbPath));
    }

    @Test
    void shouldPickSqliteInAutoModeWhenDatabaseExists() {
        factory("sqlite").open(workspace).close();

        try (KnowledgeStoragePort storage = factory("auto").open(workspace)) {
            assertInstanceOf(SqliteStorageAdapter.class, storage);
            assertEquals(3, storage.queryPlans(PlanFilters.none()).size());
        }
    }

    @Test
    void shouldFallBackToJsonForUnknownAdapter() {
        try (KnowledgeStoragePort storage = factory("mongo").open(workspace)) {
            assertInstanceOf(JsonIndexStorageAdapter.class, storage);
        }
    }

    @Test
    void shouldOpenRelationalStorageRegardlessOfConfiguredAdapter() {
        try (RelationalKnowledgeStoragePort storage = factory("json").openRelational(workspace)) {
            assertInstanceOf(SqliteStorageAdapter.class, storage);
            assertEquals(3, storage.getStats().plans());
        }
    }

    private void backdateKnowledgeTree() throws IOException {
        Path knowledgeRoot = workspace.resolve(".aiknowsys");
        try (Stream<Path> paths = Files.walk(knowledgeRoot)) {
            for (Path path : paths.toList()) {
                Files.setLastModifiedTime(path, LONG_AGO);
            }
        }
        Files.setLastModifiedTime(knowledgeRoot.resolve("context-index.json"), INDEXED);
    }

    private StorageAdapterFactory factory(String adapter) {
        return KnowledgeTestFixtures.factory(KnowledgeTestFixtures.properties(adapter), dbPath, home);
    }
}
