package me.golemcore.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.knowledge.adapter.outbound.storage.StorageAdapterFactory;
import me.golemcore.knowledge.domain.service.DatabaseLocator;
import me.golemcore.knowledge.domain.service.IndexFreshnessChecker;
import me.golemcore.knowledge.domain.service.KnowledgeFileScanner;
import me.golemcore.knowledge.domain.service.MarkdownFrontmatterParser;
import me.golemcore.knowledge.infrastructure.config.KnowledgeConfiguration;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

/**
 * Builders for markdown workspaces and wired-up components used across tests.
 */
public final class KnowledgeTestFixtures {

    public static final Instant FIXED_INSTANT = Instant.parse("2026-02-11T10:00:00Z");
    public static final String KNOWLEDGE_DIR = ".aiknowsys";

    public static final String PLAN_AUTH = """
            ---
            title: JWT authentication
            status: ACTIVE
            author: alice
            priority: high
            topics: [auth, security]
            created: 2026-01-10
            updated: 2026-02-05
            ---

            # JWT authentication

            Implement token refresh with rotating secrets.
            """;

    public static final String PLAN_SEARCH = """
            # Search index rewrite

            **Status:** 📋 PLANNED
            **Created:** 2026-01-20
            **Updated:** 2026-01-25

            Move search to SQLite FTS5 tables.
            """;

    public static final String PLAN_CLEANUP = """
            ---
            title: Legacy cleanup
            status: COMPLETE
            author: bob
            topics:
              - cleanup
            created: 2026-01-02
            updated: 2026-01-05
            ---

            # Legacy cleanup

            Removed the old config loader.
            """;

    public static final String SESSION_JAN_15 = """
            # Session: Database setup (Jan 15)

            **Plan:** search_index

            Created the schema and the migration scripts.
            """;

    public static final String SESSION_FEB_05 = """
            # Session: Token refresh (Feb 5)

            **Plan:** auth_jwt

            Wired refresh endpoints.
            """;

    public static final String SESSION_FEB_06 = """
            ---
            topic: Auth hardening
            plan: auth_jwt
            topics: [auth]
            phases: [review, fix]
            ---

            # Session: Auth hardening (Feb 6)

            Reviewed secret storage.
            """;

    public static final String LEARNED_CHALK = """
            ---
            category: errors
            keywords: [chalk, import]
            created: 2026-02-01
            ---

            # Learned Skill: chalk import error

            Use the default import for chalk.
            """;

    private KnowledgeTestFixtures() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(FIXED_INSTANT, ZoneOffset.UTC);
    }

    public static ObjectMapper objectMapper() {
        return KnowledgeConfiguration.objectMapper();
    }

    public static KnowledgeProperties properties(String adapter) {
        KnowledgeProperties properties = new KnowledgeProperties();
        properties.getStorage().setAdapter(adapter);
        return properties;
    }

    public static KnowledgeFileScanner scanner(KnowledgeProperties properties) {
        return new KnowledgeFileScanner(new MarkdownFrontmatterParser(), properties, fixedClock());
    }

    /**
     * Locator whose environment only contains {@code env} and whose home
     * directory is {@code home}.
     */
    public static DatabaseLocator locator(KnowledgeProperties properties, Map<String, String> env, Path home) {
        Map<String, String> environment = new HashMap<>(env);
        return new DatabaseLocator(objectMapper(), properties) {
            @Override
            protected String readEnvironment(String name) {
                return environment.get(name);
            }

            @Override
            protected Path homeDirectory() {
                return home;
            }
        };
    }

    public static StorageAdapterFactory factory(KnowledgeProperties properties, Path dbPath, Path home) {
        Map<String, String> env = new HashMap<>();
        if (dbPath != null) {
            env.put(properties.getLocator().getEnvVariable(), dbPath.toString());
        }
        return new StorageAdapterFactory(scanner(properties), objectMapper(), properties, fixedClock(),
                locator(properties, env, home), new IndexFreshnessChecker(properties));
    }

    public static Path writeFile(Path workspaceRoot, String relativePath, String content) {
        Path file = workspaceRoot.resolve(KNOWLEDGE_DIR).resolve(relativePath);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return file;
    }

    /**
     * Three plans, three sessions (2026-01-15, 2026-02-05, 2026-02-06) and one
     * learned skill.
     */
    public static void writeStandardWorkspace(Path workspaceRoot) {
        writeFile(workspaceRoot, "PLAN_auth_jwt.md", PLAN_AUTH);
        writeFile(workspaceRoot, "PLAN_search_index.md", PLAN_SEARCH);
        writeFile(workspaceRoot, "PLAN_legacy_cleanup.md", PLAN_CLEANUP);
        writeFile(workspaceRoot, "sessions/2026-01-15-session.md", SESSION_JAN_15);
        writeFile(workspaceRoot, "sessions/2026-02-05-session.md", SESSION_FEB_05);
        writeFile(workspaceRoot, "sessions/2026-02-06-session.md", SESSION_FEB_06);
        writeFile(workspaceRoot, "learned/errors/chalk-import-error.md", LEARNED_CHALK);
    }
}
