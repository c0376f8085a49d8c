/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.knowledge.adapter.outbound.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.domain.exception.KnowledgeValidationException;
import me.golemcore.knowledge.domain.exception.StorageUnavailableException;
import me.golemcore.knowledge.domain.model.DatabaseConfig;
import me.golemcore.knowledge.domain.model.DatabaseStats;
import me.golemcore.knowledge.domain.model.LearnedPattern;
import me.golemcore.knowledge.domain.model.LearnedPatternFilters;
import me.golemcore.knowledge.domain.model.PlanFilters;
import me.golemcore.knowledge.domain.model.PlanMetadata;
import me.golemcore.knowledge.domain.model.PlanRecord;
import me.golemcore.knowledge.domain.model.PlanStatus;
import me.golemcore.knowledge.domain.model.ProjectRecord;
import me.golemcore.knowledge.domain.model.RebuildResult;
import me.golemcore.knowledge.domain.model.SearchResult;
import me.golemcore.knowledge.domain.model.SearchResultType;
import me.golemcore.knowledge.domain.model.SearchScope;
import me.golemcore.knowledge.domain.model.SessionFilters;
import me.golemcore.knowledge.domain.model.SessionMetadata;
import me.golemcore.knowledge.domain.model.SessionRecord;
import me.golemcore.knowledge.domain.model.WorkspaceScan;
import me.golemcore.knowledge.domain.service.DatabaseLocator;
import me.golemcore.knowledge.domain.service.KnowledgeFileScanner;
import me.golemcore.knowledge.domain.service.TextMatcher;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import me.golemcore.knowledge.port.outbound.RelationalKnowledgeStoragePort;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Storage backend over a SQLite database with FTS5 full-text tables.
 *
 * <p>
 * Rows are scoped to one project, so several workspaces can share a
 * user-level database. Queries come in two modes: metadata (the
 * {@code content} column is never selected) and full content.
 *
 * <p>
 * The FTS tables are maintained only by the triggers in
 * {@code db/schema.sql}; nothing here writes to them directly.
 */
@Slf4j
public class SqliteStorageAdapter extends AbstractStorageAdapter implements RelationalKnowledgeStoragePort {

    static final String SCHEMA_RESOURCE = "db/schema.sql";

    private static final String PLAN_COLUMNS = "id, project_id, title, status, author, priority, type, description, "
            + "topics, file, created_at, updated_at";
    private static final String SESSION_COLUMNS = "id, project_id, date, topic, status, plan_id, duration, topics, "
            + "phases, file, created_at, updated_at";
    private static final String PATTERN_COLUMNS = "slug, project_id, category, title, keywords, file, created_at";
    private static final String CONTENT_COLUMN = ", content";
    private static final String LIKE_ESCAPE = " ESCAPE '\\'";
    private static final String UNKNOWN_AUTHOR = "unknown";

    private static final String UPSERT_PLAN = "INSERT INTO plans (id, project_id, title, status, author, priority, "
            + "type, description, content, topics, file, created_at, updated_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
            + "ON CONFLICT(project_id, id) DO UPDATE SET title = excluded.title, status = excluded.status, "
            + "author = excluded.author, priority = excluded.priority, type = excluded.type, "
            + "description = excluded.description, content = excluded.content, topics = excluded.topics, "
            + "file = excluded.file, created_at = excluded.created_at, updated_at = excluded.updated_at";
    private static final String UPSERT_SESSION = "INSERT INTO sessions (id, project_id, date, topic, status, "
            + "plan_id, duration, content, topics, phases, file, created_at, updated_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
            + "ON CONFLICT(project_id, id) DO UPDATE SET date = excluded.date, topic = excluded.topic, "
            + "status = excluded.status, plan_id = excluded.plan_id, duration = excluded.duration, "
            + "content = excluded.content, topics = excluded.topics, phases = excluded.phases, "
            + "file = excluded.file, created_at = excluded.created_at, updated_at = excluded.updated_at";
    private static final String UPSERT_PATTERN = "INSERT INTO patterns (slug, project_id, category, title, content, "
            + "keywords, file, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?) "
            + "ON CONFLICT(project_id, slug) DO UPDATE SET category = excluded.category, title = excluded.title, "
            + "content = excluded.content, keywords = excluded.keywords, file = excluded.file, "
            + "created_at = excluded.created_at";
    private static final String UPSERT_PROJECT = "INSERT INTO projects (id, name, path, tech_stack, created_at, "
            + "updated_at) VALUES (?, ?, ?, ?, ?, ?) "
            + "ON CONFLICT(id) DO UPDATE SET name = excluded.name, path = excluded.path, "
            + "tech_stack = COALESCE(excluded.tech_stack, projects.tech_stack), updated_at = excluded.updated_at";
    private static final String ENSURE_PROJECT = "INSERT OR IGNORE INTO projects (id, name, path, created_at, "
            + "updated_at) VALUES (?, ?, ?, ?, ?)";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final KnowledgeFileScanner scanner;
    private final ObjectMapper objectMapper;
    private final KnowledgeProperties properties;
    private final Clock clock;
    private final DatabaseConfig databaseConfig;

    private Path dbPath;
    private String projectId;
    private String projectName;
    private Connection connection;

    /**
     * @param databaseConfig
     *            located database and project identity, or {@code null} to use
     *            {@code <workspace>/.aiknowsys/knowledge.db} and the directory
     *            name as project id
     */
    public SqliteStorageAdapter(KnowledgeFileScanner scanner, ObjectMapper objectMapper,
            KnowledgeProperties properties, Clock clock, DatabaseConfig databaseConfig) {
        this.scanner = scanner;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.databaseConfig = databaseConfig;
    }

    @Override
    public void init(Path targetDir) {
        setWorkspaceRoot(targetDir);
        Path workspaceRoot = requireWorkspaceRoot();
        if (databaseConfig != null) {
            this.dbPath = databaseConfig.dbPath();
            this.projectId = databaseConfig.projectId();
            this.projectName = databaseConfig.projectName();
        } else {
            String dirName = workspaceRoot.getFileName() != null ? workspaceRoot.getFileName().toString() : "project";
            this.dbPath = scanner.knowledgeRoot(workspaceRoot).resolve(properties.getLocator().getDefaultDbFile());
            this.projectId = DatabaseLocator.sanitizeProjectId(dirName);
            this.projectName = dirName;
        }
        this.dbPath = dbPath.toAbsolutePath().normalize();

        try {
            Path parent = dbPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot create database directory for " + dbPath, e);
        }

        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (Statement statement = connection.createStatement()) {
                statement.execute("PRAGMA foreign_keys = ON");
                for (String sql : SchemaScript.load(SCHEMA_RESOURCE)) {
                    statement.execute(sql);
                }
            }
            log.info("[Sqlite] Opened {} for project {}", dbPath, projectId);
        } catch (SQLException e) {
            closeQuietly();
            log.error("[Sqlite] Failed to open database {}", dbPath);
            throw SqliteErrors.wrap(e, dbPath);
        } catch (IOException e) {
            closeQuietly();
            throw new StorageUnavailableException("Failed to load database schema: " + SCHEMA_RESOURCE, e);
        }
    }

    // ==================== Port queries ====================

    @Override
    public List<PlanMetadata> queryPlans(PlanFilters filters) {
        return queryPlanRecords(filters, false).stream().map(PlanRecord::toMetadata).toList();
    }

    @Override
    public List<SessionMetadata> querySessions(SessionFilters filters) {
        return querySessionRecords(filters, false).stream().map(SessionRecord::toMetadata).toList();
    }

    @Override
    public List<SearchResult> search(String query, SearchScope scope) {
        requireConnection();
        if (query == null || query.isBlank()) {
            return List.of();
        }
        SearchScope effectiveScope = scope != null ? scope : SearchScope.ALL;
        List<SearchResult> results = new ArrayList<>();
        try {
            if (effectiveScope.includes(SearchResultType.PLAN)) {
                searchTable("SELECT COALESCE(file, id) AS file, content FROM plans WHERE project_id = ?",
                        SearchResultType.PLAN, query, results);
            }
            if (effectiveScope.includes(SearchResultType.SESSION)) {
                searchTable("SELECT COALESCE(file, id) AS file, content FROM sessions WHERE project_id = ?",
                        SearchResultType.SESSION, query, results);
            }
            if (effectiveScope.includes(SearchResultType.LEARNED)) {
                searchTable("SELECT COALESCE(file, slug) AS file, content FROM patterns WHERE project_id = ?",
                        SearchResultType.LEARNED, query, results);
            }
        } catch (SQLException e) {
            throw SqliteErrors.wrap(e, dbPath);
        }
        results.sort(Comparator.comparingInt(SearchResult::getRelevance).reversed()
                .thenComparing(SearchResult::getFile));
        return results;
    }

    @Override
    public RebuildResult rebuildIndex() {
        requireConnection();
        Path workspaceRoot = requireWorkspaceRoot();
        WorkspaceScan scan = scanner.scan(workspaceRoot);
        String now = Instant.now(clock).toString();

        try {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                upsertProject(ProjectRecord.builder()
                        .id(projectId)
                        .name(projectName)
                        .path(workspaceRoot.toString())
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
                for (String table : List.of("plans", "sessions", "patterns")) {
                    try (PreparedStatement ps = connection.prepareStatement(
                            "DELETE FROM " + table + " WHERE project_id = ?")) {
                        ps.setString(1, projectId);
                        ps.executeUpdate();
                    }
                }
                for (PlanRecord plan : scan.plans()) {
                    plan.setProjectId(projectId);
                    upsertPlan(plan);
                }
                for (SessionRecord session : scan.sessions()) {
                    session.setProjectId(projectId);
                    upsertSession(session);
                }
                for (LearnedPattern pattern : scan.learned()) {
                    pattern.setProjectId(projectId);
                    upsertPattern(pattern);
                }
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly();
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw SqliteErrors.wrap(e, dbPath);
        }

        if (!scan.errors().isEmpty()) {
            log.warn("[Sqlite] Rebuild skipped {} file(s): {}", scan.errors().size(), scan.errors());
        }
        log.info("[Sqlite] Rebuilt project {}: {} plans, {} sessions, {} learned",
                projectId, scan.plans().size(), scan.sessions().size(), scan.learned().size());
        return new RebuildResult(scan.plans().size(), scan.sessions().size(), scan.learned().size(),
                List.copyOf(scan.errors()));
    }

    @Override
    public void close() {
        if (connection != null) {
            try {
                connection.close();
                log.debug("[Sqlite] Closed {}", dbPath);
            } catch (SQLException e) {
                log.warn("[Sqlite] Failed to close database {}: {}", dbPath, e.getMessage());
            } finally {
                connection = null;
            }
        }
    }

    // ==================== Content-mode queries ====================

    @Override
    public List<PlanRecord> queryPlanRecords(PlanFilters filters, boolean includeContent) {
        requireConnection();
        PlanFilters f = filters != null ? filters : PlanFilters.none();
        StringBuilder sql = new StringBuilder("SELECT ").append(PLAN_COLUMNS)
                .append(includeContent ? CONTENT_COLUMN : "")
                .append(" FROM plans WHERE project_id = ?");
        List<Object> params = new ArrayList<>(List.of(projectId));

        if (f.getStatus() != null) {
            sql.append(" AND status = ?");
            params.add(f.getStatus().name());
        }
        if (f.getAuthor() != null) {
            sql.append(" AND author = ?");
            params.add(f.getAuthor());
        }
        if (f.getPriority() != null) {
            sql.append(" AND priority = ?");
            params.add(f.getPriority());
        }
        if (f.getIdStartsWith() != null) {
            sql.append(" AND substr(id, 1, ?) = ?");
            params.add(f.getIdStartsWith().length());
            params.add(f.getIdStartsWith());
        }
        if (f.getTopic() != null) {
            sql.append(" AND (title LIKE ?").append(LIKE_ESCAPE)
                    .append(" OR topics LIKE ?").append(LIKE_ESCAPE).append(')');
            params.add(likeContains(f.getTopic()));
            params.add(likeContains(f.getTopic()));
        }
        if (f.getUpdatedAfter() != null) {
            sql.append(" AND updated_at > ?");
            params.add(f.getUpdatedAfter());
        }
        if (f.getUpdatedBefore() != null) {
            sql.append(" AND updated_at < ?");
            params.add(f.getUpdatedBefore());
        }
        if (f.getContentContains() != null) {
            sql.append(" AND content LIKE ?").append(LIKE_ESCAPE);
            params.add(likeContains(f.getContentContains()));
        }
        sql.append(" ORDER BY updated_at DESC, id ASC");

        List<PlanRecord> plans = new ArrayList<>();
        try (PreparedStatement ps = prepare(sql.toString(), params); ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                plans.add(PlanRecord.builder()
                        .id(rs.getString("id"))
                        .projectId(rs.getString("project_id"))
                        .title(rs.getString("title"))
                        .status(PlanStatus.fromValue(rs.getString("status")).orElse(PlanStatus.PLANNED))
                        .author(rs.getString("author"))
                        .priority(rs.getString("priority"))
                        .type(rs.getString("type"))
                        .description(rs.getString("description"))
                        .topics(readList(rs.getString("topics")))
                        .file(rs.getString("file"))
                        .created(rs.getString("created_at"))
                        .updated(rs.getString("updated_at"))
                        .content(includeContent ? rs.getString("content") : null)
                        .build());
            }
        } catch (SQLException e) {
            throw SqliteErrors.wrap(e, dbPath);
        }
        return plans;
    }

    @Override
    public List<SessionRecord> querySessionRecords(SessionFilters filters, boolean includeContent) {
        requireConnection();
        SessionFilters f = filters != null ? filters : SessionFilters.none();
        StringBuilder sql = new StringBuilder("SELECT ").append(SESSION_COLUMNS)
                .append(includeContent ? CONTENT_COLUMN : "")
                .append(" FROM sessions WHERE project_id = ?");
        List<Object> params = new ArrayList<>(List.of(projectId));

        if (f.getDate() != null) {
            sql.append(" AND date = ?");
            params.add(f.getDate());
        }
        if (f.getDateAfter() != null) {
            sql.append(" AND date >= ?");
            params.add(f.getDateAfter());
        }
        if (f.getDateBefore() != null) {
            sql.append(" AND date <= ?");
            params.add(f.getDateBefore());
        }
        if (f.getTopic() != null) {
            sql.append(" AND (topic LIKE ?").append(LIKE_ESCAPE)
                    .append(" OR topics LIKE ?").append(LIKE_ESCAPE).append(')');
            params.add(likeContains(f.getTopic()));
            params.add(likeContains(f.getTopic()));
        }
        if (f.getPlan() != null) {
            sql.append(" AND plan_id = ?");
            params.add(f.getPlan());
        }
        if (f.getStatus() != null) {
            sql.append(" AND status = ?");
            params.add(f.getStatus());
        }
        if (f.getContentContains() != null) {
            sql.append(" AND content LIKE ?").append(LIKE_ESCAPE);
            params.add(likeContains(f.getContentContains()));
        }
        sql.append(" ORDER BY date DESC, id DESC");

        List<SessionRecord> sessions = new ArrayList<>();
        try (PreparedStatement ps = prepare(sql.toString(), params); ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                sessions.add(SessionRecord.builder()
                        .id(rs.getString("id"))
                        .projectId(rs.getString("project_id"))
                        .date(rs.getString("date"))
                        .topic(rs.getString("topic"))
                        .status(rs.getString("status"))
                        .plan(rs.getString("plan_id"))
                        .duration(rs.getString("duration"))
                        .topics(readList(rs.getString("topics")))
                        .phases(readList(rs.getString("phases")))
                        .file(rs.getString("file"))
                        .created(rs.getString("created_at"))
                        .updated(rs.getString("updated_at"))
                        .content(includeContent ? rs.getString("content") : null)
                        .build());
            }
        } catch (SQLException e) {
            throw SqliteErrors.wrap(e, dbPath);
        }
        return sessions;
    }

    @Override
    public List<LearnedPattern> queryLearnedPatterns(LearnedPatternFilters filters, boolean includeContent) {
        requireConnection();
        LearnedPatternFilters f = filters != null ? filters : LearnedPatternFilters.none();
        StringBuilder sql = new StringBuilder("SELECT ").append(PATTERN_COLUMNS)
                .append(includeContent ? CONTENT_COLUMN : "")
                .append(" FROM patterns WHERE project_id = ?");
        List<Object> params = new ArrayList<>(List.of(projectId));

        if (f.getCategory() != null) {
            sql.append(" AND category = ?");
            params.add(f.getCategory());
        }
        List<String> keywords = f.getKeywords() != null ? f.getKeywords() : List.of();
        if (!keywords.isEmpty()) {
            sql.append(" AND EXISTS (SELECT 1 FROM json_each(patterns.keywords) WHERE lower(json_each.value) IN (")
                    .append(keywords.stream().map(k -> "?").collect(Collectors.joining(", ")))
                    .append("))");
            keywords.forEach(keyword -> params.add(keyword.toLowerCase(Locale.ROOT)));
        }
        sql.append(" ORDER BY category ASC, slug ASC");

        List<LearnedPattern> patterns = new ArrayList<>();
        try (PreparedStatement ps = prepare(sql.toString(), params); ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                patterns.add(LearnedPattern.builder()
                        .id(rs.getString("slug"))
                        .projectId(rs.getString("project_id"))
                        .category(rs.getString("category"))
                        .title(rs.getString("title"))
                        .keywords(readList(rs.getString("keywords")))
                        .file(rs.getString("file"))
                        .created(rs.getString("created_at"))
                        .content(includeContent ? rs.getString("content") : null)
                        .build());
            }
        } catch (SQLException e) {
            throw SqliteErrors.wrap(e, dbPath);
        }
        return patterns;
    }

    /**
     * Row counts across the whole database plus its file size.
     */
    @Override
    public DatabaseStats getStats() {
        requireConnection();
        try {
            long size = Files.exists(dbPath) ? Files.size(dbPath) : 0L;
            return new DatabaseStats(count("plans"), count("sessions"), count("patterns"), count("projects"),
                    dbPath.toString(), size);
        } catch (SQLException e) {
            throw SqliteErrors.wrap(e, dbPath);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read database size: " + dbPath, e);
        }
    }

    // ==================== Upsert helpers ====================

    @Override
    public void insertProject(ProjectRecord project) {
        requireConnection();
        if (project.getId() == null || project.getId().isBlank()) {
            throw new KnowledgeValidationException("Project id is required");
        }
        try {
            upsertProject(project);
        } catch (SQLException e) {
            throw SqliteErrors.wrap(e, dbPath);
        }
    }

    @Override
    public void insertPlan(PlanRecord plan) {
        requireConnection();
        if (plan.getId() == null || plan.getId().isBlank() || plan.getTitle() == null) {
            throw new KnowledgeValidationException("Plan id and title are required");
        }
        if (plan.getProjectId() == null) {
            plan.setProjectId(projectId);
        }
        try {
            ensureProject(plan.getProjectId());
            upsertPlan(plan);
        } catch (SQLException e) {
            throw SqliteErrors.wrap(e, dbPath);
        }
    }

    @Override
    public void insertSession(SessionRecord session) {
        requireConnection();
        if (session.getId() == null || session.getId().isBlank() || session.getDate() == null) {
            throw new KnowledgeValidationException("Session id and date are required");
        }
        if (session.getProjectId() == null) {
            session.setProjectId(projectId);
        }
        try {
            ensureProject(session.getProjectId());
            upsertSession(session);
        } catch (SQLException e) {
            throw SqliteErrors.wrap(e, dbPath);
        }
    }

    @Override
    public void insertPattern(LearnedPattern pattern) {
        requireConnection();
        if (pattern.getId() == null || pattern.getId().isBlank()) {
            throw new KnowledgeValidationException("Pattern id is required");
        }
        if (pattern.getProjectId() == null) {
            pattern.setProjectId(projectId);
        }
        try {
            ensureProject(pattern.getProjectId());
            upsertPattern(pattern);
        } catch (SQLException e) {
            throw SqliteErrors.wrap(e, dbPath);
        }
    }

    public Path getDbPath() {
        return dbPath;
    }

    public String getProjectId() {
        return projectId;
    }

    // ==================== Internals ====================

    private void upsertProject(ProjectRecord project) throws SQLException {
        String now = Instant.now(clock).toString();
        try (PreparedStatement ps = connection.prepareStatement(UPSERT_PROJECT)) {
            ps.setString(1, project.getId());
            ps.setString(2, project.getName() != null ? project.getName() : project.getId());
            ps.setString(3, project.getPath());
            ps.setString(4, project.getTechStack());
            ps.setString(5, project.getCreatedAt() != null ? project.getCreatedAt() : now);
            ps.setString(6, project.getUpdatedAt() != null ? project.getUpdatedAt() : now);
            ps.executeUpdate();
        }
    }

    private void ensureProject(String id) throws SQLException {
        String now = Instant.now(clock).toString();
        try (PreparedStatement ps = connection.prepareStatement(ENSURE_PROJECT)) {
            ps.setString(1, id);
            ps.setString(2, id.equals(projectId) ? projectName : id);
            ps.setString(3, id.equals(projectId) ? requireWorkspaceRoot().toString() : null);
            ps.setString(4, now);
            ps.setString(5, now);
            ps.executeUpdate();
        }
    }

    private void upsertPlan(PlanRecord plan) throws SQLException {
        String today = LocalDate.now(clock).toString();
        String created = plan.getCreated() != null ? plan.getCreated() : today;
        try (PreparedStatement ps = connection.prepareStatement(UPSERT_PLAN)) {
            ps.setString(1, plan.getId());
            ps.setString(2, plan.getProjectId());
            ps.setString(3, plan.getTitle());
            ps.setString(4, (plan.getStatus() != null ? plan.getStatus() : PlanStatus.PLANNED).name());
            ps.setString(5, plan.getAuthor() != null ? plan.getAuthor() : UNKNOWN_AUTHOR);
            ps.setString(6, plan.getPriority());
            ps.setString(7, plan.getType());
            ps.setString(8, plan.getDescription());
            ps.setString(9, plan.getContent());
            ps.setString(10, writeList(plan.getTopics()));
            ps.setString(11, plan.getFile());
            ps.setString(12, created);
            ps.setString(13, plan.getUpdated() != null ? plan.getUpdated() : created);
            ps.executeUpdate();
        }
    }

    private void upsertSession(SessionRecord session) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(UPSERT_SESSION)) {
            ps.setString(1, session.getId());
            ps.setString(2, session.getProjectId());
            ps.setString(3, session.getDate());
            ps.setString(4, session.getTopic() != null ? session.getTopic() : session.getId());
            ps.setString(5, session.getStatus());
            ps.setString(6, session.getPlan());
            ps.setString(7, session.getDuration());
            ps.setString(8, session.getContent());
            ps.setString(9, writeList(session.getTopics()));
            ps.setString(10, writeList(session.getPhases()));
            ps.setString(11, session.getFile());
            ps.setString(12, session.getCreated() != null ? session.getCreated() : session.getDate());
            ps.setString(13, session.getUpdated() != null ? session.getUpdated() : session.getDate());
            ps.executeUpdate();
        }
    }

    private void upsertPattern(LearnedPattern pattern) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(UPSERT_PATTERN)) {
            ps.setString(1, pattern.getId());
            ps.setString(2, pattern.getProjectId());
            ps.setString(3, pattern.getCategory() != null ? pattern.getCategory() : "general");
            ps.setString(4, pattern.getTitle() != null ? pattern.getTitle() : pattern.getId());
            ps.setString(5, pattern.getContent() != null ? pattern.getContent() : "");
            ps.setString(6, writeList(pattern.getKeywords()));
            ps.setString(7, pattern.getFile());
            ps.setString(8, pattern.getCreated() != null ? pattern.getCreated() : LocalDate.now(clock).toString());
            ps.executeUpdate();
        }
    }

    // SQLite folds case for ASCII only, so the LIKE pre-filter is applied to
    // ASCII queries; the Java match below decides in every case.
    private void searchTable(String sql, SearchResultType type, String query, List<SearchResult> results)
            throws SQLException {
        int before = properties.getSearch().getSnippetBefore();
        int after = properties.getSearch().getSnippetAfter();
        boolean prefilter = isAscii(query);
        String statement = prefilter ? sql + " AND content LIKE ?" + LIKE_ESCAPE : sql;
        try (PreparedStatement ps = connection.prepareStatement(statement)) {
            ps.setString(1, projectId);
            if (prefilter) {
                ps.setString(2, likeContains(query));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String file = rs.getString("file");
                    TextMatcher.find(rs.getString("content"), query, before, after)
                            .ifPresent(match -> results.add(SearchResult.builder()
                                    .file(file)
                                    .line(match.line())
                                    .context(match.context())
                                    .relevance(match.relevance())
                                    .type(type)
                                    .build()));
                }
            }
        }
    }

    private static boolean isAscii(String value) {
        return value.chars().allMatch(c -> c < 128);
    }

    private long count(String table) throws SQLException {
        try (Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM " + table)) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private PreparedStatement prepare(String sql, List<Object> params) throws SQLException {
        PreparedStatement ps = connection.prepareStatement(sql);
        try {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            return ps;
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
    }

    private static String likeContains(String value) {
        String escaped = value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private String writeList(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values != null ? values : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize list", e);
        }
    }

    private List<String> readList(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            List<String> values = objectMapper.readValue(json, STRING_LIST);
            return values != null ? new ArrayList<>(values) : new ArrayList<>();
        } catch (JsonProcessingException e) {
            log.debug("[Sqlite] Ignoring malformed JSON list: {}", json);
            return new ArrayList<>();
        }
    }

    private void rollbackQuietly() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("[Sqlite] Rollback failed: {}", e.getMessage());
        }
    }

    private void closeQuietly() {
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException e) {
                log.debug("[Sqlite] Failed to close connection after error: {}", e.getMessage());
            }
            connection = null;
        }
    }

    private void requireConnection() {
        if (connection == null) {
            throw new IllegalStateException("Storage adapter not initialized, call init() first");
        }
    }
}
