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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.domain.exception.StorageUnavailableException;
import me.golemcore.knowledge.domain.model.KnowledgeIndex;
import me.golemcore.knowledge.domain.model.LearnedPattern;
import me.golemcore.knowledge.domain.model.PlanFilters;
import me.golemcore.knowledge.domain.model.PlanMetadata;
import me.golemcore.knowledge.domain.model.PlanRecord;
import me.golemcore.knowledge.domain.model.RebuildResult;
import me.golemcore.knowledge.domain.model.SearchResult;
import me.golemcore.knowledge.domain.model.SearchResultType;
import me.golemcore.knowledge.domain.model.SearchScope;
import me.golemcore.knowledge.domain.model.SessionFilters;
import me.golemcore.knowledge.domain.model.SessionMetadata;
import me.golemcore.knowledge.domain.model.SessionRecord;
import me.golemcore.knowledge.domain.model.WorkspaceScan;
import me.golemcore.knowledge.domain.service.AtomicFiles;
import me.golemcore.knowledge.domain.service.KnowledgeFileScanner;
import me.golemcore.knowledge.domain.service.TextMatcher;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Storage backend keeping a flat JSON index at
 * {@code .aiknowsys/context-index.json}.
 *
 * <p>
 * The index holds metadata only. Full-text search reads the markdown files
 * directly, so it always reflects the current tree even when the index is
 * stale. A corrupt index is discarded and replaced with an empty one; the next
 * rebuild restores it.
 *
 * <p>
 * No locking: concurrent writers race and the last write wins.
 */
@Slf4j
public class JsonIndexStorageAdapter extends AbstractStorageAdapter {

    private final KnowledgeFileScanner scanner;
    private final ObjectMapper objectMapper;
    private final KnowledgeProperties properties;
    private final Clock clock;

    private Path knowledgeRoot;
    private Path indexPath;
    private KnowledgeIndex index;
    private boolean rebuildRequired;

    public JsonIndexStorageAdapter(KnowledgeFileScanner scanner, ObjectMapper objectMapper,
            KnowledgeProperties properties, Clock clock) {
        this.scanner = scanner;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void init(Path targetDir) {
        setWorkspaceRoot(targetDir);
        this.knowledgeRoot = scanner.knowledgeRoot(requireWorkspaceRoot());
        this.indexPath = knowledgeRoot.resolve(properties.getStorage().getIndexFile());

        try {
            Files.createDirectories(knowledgeRoot);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to create knowledge directory: " + knowledgeRoot, e);
        }

        if (Files.exists(indexPath)) {
            Optional<KnowledgeIndex> loaded = loadIndex();
            if (loaded.isPresent()) {
                this.index = loaded.get();
                log.debug("[JsonIndex] Loaded index: {} plans, {} sessions, {} learned",
                        index.getPlans().size(), index.getSessions().size(), index.getLearned().size());
                return;
            }
        }

        this.index = emptyIndex();
        this.rebuildRequired = true;
        saveIndex();
        log.info("[JsonIndex] Created empty index at {}", indexPath);
    }

    @Override
    public List<PlanMetadata> queryPlans(PlanFilters filters) {
        requireIndex();
        PlanFilters f = filters != null ? filters : PlanFilters.none();
        return index.getPlans().stream()
                .filter(p -> f.getStatus() == null || f.getStatus() == p.getStatus())
                .filter(p -> f.getAuthor() == null || f.getAuthor().equals(p.getAuthor()))
                .filter(p -> f.getPriority() == null || f.getPriority().equals(p.getPriority()))
                .filter(p -> f.getIdStartsWith() == null
                        || (p.getId() != null && p.getId().startsWith(f.getIdStartsWith())))
                .filter(p -> f.getTopic() == null || matchesTopic(f.getTopic(), p.getTitle(), p.getTopics()))
                .filter(p -> f.getUpdatedAfter() == null
                        || (p.getUpdated() != null && p.getUpdated().compareTo(f.getUpdatedAfter()) > 0))
                .filter(p -> f.getUpdatedBefore() == null
                        || (p.getUpdated() != null && p.getUpdated().compareTo(f.getUpdatedBefore()) < 0))
                .filter(p -> f.getContentContains() == null || fileContains(p.getFile(), f.getContentContains()))
                .sorted(Comparator.comparing(PlanMetadata::getUpdated, Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(PlanMetadata::getId, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    @Override
    public List<SessionMetadata> querySessions(SessionFilters filters) {
        requireIndex();
        SessionFilters f = filters != null ? filters : SessionFilters.none();
        return index.getSessions().stream()
                .filter(s -> f.getDate() == null || f.getDate().equals(s.getDate()))
                .filter(s -> f.getDateAfter() == null
                        || (s.getDate() != null && s.getDate().compareTo(f.getDateAfter()) >= 0))
                .filter(s -> f.getDateBefore() == null
                        || (s.getDate() != null && s.getDate().compareTo(f.getDateBefore()) <= 0))
                .filter(s -> f.getTopic() == null || matchesTopic(f.getTopic(), s.getTopic(), s.getTopics()))
                .filter(s -> f.getPlan() == null || f.getPlan().equals(s.getPlan()))
                .filter(s -> f.getStatus() == null || f.getStatus().equals(s.getStatus()))
                .filter(s -> f.getContentContains() == null || fileContains(s.getFile(), f.getContentContains()))
                .sorted(Comparator.comparing(SessionMetadata::getDate, Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(SessionMetadata::getId, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    /**
     * Learned skills recorded by the last rebuild, without content.
     */
    public List<LearnedPattern> queryLearned() {
        requireIndex();
        return List.copyOf(index.getLearned());
    }

    @Override
    public List<SearchResult> search(String query, SearchScope scope) {
        requireIndex();
        if (query == null || query.isBlank()) {
            return List.of();
        }
        SearchScope effectiveScope = scope != null ? scope : SearchScope.ALL;
        Path workspaceRoot = requireWorkspaceRoot();
        int before = properties.getSearch().getSnippetBefore();
        int after = properties.getSearch().getSnippetAfter();

        List<SearchResult> results = new ArrayList<>();
        if (effectiveScope.includes(SearchResultType.PLAN)) {
            searchFiles(scanner.listPlanFiles(workspaceRoot), SearchResultType.PLAN, query, before, after, results);
        }
        if (effectiveScope.includes(SearchResultType.SESSION)) {
            searchFiles(scanner.listSessionFiles(workspaceRoot), SearchResultType.SESSION, query, before, after,
                    results);
        }
        if (effectiveScope.includes(SearchResultType.LEARNED)) {
            searchFiles(scanner.listLearnedFiles(workspaceRoot), SearchResultType.LEARNED, query, before, after,
                    results);
        }

        results.sort(Comparator.comparingInt(SearchResult::getRelevance).reversed()
                .thenComparing(SearchResult::getFile));
        return results;
    }

    @Override
    public RebuildResult rebuildIndex() {
        requireIndex();
        WorkspaceScan scan = scanner.scan(requireWorkspaceRoot());

        KnowledgeIndex rebuilt = emptyIndex();
        rebuilt.setPlans(new ArrayList<>(scan.plans().stream().map(PlanRecord::toMetadata).toList()));
        rebuilt.setSessions(new ArrayList<>(scan.sessions().stream().map(SessionRecord::toMetadata).toList()));
        rebuilt.setLearned(new ArrayList<>(scan.learned().stream().map(LearnedPattern::withoutContent).toList()));

        this.index = rebuilt;
        saveIndex();
        this.rebuildRequired = false;

        if (!scan.errors().isEmpty()) {
            log.warn("[JsonIndex] Rebuild skipped {} file(s): {}", scan.errors().size(), scan.errors());
        }
        log.info("[JsonIndex] Index rebuilt: {} plans, {} sessions, {} learned",
                rebuilt.getPlans().size(), rebuilt.getSessions().size(), rebuilt.getLearned().size());
        return new RebuildResult(rebuilt.getPlans().size(), rebuilt.getSessions().size(),
                rebuilt.getLearned().size(), List.copyOf(scan.errors()));
    }

    @Override
    public void close() {
        // nothing held open
    }

    public Path getIndexPath() {
        return indexPath;
    }

    /**
     * True when {@link #init(Path)} found no usable index (missing or corrupt)
     * and started from an empty one that no rebuild has filled yet.
     */
    public boolean isRebuildRequired() {
        return rebuildRequired;
    }

    // ==================== Index persistence ====================

    private Optional<KnowledgeIndex> loadIndex() {
        try {
            KnowledgeIndex loaded = objectMapper.readValue(indexPath.toFile(), KnowledgeIndex.class);
            if (loaded == null) {
                return Optional.empty();
            }
            if (loaded.getPlans() == null) {
                loaded.setPlans(new ArrayList<>());
            }
            if (loaded.getSessions() == null) {
                loaded.setSessions(new ArrayList<>());
            }
            if (loaded.getLearned() == null) {
                loaded.setLearned(new ArrayList<>());
            }
            return Optional.of(loaded);
        } catch (IOException | RuntimeException e) { // NOSONAR - a corrupt cache is replaced, not fatal
            log.warn("[JsonIndex] Discarding unreadable index {}: {}", indexPath, e.getMessage());
            return Optional.empty();
        }
    }

    private void saveIndex() {
        try {
            AtomicFiles.writeString(indexPath, objectMapper.writeValueAsString(index),
                    properties.getStorage().isBackupIndex());
            alignWithDirectory();
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to write index: " + indexPath, e);
        }
    }

    // The rename touches the knowledge directory after the index was written;
    // the index must not look older than its own directory.
    private void alignWithDirectory() throws IOException {
        FileTime indexTime = Files.getLastModifiedTime(indexPath);
        FileTime directoryTime = Files.getLastModifiedTime(knowledgeRoot);
        if (directoryTime.compareTo(indexTime) > 0) {
            Files.setLastModifiedTime(indexPath, directoryTime);
        }
    }

    private KnowledgeIndex emptyIndex() {
        return KnowledgeIndex.builder()
                .updated(Instant.now(clock).toString())
                .build();
    }

    // ==================== Matching helpers ====================

    private void searchFiles(List<Path> files, SearchResultType type, String query, int before, int after,
            List<SearchResult> results) {
        for (Path file : files) {
            readQuietly(file).flatMap(content -> TextMatcher.find(content, query, before, after))
                    .ifPresent(match -> results.add(SearchResult.builder()
                            .file(KnowledgeFileScanner.relativeName(knowledgeRoot, file))
                            .line(match.line())
                            .context(match.context())
                            .relevance(match.relevance())
                            .type(type)
                            .build()));
        }
    }

    private boolean fileContains(String relativeFile, String fragment) {
        if (relativeFile == null) {
            return false;
        }
        Path file = knowledgeRoot.resolve(relativeFile).normalize();
        if (!file.startsWith(knowledgeRoot)) {
            return false;
        }
        return readQuietly(file).map(content -> TextMatcher.containsIgnoreCase(content, fragment)).orElse(false);
    }

    private Optional<String> readQuietly(Path file) {
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException | RuntimeException e) { // NOSONAR - unreadable files drop out of results
            log.debug("[JsonIndex] Skipping unreadable file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean matchesTopic(String topic, String title, List<String> topics) {
        if (TextMatcher.containsIgnoreCase(title, topic)) {
            return true;
        }
        return topics != null && topics.stream()
                .filter(Objects::nonNull)
                .anyMatch(t -> TextMatcher.containsIgnoreCase(t, topic));
    }

    private void requireIndex() {
        requireWorkspaceRoot();
        if (index == null) {
            throw new IllegalStateException("Storage adapter not initialized, call init() first");
        }
    }
}
