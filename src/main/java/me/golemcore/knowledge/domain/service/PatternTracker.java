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

package me.golemcore.knowledge.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.domain.exception.StorageUnavailableException;
import me.golemcore.knowledge.domain.model.PatternEntry;
import me.golemcore.knowledge.domain.model.PatternHistory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ledger of recurring problems and whether each has been turned into a skill,
 * persisted as {@code .aiknowsys/pattern-history.json}.
 *
 * <p>
 * One instance per workspace. Every operation re-reads the ledger, so
 * instances are cheap and never hold stale state; concurrent writers are not
 * coordinated.
 */
@Slf4j
public class PatternTracker {

    public static final String HISTORY_FILE = "pattern-history.json";

    private final Path historyPath;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PatternTracker(Path workspaceRoot, String knowledgeDir, ObjectMapper objectMapper, Clock clock) {
        this.historyPath = workspaceRoot.toAbsolutePath().normalize().resolve(knowledgeDir).resolve(HISTORY_FILE);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Creates an empty ledger when none exists.
     */
    public void initialize() {
        if (!Files.exists(historyPath)) {
            save(new PatternHistory());
            log.debug("[Patterns] Initialized {}", historyPath);
        }
    }

    /**
     * Records one more occurrence of {@code error}. Matching is on the exact
     * text; a new error starts at frequency 1.
     */
    public PatternEntry trackPattern(String error, String resolution) {
        PatternHistory history = load();
        Instant now = Instant.now(clock);

        Optional<PatternEntry> existing = find(history, error);
        PatternEntry entry;
        if (existing.isPresent()) {
            entry = existing.get();
            entry.setFrequency(entry.getFrequency() + 1);
            entry.setLastSeen(now);
        } else {
            entry = PatternEntry.builder()
                    .id(SkillGenerator.slugify(error))
                    .error(error)
                    .frequency(1)
                    .firstSeen(now)
                    .lastSeen(now)
                    .documented(false)
                    .build();
            history.getPatterns().add(entry);
        }
        if (entry.getResolutions() == null) {
            entry.setResolutions(new ArrayList<>());
        }
        if (resolution != null && !resolution.isBlank() && !entry.getResolutions().contains(resolution)) {
            entry.getResolutions().add(resolution);
        }

        save(history);
        log.debug("[Patterns] Tracked '{}' (frequency {})", error, entry.getFrequency());
        return entry;
    }

    /**
     * @return false when {@code error} is not tracked
     */
    public boolean markPatternDocumented(String error) {
        PatternHistory history = load();
        Optional<PatternEntry> entry = find(history, error);
        if (entry.isEmpty()) {
            return false;
        }
        entry.get().setDocumented(true);
        save(history);
        return true;
    }

    public boolean isDocumented(String error) {
        return find(load(), error).map(PatternEntry::isDocumented).orElse(false);
    }

    public Optional<PatternEntry> findPattern(String error) {
        return find(load(), error);
    }

    public List<PatternEntry> getPatterns() {
        return List.copyOf(load().getPatterns());
    }

    public Path getHistoryPath() {
        return historyPath;
    }

    private Optional<PatternEntry> find(PatternHistory history, String error) {
        return history.getPatterns().stream()
                .filter(entry -> entry.getError() != null && entry.getError().equals(error))
                .findFirst();
    }

    private PatternHistory load() {
        if (!Files.exists(historyPath)) {
            return new PatternHistory();
        }
        try {
            PatternHistory history = objectMapper.readValue(historyPath.toFile(), PatternHistory.class);
            if (history == null) {
                return new PatternHistory();
            }
            if (history.getPatterns() == null) {
                history.setPatterns(new ArrayList<>());
            }
            return history;
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read pattern history: " + historyPath, e);
        }
    }

    private void save(PatternHistory history) {
        try {
            AtomicFiles.writeString(historyPath, objectMapper.writeValueAsString(history), false);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to write pattern history: " + historyPath, e);
        }
    }
}
