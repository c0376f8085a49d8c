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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.domain.model.DatabaseStats;
import me.golemcore.knowledge.domain.model.LearnedPattern;
import me.golemcore.knowledge.domain.model.LearnedPatternFilters;
import me.golemcore.knowledge.domain.model.PlanFilters;
import me.golemcore.knowledge.domain.model.PlanRecord;
import me.golemcore.knowledge.domain.model.SearchContextResult;
import me.golemcore.knowledge.domain.model.SearchResult;
import me.golemcore.knowledge.domain.model.SearchScope;
import me.golemcore.knowledge.domain.model.SessionFilters;
import me.golemcore.knowledge.domain.model.SessionRecord;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import me.golemcore.knowledge.port.outbound.KnowledgeStorageProvider;
import me.golemcore.knowledge.port.outbound.RelationalKnowledgeStoragePort;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Queries that only the relational backend can answer: full-content reads,
 * learned pattern lookups and database statistics.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SqliteQueryService {

    private final KnowledgeStorageProvider storageProvider;
    private final KnowledgeProperties properties;

    public List<PlanRecord> queryPlans(PlanFilters filters, boolean includeContent, Path targetDir) {
        PlanFilters validated = filters != null ? filters : PlanFilters.none();
        QueryValidator.date(validated.getUpdatedAfter());
        QueryValidator.date(validated.getUpdatedBefore());

        try (RelationalKnowledgeStoragePort storage = openRelational(targetDir)) {
            return storage.queryPlanRecords(validated, includeContent);
        }
    }

    public List<SessionRecord> querySessions(SessionFilters filters, boolean includeContent, Path targetDir) {
        SessionFilters validated = filters != null ? filters : SessionFilters.none();
        QueryValidator.date(validated.getDate());
        QueryValidator.date(validated.getDateAfter());
        QueryValidator.date(validated.getDateBefore());

        try (RelationalKnowledgeStoragePort storage = openRelational(targetDir)) {
            return storage.querySessionRecords(validated, includeContent);
        }
    }

    public List<LearnedPattern> queryLearnedPatterns(LearnedPatternFilters filters, boolean includeContent,
            Path targetDir) {
        try (RelationalKnowledgeStoragePort storage = openRelational(targetDir)) {
            return storage.queryLearnedPatterns(filters, includeContent);
        }
    }

    public SearchContextResult searchContext(String query, String scope, Integer limit, Path targetDir) {
        String validQuery = QueryValidator.query(query);
        SearchScope validScope = QueryValidator.scope(scope);
        int maxResults = QueryValidator.limit(limit != null ? limit : properties.getSearch().getDefaultLimit());

        try (RelationalKnowledgeStoragePort storage = openRelational(targetDir)) {
            List<SearchResult> results = storage.search(validQuery, validScope);
            if (results.size() > maxResults) {
                log.debug("[Query] Truncating {} results to {}", results.size(), maxResults);
                results = results.subList(0, maxResults);
            }
            return SearchContextResult.of(validQuery, validScope, results);
        }
    }

    public DatabaseStats getStats(Path targetDir) {
        try (RelationalKnowledgeStoragePort storage = openRelational(targetDir)) {
            return storage.getStats();
        }
    }

    private RelationalKnowledgeStoragePort openRelational(Path targetDir) {
        return storageProvider.openRelational(QueryValidator.targetDir(targetDir));
    }
}
