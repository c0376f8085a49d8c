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
import me.golemcore.knowledge.domain.model.PlanFilters;
import me.golemcore.knowledge.domain.model.PlanMetadata;
import me.golemcore.knowledge.domain.model.PlanQueryOptions;
import me.golemcore.knowledge.domain.model.PlanQueryResult;
import me.golemcore.knowledge.domain.model.SearchContextResult;
import me.golemcore.knowledge.domain.model.SearchResult;
import me.golemcore.knowledge.domain.model.SearchScope;
import me.golemcore.knowledge.domain.model.SessionFilters;
import me.golemcore.knowledge.domain.model.SessionMetadata;
import me.golemcore.knowledge.domain.model.SessionQueryOptions;
import me.golemcore.knowledge.domain.model.SessionQueryResult;
import me.golemcore.knowledge.port.outbound.KnowledgeStoragePort;
import me.golemcore.knowledge.port.outbound.KnowledgeStorageProvider;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Query entry point shared by every caller (command line, tool servers,
 * tests).
 *
 * <p>
 * Each call validates its input, opens exactly one storage adapter through
 * {@link KnowledgeStorageProvider}, runs one query and closes the adapter on every
 * path. Invalid input fails with
 * {@link me.golemcore.knowledge.domain.exception.KnowledgeValidationException}
 * before any file is touched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeQueryService {

    private final KnowledgeStorageProvider storageProvider;
    private final Clock clock;

    public PlanQueryResult queryPlans(PlanQueryOptions options, Path targetDir) {
        PlanQueryOptions o = options != null ? options : new PlanQueryOptions();
        PlanFilters filters = PlanFilters.builder()
                .status(QueryValidator.status(o.getStatus()))
                .author(QueryValidator.text(o.getAuthor()))
                .topic(QueryValidator.text(o.getTopic()))
                .updatedAfter(QueryValidator.date(o.getUpdatedAfter()))
                .updatedBefore(QueryValidator.date(o.getUpdatedBefore()))
                .build();
        Path root = QueryValidator.targetDir(targetDir);

        try (KnowledgeStoragePort storage = storageProvider.open(root)) {
            List<PlanMetadata> plans = storage.queryPlans(filters);
            log.debug("[Query] {} plan(s) matched {}", plans.size(), filters);
            return PlanQueryResult.of(plans);
        }
    }

    public SessionQueryResult querySessions(SessionQueryOptions options, Path targetDir) {
        SessionQueryOptions o = options != null ? options : new SessionQueryOptions();
        String date = QueryValidator.date(o.getDate());
        String dateAfter = QueryValidator.date(o.getDateAfter());
        String dateBefore = QueryValidator.date(o.getDateBefore());
        Integer days = QueryValidator.days(o.getDays());
        if (dateAfter == null && days != null) {
            dateAfter = LocalDate.now(clock).minusDays(days).toString();
        }

        SessionFilters filters = SessionFilters.builder()
                .date(date)
                .dateAfter(dateAfter)
                .dateBefore(dateBefore)
                .topic(QueryValidator.text(o.getTopic()))
                .plan(QueryValidator.text(o.getPlan()))
                .build();
        Path root = QueryValidator.targetDir(targetDir);

        try (KnowledgeStoragePort storage = storageProvider.open(root)) {
            List<SessionMetadata> sessions = new ArrayList<>(storage.querySessions(filters));
            sessions.sort(Comparator.comparing(SessionMetadata::getDate, Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(SessionMetadata::getId, Comparator.nullsLast(Comparator.reverseOrder())));
            log.debug("[Query] {} session(s) matched {}", sessions.size(), filters);
            return SessionQueryResult.of(sessions);
        }
    }

    public SearchContextResult searchContext(String query, String scope, Path targetDir) {
        String validQuery = QueryValidator.query(query);
        SearchScope validScope = QueryValidator.scope(scope);
        Path root = QueryValidator.targetDir(targetDir);

        try (KnowledgeStoragePort storage = storageProvider.open(root)) {
            List<SearchResult> results = storage.search(validQuery, validScope);
            log.debug("[Query] '{}' in {}: {} result(s)", validQuery, validScope.getValue(), results.size());
            return SearchContextResult.of(validQuery, validScope, results);
        }
    }
}
