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

package me.golemcore.knowledge.port.outbound;

import me.golemcore.knowledge.domain.model.DatabaseStats;
import me.golemcore.knowledge.domain.model.LearnedPattern;
import me.golemcore.knowledge.domain.model.LearnedPatternFilters;
import me.golemcore.knowledge.domain.model.PlanFilters;
import me.golemcore.knowledge.domain.model.PlanRecord;
import me.golemcore.knowledge.domain.model.ProjectRecord;
import me.golemcore.knowledge.domain.model.SessionFilters;
import me.golemcore.knowledge.domain.model.SessionRecord;

import java.util.List;

/**
 * Storage with full-content rows, learned pattern lookups and upserts.
 *
 * <p>
 * With {@code includeContent == false} the markdown body is never loaded and
 * the returned records carry a {@code null} content.
 */
public interface RelationalKnowledgeStoragePort extends KnowledgeStoragePort {

    List<PlanRecord> queryPlanRecords(PlanFilters filters, boolean includeContent);

    List<SessionRecord> querySessionRecords(SessionFilters filters, boolean includeContent);

    List<LearnedPattern> queryLearnedPatterns(LearnedPatternFilters filters, boolean includeContent);

    DatabaseStats getStats();

    void insertProject(ProjectRecord project);

    void insertPlan(PlanRecord plan);

    void insertSession(SessionRecord session);

    void insertPattern(LearnedPattern pattern);
}
