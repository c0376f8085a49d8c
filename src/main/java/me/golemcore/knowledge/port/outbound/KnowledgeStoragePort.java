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

import me.golemcore.knowledge.domain.model.PlanFilters;
import me.golemcore.knowledge.domain.model.PlanMetadata;
import me.golemcore.knowledge.domain.model.RebuildResult;
import me.golemcore.knowledge.domain.model.SearchResult;
import me.golemcore.knowledge.domain.model.SearchScope;
import me.golemcore.knowledge.domain.model.SessionFilters;
import me.golemcore.knowledge.domain.model.SessionMetadata;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for the derived knowledge store built from the markdown tree under
 * {@code .aiknowsys/}.
 *
 * <p>
 * The markdown files are the source of truth. Implementations are caches or
 * databases that can always be rebuilt from them, so {@link #rebuildIndex()}
 * over an unchanged tree yields the same query results as a fresh scan.
 *
 * <p>
 * An instance serves one logical operation: {@link #init(Path)}, any number of
 * queries, then {@link #close()}.
 */
public interface KnowledgeStoragePort extends AutoCloseable {

    /**
     * Opens or creates the backing store for the workspace rooted at
     * {@code targetDir}.
     *
     * @throws me.golemcore.knowledge.domain.exception.StorageUnavailableException
     *             if the store cannot be opened or created
     */
    void init(Path targetDir);

    List<PlanMetadata> queryPlans(PlanFilters filters);

    List<SessionMetadata> querySessions(SessionFilters filters);

    /**
     * Case-insensitive literal search, sorted by relevance descending.
     */
    List<SearchResult> search(String query, SearchScope scope);

    /**
     * Rescans the markdown tree and replaces the stored records.
     */
    RebuildResult rebuildIndex();

    /**
     * Releases the underlying resources. Safe to call more than once.
     */
    @Override
    void close();
}
