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

import me.golemcore.knowledge.domain.exception.StorageNotImplementedException;
import me.golemcore.knowledge.domain.model.PlanFilters;
import me.golemcore.knowledge.domain.model.PlanMetadata;
import me.golemcore.knowledge.domain.model.RebuildResult;
import me.golemcore.knowledge.domain.model.SearchResult;
import me.golemcore.knowledge.domain.model.SearchScope;
import me.golemcore.knowledge.domain.model.SessionFilters;
import me.golemcore.knowledge.domain.model.SessionMetadata;
import me.golemcore.knowledge.port.outbound.KnowledgeStoragePort;

import java.nio.file.Path;
import java.util.List;

/**
 * Base class for storage backends. Every operation fails with
 * {@link StorageNotImplementedException} until a subclass overrides it.
 */
public abstract class AbstractStorageAdapter implements KnowledgeStoragePort {

    private Path workspaceRoot;

    @Override
    public void init(Path targetDir) {
        throw new StorageNotImplementedException("init");
    }

    @Override
    public List<PlanMetadata> queryPlans(PlanFilters filters) {
        throw new StorageNotImplementedException("queryPlans");
    }

    @Override
    public List<SessionMetadata> querySessions(SessionFilters filters) {
        throw new StorageNotImplementedException("querySessions");
    }

    @Override
    public List<SearchResult> search(String query, SearchScope scope) {
        throw new StorageNotImplementedException("search");
    }

    @Override
    public RebuildResult rebuildIndex() {
        throw new StorageNotImplementedException("rebuildIndex");
    }

    @Override
    public void close() {
        throw new StorageNotImplementedException("close");
    }

    protected void setWorkspaceRoot(Path targetDir) {
        this.workspaceRoot = targetDir.toAbsolutePath().normalize();
    }

    protected Path requireWorkspaceRoot() {
        if (workspaceRoot == null) {
            throw new IllegalStateException("Storage adapter not initialized, call init() first");
        }
        return workspaceRoot;
    }
}
