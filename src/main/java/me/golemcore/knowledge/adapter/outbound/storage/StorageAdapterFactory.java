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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.domain.model.DatabaseConfig;
import me.golemcore.knowledge.domain.service.DatabaseLocator;
import me.golemcore.knowledge.domain.service.IndexFreshnessChecker;
import me.golemcore.knowledge.domain.service.KnowledgeFileScanner;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import me.golemcore.knowledge.port.outbound.KnowledgeStoragePort;
import me.golemcore.knowledge.port.outbound.KnowledgeStorageProvider;
import me.golemcore.knowledge.port.outbound.RelationalKnowledgeStoragePort;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;

/**
 * Creates initialized storage adapters for a workspace.
 *
 * <p>
 * The backend is chosen by {@code knowledge.storage.adapter}:
 * <ul>
 * <li>json - the {@code context-index.json} cache
 * <li>sqlite - the database resolved by {@link DatabaseLocator}
 * <li>auto - sqlite when that database file already exists, json otherwise
 * </ul>
 *
 * <p>
 * With {@code knowledge.storage.auto-rebuild} enabled, a JSON index is rebuilt
 * when {@link IndexFreshnessChecker} reports it stale, and the SQLite rows of
 * the project are always refreshed from the markdown tree.
 *
 * <p>
 * Callers own the returned adapter and must close it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageAdapterFactory implements KnowledgeStorageProvider {

    public static final String ADAPTER_JSON = "json";
    public static final String ADAPTER_SQLITE = "sqlite";
    public static final String ADAPTER_AUTO = "auto";

    private final KnowledgeFileScanner scanner;
    private final ObjectMapper objectMapper;
    private final KnowledgeProperties properties;
    private final Clock clock;
    private final DatabaseLocator databaseLocator;
    private final IndexFreshnessChecker freshnessChecker;

    @Override
    public KnowledgeStoragePort open(Path targetDir) {
        return create(targetDir);
    }

    @Override
    public RelationalKnowledgeStoragePort openRelational(Path targetDir) {
        return createSqlite(targetDir);
    }

    public KnowledgeStoragePort create(Path targetDir) {
        Path workspaceRoot = targetDir.toAbsolutePath().normalize();
        String configured = properties.getStorage().getAdapter();
        String type = configured != null ? configured.trim().toLowerCase(Locale.ROOT) : ADAPTER_AUTO;

        return switch (type) {
        case ADAPTER_JSON -> createJson(workspaceRoot);
        case ADAPTER_SQLITE -> createSqlite(workspaceRoot);
        case ADAPTER_AUTO -> createAuto(workspaceRoot);
        default -> {
            log.warn("[Storage] Adapter '{}' not found, using: {}", configured, ADAPTER_JSON);
            yield createJson(workspaceRoot);
        }
        };
    }

    private KnowledgeStoragePort createAuto(Path workspaceRoot) {
        DatabaseConfig config = databaseLocator.getDatabaseConfig(workspaceRoot);
        if (Files.isRegularFile(config.dbPath())) {
            log.debug("[Storage] Found database {}, using sqlite", config.dbPath());
            return openSqlite(workspaceRoot, config);
        }
        return createJson(workspaceRoot);
    }

    public JsonIndexStorageAdapter createJson(Path targetDir) {
        Path workspaceRoot = targetDir.toAbsolutePath().normalize();
        boolean stale = freshnessChecker.isStale(workspaceRoot);

        JsonIndexStorageAdapter adapter = new JsonIndexStorageAdapter(scanner, objectMapper, properties, clock);
        adapter.init(workspaceRoot);
        if (properties.getStorage().isAutoRebuild() && (stale || adapter.isRebuildRequired())) {
            log.debug("[Storage] Index is stale or was reset, rebuilding");
            adapter.rebuildIndex();
        }
        return adapter;
    }

    public SqliteStorageAdapter createSqlite(Path targetDir) {
        Path workspaceRoot = targetDir.toAbsolutePath().normalize();
        return openSqlite(workspaceRoot, databaseLocator.getDatabaseConfig(workspaceRoot));
    }

    private SqliteStorageAdapter openSqlite(Path workspaceRoot, DatabaseConfig config) {
        SqliteStorageAdapter adapter = new SqliteStorageAdapter(scanner, objectMapper, properties, clock, config);
        adapter.init(workspaceRoot);
        if (properties.getStorage().isAutoRebuild()) {
            try {
                adapter.rebuildIndex();
            } catch (RuntimeException e) {
                adapter.close();
                throw e;
            }
        }
        return adapter;
    }
}
