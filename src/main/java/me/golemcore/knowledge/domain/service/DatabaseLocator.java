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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.domain.model.DatabaseConfig;
import me.golemcore.knowledge.domain.model.KnowledgeConfigFile;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves where the relational database lives and which project a workspace
 * belongs to.
 *
 * <p>
 * Database path priority:
 * <ol>
 * <li>the {@code AIKNOWSYS_DB_PATH} environment variable</li>
 * <li>{@code databasePath} in {@code .aiknowsys.config} at the project root,
 * relative paths resolved against the project</li>
 * <li>{@code ~/.aiknowsys/knowledge.db}</li>
 * </ol>
 *
 * <p>
 * A missing or malformed config file falls back to defaults; no lookup here
 * throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DatabaseLocator {

    private static final Pattern REMOTE_SECTION = Pattern.compile("^\\s*\\[remote\\s+\"([^\"]+)\"]\\s*$");
    private static final Pattern SECTION = Pattern.compile("^\\s*\\[.*]\\s*$");
    private static final Pattern URL_LINE = Pattern.compile("^\\s*url\\s*=\\s*(.+?)\\s*$");
    private static final Pattern OWNER_REPO = Pattern.compile("[:/]([^/:]+)/([^/]+?)(?:\\.git)?/?$");
    private static final String FALLBACK_PROJECT_ID = "project";

    private final ObjectMapper objectMapper;
    private final KnowledgeProperties properties;

    public DatabaseConfig getDatabaseConfig(Path targetDir) {
        Path projectRoot = targetDir.toAbsolutePath().normalize();
        Optional<KnowledgeConfigFile> config = readConfig(projectRoot);

        Path dbPath = resolveDatabasePath(projectRoot, config);
        Path parent = dbPath.getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                log.warn("[Locator] Failed to create database directory {}: {}", parent, e.getMessage());
            }
        }

        String projectId = config.map(KnowledgeConfigFile::getProjectId)
                .filter(id -> !id.isBlank())
                .orElseGet(() -> getProjectId(projectRoot));
        String projectName = config.map(KnowledgeConfigFile::getProjectName)
                .filter(name -> !name.isBlank())
                .orElseGet(() -> basename(projectRoot));

        log.debug("[Locator] Database {} for project {} ({})", dbPath, projectId, projectName);
        return new DatabaseConfig(dbPath, projectId, projectName);
    }

    /**
     * Project identifier from the git {@code origin} remote
     * ({@code owner-repo}), or the sanitized directory name.
     */
    public String getProjectId(Path targetDir) {
        Path projectRoot = targetDir.toAbsolutePath().normalize();
        return readRemoteUrl(projectRoot)
                .flatMap(DatabaseLocator::ownerAndRepo)
                .map(DatabaseLocator::sanitizeProjectId)
                .filter(id -> !id.isEmpty())
                .orElseGet(() -> {
                    String fromName = sanitizeProjectId(basename(projectRoot));
                    return fromName.isEmpty() ? FALLBACK_PROJECT_ID : fromName;
                });
    }

    public String getProjectName(Path targetDir) {
        Path projectRoot = targetDir.toAbsolutePath().normalize();
        return readConfig(projectRoot)
                .map(KnowledgeConfigFile::getProjectName)
                .filter(name -> !name.isBlank())
                .orElseGet(() -> basename(projectRoot));
    }

    /**
     * Lowercases and collapses every run of characters outside
     * {@code [a-z0-9]} into one hyphen, trimming hyphens at both ends.
     */
    public static String sanitizeProjectId(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
    }

    protected String readEnvironment(String name) {
        return System.getenv(name);
    }

    protected Path homeDirectory() {
        String home = readEnvironment("HOME");
        return Path.of(home != null && !home.isBlank() ? home : System.getProperty("user.home"));
    }

    // ==================== Internals ====================

    private Path resolveDatabasePath(Path projectRoot, Optional<KnowledgeConfigFile> config) {
        KnowledgeProperties.LocatorProperties locator = properties.getLocator();

        String fromEnv = readEnvironment(locator.getEnvVariable());
        if (fromEnv != null && !fromEnv.isBlank()) {
            Optional<Path> envPath = toPath(fromEnv.trim());
            if (envPath.isPresent()) {
                return envPath.get().toAbsolutePath().normalize();
            }
            log.warn("[Locator] Ignoring invalid {} value: {}", locator.getEnvVariable(), fromEnv);
        }

        Optional<Path> fromConfig = config.map(KnowledgeConfigFile::getDatabasePath)
                .filter(path -> !path.isBlank())
                .flatMap(path -> toPath(path.trim()));
        if (fromConfig.isPresent()) {
            Path configured = fromConfig.get();
            return (configured.isAbsolute() ? configured : projectRoot.resolve(configured)).normalize();
        }

        return homeDirectory().resolve(locator.getDefaultDbDir()).resolve(locator.getDefaultDbFile())
                .toAbsolutePath().normalize();
    }

    private Optional<KnowledgeConfigFile> readConfig(Path projectRoot) {
        Path configPath = projectRoot.resolve(properties.getLocator().getConfigFile());
        if (!Files.isRegularFile(configPath)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(configPath.toFile(), KnowledgeConfigFile.class));
        } catch (IOException | RuntimeException e) { // NOSONAR - malformed config falls back to defaults
            log.warn("[Locator] Ignoring malformed {}: {}", configPath, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> readRemoteUrl(Path projectRoot) {
        Path gitConfig = projectRoot.resolve(".git").resolve("config");
        if (!Files.isRegularFile(gitConfig)) {
            return Optional.empty();
        }
        try {
            String originUrl = null;
            String firstUrl = null;
            String currentRemote = null;
            for (String line : Files.readAllLines(gitConfig, StandardCharsets.UTF_8)) {
                Matcher remote = REMOTE_SECTION.matcher(line);
                if (remote.matches()) {
                    currentRemote = remote.group(1);
                    continue;
                }
                if (SECTION.matcher(line).matches()) {
                    currentRemote = null;
                    continue;
                }
                Matcher url = URL_LINE.matcher(line);
                if (currentRemote != null && url.matches()) {
                    if (firstUrl == null) {
                        firstUrl = url.group(1);
                    }
                    if ("origin".equals(currentRemote)) {
                        originUrl = url.group(1);
                    }
                }
            }
            return Optional.ofNullable(originUrl != null ? originUrl : firstUrl);
        } catch (IOException | RuntimeException e) { // NOSONAR - no git identity, use the directory name
            log.debug("[Locator] Failed to read {}: {}", gitConfig, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<String> ownerAndRepo(String remoteUrl) {
        Matcher matcher = OWNER_REPO.matcher(remoteUrl);
        return matcher.find() ? Optional.of(matcher.group(1) + "-" + matcher.group(2)) : Optional.empty();
    }

    private static Optional<Path> toPath(String value) {
        try {
            return Optional.of(Path.of(value));
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    private static String basename(Path projectRoot) {
        Path name = projectRoot.getFileName();
        return name != null ? name.toString() : FALLBACK_PROJECT_ID;
    }
}
