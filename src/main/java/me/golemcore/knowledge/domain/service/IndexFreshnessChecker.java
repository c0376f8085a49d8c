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
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.stream.Stream;

/**
 * Decides whether the JSON index lags behind the markdown tree: it is stale
 * when missing, or when any markdown file or directory under the knowledge
 * directory was modified after it. Directory times catch deleted and renamed
 * files, which leave no file behind to compare.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndexFreshnessChecker {

    private static final String MARKDOWN_EXT = ".md";

    private final KnowledgeProperties properties;

    public boolean isStale(Path workspaceRoot) {
        Path knowledgeRoot = workspaceRoot.resolve(properties.getStorage().getKnowledgeDir());
        Path indexPath = knowledgeRoot.resolve(properties.getStorage().getIndexFile());
        if (!Files.isRegularFile(indexPath)) {
            return true;
        }

        try (Stream<Path> paths = Files.walk(knowledgeRoot)) {
            FileTime indexTime = Files.getLastModifiedTime(indexPath);
            return paths
                    .filter(path -> Files.isDirectory(path) || isMarkdown(path))
                    .anyMatch(path -> isNewer(path, indexTime));
        } catch (IOException | RuntimeException e) { // NOSONAR - when in doubt, rebuild
            log.debug("[Freshness] Cannot compare timestamps under {}: {}", knowledgeRoot, e.getMessage());
            return true;
        }
    }

    private static boolean isMarkdown(Path path) {
        return Files.isRegularFile(path) && path.getFileName().toString().endsWith(MARKDOWN_EXT);
    }

    private boolean isNewer(Path file, FileTime indexTime) {
        try {
            boolean newer = Files.getLastModifiedTime(file).compareTo(indexTime) > 0;
            if (newer) {
                log.debug("[Freshness] {} is newer than the index", file);
            }
            return newer;
        } catch (IOException e) {
            return true;
        }
    }
}
