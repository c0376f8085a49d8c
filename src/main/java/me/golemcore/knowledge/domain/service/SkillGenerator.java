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
import me.golemcore.knowledge.domain.exception.KnowledgeValidationException;
import me.golemcore.knowledge.domain.exception.StorageUnavailableException;
import me.golemcore.knowledge.domain.model.SkillCreationOptions;
import me.golemcore.knowledge.domain.model.SkillCreationResult;
import me.golemcore.knowledge.domain.model.SkillExample;
import me.golemcore.knowledge.domain.model.SkillPattern;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Materializes a detected pattern as a learned-skill markdown file.
 *
 * <p>
 * Shared skills go to {@code .aiknowsys/learned/}, personal ones to
 * {@code .aiknowsys/personal/<username>/}. An existing file is never
 * overwritten, so repeated runs are idempotent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SkillGenerator {

    static final String PERSONAL_DIR = "personal";
    private static final int MAX_SLUG_LENGTH = 80;
    private static final String FALLBACK_SLUG = "learned-skill";

    private final KnowledgeProperties properties;
    private final Clock clock;

    public SkillCreationResult createLearnedSkill(SkillPattern pattern, Path targetDir, SkillCreationOptions options) {
        if (pattern == null || pattern.getError() == null || pattern.getError().isBlank()) {
            throw new KnowledgeValidationException("Pattern error text is required");
        }
        SkillCreationOptions o = options != null ? options : SkillCreationOptions.sharedSkill();
        Path knowledgeRoot = targetDir.toAbsolutePath().normalize()
                .resolve(properties.getStorage().getKnowledgeDir());
        Path skillDir = resolveSkillDir(knowledgeRoot, o);
        Path skillPath = skillDir.resolve(slugify(pattern.getError()) + ".md");

        if (Files.exists(skillPath)) {
            log.debug("[Skills] Skill already exists: {}", skillPath);
            return new SkillCreationResult(skillPath, false, true);
        }

        try {
            Files.createDirectories(skillDir);
            Files.writeString(skillPath, render(pattern), StandardOpenOption.CREATE_NEW);
        } catch (FileAlreadyExistsException e) {
            return new SkillCreationResult(skillPath, false, true);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to write skill: " + skillPath, e);
        }
        log.info("[Skills] Created learned skill: {}", skillPath);
        return new SkillCreationResult(skillPath, true, false);
    }

    /**
     * Lowercase, runs of non-alphanumerics collapsed to one hyphen, trimmed and
     * capped in length.
     */
    public static String slugify(String text) {
        String slug = text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? FALLBACK_SLUG : slug;
    }

    String render(SkillPattern pattern) {
        List<String> keywords = pattern.getKeywords() != null ? pattern.getKeywords() : List.of();
        int frequency = Math.max(1, pattern.getFrequency());
        String resolution = pattern.getResolution() != null && !pattern.getResolution().isBlank()
                ? pattern.getResolution()
                : pattern.getError();

        StringBuilder sb = new StringBuilder();
        sb.append("---\n");
        sb.append("category: learned\n");
        sb.append("keywords: [")
                .append(keywords.stream().map(SkillGenerator::yamlScalar).collect(Collectors.joining(", ")))
                .append("]\n");
        sb.append("created: ").append(LocalDate.now(clock)).append('\n');
        sb.append("---\n\n");

        sb.append("# Learned Skill: ").append(pattern.getError()).append("\n\n");
        sb.append("**Description:** Pattern discovered from ").append(frequency).append(" occurrences\n\n");

        sb.append("## Trigger Words\n\n");
        for (String keyword : keywords) {
            sb.append("- `").append(keyword).append("`\n");
        }
        sb.append('\n');

        sb.append("## Resolution\n\n").append(resolution).append('\n');

        List<SkillExample> examples = pattern.getExamples();
        if (examples != null && !examples.isEmpty()) {
            sb.append("\n## Examples\n\n");
            for (SkillExample example : examples) {
                sb.append("**Before:**\n```\n").append(example.before()).append("\n```\n\n");
                sb.append("**After:**\n```\n").append(example.after()).append("\n```\n\n");
            }
        }

        List<String> related = pattern.getRelatedSkills();
        if (related != null && !related.isEmpty()) {
            sb.append("\n## Related Skills\n\n");
            related.forEach(skill -> sb.append("- ").append(skill).append('\n'));
        }

        sb.append("\n---\n\n*Auto-generated learned skill. Edit as needed.*\n");
        return sb.toString();
    }

    private Path resolveSkillDir(Path knowledgeRoot, SkillCreationOptions options) {
        String username = options.getUsername();
        if (options.isShared() || username == null || username.isBlank()) {
            return knowledgeRoot.resolve(KnowledgeFileScanner.LEARNED_DIR);
        }
        Path personalRoot = knowledgeRoot.resolve(PERSONAL_DIR);
        Path resolved = personalRoot.resolve(username.trim()).normalize();
        if (!resolved.startsWith(personalRoot) || resolved.equals(personalRoot)) {
            throw new KnowledgeValidationException("Path traversal blocked: " + username);
        }
        return resolved;
    }

    private static String yamlScalar(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
