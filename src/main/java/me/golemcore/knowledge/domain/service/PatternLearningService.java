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
import me.golemcore.knowledge.domain.exception.KnowledgeValidationException;
import me.golemcore.knowledge.domain.model.AutoCreateResult;
import me.golemcore.knowledge.domain.model.DetectedPattern;
import me.golemcore.knowledge.domain.model.LearnOutcome;
import me.golemcore.knowledge.domain.model.SkillCreationOptions;
import me.golemcore.knowledge.domain.model.SkillCreationResult;
import me.golemcore.knowledge.domain.model.SkillPattern;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns detected patterns into learned skills and keeps the pattern ledger in
 * step with what has been documented.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatternLearningService {

    private final PatternDetector patternDetector;
    private final SkillGenerator skillGenerator;
    private final KnowledgeProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public List<DetectedPattern> listPatterns(Path targetDir) {
        return patternDetector.detectPatterns(resolve(targetDir));
    }

    /**
     * Finds the first pattern (seen at least once) whose text or keywords
     * contain {@code searchTerm} and writes it as a skill.
     */
    public LearnOutcome extractPattern(Path targetDir, String searchTerm, SkillCreationOptions options) {
        if (searchTerm == null || searchTerm.isBlank()) {
            throw new KnowledgeValidationException("Search term cannot be empty");
        }
        Path root = resolve(targetDir);
        Optional<DetectedPattern> match = patternDetector.detectPatterns(root, 1).stream()
                .filter(pattern -> matches(pattern, searchTerm.trim()))
                .findFirst();
        if (match.isEmpty()) {
            log.debug("[Patterns] No pattern matches '{}'", searchTerm);
            return LearnOutcome.notFound();
        }

        DetectedPattern pattern = match.get();
        SkillCreationResult result = document(root, pattern, options);
        String message = result.existed() ? "Skill already exists" : "Skill created";
        return new LearnOutcome(true, message, pattern, result.path());
    }

    /**
     * Writes a skill for every pattern at or above {@code threshold} that the
     * ledger does not list as documented yet.
     */
    public AutoCreateResult autoCreateSkills(Path targetDir, Integer threshold, SkillCreationOptions options) {
        Path root = resolve(targetDir);
        int minFrequency = threshold != null ? threshold : properties.getPatterns().getMinFrequency();
        PatternTracker tracker = tracker(root);

        List<Path> created = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (DetectedPattern pattern : patternDetector.detectPatterns(root, minFrequency)) {
            if (tracker.isDocumented(pattern.getError())) {
                skipped.add(pattern.getError());
                continue;
            }
            SkillCreationResult result = document(root, pattern, options);
            if (result.created()) {
                created.add(result.path());
            } else {
                skipped.add(pattern.getError());
            }
        }
        log.info("[Patterns] Auto-created {} skill(s), skipped {}", created.size(), skipped.size());
        return new AutoCreateResult(created, skipped);
    }

    public PatternTracker tracker(Path targetDir) {
        PatternTracker tracker = new PatternTracker(resolve(targetDir), properties.getStorage().getKnowledgeDir(),
                objectMapper, clock);
        tracker.initialize();
        return tracker;
    }

    private SkillCreationResult document(Path root, DetectedPattern pattern, SkillCreationOptions options) {
        SkillCreationResult result = skillGenerator.createLearnedSkill(SkillPattern.builder()
                .error(pattern.getError())
                .resolution(pattern.getCommonResolution())
                .keywords(new ArrayList<>(pattern.getKeywords()))
                .frequency(pattern.getFrequency())
                .build(), root, options);

        PatternTracker tracker = tracker(root);
        if (tracker.findPattern(pattern.getError()).isEmpty()) {
            tracker.trackPattern(pattern.getError(), pattern.getCommonResolution());
        }
        tracker.markPatternDocumented(pattern.getError());
        return result;
    }

    private static boolean matches(DetectedPattern pattern, String term) {
        if (TextMatcher.containsIgnoreCase(pattern.getError(), term)) {
            return true;
        }
        return pattern.getKeywords().stream().anyMatch(keyword -> TextMatcher.containsIgnoreCase(keyword, term));
    }

    private static Path resolve(Path targetDir) {
        return QueryValidator.targetDir(targetDir);
    }
}
