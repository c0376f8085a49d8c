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
import me.golemcore.knowledge.domain.model.DetectedPattern;
import me.golemcore.knowledge.domain.model.PatternCandidate;
import me.golemcore.knowledge.domain.model.SessionFile;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Finds recurring "Key Learning" observations across recent session logs.
 *
 * <p>
 * Each observation is reduced to a keyword set (lowercase words of four or
 * more letters, stop words removed, first five distinct). Two observations are
 * similar when the Jaccard index of their keyword sets reaches the configured
 * threshold. Similar observations are linked transitively, so the clusters do
 * not depend on the order in which observations are compared.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatternDetector {

    private static final Pattern KEY_LEARNING = Pattern.compile(
            "^[ \\t]*(?:[-*][ \\t]+)?\\*{0,2}Key Learning\\*{0,2}[ \\t]*:?[ \\t]*\\*{0,2}[ \\t]*(.+?)[ \\t]*$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern DATE_PREFIX = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})");
    private static final Set<String> STOP_WORDS = Set.of(
            "this", "that", "with", "from", "were", "been", "have", "will", "when", "should", "would", "could");
    private static final int MIN_WORD_LENGTH = 4;

    private final KnowledgeProperties properties;
    private final Clock clock;

    /**
     * Patterns seen at least {@code knowledge.patterns.min-frequency} times in
     * the configured window.
     */
    public List<DetectedPattern> detectPatterns(Path targetDir) {
        return detectPatterns(targetDir, properties.getPatterns().getMinFrequency());
    }

    public List<DetectedPattern> detectPatterns(Path targetDir, int threshold) {
        List<SessionFile> sessions = loadRecentSessions(targetDir, properties.getPatterns().getWindowDays());
        List<DetectedPattern> patterns = cluster(extractCandidates(sessions),
                properties.getPatterns().getSimilarityThreshold()).stream()
                .filter(pattern -> pattern.getFrequency() >= threshold)
                .toList();
        log.debug("[Patterns] {} pattern(s) at frequency >= {} across {} session(s)",
                patterns.size(), threshold, sessions.size());
        return patterns;
    }

    /**
     * Session logs dated within the last {@code windowDays} days, oldest first.
     * Files without a date prefix count as written today.
     */
    public List<SessionFile> loadRecentSessions(Path targetDir, int windowDays) {
        Path sessionsDir = targetDir.toAbsolutePath().normalize()
                .resolve(properties.getStorage().getKnowledgeDir())
                .resolve(KnowledgeFileScanner.SESSIONS_DIR);
        if (!Files.isDirectory(sessionsDir)) {
            return List.of();
        }

        LocalDate today = LocalDate.now(clock);
        LocalDate cutoff = today.minusDays(windowDays);
        List<SessionFile> sessions = new ArrayList<>();

        List<Path> files;
        try (Stream<Path> paths = Files.list(sessionsDir)) {
            files = paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".md"))
                    .toList();
        } catch (IOException e) {
            log.warn("[Patterns] Failed to list {}: {}", sessionsDir, e.getMessage());
            return List.of();
        }

        for (Path file : files) {
            String fileName = file.getFileName().toString();
            LocalDate date = dateFromFileName(fileName, today);
            if (date.isBefore(cutoff)) {
                continue;
            }
            try {
                sessions.add(new SessionFile(fileName, date, Files.readString(file, StandardCharsets.UTF_8)));
            } catch (IOException | RuntimeException e) { // NOSONAR - unreadable sessions are skipped
                log.warn("[Patterns] Skipping unreadable session {}: {}", file, e.getMessage());
            }
        }

        sessions.sort(Comparator.comparing(SessionFile::date).thenComparing(SessionFile::fileName));
        return sessions;
    }

    public List<PatternCandidate> extractCandidates(List<SessionFile> sessions) {
        List<PatternCandidate> candidates = new ArrayList<>();
        for (SessionFile session : sessions) {
            Matcher matcher = KEY_LEARNING.matcher(session.content().replace("\r\n", "\n"));
            while (matcher.find()) {
                String text = matcher.group(1).trim();
                Set<String> keywords = extractKeywords(text, properties.getPatterns().getMaxKeywords());
                if (!text.isEmpty() && !keywords.isEmpty()) {
                    candidates.add(new PatternCandidate(text, keywords, session.date(), session.fileName()));
                }
            }
        }
        return candidates;
    }

    public static Set<String> extractKeywords(String text, int maxKeywords) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String word : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (keywords.size() >= maxKeywords) {
                break;
            }
            if (word.length() >= MIN_WORD_LENGTH && !STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    /**
     * {@code |a ∩ b| / |a ∪ b|}, or 0 when both sets are empty.
     */
    public static double jaccardSimilarity(Set<String> a, Set<String> b) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return (double) intersection.size() / union.size();
    }

    /**
     * Groups candidates whose pairwise similarity reaches {@code threshold},
     * linking transitively. Clusters are ordered by frequency, then by first
     * appearance.
     */
    public List<DetectedPattern> cluster(List<PatternCandidate> candidates, double threshold) {
        int[] parent = new int[candidates.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                if (jaccardSimilarity(candidates.get(i).keywords(), candidates.get(j).keywords()) >= threshold) {
                    union(parent, i, j);
                }
            }
        }

        Map<Integer, List<PatternCandidate>> groups = new LinkedHashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            groups.computeIfAbsent(find(parent, i), root -> new ArrayList<>()).add(candidates.get(i));
        }

        List<DetectedPattern> patterns = new ArrayList<>();
        for (List<PatternCandidate> members : groups.values()) {
            patterns.add(toPattern(members));
        }
        patterns.sort(Comparator.comparingInt(DetectedPattern::getFrequency).reversed()
                .thenComparing(DetectedPattern::getFirstSeen));
        return patterns;
    }

    private DetectedPattern toPattern(List<PatternCandidate> members) {
        List<PatternCandidate> ordered = new ArrayList<>(members);
        ordered.sort(Comparator.comparing(PatternCandidate::date));

        Set<String> keywords = new LinkedHashSet<>();
        List<String> examples = new ArrayList<>();
        for (PatternCandidate member : ordered) {
            keywords.addAll(member.keywords());
            examples.add(member.text());
        }

        return DetectedPattern.builder()
                .error(ordered.get(0).text())
                .frequency(ordered.size())
                .firstSeen(ordered.get(0).date())
                .lastSeen(ordered.get(ordered.size() - 1).date())
                .keywords(new ArrayList<>(keywords))
                .examples(examples)
                .commonResolution(examples.get(0))
                .build();
    }

    private static LocalDate dateFromFileName(String fileName, LocalDate fallback) {
        Matcher matcher = DATE_PREFIX.matcher(fileName);
        if (!matcher.find()) {
            return fallback;
        }
        try {
            return LocalDate.parse(matcher.group(1));
        } catch (DateTimeParseException e) {
            return fallback;
        }
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA != rootB) {
            parent[Math.max(rootA, rootB)] = Math.min(rootA, rootB);
        }
    }
}
