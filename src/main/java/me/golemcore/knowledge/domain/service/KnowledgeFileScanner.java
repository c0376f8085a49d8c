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
import me.golemcore.knowledge.domain.model.LearnedPattern;
import me.golemcore.knowledge.domain.model.MarkdownDocument;
import me.golemcore.knowledge.domain.model.PlanRecord;
import me.golemcore.knowledge.domain.model.PlanStatus;
import me.golemcore.knowledge.domain.model.SessionRecord;
import me.golemcore.knowledge.domain.model.WorkspaceScan;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Walks the {@code .aiknowsys/} tree and parses every plan, session and learned
 * skill file into full records. Both storage backends rebuild from this scan.
 *
 * <p>
 * Layout:
 * <ul>
 * <li>{@code PLAN_<id>.md} - plans</li>
 * <li>{@code plans/active-<user>.md} - per-user pointers to the active
 * plan</li>
 * <li>{@code sessions/YYYY-MM-DD*.md} - session logs</li>
 * <li>{@code learned/**.md} - learned skills</li>
 * </ul>
 *
 * <p>
 * A file that cannot be read or parsed is skipped and reported in
 * {@link WorkspaceScan#errors()}; the scan itself never fails.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KnowledgeFileScanner {

    public static final String PLANS_DIR = "plans";
    public static final String SESSIONS_DIR = "sessions";
    public static final String LEARNED_DIR = "learned";

    private static final String PLAN_PREFIX = "PLAN_";
    private static final String MARKDOWN_EXT = ".md";
    private static final Pattern SESSION_FILE_PATTERN = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}).*\\.md$");
    private static final Pattern POINTER_FILE_PATTERN = Pattern.compile("^active-(.+)\\.md$");
    private static final Pattern SESSION_HEADING_PATTERN = Pattern.compile("^#\\s+Session:\\s+(.+?)(?:\\s+\\(.*)?$",
            Pattern.MULTILINE);
    private static final String UNKNOWN_AUTHOR = "unknown";
    private static final String DEFAULT_CATEGORY = "general";
    private static final String DEFAULT_SESSION_TOPIC = "Session";

    private final MarkdownFrontmatterParser parser;
    private final KnowledgeProperties properties;
    private final Clock clock;

    public Path knowledgeRoot(Path workspaceRoot) {
        return workspaceRoot.resolve(properties.getStorage().getKnowledgeDir());
    }

    public WorkspaceScan scan(Path workspaceRoot) {
        Path root = knowledgeRoot(workspaceRoot);
        List<String> errors = new ArrayList<>();

        List<PlanRecord> plans = scanPlans(root, errors);
        List<SessionRecord> sessions = scanSessions(root, errors);
        List<LearnedPattern> learned = scanLearned(root, errors);

        log.debug("[Scanner] {}: {} plans, {} sessions, {} learned, {} errors",
                root, plans.size(), sessions.size(), learned.size(), errors.size());
        return new WorkspaceScan(plans, sessions, learned, errors);
    }

    /**
     * Plan files read by full-text search.
     */
    public List<Path> listPlanFiles(Path workspaceRoot) {
        return listPlanFilesIn(knowledgeRoot(workspaceRoot));
    }

    private List<Path> listPlanFilesIn(Path root) {
        return listFiles(root, path -> {
            String name = path.getFileName().toString();
            return name.startsWith(PLAN_PREFIX) && name.endsWith(MARKDOWN_EXT);
        });
    }

    public List<Path> listSessionFiles(Path workspaceRoot) {
        Path dir = knowledgeRoot(workspaceRoot).resolve(SESSIONS_DIR);
        return listFiles(dir, path -> path.getFileName().toString().endsWith(MARKDOWN_EXT));
    }

    public List<Path> listLearnedFiles(Path workspaceRoot) {
        return listLearnedFilesIn(knowledgeRoot(workspaceRoot));
    }

    private List<Path> listLearnedFilesIn(Path root) {
        Path dir = root.resolve(LEARNED_DIR);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(MARKDOWN_EXT))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("[Scanner] Failed to list learned files in {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    public static String relativeName(Path knowledgeRoot, Path file) {
        return knowledgeRoot.relativize(file).toString().replace('\\', '/');
    }

    // ==================== Plans ====================

    private List<PlanRecord> scanPlans(Path root, List<String> errors) {
        Map<String, PlanRecord> pointersByFile = new HashMap<>();
        List<PlanRecord> plans = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (Path pointerFile : listFiles(root.resolve(PLANS_DIR),
                path -> POINTER_FILE_PATTERN.matcher(path.getFileName().toString()).matches())) {
            parsePointer(root, pointerFile, errors).ifPresent(pointer -> {
                plans.add(pointer);
                ids.add(pointer.getId());
                pointersByFile.put(pointer.getFile(), pointer);
            });
        }

        for (Path planFile : listPlanFilesIn(root)) {
            Optional<PlanRecord> parsed = parsePlan(root, planFile, errors);
            if (parsed.isEmpty()) {
                continue;
            }
            PlanRecord plan = parsed.get();
            PlanRecord pointer = pointersByFile.get(plan.getFile());
            if (pointer != null) {
                mergeIntoPointer(pointer, plan);
            } else if (!ids.add(plan.getId())) {
                errors.add(plan.getFile() + ": Duplicate plan id: " + plan.getId());
            } else {
                plans.add(plan);
            }
        }
        return plans;
    }

    private Optional<PlanRecord> parsePointer(Path root, Path file, List<String> errors) {
        String relative = relativeName(root, file);
        Matcher nameMatcher = POINTER_FILE_PATTERN.matcher(file.getFileName().toString());
        if (!nameMatcher.matches()) {
            return Optional.empty();
        }
        String author = nameMatcher.group(1);

        Optional<String> content = readFile(root, file, errors);
        if (content.isEmpty()) {
            return Optional.empty();
        }
        MarkdownDocument document = parser.parse(content.get());
        String body = document.body();

        Optional<String[]> link = MarkdownFrontmatterParser.boldField(body, "Plan")
                .or(() -> MarkdownFrontmatterParser.boldField(body, "Currently Working On"))
                .flatMap(MarkdownFrontmatterParser::markdownLink);
        if (link.isEmpty()) {
            log.debug("[Scanner] No active plan referenced in {}", relative);
            return Optional.empty();
        }

        Optional<PlanStatus> status = resolveStatus(document, PlanStatus.ACTIVE, relative, errors);
        if (status.isEmpty()) {
            return Optional.empty();
        }

        String today = LocalDate.now(clock).toString();
        return Optional.of(PlanRecord.builder()
                .id(author + "-plan")
                .title(link.get()[0].trim())
                .status(status.get())
                .author(author)
                .created(today)
                .updated(today)
                .file(resolveLink(root, file, link.get()[1]))
                .build());
    }

    private Optional<PlanRecord> parsePlan(Path root, Path file, List<String> errors) {
        String relative = relativeName(root, file);
        Optional<String> content = readFile(root, file, errors);
        if (content.isEmpty()) {
            return Optional.empty();
        }
        MarkdownDocument document = parser.parse(content.get());
        if (document.hasErrors()) {
            document.errors().forEach(error -> errors.add(relative + ": " + error));
            return Optional.empty();
        }
        Map<String, Object> fm = document.frontmatter();
        String body = document.body();

        Optional<String> title = MarkdownFrontmatterParser.getString(fm, "title")
                .or(() -> MarkdownFrontmatterParser.firstHeading(body));
        if (title.isEmpty()) {
            errors.add(relative + ": Missing plan title");
            return Optional.empty();
        }

        Optional<PlanStatus> status = resolveStatus(document, PlanStatus.PLANNED, relative, errors);
        if (status.isEmpty()) {
            return Optional.empty();
        }

        String fileName = file.getFileName().toString();
        String created = MarkdownFrontmatterParser.getDate(fm, "created")
                .or(() -> MarkdownFrontmatterParser.boldDate(body, "Created"))
                .orElseGet(() -> modifiedDate(file));
        String updated = MarkdownFrontmatterParser.getDate(fm, "updated")
                .or(() -> MarkdownFrontmatterParser.boldDate(body, "Updated"))
                .orElse(created);

        List<String> topics = MarkdownFrontmatterParser.getStringList(fm, "topics");
        if (topics.isEmpty()) {
            topics = MarkdownFrontmatterParser.getStringList(fm, "tags");
        }

        return Optional.of(PlanRecord.builder()
                .id(fileName.substring(PLAN_PREFIX.length(), fileName.length() - MARKDOWN_EXT.length()))
                .title(title.get())
                .status(status.get())
                .author(MarkdownFrontmatterParser.getString(fm, "author").orElse(UNKNOWN_AUTHOR))
                .priority(MarkdownFrontmatterParser.getString(fm, "priority").orElse(null))
                .type(MarkdownFrontmatterParser.getString(fm, "type").orElse(null))
                .created(created)
                .updated(updated)
                .topics(new ArrayList<>(topics))
                .description(MarkdownFrontmatterParser.getString(fm, "description").orElse(null))
                .file(relative)
                .content(content.get())
                .build());
    }

    private void mergeIntoPointer(PlanRecord pointer, PlanRecord plan) {
        pointer.setCreated(plan.getCreated());
        pointer.setUpdated(plan.getUpdated());
        pointer.setPriority(plan.getPriority());
        pointer.setType(plan.getType());
        pointer.setTopics(plan.getTopics());
        pointer.setDescription(plan.getDescription());
        pointer.setContent(plan.getContent());
    }

    /**
     * Empty when the declared status is not a known value; the error is
     * recorded.
     */
    private Optional<PlanStatus> resolveStatus(MarkdownDocument document, PlanStatus fallback, String relative,
            List<String> errors) {
        Optional<String> declared = MarkdownFrontmatterParser.getString(document.frontmatter(), "status")
                .or(() -> MarkdownFrontmatterParser.boldField(document.body(), "Status")
                        .flatMap(MarkdownFrontmatterParser::firstWord));
        if (declared.isEmpty()) {
            return Optional.of(fallback);
        }
        Optional<PlanStatus> status = PlanStatus.fromValue(declared.get());
        if (status.isEmpty()) {
            errors.add(relative + ": Invalid plan status: " + declared.get());
        }
        return status;
    }

    private String resolveLink(Path root, Path pointerFile, String link) {
        try {
            Path target = pointerFile.getParent().resolve(link.trim()).normalize();
            if (target.startsWith(root)) {
                return relativeName(root, target);
            }
        } catch (InvalidPathException e) {
            log.debug("[Scanner] Plan link is not a local path: {}", link);
        }
        return link.replace("../", "").trim();
    }

    // ==================== Sessions ====================

    private List<SessionRecord> scanSessions(Path root, List<String> errors) {
        List<SessionRecord> sessions = new ArrayList<>();
        for (Path file : listFiles(root.resolve(SESSIONS_DIR),
                path -> SESSION_FILE_PATTERN.matcher(path.getFileName().toString()).matches())) {
            parseSession(root, file, errors).ifPresent(sessions::add);
        }
        return sessions;
    }

    private Optional<SessionRecord> parseSession(Path root, Path file, List<String> errors) {
        String relative = relativeName(root, file);
        String fileName = file.getFileName().toString();
        Matcher nameMatcher = SESSION_FILE_PATTERN.matcher(fileName);
        if (!nameMatcher.matches()) {
            return Optional.empty();
        }
        String date = nameMatcher.group(1);
        try {
            LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            errors.add(relative + ": Invalid session date: " + date);
            return Optional.empty();
        }

        Optional<String> content = readFile(root, file, errors);
        if (content.isEmpty()) {
            return Optional.empty();
        }
        MarkdownDocument document = parser.parse(content.get());
        if (document.hasErrors()) {
            document.errors().forEach(error -> errors.add(relative + ": " + error));
            return Optional.empty();
        }
        Map<String, Object> fm = document.frontmatter();
        String body = document.body();

        String topic = MarkdownFrontmatterParser.getString(fm, "topic")
                .or(() -> {
                    Matcher matcher = SESSION_HEADING_PATTERN.matcher(body);
                    return matcher.find() ? Optional.of(matcher.group(1).trim()) : Optional.empty();
                })
                .or(() -> MarkdownFrontmatterParser.firstHeading(body))
                .orElse(DEFAULT_SESSION_TOPIC);

        String plan = MarkdownFrontmatterParser.getString(fm, "plan")
                .or(() -> MarkdownFrontmatterParser.boldField(body, "Plan"))
                .map(value -> MarkdownFrontmatterParser.markdownLink(value).map(link -> link[0]).orElse(value))
                .orElse(null);

        List<String> topics = MarkdownFrontmatterParser.getStringList(fm, "topics");
        if (topics.isEmpty()) {
            topics = MarkdownFrontmatterParser.getStringList(fm, "tags");
        }

        return Optional.of(SessionRecord.builder()
                .id(fileName.substring(0, fileName.length() - MARKDOWN_EXT.length()))
                .date(date)
                .topic(topic)
                .plan(plan)
                .duration(MarkdownFrontmatterParser.getString(fm, "duration")
                        .or(() -> MarkdownFrontmatterParser.boldField(body, "Duration"))
                        .orElse(null))
                .status(MarkdownFrontmatterParser.getString(fm, "status").orElse(null))
                .phases(new ArrayList<>(MarkdownFrontmatterParser.getStringList(fm, "phases")))
                .topics(new ArrayList<>(topics))
                .file(relative)
                .created(MarkdownFrontmatterParser.getDate(fm, "created").orElse(date))
                .updated(MarkdownFrontmatterParser.getDate(fm, "updated").orElse(date))
                .content(content.get())
                .build());
    }

    // ==================== Learned ====================

    private List<LearnedPattern> scanLearned(Path root, List<String> errors) {
        Path learnedDir = root.resolve(LEARNED_DIR);
        List<LearnedPattern> learned = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (Path file : listLearnedFilesIn(root)) {
            parseLearned(root, learnedDir, file, errors).ifPresent(pattern -> {
                if (ids.add(pattern.getId())) {
                    learned.add(pattern);
                } else {
                    errors.add(pattern.getFile() + ": Duplicate learned pattern id: " + pattern.getId());
                }
            });
        }
        return learned;
    }

    private Optional<LearnedPattern> parseLearned(Path root, Path learnedDir, Path file, List<String> errors) {
        String relative = relativeName(root, file);
        Optional<String> content = readFile(root, file, errors);
        if (content.isEmpty()) {
            return Optional.empty();
        }
        MarkdownDocument document = parser.parse(content.get());
        if (document.hasErrors()) {
            document.errors().forEach(error -> errors.add(relative + ": " + error));
            return Optional.empty();
        }
        Map<String, Object> fm = document.frontmatter();
        String body = document.body();

        String inLearned = relativeName(learnedDir, file);
        String id = inLearned.substring(0, inLearned.length() - MARKDOWN_EXT.length()).replace('/', '-');
        int slash = inLearned.indexOf('/');
        String category = MarkdownFrontmatterParser.getString(fm, "category")
                .orElse(slash > 0 ? inLearned.substring(0, slash) : DEFAULT_CATEGORY);

        List<String> keywords = MarkdownFrontmatterParser.getStringList(fm, "keywords");
        if (keywords.isEmpty()) {
            keywords = MarkdownFrontmatterParser.getStringList(fm, "triggers");
        }
        if (keywords.isEmpty()) {
            keywords = MarkdownFrontmatterParser.sectionBullets(body, "Trigger Words");
        }

        String title = MarkdownFrontmatterParser.getString(fm, "title")
                .or(() -> MarkdownFrontmatterParser.firstHeading(body)
                        .map(heading -> heading.replaceFirst("^Learned Skill:\\s*", "")))
                .orElse(id);

        return Optional.of(LearnedPattern.builder()
                .id(id)
                .category(category)
                .title(title)
                .keywords(new ArrayList<>(keywords))
                .created(MarkdownFrontmatterParser.getDate(fm, "created").orElseGet(() -> modifiedDate(file)))
                .file(relative)
                .content(content.get())
                .build());
    }

    // ==================== File helpers ====================

    private Optional<String> readFile(Path root, Path file, List<String> errors) {
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException | RuntimeException e) { // NOSONAR - unreadable files are reported and skipped
            log.warn("[Scanner] Failed to read {}: {}", file, e.getMessage());
            errors.add(relativeName(root, file) + ": Failed to read file: " + e.getMessage());
            return Optional.empty();
        }
    }

    private String modifiedDate(Path file) {
        try {
            return LocalDate.ofInstant(Files.getLastModifiedTime(file).toInstant(), clock.getZone()).toString();
        } catch (IOException e) {
            return LocalDate.now(clock).toString();
        }
    }

    private List<Path> listFiles(Path dir, Predicate<Path> filter) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.list(dir)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(filter)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            log.warn("[Scanner] Failed to list {}: {}", dir, e.getMessage());
            return List.of();
        }
    }
}
