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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.domain.model.MarkdownDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits knowledge markdown files into YAML frontmatter and body, and reads the
 * bold-label conventions ({@code **Status:** ACTIVE}) used when frontmatter is
 * missing.
 *
 * <p>
 * Never throws on malformed input: a broken frontmatter block yields an empty
 * map and an entry in {@link MarkdownDocument#errors()}.
 */
@Component
@Slf4j
public class MarkdownFrontmatterParser {

    private static final Pattern FRONTMATTER_PATTERN = Pattern.compile(
            "^---[ \\t]*\\n(?:(.*?)\\n)?---[ \\t]*(?:\\n(.*))?$", Pattern.DOTALL);
    private static final Pattern HEADING_PATTERN = Pattern.compile("^#\\s+(.+?)\\s*$", Pattern.MULTILINE);
    private static final Pattern ISO_DATE_PATTERN = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})");
    private static final Pattern MARKDOWN_LINK_PATTERN = Pattern.compile("\\[([^\\]]+)]\\(([^)]+)\\)");

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public MarkdownDocument parse(String content) {
        String normalized = content == null ? "" : content.replace("\r\n", "\n");
        if (normalized.startsWith("\uFEFF")) {
            normalized = normalized.substring(1);
        }

        Matcher matcher = FRONTMATTER_PATTERN.matcher(normalized);
        if (!matcher.matches()) {
            return new MarkdownDocument(Map.of(), normalized, List.of());
        }

        String frontmatter = matcher.group(1);
        String body = matcher.group(2) != null ? matcher.group(2) : "";
        if (frontmatter == null || frontmatter.isBlank()) {
            return new MarkdownDocument(Map.of(), body, List.of());
        }

        try {
            Map<String, Object> yaml = yamlMapper.readValue(frontmatter, MAP_TYPE);
            return new MarkdownDocument(yaml != null ? yaml : Map.of(), body, List.of());
        } catch (IOException | RuntimeException e) { // NOSONAR - malformed frontmatter degrades to empty
            log.debug("Failed to parse frontmatter: {}", e.getMessage());
            return new MarkdownDocument(Map.of(), body, List.of("Invalid YAML frontmatter: " + firstLine(e.getMessage())));
        }
    }

    // ==================== Frontmatter accessors ====================

    public static Optional<String> getString(Map<String, Object> frontmatter, String key) {
        Object value = frontmatter.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /**
     * Reads a list value written either as a YAML sequence or as a comma
     * separated string, optionally in brackets.
     */
    public static List<String> getStringList(Map<String, Object> frontmatter, String key) {
        Object value = frontmatter.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString().trim());
                }
            }
        } else if (value != null) {
            String text = value.toString().trim();
            if (text.startsWith("[") && text.endsWith("]")) {
                text = text.substring(1, text.length() - 1);
            }
            Arrays.stream(text.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(result::add);
        }
        return result;
    }

    /**
     * Reads a date value as ISO {@code YYYY-MM-DD}, accepting full timestamps.
     */
    public static Optional<String> getDate(Map<String, Object> frontmatter, String key) {
        return getString(frontmatter, key).flatMap(MarkdownFrontmatterParser::extractIsoDate);
    }

    // ==================== Body conventions ====================

    public static Optional<String> firstHeading(String body) {
        Matcher matcher = HEADING_PATTERN.matcher(body);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * Value of the first {@code **Label:** value} line.
     */
    public static Optional<String> boldField(String body, String label) {
        Pattern pattern = Pattern.compile("^\\s*(?:[-*]\\s+)?\\*\\*" + Pattern.quote(label) + ":\\*\\*[ \\t]*(.+?)\\s*$",
                Pattern.MULTILINE);
        Matcher matcher = pattern.matcher(body);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    public static Optional<String> boldDate(String body, String label) {
        return boldField(body, label).flatMap(MarkdownFrontmatterParser::extractIsoDate);
    }

    /**
     * First alphabetic word of a value such as {@code "🎯 ACTIVE (phase 2)"}.
     */
    public static Optional<String> firstWord(String value) {
        Matcher matcher = Pattern.compile("([A-Za-z_]+)").matcher(value);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    public static Optional<String[]> markdownLink(String value) {
        Matcher matcher = MARKDOWN_LINK_PATTERN.matcher(value);
        return matcher.find() ? Optional.of(new String[] { matcher.group(1), matcher.group(2) }) : Optional.empty();
    }

    /**
     * Items of the bullet list directly under a {@code ## heading}.
     */
    public static List<String> sectionBullets(String body, String heading) {
        List<String> items = new ArrayList<>();
        boolean inSection = false;
        for (String line : body.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("#")) {
                if (inSection) {
                    break;
                }
                inSection = trimmed.replaceFirst("^#+\\s*", "").equalsIgnoreCase(heading);
                continue;
            }
            if (inSection && (trimmed.startsWith("- ") || trimmed.startsWith("* "))) {
                String item = trimmed.substring(2).replace("`", "").trim();
                if (!item.isEmpty()) {
                    items.add(item);
                }
            }
        }
        return items;
    }

    private static Optional<String> extractIsoDate(String text) {
        Matcher matcher = ISO_DATE_PATTERN.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }
}
