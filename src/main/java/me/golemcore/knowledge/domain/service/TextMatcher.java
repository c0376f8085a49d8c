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

import java.util.Locale;
import java.util.Optional;

/**
 * Case-insensitive literal matching shared by both storage backends, so a
 * query scores the same whichever backend serves it.
 */
public final class TextMatcher {

    private static final String ELLIPSIS = "...";
    private static final int POINTS_PER_OCCURRENCE = 10;
    private static final int MAX_RELEVANCE = 100;

    private TextMatcher() {
    }

    /**
     * Location and score of the first occurrence of {@code query} in
     * {@code content}.
     */
    public record Match(int line, String context, int occurrences) {

        public int relevance() {
            return Math.min(MAX_RELEVANCE, occurrences * POINTS_PER_OCCURRENCE);
        }
    }

    public static Optional<Match> find(String content, String query, int before, int after) {
        if (content == null || query == null || query.isBlank()) {
            return Optional.empty();
        }
        String haystack = content.toLowerCase(Locale.ROOT);
        String needle = query.toLowerCase(Locale.ROOT);
        int first = haystack.indexOf(needle);
        if (first < 0) {
            return Optional.empty();
        }

        int occurrences = 0;
        int from = first;
        while (from >= 0) {
            occurrences++;
            from = haystack.indexOf(needle, from + needle.length());
        }

        int index = Math.min(first, content.length());
        int line = 1;
        for (int i = 0; i < index; i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return Optional.of(new Match(line, snippet(content, index, before, after), occurrences));
    }

    public static boolean containsIgnoreCase(String text, String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return true;
        }
        return text != null && text.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
    }

    static String snippet(String content, int index, int before, int after) {
        int start = Math.max(0, index - before);
        int end = Math.min(content.length(), index + after);
        String window = content.substring(start, end).replaceAll("\\s+", " ").trim();
        return (start > 0 ? ELLIPSIS : "") + window + (end < content.length() ? ELLIPSIS : "");
    }
}
