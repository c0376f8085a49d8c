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

package me.golemcore.knowledge.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Subset of the knowledge base a full-text search covers.
 */
public enum SearchScope {
    ALL("all"), PLANS("plans"), SESSIONS("sessions"), LEARNED("learned");

    private final String value;

    SearchScope(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean includes(SearchResultType type) {
        return switch (this) {
        case ALL -> true;
        case PLANS -> type == SearchResultType.PLAN;
        case SESSIONS -> type == SearchResultType.SESSION;
        case LEARNED -> type == SearchResultType.LEARNED;
        };
    }

    public static Optional<SearchScope> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(scope -> scope.value.equals(normalized))
                .findFirst();
    }

    public static String validValues() {
        return Arrays.stream(values())
                .map(SearchScope::getValue)
                .collect(Collectors.joining(", "));
    }
}
