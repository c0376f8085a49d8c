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

import me.golemcore.knowledge.domain.exception.KnowledgeValidationException;
import me.golemcore.knowledge.domain.model.PlanStatus;
import me.golemcore.knowledge.domain.model.SearchScope;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Input checks run before any storage is opened.
 */
final class QueryValidator {

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private QueryValidator() {
    }

    static String date(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (!ISO_DATE.matcher(trimmed).matches()) {
            throw new KnowledgeValidationException("Invalid date format: " + value + ". Expected YYYY-MM-DD");
        }
        try {
            LocalDate.parse(trimmed);
        } catch (DateTimeParseException e) {
            throw new KnowledgeValidationException("Invalid date format: " + value + ". Expected YYYY-MM-DD");
        }
        return trimmed;
    }

    static PlanStatus status(String value) {
        if (value == null) {
            return null;
        }
        return PlanStatus.fromValue(value).orElseThrow(() -> new KnowledgeValidationException(
                "Invalid plan status: " + value + ". Valid statuses: " + PlanStatus.validValues()));
    }

    static SearchScope scope(String value) {
        if (value == null) {
            return SearchScope.ALL;
        }
        return SearchScope.fromValue(value).orElseThrow(() -> new KnowledgeValidationException(
                "Invalid scope: " + value + ". Must be one of: " + SearchScope.validValues()));
    }

    static String query(String value) {
        if (value == null || value.isBlank()) {
            throw new KnowledgeValidationException("Search query cannot be empty");
        }
        return value.trim();
    }

    static Integer days(Integer value) {
        if (value != null && value < 0) {
            throw new KnowledgeValidationException("Invalid days value: " + value + ". Must be zero or positive");
        }
        return value;
    }

    static int limit(int value) {
        if (value <= 0) {
            throw new KnowledgeValidationException("Invalid limit: " + value + ". Must be positive");
        }
        return value;
    }

    static String text(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    static Path targetDir(Path value) {
        Path dir = value != null ? value : Path.of("");
        return dir.toAbsolutePath().normalize();
    }
}
