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

import java.util.List;
import java.util.Map;

/**
 * A markdown file split into its YAML frontmatter and body. A document without
 * frontmatter has an empty map; a malformed block also leaves an entry in
 * {@code errors}.
 */
public record MarkdownDocument(Map<String, Object> frontmatter, String body, List<String> errors) {

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
