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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A learned-skill document from {@code learned/}. The JSON index never stores
 * {@code content}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LearnedPattern {

    private String projectId;
    private String id;
    private String category;
    private String title;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private String created;
    private String file;
    private String content;

    public LearnedPattern withoutContent() {
        return LearnedPattern.builder()
                .projectId(projectId)
                .id(id)
                .category(category)
                .title(title)
                .keywords(keywords != null ? new ArrayList<>(keywords) : new ArrayList<>())
                .created(created)
                .file(file)
                .build();
    }
}
