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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Indexed view of a plan file. Dates are ISO {@code YYYY-MM-DD} strings so they
 * compare lexicographically.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanMetadata {

    private String id;
    private String title;
    private PlanStatus status;
    private String author;
    private String priority;
    private String created;
    private String updated;

    @Builder.Default
    private List<String> topics = new ArrayList<>();

    private String description;
    private String file; // relative to the knowledge directory
}
