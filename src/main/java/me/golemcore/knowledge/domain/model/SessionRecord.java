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
 * Full session row, see {@link PlanRecord} for the content convention.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionRecord {

    private String projectId;
    private String id;
    private String date;
    private String topic;
    private String plan;
    private String duration;
    private String status;

    @Builder.Default
    private List<String> phases = new ArrayList<>();

    @Builder.Default
    private List<String> topics = new ArrayList<>();

    private String file;
    private String created;
    private String updated;
    private String content;

    public SessionMetadata toMetadata() {
        return SessionMetadata.builder()
                .id(id)
                .date(date)
                .topic(topic)
                .plan(plan)
                .duration(duration)
                .status(status)
                .phases(phases != null ? new ArrayList<>(phases) : new ArrayList<>())
                .topics(topics != null ? new ArrayList<>(topics) : new ArrayList<>())
                .file(file)
                .created(created)
                .updated(updated)
                .build();
    }
}
