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

/**
 * Conjunctive session filters; null fields are ignored. Date bounds are
 * inclusive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionFilters {

    private String date;
    private String dateAfter;
    private String dateBefore;
    private String topic;
    private String plan;

    // relational backend only
    private String status;
    private String contentContains;

    public static SessionFilters none() {
        return new SessionFilters();
    }
}
