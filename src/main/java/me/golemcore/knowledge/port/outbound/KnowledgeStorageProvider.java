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

package me.golemcore.knowledge.port.outbound;

import java.nio.file.Path;

/**
 * Opens initialized storage for a workspace. The caller closes what it gets.
 */
public interface KnowledgeStorageProvider {

    /**
     * Storage of the configured type.
     */
    KnowledgeStoragePort open(Path targetDir);

    /**
     * Relational storage, regardless of the configured type.
     */
    RelationalKnowledgeStoragePort openRelational(Path targetDir);
}
