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

package me.golemcore.knowledge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the knowledge base service.
 *
 * <p>
 * Plans, session logs and learned patterns live as markdown files with YAML
 * frontmatter under {@code .aiknowsys/}. This application keeps a derived,
 * rebuildable store over them and exposes querying, search and pattern
 * learning.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Domain Layer       → query facades, pattern detector/tracker, skill generator
 * Ports              → KnowledgeStoragePort
 * Infrastructure     → JSON index and SQLite adapters, database locator
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code knowledge.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class KnowledgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(KnowledgeApplication.class, args);
    }

}
