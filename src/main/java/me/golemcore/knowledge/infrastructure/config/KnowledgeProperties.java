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

package me.golemcore.knowledge.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties bound from {@code application.properties} under the
 * {@code knowledge.*} prefix.
 *
 * <ul>
 * <li>{@link StorageProperties} - backend selection and rebuild policy</li>
 * <li>{@link LocatorProperties} - database location overrides</li>
 * <li>{@link SearchProperties} - snippet window</li>
 * <li>{@link PatternProperties} - similarity clustering thresholds</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "knowledge")
@Data
public class KnowledgeProperties {

    private StorageProperties storage = new StorageProperties();
    private LocatorProperties locator = new LocatorProperties();
    private SearchProperties search = new SearchProperties();
    private PatternProperties patterns = new PatternProperties();

    @Data
    public static class StorageProperties {
        /** json, sqlite or auto (sqlite when the located database exists). */
        private String adapter = "auto";
        private boolean autoRebuild = true;
        private String knowledgeDir = ".aiknowsys";
        private String indexFile = "context-index.json";
        private boolean backupIndex = false;
    }

    @Data
    public static class LocatorProperties {
        private String envVariable = "AIKNOWSYS_DB_PATH";
        private String configFile = ".aiknowsys.config";
        private String defaultDbDir = ".aiknowsys";
        private String defaultDbFile = "knowledge.db";
    }

    @Data
    public static class SearchProperties {
        private int snippetBefore = 50;
        private int snippetAfter = 100;
        private int defaultLimit = 50;
    }

    @Data
    public static class PatternProperties {
        private double similarityThreshold = 0.4;
        private int minFrequency = 3;
        private int windowDays = 30;
        private int maxKeywords = 5;
    }
}
