package me.golemcore.knowledge.infrastructure.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.knowledge.domain.model.PatternEntry;
import me.golemcore.knowledge.domain.model.SearchResult;
import me.golemcore.knowledge.domain.model.SearchResultType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KnowledgeConfigurationTest {

    private static final Instant FIXED_INSTANT = Instant.parse("2026-02-11T10:00:00Z");

    @Test
    void shouldWriteInstantsAsIsoStrings() throws JsonProcessingException {
        ObjectMapper mapper = KnowledgeConfiguration.objectMapper();
        PatternEntry entry = PatternEntry.builder().id("x").error("x").firstSeen(FIXED_INSTANT).build();

        String json = mapper.writeValueAsString(entry);

        assertTrue(json.contains("\"firstSeen\" : \"2026-02-11T10:00:00Z\""), json);
        assertEquals(FIXED_INSTANT, mapper.readValue(json, PatternEntry.class).getFirstSeen());
    }

    @Test
    void shouldIgnoreUnknownPropertiesAndWriteLowercaseTypes() throws JsonProcessingException {
        ObjectMapper mapper = KnowledgeConfiguration.objectMapper();

        SearchResult result = mapper.readValue("{\"file\": \"PLAN_a.md\", \"score\": 3, \"type\": \"plan\"}",
                SearchResult.class);

        assertEquals("PLAN_a.md", result.getFile());
        assertEquals(SearchResultType.PLAN, result.getType());
        assertTrue(mapper.writeValueAsString(result).contains("\"type\" : \"plan\""));
    }

    @Test
    void shouldProvideSystemClock() {
        assertNotNull(KnowledgeConfiguration.clock());
    }

    @Test
    void shouldDefaultPropertiesToDocumentedValues() {
        KnowledgeProperties properties = new KnowledgeProperties();

        assertEquals("auto", properties.getStorage().getAdapter());
        assertTrue(properties.getStorage().isAutoRebuild());
        assertEquals(".aiknowsys", properties.getStorage().getKnowledgeDir());
        assertEquals("context-index.json", properties.getStorage().getIndexFile());
        assertEquals("AIKNOWSYS_DB_PATH", properties.getLocator().getEnvVariable());
        assertEquals(50, properties.getSearch().getSnippetBefore());
        assertEquals(100, properties.getSearch().getSnippetAfter());
        assertEquals(0.4, properties.getPatterns().getSimilarityThreshold());
        assertEquals(3, properties.getPatterns().getMinFrequency());
        assertEquals(30, properties.getPatterns().getWindowDays());
    }
}
