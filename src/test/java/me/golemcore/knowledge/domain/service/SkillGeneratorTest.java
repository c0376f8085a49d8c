package me.golemcore.knowledge.domain.service;

import me.golemcore.knowledge.KnowledgeTestFixtures;
import me.golemcore.knowledge.domain.exception.KnowledgeValidationException;
import me.golemcore.knowledge.domain.model.LearnedPattern;
import me.golemcore.knowledge.domain.model.SkillCreationOptions;
import me.golemcore.knowledge.domain.model.SkillCreationResult;
import me.golemcore.knowledge.domain.model.SkillExample;
import me.golemcore.knowledge.domain.model.SkillPattern;
import me.golemcore.knowledge.infrastructure.config.KnowledgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SkillGeneratorTest {

    @TempDir
    Path workspace;

    private KnowledgeProperties properties;
    private SkillGenerator generator;
    private SkillPattern pattern;

    @BeforeEach
    void setUp() {
        properties = KnowledgeTestFixtures.properties("json");
        generator = new SkillGenerator(properties, KnowledgeTestFixtures.fixedClock());
        pattern = SkillPattern.builder()
                .error("Chalk import error")
                .resolution("Use the default import: import chalk from 'chalk'")
                .keywords(List.of("chalk", "import", "error"))
                .frequency(3)
                .build();
    }

    @Test
    void shouldWriteSharedSkillWithFrontmatterAndSections() throws IOException {
        SkillCreationResult result = generator.createLearnedSkill(pattern, workspace,
                SkillCreationOptions.sharedSkill());

        Path expected = workspace.resolve(".aiknowsys/learned/chalk-import-error.md").toAbsolutePath().normalize();
        assertEquals(expected, result.path());
        assertTrue(result.created());
        assertFalse(result.existed());

        String content = Files.readString(expected);
        assertTrue(content.startsWith("---\ncategory: learned\nkeywords: [\"chalk\", \"import\", \"error\"]\n"
                + "created: 2026-02-11\n---\n"));
        assertTrue(content.contains("# Learned Skill: Chalk import error\n"));
        assertTrue(content.contains("**Description:** Pattern discovered from 3 occurrences"));
        assertTrue(content.contains("## Trigger Words\n\n- `chalk`\n- `import`\n- `error`\n"));
        assertTrue(content.contains("## Resolution\n\nUse the default import: import chalk from 'chalk'\n"));
        assertTrue(content.endsWith("*Auto-generated learned skill. Edit as needed.*\n"));
        assertFalse(content.contains("## Examples"));
    }

    @Test
    void shouldNeverOverwriteExistingSkill() throws IOException {
        SkillCreationResult first = generator.createLearnedSkill(pattern, workspace, null);
        Files.writeString(first.path(), "edited by hand");

        SkillCreationResult second = generator.createLearnedSkill(pattern, workspace, null);

        assertFalse(second.created());
        assertTrue(second.existed());
        assertEquals(first.path(), second.path());
        assertEquals("edited by hand", Files.readString(second.path()));
    }

    @Test
    void shouldWritePersonalSkillUnderUsername() {
        SkillCreationResult result = generator.createLearnedSkill(pattern, workspace,
                SkillCreationOptions.builder().shared(false).username("alice").build());

        assertEquals(workspace.resolve(".aiknowsys/personal/alice/chalk-import-error.md").toAbsolutePath().normalize(),
                result.path());
        assertTrue(Files.exists(result.path()));
    }

    @Test
    void shouldFallBackToSharedWithoutUsername() {
        SkillCreationResult result = generator.createLearnedSkill(pattern, workspace,
                SkillCreationOptions.builder().shared(false).build());

        assertEquals(workspace.resolve(".aiknowsys/learned/chalk-import-error.md").toAbsolutePath().normalize(),
                result.path());
    }

    @Test
    void shouldBlockPathTraversalInUsername() {
        SkillCreationOptions options = SkillCreationOptions.builder().shared(false).username("../../etc").build();

        assertThrows(KnowledgeValidationException.class,
                () -> generator.createLearnedSkill(pattern, workspace, options));
    }

    @Test
    void shouldRejectPatternWithoutErrorText() {
        SkillPattern empty = SkillPattern.builder().error(" ").build();

        assertThrows(KnowledgeValidationException.class, () -> generator.createLearnedSkill(empty, workspace, null));
    }

    @Test
    void shouldRenderExamplesAndRelatedSkills() {
        pattern.setExamples(List.of(new SkillExample("import { red } from 'chalk'", "import chalk from 'chalk'")));
        pattern.setRelatedSkills(List.of("esm-migration"));

        String content = generator.render(pattern);

        assertTrue(content.contains("## Examples\n\n**Before:**\n```\nimport { red } from 'chalk'\n```\n"));
        assertTrue(content.contains("**After:**\n```\nimport chalk from 'chalk'\n```\n"));
        assertTrue(content.contains("## Related Skills\n\n- esm-migration\n"));
    }

    @Test
    void shouldProduceFileTheScannerReadsBack() {
        generator.createLearnedSkill(pattern, workspace, null);

        List<LearnedPattern> learned = KnowledgeTestFixtures.scanner(properties).scan(workspace).learned();

        assertEquals(1, learned.size());
        assertEquals("chalk-import-error", learned.get(0).getId());
        assertEquals("learned", learned.get(0).getCategory());
        assertEquals(List.of("chalk", "import", "error"), learned.get(0).getKeywords());
        assertEquals("Chalk import error", learned.get(0).getTitle());
    }

    @Test
    void shouldSlugifyText() {
        assertEquals("cannot-find-module-chalk", SkillGenerator.slugify("Cannot find module 'chalk'!"));
        assertEquals("learned-skill", SkillGenerator.slugify("!!!"));
        String capped = SkillGenerator.slugify("word ".repeat(40));
        assertTrue(capped.length() <= 80);
        assertFalse(capped.endsWith("-"));
    }
}
