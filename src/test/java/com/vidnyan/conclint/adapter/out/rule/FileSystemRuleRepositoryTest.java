package com.vidnyan.conclint.adapter.out.rule;

import com.vidnyan.conclint.config.ConclintConfiguration;
import com.vidnyan.conclint.domain.rule.RuleDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.vidnyan.conclint.TestTrees.catalog;
import static org.junit.jupiter.api.Assertions.*;

class FileSystemRuleRepositoryTest {

    @TempDir
    Path tempDir;

    @Test
    void loadRules_ShouldLoadBundledCatalog() {
        List<RuleDefinition> rules = catalog().findAll();

        assertEquals(23, rules.size());
        assertEquals("ARCH_001", rules.get(0).id());
        for (RuleDefinition rule : rules) {
            assertTrue(rule.messageTemplate().startsWith("[" + rule.id() + "]"), rule.id());
            assertNotNull(rule.docAnchor(), rule.id());
            assertTrue(rule.isEnabled(), rule.id());
        }
    }

    @Test
    void findAll_ShouldKeepCategoriesSortedById() {
        List<String> scope = catalog().findAll().stream()
                .filter(r -> r.category() == RuleDefinition.Category.SCOPE)
                .map(RuleDefinition::id)
                .toList();

        assertEquals(List.of("SCOPE_001", "SCOPE_002", "SCOPE_003", "SCOPE_004", "SCOPE_005", "SCOPE_006"), scope);
        assertEquals(4, catalog().findAll().stream()
                .filter(r -> r.category() == RuleDefinition.Category.DISPATCHER)
                .count());
        assertEquals(RuleDefinition.Category.ARCHITECTURE, catalog().findById("ARCH_001").orElseThrow().category());
    }

    @Test
    void findById_ShouldResolveNameAndSeverity() {
        RuleDefinition rule = catalog().findById("RUNBLOCK_002").orElseThrow();

        assertEquals("BlockingBridgeInSuspend", rule.name());
        assertEquals(RuleDefinition.Severity.ERROR, rule.severity());
        assertEquals(RuleDefinition.Category.RUN_BLOCKING, rule.category());
        assertTrue(catalog().findById("NOPE_001").isEmpty());
    }

    @Test
    void loadRules_ShouldSkipBrokenFilesAndApplyDefaults() throws IOException {
        Files.writeString(tempDir.resolve("a.json"), "{\"id\":\"X_001\",\"name\":\"First\",\"severity\":\"warn\","
                + "\"category\":\"dispatch\",\"message\":\"[X_001] first\",\"enabled\":false}");
        Files.writeString(tempDir.resolve("b.json"), "{\"id\":\"X_003\",\"category\":\"Run Blocking\"}");
        Files.writeString(tempDir.resolve("c.json"), "{\"id\":\"X_002\",\"category\":\"weather\"}");
        Files.writeString(tempDir.resolve("d.json"), "not json");

        FileSystemRuleRepository repository = new FileSystemRuleRepository(
                new ConclintConfiguration().objectMapper(), "file:" + tempDir.toAbsolutePath() + "/*.json");
        repository.loadRules();

        assertEquals(2, repository.findAll().size());
        RuleDefinition rule = repository.findById("X_001").orElseThrow();
        assertEquals("First", rule.name());
        assertEquals(RuleDefinition.Severity.WARNING, rule.severity());
        assertEquals(RuleDefinition.Category.DISPATCHER, rule.category());
        RuleDefinition defaulted = repository.findById("X_003").orElseThrow();
        assertEquals("X_003", defaulted.name());
        assertEquals(RuleDefinition.Category.RUN_BLOCKING, defaulted.category());
        assertEquals(List.of("X_003"), repository.findEnabled().stream().map(RuleDefinition::id).toList());
    }
}
