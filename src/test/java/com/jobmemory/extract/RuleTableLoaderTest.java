package com.jobmemory.extract;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleTableLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void bundledTableHasTheCoreRules() {
        var table = RuleTableLoader.loadDefault();

        var names = table.rules().stream().map(ExtractionRule::name).toList();
        assertTrue(names.containsAll(List.of("skills", "roles", "companies", "preferences")));
        assertFalse(table.jobKeywords().isEmpty());
        assertEquals(2, table.relations().size());
    }

    @Test
    void customFileReplacesBundledTable() throws IOException {
        var rules = tempDir.resolve("rules.yaml");
        Files.writeString(rules, """
                job-keywords: ["gig"]
                rules:
                  - name: tools
                    entity-type: tool
                    keywords: ["Vim"]
                    aliases:
                      NVim: Vim
                relations: []
                """);

        var table = RuleTableLoader.loadOrDefault(rules);

        assertEquals(1, table.rules().size());
        var rule = table.rules().get(0);
        assertEquals(ExtractionShape.KEYWORD, rule.shape());
        assertTrue(rule.jobSignal());
        assertEquals("Vim", rule.canonical("nvim"));

        var delta = new ObservationExtractor(table).extract("u1", "gig using nvim");
        assertEquals("Vim", delta.observations().get(0).entityName());
    }

    @Test
    void missingFileFallsBackToBundledTable() {
        var table = RuleTableLoader.loadOrDefault(tempDir.resolve("absent.yaml"));
        assertEquals(RuleTableLoader.loadDefault(), table);
    }

    @Test
    void fixedEntityRuleNeedsAName() throws IOException {
        var rules = tempDir.resolve("bad.yaml");
        Files.writeString(rules, """
                rules:
                  - name: broken
                    shape: fixed-entity
                    keywords: ["x"]
                """);

        assertThrows(IllegalArgumentException.class, () -> RuleTableLoader.loadOrDefault(rules));
    }

    @Test
    void shapeNamesParseWithDashes() {
        assertEquals(ExtractionShape.ROLE_PHRASE, ExtractionShape.parse("role-phrase"));
        assertEquals(ExtractionShape.FIXED_ENTITY, ExtractionShape.parse("FIXED_ENTITY"));
        assertEquals(ExtractionShape.KEYWORD, ExtractionShape.parse(null));
    }
}
