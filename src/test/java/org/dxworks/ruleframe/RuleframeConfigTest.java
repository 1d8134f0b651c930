package org.dxworks.ruleframe;

import org.dxworks.ruleframe.RuleframeConfig.HasConditionsMode;
import org.dxworks.ruleframe.model.FormRequestRules;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.dxworks.ruleframe.TestUtils.php;
import static org.junit.jupiter.api.Assertions.*;

class RuleframeConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        RuleframeConfig config = RuleframeConfig.load(tempDir.resolve("ruleframe-config.yml"));

        assertEquals(20000, config.getMaxFileLines());
        assertEquals("rules", config.getRulesMethod());
        assertEquals("Rule", config.getRuleBuilderClass());
        assertEquals("array_merge", config.getMergeFunction());
        assertEquals(HasConditionsMode.LAST_RETURN, config.getHasConditionsMode());
        assertTrue(config.isHelperMethod("baseRules"));
        assertFalse(config.isHelperMethod(null));
    }

    @Test
    void yamlOverridesDefaults() throws IOException {
        Path file = tempDir.resolve("ruleframe-config.yml");
        Files.writeString(file, php(
                "maxFileLines: 500",
                "rulesMethod: validationRules",
                "helperMethods:",
                "  - sharedRules",
                "requestFieldAccessors: [has, exists]",
                "hasConditionsMode: ANY_ENTRY",
                "somethingUnknown: true"));

        RuleframeConfig config = RuleframeConfig.load(file);

        assertEquals(500, config.getMaxFileLines());
        assertEquals("validationRules", config.getRulesMethod());
        assertEquals(List.of("sharedRules"), config.getHelperMethods());
        assertEquals(List.of("has", "exists"), config.getRequestFieldAccessors());
        assertEquals(List.of("isMethod", "method"), config.getHttpMethodAccessors());
        assertEquals(HasConditionsMode.ANY_ENTRY, config.getHasConditionsMode());
    }

    @Test
    void invalidValuesFallBackToDefaults() throws IOException {
        Path file = tempDir.resolve("ruleframe-config.yml");
        Files.writeString(file, php(
                "maxFileLines: -3",
                "rulesMethod: '  '",
                "helperMethods: []"));

        RuleframeConfig config = RuleframeConfig.load(file);

        assertEquals(20000, config.getMaxFileLines());
        assertEquals("rules", config.getRulesMethod());
        assertEquals(List.of("additionalRules", "baseRules", "commonRules"), config.getHelperMethods());
    }

    @Test
    void unreadableYamlGivesDefaults() throws IOException {
        Path file = tempDir.resolve("ruleframe-config.yml");
        Files.writeString(file, "maxFileLines: [not, a, number");

        assertEquals(20000, RuleframeConfig.load(file).getMaxFileLines());
    }

    @Test
    void configuredRulesMethodIsAnalyzed() throws IOException {
        Path file = tempDir.resolve("ruleframe-config.yml");
        Files.writeString(file, "rulesMethod: validationRules");
        String source = php(
                "<?php",
                "class ImportRequest",
                "{",
                "    public function validationRules(): array",
                "    {",
                "        return ['file' => 'required|file'];",
                "    }",
                "}");

        FormRequestRules request = Ruleframe.analyzeSource("ImportRequest.php", source, RuleframeConfig.load(file))
                .findRequest("ImportRequest");

        assertEquals("validationRules", request.methodName);
        assertEquals(List.of("file"), List.copyOf(request.ruleSets.mergedRules.keySet()));
    }
}
