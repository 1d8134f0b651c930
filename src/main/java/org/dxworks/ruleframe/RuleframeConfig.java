package org.dxworks.ruleframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public class RuleframeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "ruleframe-config.yml";
    private static final String DEFAULT_RULES_METHOD = "rules";
    private static final List<String> DEFAULT_HELPER_METHODS = List.of("additionalRules", "baseRules", "commonRules");
    private static final String DEFAULT_RULE_BUILDER_CLASS = "Rule";
    private static final String DEFAULT_MERGE_FUNCTION = "array_merge";
    private static final List<String> DEFAULT_HTTP_METHOD_ACCESSORS = List.of("isMethod", "method");
    private static final List<String> DEFAULT_REQUEST_FIELD_ACCESSORS = List.of("has", "filled", "missing");
    private static final HasConditionsMode DEFAULT_HAS_CONDITIONS_MODE = HasConditionsMode.LAST_RETURN;

    /**
     * How {@code hasConditions} is derived from the emitted rule sets.
     */
    public enum HasConditionsMode {
        /**
         * The last emitted rule set was under at least one branch guard. A later return that
         * resolves to nothing does not count.
         */
        LAST_RETURN,
        /** Any emitted rule set has a non-empty condition path. */
        ANY_ENTRY
    }

    private final int maxFileLines;
    private final String rulesMethod;
    private final List<String> helperMethods;
    private final String ruleBuilderClass;
    private final String mergeFunction;
    private final List<String> httpMethodAccessors;
    private final List<String> requestFieldAccessors;
    private final HasConditionsMode hasConditionsMode;

    private RuleframeConfig(int maxFileLines,
                            String rulesMethod,
                            List<String> helperMethods,
                            String ruleBuilderClass,
                            String mergeFunction,
                            List<String> httpMethodAccessors,
                            List<String> requestFieldAccessors,
                            HasConditionsMode hasConditionsMode) {
        this.maxFileLines = maxFileLines;
        this.rulesMethod = rulesMethod;
        this.helperMethods = List.copyOf(helperMethods);
        this.ruleBuilderClass = ruleBuilderClass;
        this.mergeFunction = mergeFunction;
        this.httpMethodAccessors = List.copyOf(httpMethodAccessors);
        this.requestFieldAccessors = List.copyOf(requestFieldAccessors);
        this.hasConditionsMode = hasConditionsMode;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public String getRulesMethod() {
        return rulesMethod;
    }

    public List<String> getHelperMethods() {
        return helperMethods;
    }

    public String getRuleBuilderClass() {
        return ruleBuilderClass;
    }

    public String getMergeFunction() {
        return mergeFunction;
    }

    public List<String> getHttpMethodAccessors() {
        return httpMethodAccessors;
    }

    public List<String> getRequestFieldAccessors() {
        return requestFieldAccessors;
    }

    public HasConditionsMode getHasConditionsMode() {
        return hasConditionsMode;
    }

    public boolean isHelperMethod(String methodName) {
        return methodName != null && helperMethods.contains(methodName);
    }

    public static RuleframeConfig defaults() {
        return new RuleframeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_RULES_METHOD, DEFAULT_HELPER_METHODS,
                DEFAULT_RULE_BUILDER_CLASS, DEFAULT_MERGE_FUNCTION, DEFAULT_HTTP_METHOD_ACCESSORS,
                DEFAULT_REQUEST_FIELD_ACCESSORS, DEFAULT_HAS_CONDITIONS_MODE);
    }

    /**
     * Reads {@value #CONFIG_FILE_NAME} from the working directory, or returns the defaults.
     */
    public static RuleframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static RuleframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig);
            }
        } catch (IOException e) {
            System.err.println("Warning: Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static RuleframeConfig with(int maxFileLines, HasConditionsMode hasConditionsMode) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        HasConditionsMode effectiveMode = hasConditionsMode != null ? hasConditionsMode : DEFAULT_HAS_CONDITIONS_MODE;
        return new RuleframeConfig(effectiveMaxFileLines, DEFAULT_RULES_METHOD, DEFAULT_HELPER_METHODS,
                DEFAULT_RULE_BUILDER_CLASS, DEFAULT_MERGE_FUNCTION, DEFAULT_HTTP_METHOD_ACCESSORS,
                DEFAULT_REQUEST_FIELD_ACCESSORS, effectiveMode);
    }

    private static RuleframeConfig fromYaml(YamlConfig yaml) {
        int effectiveMaxFileLines = (yaml.maxFileLines != null && yaml.maxFileLines > 0)
                ? yaml.maxFileLines
                : DEFAULT_MAX_FILE_LINES;

        return new RuleframeConfig(
                effectiveMaxFileLines,
                nonBlankOr(yaml.rulesMethod, DEFAULT_RULES_METHOD),
                nonEmptyOr(yaml.helperMethods, DEFAULT_HELPER_METHODS),
                nonBlankOr(yaml.ruleBuilderClass, DEFAULT_RULE_BUILDER_CLASS),
                nonBlankOr(yaml.mergeFunction, DEFAULT_MERGE_FUNCTION),
                nonEmptyOr(yaml.httpMethodAccessors, DEFAULT_HTTP_METHOD_ACCESSORS),
                nonEmptyOr(yaml.requestFieldAccessors, DEFAULT_REQUEST_FIELD_ACCESSORS),
                yaml.hasConditionsMode != null ? yaml.hasConditionsMode : DEFAULT_HAS_CONDITIONS_MODE);
    }

    private static String nonBlankOr(String value, String fallback) {
        return (value != null && !value.isBlank()) ? value.trim() : fallback;
    }

    private static List<String> nonEmptyOr(List<String> values, List<String> fallback) {
        if (values == null) return fallback;
        List<String> cleaned = values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .collect(Collectors.toList());
        return cleaned.isEmpty() ? fallback : cleaned;
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public String rulesMethod;
        public List<String> helperMethods;
        public String ruleBuilderClass;
        public String mergeFunction;
        public List<String> httpMethodAccessors;
        public List<String> requestFieldAccessors;
        public HasConditionsMode hasConditionsMode;
    }
}
