package org.dxworks.ruleframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonPropertyOrder({"entries", "mergedRules", "hasConditions"})
public final class RuleSetsResult {
    public final List<RuleSetEntry> entries;
    public final Map<String, List<RuleValue>> mergedRules;
    public final boolean hasConditions;

    public RuleSetsResult(List<RuleSetEntry> entries, Map<String, List<RuleValue>> mergedRules, boolean hasConditions) {
        this.entries = List.copyOf(entries);
        this.mergedRules = Collections.unmodifiableMap(new LinkedHashMap<>(mergedRules));
        this.hasConditions = hasConditions;
    }

    public static RuleSetsResult empty() {
        return new RuleSetsResult(List.of(), Map.of(), false);
    }

    /**
     * No entries means no rule structure was recognized, not that the analysis failed.
     */
    @JsonIgnore
    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
