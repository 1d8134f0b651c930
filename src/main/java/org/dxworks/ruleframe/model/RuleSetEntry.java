package org.dxworks.ruleframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The rules returned by one reachable {@code return}, with the branch tests that lead to it.
 */
@JsonPropertyOrder({"conditions", "rules", "probability"})
public final class RuleSetEntry {
    public final List<Condition> conditions;
    public final Map<String, RuleValue> rules;
    public final double probability;

    public RuleSetEntry(List<Condition> conditions, Map<String, RuleValue> rules, double probability) {
        this.conditions = List.copyOf(conditions);
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
        this.probability = probability;
    }

    @JsonIgnore
    public boolean isUnconditional() {
        return conditions.isEmpty();
    }
}
