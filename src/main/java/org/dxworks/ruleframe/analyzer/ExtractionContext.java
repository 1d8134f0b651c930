package org.dxworks.ruleframe.analyzer;

import org.dxworks.ruleframe.RuleframeConfig;
import org.dxworks.ruleframe.model.Condition;
import org.dxworks.ruleframe.model.RuleSetEntry;
import org.dxworks.ruleframe.model.RuleValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one extraction over one method body. Never shared between invocations.
 *
 * <p>The variable scope is flat: an assignment made inside one branch stays visible to
 * everything traversed after it, including sibling branches.
 */
public class ExtractionContext {

    final PhpSyntax syntax;
    final RuleframeConfig config;

    final Map<String, Map<String, RuleValue>> variableScope = new HashMap<>();
    final Map<String, Map<String, RuleValue>> methodReturns = new HashMap<>();

    private final List<Condition> conditionPath = new ArrayList<>();
    private final List<RuleSetEntry> entries = new ArrayList<>();
    private boolean lastEntryConditional;

    public ExtractionContext(PhpSyntax syntax, RuleframeConfig config) {
        this.syntax = syntax;
        this.config = config;
    }

    void pushCondition(Condition condition) {
        conditionPath.add(condition);
    }

    void popCondition() {
        conditionPath.remove(conditionPath.size() - 1);
    }

    void emit(Map<String, RuleValue> rules) {
        double probability = 1.0 / Math.pow(2, conditionPath.size());
        entries.add(new RuleSetEntry(conditionPath, rules, probability));
        lastEntryConditional = !conditionPath.isEmpty();
    }

    public List<RuleSetEntry> getEntries() {
        return entries;
    }

    public boolean isLastEntryConditional() {
        return lastEntryConditional;
    }
}
