package org.dxworks.ruleframe.analyzer;

import org.dxworks.ruleframe.RuleframeConfig.HasConditionsMode;
import org.dxworks.ruleframe.model.EnumRule;
import org.dxworks.ruleframe.model.RuleList;
import org.dxworks.ruleframe.model.RuleSetEntry;
import org.dxworks.ruleframe.model.RuleSetsResult;
import org.dxworks.ruleframe.model.RuleToken;
import org.dxworks.ruleframe.model.RuleValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public class RuleSetAggregator {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile(Pattern.quote(RuleToken.SEPARATOR));

    private final HasConditionsMode hasConditionsMode;

    public RuleSetAggregator(HasConditionsMode hasConditionsMode) {
        this.hasConditionsMode = hasConditionsMode;
    }

    /**
     * @param lastEntryConditional whether the condition path was non-empty when the last entry was emitted
     */
    public RuleSetsResult aggregate(List<RuleSetEntry> entries, boolean lastEntryConditional) {
        return new RuleSetsResult(entries, mergeAllRules(entries), hasConditions(entries, lastEntryConditional));
    }

    /**
     * Union of every field's rules across all entries, regardless of condition path.
     */
    public Map<String, List<RuleValue>> mergeAllRules(List<RuleSetEntry> entries) {
        Map<String, Set<RuleValue>> merged = new LinkedHashMap<>();
        for (RuleSetEntry entry : entries) {
            for (Map.Entry<String, RuleValue> field : entry.rules.entrySet()) {
                merged.computeIfAbsent(field.getKey(), k -> new LinkedHashSet<>())
                        .addAll(toRuleItems(field.getValue()));
            }
        }

        Map<String, List<RuleValue>> result = new LinkedHashMap<>();
        merged.forEach((field, rules) -> result.put(field, List.copyOf(rules)));
        return result;
    }

    /**
     * {@code 'required|string'} splits into two tokens; a list contributes its items as they are.
     */
    static List<RuleValue> toRuleItems(RuleValue value) {
        List<RuleValue> items = new ArrayList<>();
        if (value instanceof RuleToken) {
            for (String token : TOKEN_SEPARATOR.split(((RuleToken) value).getValue(), -1)) {
                items.add(RuleToken.of(token));
            }
        } else if (value instanceof RuleList) {
            items.addAll(((RuleList) value).getItems());
        } else if (value instanceof EnumRule) {
            items.add(value);
        }
        return items;
    }

    private boolean hasConditions(List<RuleSetEntry> entries, boolean lastEntryConditional) {
        if (entries.isEmpty()) return false;
        if (hasConditionsMode == HasConditionsMode.ANY_ENTRY) {
            return entries.stream().anyMatch(entry -> !entry.isUnconditional());
        }
        return lastEntryConditional;
    }
}
