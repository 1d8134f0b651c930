package org.dxworks.ruleframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Rule items written as an array, e.g. {@code ['required', Rule::in([...])]}.
 */
public final class RuleList implements RuleValue {

    private final List<RuleValue> items;

    public RuleList(List<RuleValue> items) {
        this.items = Collections.unmodifiableList(items);
    }

    @JsonValue
    public List<RuleValue> getItems() {
        return items;
    }

    @Override
    public String asText() {
        return items.stream().map(RuleValue::asText).collect(Collectors.joining(RuleToken.SEPARATOR));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RuleList)) return false;
        return items.equals(((RuleList) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
