package org.dxworks.ruleframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

public final class RuleToken implements RuleValue {

    public static final String SEPARATOR = "|";

    private final String value;

    public RuleToken(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public static RuleToken of(String value) {
        return new RuleToken(value);
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String asText() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RuleToken)) return false;
        return value.equals(((RuleToken) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
