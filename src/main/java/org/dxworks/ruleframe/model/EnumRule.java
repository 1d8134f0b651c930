package org.dxworks.ruleframe.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Enum-backed rule such as {@code new Enum(Status::class)}.
 */
@JsonPropertyOrder({"kind", "typeName"})
public final class EnumRule implements RuleValue {

    public static final String KIND = "enum";

    private final String typeName;

    public EnumRule(String typeName) {
        this.typeName = Objects.requireNonNull(typeName, "typeName");
    }

    public String getKind() {
        return KIND;
    }

    public String getTypeName() {
        return typeName;
    }

    @Override
    public String asText() {
        return KIND + ":" + typeName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnumRule)) return false;
        return typeName.equals(((EnumRule) o).typeName);
    }

    @Override
    public int hashCode() {
        return typeName.hashCode();
    }

    @Override
    public String toString() {
        return asText();
    }
}
