package org.dxworks.ruleframe.model;

/**
 * A validation rule as found in a field-rule map: a single token, a list of rule items,
 * or a reference to an enum class.
 */
public interface RuleValue {

    /**
     * Plain-text form used when a rule is concatenated with other fragments.
     */
    String asText();
}
