package org.dxworks.ruleframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One branch test on a condition path.
 * Instances are only created through the static factories, one per {@link ConditionType}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "expression", "method", "check", "field"})
public final class Condition {

    public static final String ELSE_DESCRIPTION = "Default case";

    private final ConditionType type;
    private final String expression;
    private final String method;
    private final String check;
    private final String field;

    private Condition(ConditionType type, String expression, String method, String check, String field) {
        this.type = type;
        this.expression = expression;
        this.method = method;
        this.check = check;
        this.field = field;
    }

    /** {@code $this->isMethod('POST')}; the method is null when the argument is not a literal. */
    public static Condition httpMethod(String method, String expression) {
        return new Condition(ConditionType.HTTP_METHOD, expression, method, null, null);
    }

    /** {@code $this->user()->isAdmin()}. */
    public static Condition userCheck(String method, String expression) {
        return new Condition(ConditionType.USER_CHECK, expression, method, null, null);
    }

    /** {@code $this->has('email')}, {@code $this->input('type') === 'x'}. */
    public static Condition requestField(String check, String field, String expression) {
        return new Condition(ConditionType.REQUEST_FIELD, expression, null, check, field);
    }

    public static Condition ruleWhen(String expression) {
        return new Condition(ConditionType.RULE_WHEN, expression, null, null, null);
    }

    public static Condition elseBranch() {
        return new Condition(ConditionType.ELSE, ELSE_DESCRIPTION, null, null, null);
    }

    public static Condition custom(String expression) {
        return new Condition(ConditionType.CUSTOM, expression, null, null, null);
    }

    public ConditionType getType() {
        return type;
    }

    public String getExpression() {
        return expression;
    }

    public String getMethod() {
        return method;
    }

    public String getCheck() {
        return check;
    }

    public String getField() {
        return field;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Condition)) return false;
        Condition other = (Condition) o;
        return type == other.type
                && Objects.equals(expression, other.expression)
                && Objects.equals(method, other.method)
                && Objects.equals(check, other.check)
                && Objects.equals(field, other.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, expression, method, check, field);
    }

    @Override
    public String toString() {
        return type.getName() + "(" + expression + ")";
    }
}
