package org.dxworks.ruleframe.analyzer;

import org.dxworks.ruleframe.model.EnumRule;
import org.dxworks.ruleframe.model.RuleList;
import org.dxworks.ruleframe.model.RuleToken;
import org.dxworks.ruleframe.model.RuleValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RuleValueNormalizerTest {

    private static RuleValue normalize(String expression) {
        ParsedPhp php = ParsedPhp.assigned(expression);
        return new RuleValueNormalizer(php.syntax, "Rule").normalize(php.assignedValue());
    }

    private static RuleToken token(String value) {
        return RuleToken.of(value);
    }

    @Test
    void stringStaysOneToken() {
        assertEquals(token("required|string|max:255"), normalize("'required|string|max:255'"));
        assertEquals(token("required"), normalize("\"required\""));
    }

    @Test
    void arrayBecomesListInOrder() {
        assertEquals(new RuleList(List.of(token("required"), token("max:255"))),
                normalize("['required', 'max:255']"));
    }

    @Test
    void spreadItemsAreDropped() {
        assertEquals(new RuleList(List.of(token("required"))), normalize("[...$base, 'required']"));
    }

    @Test
    void ruleIn() {
        assertEquals(token("in:a,b"), normalize("Rule::in(['a', 'b'])"));
        assertEquals(token("in:a,b"), normalize("Rule::in('a', 'b')"));
    }

    @Test
    void ruleInWithoutLiteralValues() {
        assertEquals(token("in:"), normalize("Rule::in([])"));
        assertEquals(token("in:"), normalize("Rule::in($allowed)"));
    }

    @Test
    void ruleNotIn() {
        assertEquals(token("not_in:root,admin"), normalize("Rule::notIn(['root', 'admin'])"));
    }

    @Test
    void ruleExistsAndUnique() {
        assertEquals(token("exists:users,id"), normalize("Rule::exists('users', 'id')"));
        assertEquals(token("unique:users"), normalize("Rule::unique('users')"));
        assertEquals(token("unique:users,email"), normalize("Rule::unique('users', 'email')"));
        assertEquals(token("exists:"), normalize("Rule::exists($table)"));
    }

    @Test
    void chainedCallCollapsesToRoot() {
        assertEquals(token("unique:users,email"),
                normalize("Rule::unique('users', 'email')->ignore($this->user)->where('active', 1)"));
    }

    @Test
    void ruleRequiredIf() {
        assertEquals(token("required_if:"), normalize("Rule::requiredIf($this->isBusiness())"));
        assertEquals(token("required_if:type,business"), normalize("Rule::requiredIf('type', 'business')"));
    }

    @Test
    void ruleWhenActsAsSometimes() {
        assertEquals(token("sometimes"), normalize("Rule::when($isUpdate, ['required'])"));
    }

    @Test
    void qualifiedRuleBuilder() {
        assertEquals(token("in:x"), normalize("\\Illuminate\\Validation\\Rule::in(['x'])"));
    }

    @Test
    void enumRules() {
        assertEquals(new EnumRule("OrderStatus"), normalize("new Enum(OrderStatus::class)"));
        assertEquals(new EnumRule("OrderStatus"), normalize("Rule::enum(OrderStatus::class)"));
    }

    @Test
    void concatenationJoinsParts() {
        assertEquals(token("max:255"), normalize("'max:' . 255"));
        assertEquals(token("max:$this->limit"), normalize("'max:' . $this->limit"));
        assertEquals(token("in:a,b|required"), normalize("Rule::in(['a', 'b']) . '|required'"));
        assertEquals(token("prefix:enum:Status"), normalize("'prefix:' . new Enum(Status::class)"));
    }

    @Test
    void unknownExpressionKeepsSourceText() {
        assertEquals(token("new Password(8)"), normalize("new Password(8)"));
        assertEquals(token("Password::min(8)->mixedCase()"), normalize("Password::min(8)->mixedCase()"));
    }

    @Test
    void unknownRuleBuilderMethodKeepsSourceText() {
        assertEquals(token("Rule::dimensions(['min_width' => 100])"),
                normalize("Rule::dimensions(['min_width' => 100])"));
    }
}
