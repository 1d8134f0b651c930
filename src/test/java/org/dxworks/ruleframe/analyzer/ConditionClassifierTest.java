package org.dxworks.ruleframe.analyzer;

import org.dxworks.ruleframe.RuleframeConfig;
import org.dxworks.ruleframe.model.Condition;
import org.dxworks.ruleframe.model.ConditionType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ConditionClassifierTest {

    private static Condition classify(String condition) {
        ParsedPhp php = ParsedPhp.of("<?php if (" + condition + ") { }");
        ConditionClassifier classifier = new ConditionClassifier(php.syntax, RuleframeConfig.defaults());
        return classifier.classify(TreeSitterHelper.getChildByFieldName(php.first("if_statement"), "condition"));
    }

    @Test
    void httpMethodCheck() {
        Condition condition = classify("$this->isMethod('POST')");

        assertEquals(ConditionType.HTTP_METHOD, condition.getType());
        assertEquals("POST", condition.getMethod());
        assertEquals("$this->isMethod('POST')", condition.getExpression());
    }

    @Test
    void httpMethodCheckWithoutLiteralHasNoMethod() {
        Condition condition = classify("$this->isMethod($verb)");

        assertEquals(ConditionType.HTTP_METHOD, condition.getType());
        assertNull(condition.getMethod());
    }

    @Test
    void userCheck() {
        Condition condition = classify("$this->user()->hasRole('admin')");

        assertEquals(ConditionType.USER_CHECK, condition.getType());
        assertEquals("hasRole", condition.getMethod());
    }

    @Test
    void requestFieldPresence() {
        Condition condition = classify("$this->has('email')");

        assertEquals(ConditionType.REQUEST_FIELD, condition.getType());
        assertEquals("has", condition.getCheck());
        assertEquals("email", condition.getField());
    }

    @Test
    void inputComparisonIsRequestField() {
        Condition condition = classify("$this->input('type') === 'business'");

        assertEquals(ConditionType.REQUEST_FIELD, condition.getType());
        assertEquals("input", condition.getCheck());
        assertEquals("type", condition.getField());
        assertEquals("$this->input('type') === 'business'", condition.getExpression());
    }

    @Test
    void ruleWhen() {
        Condition condition = classify("Rule::when($this->isUpdate(), 'required', 'sometimes')");

        assertEquals(ConditionType.RULE_WHEN, condition.getType());
    }

    @Test
    void anythingElseIsCustomWithCollapsedText() {
        Condition condition = classify("$count >\n        5");

        assertEquals(Condition.custom("$count > 5"), condition);
    }

    @Test
    void userAccessorOnOtherObjectIsCustom() {
        Condition condition = classify("$request->user()->isAdmin()");

        assertEquals(ConditionType.CUSTOM, condition.getType());
    }
}
