package org.dxworks.ruleframe.analyzer;

import org.dxworks.ruleframe.RuleframeConfig;
import org.dxworks.ruleframe.model.RuleToken;
import org.dxworks.ruleframe.model.RuleValue;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ExpressionEvaluatorTest {

    private ExtractionContext context;

    private Map<String, RuleValue> evaluate(String expression) {
        ParsedPhp php = ParsedPhp.assigned(expression);
        context = new ExtractionContext(php.syntax, RuleframeConfig.defaults());
        return evaluate(php);
    }

    private Map<String, RuleValue> evaluate(ParsedPhp php) {
        RuleValueNormalizer normalizer = new RuleValueNormalizer(php.syntax, "Rule");
        return new ExpressionEvaluator(context, normalizer).evaluate(php.assignedValue());
    }

    private static Map<String, RuleValue> rules(String... keysAndValues) {
        Map<String, RuleValue> rules = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            rules.put(keysAndValues[i], RuleToken.of(keysAndValues[i + 1]));
        }
        return rules;
    }

    @Test
    void arrayLiteral() {
        assertEquals(rules("name", "required", "age", "integer"),
                evaluate("['name' => 'required', 'age' => 'integer']"));
    }

    @Test
    void itemsWithoutKeysAreSkipped() {
        assertEquals(rules("name", "required"), evaluate("['orphan', 'name' => 'required', ...$more]"));
    }

    @Test
    void integerKeysAreText() {
        assertEquals(rules("0", "required"), evaluate("[0 => 'required']"));
    }

    @Test
    void mergeLetsLaterArgumentsWin() {
        Map<String, RuleValue> result = evaluate("array_merge(['a' => 1, 'b' => 2], ['b' => 3, 'c' => 4])");

        assertEquals(rules("a", "1", "b", "3", "c", "4"), result);
        assertEquals(List.of("a", "b", "c"), List.copyOf(result.keySet()));
    }

    @Test
    void fullyQualifiedMergeFunction() {
        assertEquals(rules("a", "x", "b", "y"), evaluate("\\array_merge(['a' => 'x'], ['b' => 'y'])"));
    }

    @Test
    void unionLetsLeftSideWin() {
        assertEquals(rules("a", "1", "b", "2", "c", "4"), evaluate("['a' => 1, 'b' => 2] + ['b' => 3, 'c' => 4]"));
    }

    @Test
    void ternaryPrefersTrueBranch() {
        assertEquals(rules("a", "required"), evaluate("$update ? ['a' => 'required'] : ['a' => 'sometimes']"));
    }

    @Test
    void ternaryFallsBackWhenTrueBranchIsUnknown() {
        assertEquals(rules("a", "sometimes"), evaluate("$update ? $unknown : ['a' => 'sometimes']"));
    }

    @Test
    void parenthesesAreTransparent() {
        assertEquals(rules("a", "x"), evaluate("((['a' => 'x']))"));
    }

    @Test
    void variableResolvesThroughScope() {
        ParsedPhp php = ParsedPhp.assigned("$rules");
        context = new ExtractionContext(php.syntax, RuleframeConfig.defaults());
        context.variableScope.put("rules", rules("email", "required|email"));

        assertEquals(rules("email", "required|email"), evaluate(php));
    }

    @Test
    void unknownVariableIsUnresolved() {
        assertNull(evaluate("$missing"));
    }

    @Test
    void cachedHelperMethod() {
        ParsedPhp php = ParsedPhp.assigned("$this->additionalRules()");
        context = new ExtractionContext(php.syntax, RuleframeConfig.defaults());
        context.methodReturns.put("additionalRules", rules("extra", "nullable"));

        assertEquals(rules("extra", "nullable"), evaluate(php));
    }

    @Test
    void uncachedBaseRulesGivesPlaceholder() {
        Map<String, RuleValue> result = evaluate("$this->baseRules()");

        assertEquals(List.of(ExpressionEvaluator.NOTICE_FIELD), List.copyOf(result.keySet()));
    }

    @Test
    void unknownCallsAreUnresolved() {
        assertNull(evaluate("$this->somethingElse()"));
        assertNull(evaluate("$other->baseRules()"));
        assertNull(evaluate("buildRules()"));
        assertNull(evaluate("'required'"));
    }
}
