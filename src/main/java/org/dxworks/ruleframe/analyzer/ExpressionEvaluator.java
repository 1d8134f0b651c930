package org.dxworks.ruleframe.analyzer;

import org.dxworks.ruleframe.model.RuleToken;
import org.dxworks.ruleframe.model.RuleValue;
import org.treesitter.TSNode;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.dxworks.ruleframe.analyzer.PhpSyntax.*;
import static org.dxworks.ruleframe.analyzer.TreeSitterHelper.getChildByFieldName;
import static org.dxworks.ruleframe.analyzer.TreeSitterHelper.isNull;

/**
 * Evaluates an expression that denotes a whole field-rule map. Returns null whenever the
 * map cannot be resolved statically.
 */
public class ExpressionEvaluator {

    static final String NOTICE_FIELD = "_notice";

    private final ExtractionContext context;
    private final PhpSyntax syntax;
    private final RuleValueNormalizer normalizer;

    public ExpressionEvaluator(ExtractionContext context, RuleValueNormalizer normalizer) {
        this.context = context;
        this.syntax = context.syntax;
        this.normalizer = normalizer;
    }

    public Map<String, RuleValue> evaluate(TSNode expr) {
        TSNode node = unwrapParentheses(expr);
        if (isNull(node)) return null;

        switch (node.getType()) {
            case ARRAY:
                return extractArrayRules(node);
            case VARIABLE:
                return context.variableScope.get(syntax.variableName(node));
            case FUNCTION_CALL:
                return context.config.getMergeFunction().equals(syntax.callName(node))
                        ? evaluateMerge(node)
                        : null;
            case MEMBER_CALL:
                return evaluateMethodCall(node);
            case TERNARY:
                return evaluateTernary(node);
            case BINARY:
                return "+".equals(syntax.binaryOperator(node)) ? evaluateUnion(node) : null;
            default:
                return null;
        }
    }

    /**
     * Keyed items of an array literal. Items without a key and spread items are skipped.
     */
    public Map<String, RuleValue> extractArrayRules(TSNode array) {
        Map<String, RuleValue> rules = new LinkedHashMap<>();
        for (ArrayElement element : syntax.arrayElements(array)) {
            if (element.spread || element.key == null) continue;

            String key = evaluateKey(element.key);
            if (key != null) {
                rules.put(key, normalizer.normalize(element.value));
            }
        }
        return rules;
    }

    private String evaluateKey(TSNode keyNode) {
        TSNode key = unwrapParentheses(keyNode);
        String literal = syntax.stringLiteral(key);
        if (literal != null) return literal;
        if (is(key, INTEGER)) return syntax.text(key).trim();
        return syntax.inlineText(key);
    }

    /**
     * {@code array_merge($a, $b)}: a later argument overwrites an earlier one on the same field.
     */
    private Map<String, RuleValue> evaluateMerge(TSNode call) {
        Map<String, RuleValue> merged = new LinkedHashMap<>();
        for (TSNode arg : callArguments(call)) {
            Map<String, RuleValue> value = evaluate(arg);
            if (value != null) {
                merged.putAll(value);
            }
        }
        return merged;
    }

    /**
     * {@code $a + $b}: fields of the left side win, the right side only adds missing fields.
     */
    private Map<String, RuleValue> evaluateUnion(TSNode binary) {
        Map<String, RuleValue> leftRules = evaluate(left(binary));
        Map<String, RuleValue> rightRules = evaluate(right(binary));

        Map<String, RuleValue> union = new LinkedHashMap<>();
        if (leftRules != null) union.putAll(leftRules);
        if (rightRules != null) {
            for (Map.Entry<String, RuleValue> entry : rightRules.entrySet()) {
                union.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }
        return union;
    }

    private Map<String, RuleValue> evaluateMethodCall(TSNode call) {
        if (!syntax.isThis(unwrapParentheses(callObject(call)))) return null;

        String methodName = syntax.callName(call);
        if (methodName == null) return null;

        Map<String, RuleValue> cached = context.methodReturns.get(methodName);
        if (cached != null) return cached;

        if ("baseRules".equals(methodName) || "commonRules".equals(methodName)) {
            Map<String, RuleValue> notice = new LinkedHashMap<>();
            notice.put(NOTICE_FIELD, RuleToken.of("Method " + methodName + "() - implement in subclass"));
            return notice;
        }
        return null;
    }

    /**
     * The guard is not evaluated; the true branch is preferred and the false branch is the fallback.
     */
    private Map<String, RuleValue> evaluateTernary(TSNode ternary) {
        TSNode body = getChildByFieldName(ternary, "body");
        if (!isNull(body)) {
            Map<String, RuleValue> result = evaluate(body);
            if (result != null) return result;
        }
        TSNode alternative = getChildByFieldName(ternary, "alternative");
        return !isNull(alternative) ? evaluate(alternative) : null;
    }
}
