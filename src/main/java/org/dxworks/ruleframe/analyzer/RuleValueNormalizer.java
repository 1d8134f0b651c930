package org.dxworks.ruleframe.analyzer;

import org.dxworks.ruleframe.model.EnumRule;
import org.dxworks.ruleframe.model.RuleList;
import org.dxworks.ruleframe.model.RuleToken;
import org.dxworks.ruleframe.model.RuleValue;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.ruleframe.analyzer.PhpSyntax.*;
import static org.dxworks.ruleframe.analyzer.TreeSitterHelper.isNull;

/**
 * Turns the value side of a field-rule entry into a {@link RuleValue}.
 * Every expression yields a value: anything not understood becomes a token holding its source text.
 */
public class RuleValueNormalizer {

    private static final String ENUM_RULE_CLASS = "Enum";

    private final PhpSyntax syntax;
    private final String ruleBuilderClass;

    public RuleValueNormalizer(PhpSyntax syntax, String ruleBuilderClass) {
        this.syntax = syntax;
        this.ruleBuilderClass = ruleBuilderClass;
    }

    /**
     * A field's rule value: a string, an array of rule items, or a single rule expression.
     */
    public RuleValue normalize(TSNode expr) {
        TSNode node = unwrapParentheses(expr);

        String literal = syntax.stringLiteral(node);
        if (literal != null) {
            return RuleToken.of(literal);
        }

        if (is(node, ARRAY)) {
            List<RuleValue> items = new ArrayList<>();
            for (ArrayElement element : syntax.arrayElements(node)) {
                if (element.spread) continue;
                items.add(normalizeSingleRule(element.value));
            }
            return new RuleList(items);
        }

        return normalizeSingleRule(node);
    }

    /**
     * One rule item. Never returns a list.
     */
    public RuleValue normalizeSingleRule(TSNode expr) {
        TSNode node = unwrapParentheses(expr);

        String literal = syntax.stringLiteral(node);
        if (literal != null) {
            return RuleToken.of(literal);
        }

        if (isRuleBuilderCall(node)) {
            return evaluateRuleBuilderCall(node);
        }

        // Rule::unique('users')->ignore($id): only the root call is evaluated
        if (is(node, MEMBER_CALL)) {
            TSNode root = chainRoot(node);
            if (isRuleBuilderCall(root)) {
                return evaluateRuleBuilderCall(root);
            }
        }

        if (is(node, OBJECT_CREATION)) {
            EnumRule enumRule = extractEnumRule(node);
            if (enumRule != null) return enumRule;
        }

        if (is(node, BINARY) && ".".equals(syntax.binaryOperator(node))) {
            return RuleToken.of(concatenationPart(left(node)) + concatenationPart(right(node)));
        }

        return fallback(node);
    }

    private String concatenationPart(TSNode operand) {
        if (isNull(operand)) return "";
        return normalizeSingleRule(operand).asText();
    }

    private boolean isRuleBuilderCall(TSNode node) {
        return is(node, SCOPED_CALL) && namesClass(syntax.callScope(node), ruleBuilderClass);
    }

    private static TSNode chainRoot(TSNode memberCall) {
        TSNode current = memberCall;
        while (is(current, MEMBER_CALL)) {
            current = unwrapParentheses(callObject(current));
        }
        return current;
    }

    private RuleValue evaluateRuleBuilderCall(TSNode call) {
        String method = syntax.callName(call);
        if (method == null) return fallback(call);

        switch (method) {
            case "in":
                return RuleToken.of("in:" + String.join(",", listedValues(call)));
            case "notIn":
                return RuleToken.of("not_in:" + String.join(",", listedValues(call)));
            case "exists":
                return RuleToken.of("exists:" + tableReference(call));
            case "unique":
                return RuleToken.of("unique:" + tableReference(call));
            case "requiredIf":
                return RuleToken.of("required_if:" + String.join(",", literalArguments(call)));
            case "when":
                return RuleToken.of("sometimes");
            case "enum": {
                List<TSNode> args = callArguments(call);
                String typeName = args.isEmpty() ? null : syntax.classReference(unwrapParentheses(args.get(0)));
                return typeName != null ? new EnumRule(typeName) : fallback(call);
            }
            default:
                return fallback(call);
        }
    }

    /**
     * Values of {@code Rule::in(['a', 'b'])} or {@code Rule::in('a', 'b')}. Non-literal items are dropped.
     */
    private List<String> listedValues(TSNode call) {
        List<TSNode> args = callArguments(call);
        if (args.isEmpty()) return List.of();

        TSNode first = unwrapParentheses(args.get(0));
        if (is(first, ARRAY)) {
            List<String> values = new ArrayList<>();
            for (ArrayElement element : syntax.arrayElements(first)) {
                if (element.spread) continue;
                String value = syntax.stringLiteral(unwrapParentheses(element.value));
                if (value != null) values.add(value);
            }
            return values;
        }
        return literalArguments(call);
    }

    private List<String> literalArguments(TSNode call) {
        List<String> values = new ArrayList<>();
        for (TSNode arg : callArguments(call)) {
            String value = syntax.stringLiteral(unwrapParentheses(arg));
            if (value != null) values.add(value);
        }
        return values;
    }

    /**
     * {@code table} or {@code table,column} from the first two arguments; empty when the table is not a literal.
     */
    private String tableReference(TSNode call) {
        List<TSNode> args = callArguments(call);
        if (args.isEmpty()) return "";

        String table = syntax.stringLiteral(unwrapParentheses(args.get(0)));
        if (table == null) return "";
        if (args.size() > 1) {
            String column = syntax.stringLiteral(unwrapParentheses(args.get(1)));
            if (column != null) return table + "," + column;
        }
        return table;
    }

    private EnumRule extractEnumRule(TSNode objectCreation) {
        if (!namesClass(syntax.createdClassName(objectCreation), ENUM_RULE_CLASS)) return null;
        List<TSNode> args = callArguments(objectCreation);
        if (args.isEmpty()) return null;
        String typeName = syntax.classReference(unwrapParentheses(args.get(0)));
        return typeName != null ? new EnumRule(typeName) : null;
    }

    private RuleToken fallback(TSNode node) {
        return RuleToken.of(syntax.inlineText(node));
    }
}
