package org.dxworks.ruleframe.analyzer;

import org.dxworks.ruleframe.RuleframeConfig;
import org.dxworks.ruleframe.model.Condition;
import org.treesitter.TSNode;

import java.util.List;

import static org.dxworks.ruleframe.analyzer.PhpSyntax.*;

/**
 * Maps the test of an {@code if}/{@code elseif} to a {@link Condition}. The first matching
 * shape wins; anything else is a custom condition carrying its source text.
 */
public class ConditionClassifier {

    private static final String USER_ACCESSOR = "user";
    private static final String INPUT_ACCESSOR = "input";

    private final PhpSyntax syntax;
    private final RuleframeConfig config;

    public ConditionClassifier(PhpSyntax syntax, RuleframeConfig config) {
        this.syntax = syntax;
        this.config = config;
    }

    public Condition classify(TSNode conditionNode) {
        TSNode condition = unwrapParentheses(conditionNode);
        String expression = syntax.inlineText(condition);

        if (isHttpMethodCheck(condition)) {
            return Condition.httpMethod(firstLiteralArgument(condition), expression);
        }

        if (isUserCheck(condition)) {
            return Condition.userCheck(syntax.callName(condition), expression);
        }

        if (is(condition, MEMBER_CALL) && config.getRequestFieldAccessors().contains(syntax.callName(condition))) {
            return Condition.requestField(syntax.callName(condition), firstLiteralArgument(condition), expression);
        }

        if (isInputComparison(condition)) {
            TSNode inputCall = unwrapParentheses(left(condition));
            return Condition.requestField(INPUT_ACCESSOR, firstLiteralArgument(inputCall), expression);
        }

        if (isRuleWhen(condition)) {
            return Condition.ruleWhen(expression);
        }

        return Condition.custom(expression);
    }

    /**
     * {@code $this->isMethod('POST')}, {@code request()->method()}.
     */
    private boolean isHttpMethodCheck(TSNode node) {
        return is(node, MEMBER_CALL)
                && config.getHttpMethodAccessors().contains(syntax.callName(node))
                && callArguments(node).size() <= 1;
    }

    /**
     * {@code $this->user()->hasRole('admin')}.
     */
    private boolean isUserCheck(TSNode node) {
        if (!is(node, MEMBER_CALL)) return false;
        TSNode object = unwrapParentheses(callObject(node));
        return is(object, MEMBER_CALL)
                && USER_ACCESSOR.equals(syntax.callName(object))
                && syntax.isThis(unwrapParentheses(callObject(object)));
    }

    /**
     * {@code $this->input('type') === 'business'}.
     */
    private boolean isInputComparison(TSNode node) {
        if (!is(node, BINARY)) return false;
        TSNode leftSide = unwrapParentheses(left(node));
        return is(leftSide, MEMBER_CALL) && INPUT_ACCESSOR.equals(syntax.callName(leftSide));
    }

    private boolean isRuleWhen(TSNode node) {
        return is(node, SCOPED_CALL)
                && namesClass(syntax.callScope(node), config.getRuleBuilderClass())
                && "when".equals(syntax.callName(node));
    }

    private String firstLiteralArgument(TSNode call) {
        List<TSNode> args = callArguments(call);
        return args.isEmpty() ? null : syntax.stringLiteral(unwrapParentheses(args.get(0)));
    }
}
