package org.dxworks.ruleframe.analyzer;

import org.dxworks.ruleframe.model.Condition;
import org.dxworks.ruleframe.model.RuleValue;
import org.treesitter.TSNode;

import java.util.Map;

import static org.dxworks.ruleframe.analyzer.PhpSyntax.*;
import static org.dxworks.ruleframe.analyzer.TreeSitterHelper.*;

/**
 * Walks a method body in source order, keeping the chain of branch tests active at each point.
 * Every {@code return} whose expression evaluates to a field-rule map becomes one rule set,
 * tagged with a copy of the current condition path.
 */
public class BranchPathTracker {

    private static final String IF = "if_statement";
    private static final String ELSE_IF = "else_if_clause";
    private static final String ELSE = "else_clause";
    private static final String RETURN = "return_statement";
    private static final String METHOD = "method_declaration";

    // Bodies that do not belong to the analyzed method
    private static final String[] FOREIGN_SCOPES = {
            "anonymous_function", "anonymous_function_creation_expression", "arrow_function",
            "function_definition", "class_declaration", "anonymous_class"
    };

    private final ExtractionContext context;
    private final PhpSyntax syntax;
    private final ExpressionEvaluator evaluator;
    private final ConditionClassifier classifier;

    public BranchPathTracker(ExtractionContext context, ExpressionEvaluator evaluator, ConditionClassifier classifier) {
        this.context = context;
        this.syntax = context.syntax;
        this.evaluator = evaluator;
        this.classifier = classifier;
    }

    /**
     * Track every statement under {@code body}, normally a method's {@code compound_statement}.
     */
    public void track(TSNode body) {
        visit(body);
    }

    /**
     * Cache the array returned by a recognized helper method such as {@code baseRules()}.
     * Only the first top-level {@code return} of an array literal counts.
     */
    public void cacheHelperMethod(TSNode methodDecl) {
        TSNode nameNode = getChildByFieldName(methodDecl, "name");
        String methodName = isNull(nameNode) ? null : syntax.text(nameNode);
        if (!context.config.isHelperMethod(methodName)) return;

        TSNode body = getChildByFieldName(methodDecl, "body");
        for (TSNode stmt : namedChildren(body)) {
            if (!is(stmt, RETURN)) continue;
            TSNode expr = unwrapParentheses(returnedExpression(stmt));
            if (is(expr, ARRAY)) {
                context.methodReturns.put(methodName, evaluator.extractArrayRules(expr));
                return;
            }
        }
    }

    /**
     * @return true when a {@code return} ended the enclosing statement list
     */
    private boolean visit(TSNode node) {
        if (isNull(node)) return false;
        String type = node.getType();

        if (ASSIGNMENT.equals(type)) {
            handleAssignment(node);
            return false;
        }
        if (METHOD.equals(type)) {
            cacheHelperMethod(node);
            return false;
        }
        if (IF.equals(type)) {
            handleIf(node);
            return false;
        }
        if (RETURN.equals(type)) {
            return handleReturn(node);
        }
        if (isTypeOneOf(type, FOREIGN_SCOPES)) {
            return false;
        }

        for (TSNode child : namedChildren(node)) {
            if (visit(child)) return true;
        }
        return false;
    }

    private void handleAssignment(TSNode assignment) {
        String variable = syntax.variableName(left(assignment));
        if (variable == null) return;

        TSNode value = unwrapParentheses(right(assignment));
        if (is(value, ARRAY)) {
            context.variableScope.put(variable, evaluator.extractArrayRules(value));
        } else if (isNodeTypeOneOf(value, MEMBER_CALL, FUNCTION_CALL)) {
            Map<String, RuleValue> result = evaluator.evaluate(value);
            if (result != null) {
                context.variableScope.put(variable, result);
            }
        }
    }

    /**
     * Each branch body is processed under its own condition pushed on the path. A return inside a
     * branch ends only that branch.
     */
    private void handleIf(TSNode ifStatement) {
        processBranch(classifier.classify(getChildByFieldName(ifStatement, "condition")),
                getChildByFieldName(ifStatement, "body"));

        for (TSNode alternative : getChildrenByFieldName(ifStatement, "alternative")) {
            if (is(alternative, ELSE_IF)) {
                processBranch(classifier.classify(getChildByFieldName(alternative, "condition")),
                        getChildByFieldName(alternative, "body"));
            } else if (is(alternative, ELSE)) {
                processBranch(Condition.elseBranch(), getChildByFieldName(alternative, "body"));
            }
        }
    }

    private void processBranch(Condition condition, TSNode body) {
        context.pushCondition(condition);
        try {
            visit(body);
        } finally {
            context.popCondition();
        }
    }

    private boolean handleReturn(TSNode returnStatement) {
        TSNode expr = returnedExpression(returnStatement);
        if (isNull(expr)) return false;

        Map<String, RuleValue> rules = evaluator.evaluate(expr);
        if (rules != null) {
            context.emit(rules);
        }
        return true;
    }
}
