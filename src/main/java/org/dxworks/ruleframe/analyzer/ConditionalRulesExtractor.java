package org.dxworks.ruleframe.analyzer;

import org.dxworks.ruleframe.RuleframeConfig;
import org.dxworks.ruleframe.model.RuleSetsResult;
import org.treesitter.TSNode;

import java.util.List;

import static org.dxworks.ruleframe.analyzer.TreeSitterHelper.getChildByFieldName;
import static org.dxworks.ruleframe.analyzer.TreeSitterHelper.isNull;

/**
 * Runs one extraction over one method: the helper-method pre-pass over its siblings, the
 * branch walk over its body, then aggregation. Each call starts from a fresh context, so a
 * single extractor can be reused, also from several threads.
 */
public class ConditionalRulesExtractor {

    private final RuleframeConfig config;

    public ConditionalRulesExtractor(RuleframeConfig config) {
        this.config = config;
    }

    public RuleSetsResult extract(String source, TSNode methodDecl, List<TSNode> siblingMethods) {
        TSNode body = getChildByFieldName(methodDecl, "body");
        if (isNull(body)) {
            return RuleSetsResult.empty();
        }
        return extractFromBody(source, body, siblingMethods);
    }

    /**
     * @param body the statement list to walk, usually a method's {@code compound_statement}
     */
    public RuleSetsResult extractFromBody(String source, TSNode body, List<TSNode> siblingMethods) {
        ExtractionContext context = new ExtractionContext(new PhpSyntax(source), config);
        BranchPathTracker tracker = newTracker(context);

        for (TSNode sibling : siblingMethods) {
            tracker.cacheHelperMethod(sibling);
        }
        tracker.track(body);

        return new RuleSetAggregator(config.getHasConditionsMode())
                .aggregate(context.getEntries(), context.isLastEntryConditional());
    }

    static BranchPathTracker newTracker(ExtractionContext context) {
        RuleValueNormalizer normalizer = new RuleValueNormalizer(context.syntax, context.config.getRuleBuilderClass());
        ExpressionEvaluator evaluator = new ExpressionEvaluator(context, normalizer);
        ConditionClassifier classifier = new ConditionClassifier(context.syntax, context.config);
        return new BranchPathTracker(context, evaluator, classifier);
    }
}
