package org.dxworks.ruleframe.analyzer;

import org.dxworks.ruleframe.RuleframeConfig;
import org.dxworks.ruleframe.model.FormRequestRules;
import org.dxworks.ruleframe.model.RuleSetsResult;
import org.dxworks.ruleframe.model.RulesFileAnalysis;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.ruleframe.analyzer.TreeSitterHelper.*;

/**
 * Finds the classes of a PHP file that declare the rules method and extracts their
 * conditional rule sets.
 */
public class FormRequestAnalyzer {

    private final RuleframeConfig config;
    private final ConditionalRulesExtractor extractor;

    public FormRequestAnalyzer(RuleframeConfig config) {
        this.config = config;
        this.extractor = new ConditionalRulesExtractor(config);
    }

    public RulesFileAnalysis analyze(String filePath, String sourceCode, TSNode rootNode) {
        RulesFileAnalysis analysis = new RulesFileAnalysis();
        analysis.filePath = filePath;
        analysis.language = "php";

        if (isNull(rootNode)) {
            System.err.println("Warning: Root node is null for PHP file: " + filePath);
            return analysis;
        }

        PhpSyntax syntax = new PhpSyntax(sourceCode);
        for (TSNode classDecl : findAllDescendants(rootNode, "class_declaration")) {
            try {
                FormRequestRules request = analyzeClass(syntax, sourceCode, classDecl);
                if (request != null) {
                    analysis.requests.add(request);
                }
            } catch (RuntimeException e) {
                System.err.println("Warning: Failed to analyze class in " + filePath + ": " + e.getMessage());
            }
        }

        return analysis;
    }

    private FormRequestRules analyzeClass(PhpSyntax syntax, String source, TSNode classDecl) {
        TSNode nameNode = getChildByFieldName(classDecl, "name");
        String className = isNull(nameNode) ? null : syntax.text(nameNode);

        TSNode body = getChildByFieldName(classDecl, "body");
        if (isNull(body)) {
            body = findFirstChild(classDecl, "declaration_list");
        }

        TSNode rulesMethod = null;
        List<TSNode> siblings = new ArrayList<>();
        for (TSNode method : findAllChildren(body, "method_declaration")) {
            if (rulesMethod == null && config.getRulesMethod().equals(methodName(syntax, method))) {
                rulesMethod = method;
            } else {
                siblings.add(method);
            }
        }
        if (rulesMethod == null) return null;

        RuleSetsResult ruleSets = extractor.extract(source, rulesMethod, siblings);
        return new FormRequestRules(className, config.getRulesMethod(), ruleSets);
    }

    private static String methodName(PhpSyntax syntax, TSNode method) {
        TSNode nameNode = getChildByFieldName(method, "name");
        return isNull(nameNode) ? null : syntax.text(nameNode);
    }
}
