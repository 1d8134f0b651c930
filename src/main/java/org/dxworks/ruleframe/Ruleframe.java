package org.dxworks.ruleframe;

import org.dxworks.ruleframe.analyzer.FormRequestAnalyzer;
import org.dxworks.ruleframe.model.RulesFileAnalysis;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPhp;

import java.io.IOException;
import java.lang.ref.Reference;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point: parses PHP sources with tree-sitter and extracts the conditional
 * validation rule sets of every class declaring the configured rules method.
 */
public class Ruleframe {

    private static final TSLanguage PHP;

    static {
        try {
            PHP = new TreeSitterPhp();
        } catch (RuntimeException | LinkageError e) {
            throw new RuntimeException("Failed to initialize Tree-sitter PHP language", e);
        }
    }

    public static RulesFileAnalysis analyzeFile(Path filePath) throws IOException {
        return analyzeFile(filePath, RuleframeConfig.load());
    }

    public static RulesFileAnalysis analyzeFile(Path filePath, RuleframeConfig config) throws IOException {
        String sourceCode = Files.readString(filePath, StandardCharsets.UTF_8);

        long lines = sourceCode.lines().count();
        if (lines > config.getMaxFileLines()) {
            System.err.println("Warning: Skipping " + filePath + ": " + lines + " lines exceeds maxFileLines "
                    + config.getMaxFileLines());
            RulesFileAnalysis skipped = new RulesFileAnalysis();
            skipped.filePath = filePath.toString();
            skipped.language = "php";
            return skipped;
        }

        return analyzeSource(filePath.toString(), sourceCode, config);
    }

    public static RulesFileAnalysis analyzeSource(String filePath, String sourceCode) {
        return analyzeSource(filePath, sourceCode, RuleframeConfig.load());
    }

    public static RulesFileAnalysis analyzeSource(String filePath, String sourceCode, RuleframeConfig config) {
        // Remove BOM if present
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }

        TSTree tree = parse(sourceCode);
        try {
            TSNode rootNode = tree.getRootNode();
            return new FormRequestAnalyzer(config).analyze(filePath, sourceCode, rootNode);
        } finally {
            // nodes point into the native tree
            Reference.reachabilityFence(tree);
        }
    }

    /**
     * A fresh parser per call; parsers are not shared between threads.
     */
    public static TSTree parse(String sourceCode) {
        TSParser parser = new TSParser();
        parser.setLanguage(PHP);
        return parser.parseString(null, sourceCode);
    }
}
