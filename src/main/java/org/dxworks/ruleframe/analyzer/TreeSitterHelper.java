package org.dxworks.ruleframe.analyzer;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class TreeSitterHelper {

    /**
     * Tree-sitter reports UTF-8 byte offsets, so the text is cut from the encoded source
     * rather than from the Java string.
     */
    public static String getNodeText(byte[] sourceBytes, TSNode node) {
        if (isNull(node)) return null;
        int startByte = node.getStartByte();
        int endByte = node.getEndByte();

        if (startByte < 0) startByte = 0;
        if (endByte > sourceBytes.length) endByte = sourceBytes.length;
        if (startByte >= endByte) return "";

        String text = new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);

        // Normalize line endings to LF for cross-platform consistency
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }

    /**
     * Collapse all whitespace (including newlines and tabs) to single spaces and trim.
     */
    public static String normalizeInline(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s+", " ").trim();
    }

    public static boolean isNull(TSNode node) {
        return node == null || node.isNull();
    }

    public static TSNode findFirstChild(TSNode parent, String nodeType) {
        if (isNull(parent)) return null;
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (!isNull(child) && nodeType.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    public static List<TSNode> findAllChildren(TSNode parent, String nodeType) {
        List<TSNode> result = new ArrayList<>();
        if (isNull(parent)) return result;
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (!isNull(child) && nodeType.equals(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    public static List<TSNode> namedChildren(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        if (isNull(parent)) return result;
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (!isNull(child)) {
                result.add(child);
            }
        }
        return result;
    }

    public static List<TSNode> findAllDescendants(TSNode root, String nodeType) {
        List<TSNode> result = new ArrayList<>();
        if (isNull(root)) return result;

        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (isNull(node)) continue;

            if (nodeType.equals(node.getType())) {
                result.add(node);
            }
            int count = node.getNamedChildCount();
            for (int i = count - 1; i >= 0; i--) {
                TSNode child = node.getNamedChild(i);
                if (!isNull(child)) {
                    stack.push(child);
                }
            }
        }
        return result;
    }

    public static TSNode getChildByFieldName(TSNode parent, String fieldName) {
        List<TSNode> matches = getChildrenByFieldName(parent, fieldName);
        return matches.isEmpty() ? null : matches.get(0);
    }

    /**
     * All children carrying the given field name, in source order. Needed for repeated fields
     * such as the {@code alternative} clauses of an {@code if_statement}.
     */
    public static List<TSNode> getChildrenByFieldName(TSNode parent, String fieldName) {
        List<TSNode> result = new ArrayList<>();
        if (isNull(parent)) return result;
        // getFieldNameForChild(i) expects the total child index (including anonymous nodes like
        // operators and punctuation), not the named child index
        for (int i = 0; i < parent.getChildCount(); i++) {
            String fn;
            try {
                fn = parent.getFieldNameForChild(i);
            } catch (RuntimeException e) {
                continue;
            }
            if (fieldName.equals(fn)) {
                TSNode child = parent.getChild(i);
                if (!isNull(child)) result.add(child);
            }
        }
        return result;
    }

    /**
     * Text of the anonymous tokens of a node, e.g. {@code "=>"} or {@code "..."}.
     */
    public static List<String> anonymousTokens(byte[] sourceBytes, TSNode parent) {
        List<String> result = new ArrayList<>();
        if (isNull(parent)) return result;
        for (int i = 0; i < parent.getChildCount(); i++) {
            TSNode child = parent.getChild(i);
            if (!isNull(child) && !child.isNamed()) {
                result.add(getNodeText(sourceBytes, child));
            }
        }
        return result;
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(TSNode node, String... types) {
        if (isNull(node)) return false;
        return isTypeOneOf(node.getType(), types);
    }
}
