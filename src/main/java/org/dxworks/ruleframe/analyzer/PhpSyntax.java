package org.dxworks.ruleframe.analyzer;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.dxworks.ruleframe.analyzer.TreeSitterHelper.*;

/**
 * Read access to tree-sitter-php nodes of one source file: node text, literals,
 * and the parts of calls, arrays and operators the extractor looks at.
 */
public class PhpSyntax {

    static final String ARRAY = "array_creation_expression";
    static final String ARRAY_ELEMENT = "array_element_initializer";
    static final String VARIABLE = "variable_name";
    static final String MEMBER_CALL = "member_call_expression";
    static final String SCOPED_CALL = "scoped_call_expression";
    static final String FUNCTION_CALL = "function_call_expression";
    static final String OBJECT_CREATION = "object_creation_expression";
    static final String CLASS_CONSTANT = "class_constant_access_expression";
    static final String BINARY = "binary_expression";
    static final String TERNARY = "conditional_expression";
    static final String PARENTHESIZED = "parenthesized_expression";
    static final String ASSIGNMENT = "assignment_expression";
    static final String SPREAD = "variadic_unpacking";
    static final String STRING = "string";
    static final String ENCAPSED_STRING = "encapsed_string";
    static final String INTEGER = "integer";

    private static final String CLASS_SUFFIX = "::class";

    private final byte[] sourceBytes;

    public PhpSyntax(String source) {
        this.sourceBytes = source.getBytes(StandardCharsets.UTF_8);
    }

    public String text(TSNode node) {
        return getNodeText(sourceBytes, node);
    }

    /**
     * Node text with whitespace runs collapsed, used wherever an expression has to be shown as text.
     */
    public String inlineText(TSNode node) {
        String text = normalizeInline(text(node));
        return text != null ? text : "";
    }

    public static boolean is(TSNode node, String type) {
        return !isNull(node) && type.equals(node.getType());
    }

    public static TSNode unwrapParentheses(TSNode node) {
        TSNode current = node;
        while (is(current, PARENTHESIZED) && current.getNamedChildCount() > 0) {
            current = current.getNamedChild(0);
        }
        return current;
    }

    /**
     * Value of a single-quoted string or of a double-quoted string without interpolation; null otherwise.
     */
    public String stringLiteral(TSNode node) {
        if (isNull(node)) return null;
        String type = node.getType();
        if (STRING.equals(type)) {
            String body = stripQuotes(text(node), '\'');
            return body != null ? body.replace("\\'", "'").replace("\\\\", "\\") : null;
        }
        if (ENCAPSED_STRING.equals(type)) {
            for (TSNode part : namedChildren(node)) {
                if (!isNodeTypeOneOf(part, "string_content", "string_value", "escape_sequence")) {
                    return null;
                }
            }
            String body = stripQuotes(text(node), '"');
            return body != null ? unescapeDoubleQuoted(body) : null;
        }
        return null;
    }

    private static String stripQuotes(String text, char quote) {
        if (text == null) return null;
        String value = text;
        // binary string prefix: b'...'
        if (value.length() > 0 && (value.charAt(0) == 'b' || value.charAt(0) == 'B')) {
            value = value.substring(1);
        }
        if (value.length() >= 2 && value.charAt(0) == quote && value.charAt(value.length() - 1) == quote) {
            return value.substring(1, value.length() - 1);
        }
        return null;
    }

    private static String unescapeDoubleQuoted(String body) {
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(i + 1);
                switch (next) {
                    case 'n': sb.append('\n'); i++; continue;
                    case 't': sb.append('\t'); i++; continue;
                    case '"': case '\\': case '$': sb.append(next); i++; continue;
                    default: break;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * {@code $rules} gives {@code rules}; null for anything that is not a plain variable.
     */
    public String variableName(TSNode node) {
        if (!is(node, VARIABLE)) return null;
        String text = text(node);
        if (text == null) return null;
        return text.startsWith("$") ? text.substring(1) : text;
    }

    public boolean isThis(TSNode node) {
        return "this".equals(variableName(node));
    }

    public String callName(TSNode call) {
        TSNode name = getChildByFieldName(call, "name");
        if (isNull(name) && is(call, FUNCTION_CALL)) {
            name = getChildByFieldName(call, "function");
        }
        if (isNull(name)) return null;
        String text = text(name);
        return text != null && text.startsWith("\\") ? text.substring(1) : text;
    }

    /**
     * Expression of a {@code return}, skipping comments written before it; null for a bare return.
     */
    public static TSNode returnedExpression(TSNode returnStatement) {
        for (TSNode child : namedChildren(returnStatement)) {
            if (!is(child, "comment")) return child;
        }
        return null;
    }

    public static TSNode callObject(TSNode memberCall) {
        return getChildByFieldName(memberCall, "object");
    }

    /**
     * Class part of {@code Rule::in(...)}, without a leading namespace separator.
     */
    public String callScope(TSNode scopedCall) {
        TSNode scope = getChildByFieldName(scopedCall, "scope");
        if (isNull(scope)) return null;
        String text = text(scope);
        return text != null && text.startsWith("\\") ? text.substring(1) : text;
    }

    /**
     * Whether a class reference written in source names the given short class name,
     * e.g. {@code Rule} and {@code Illuminate\Validation\Rule} both name {@code Rule}.
     */
    public static boolean namesClass(String written, String shortName) {
        if (written == null || shortName == null) return false;
        return written.equals(shortName) || written.endsWith("\\" + shortName);
    }

    /**
     * Argument expressions of a call, in order. Named arguments contribute their value.
     */
    public static List<TSNode> callArguments(TSNode call) {
        List<TSNode> result = new ArrayList<>();
        TSNode arguments = getChildByFieldName(call, "arguments");
        if (isNull(arguments)) {
            arguments = findFirstChild(call, "arguments");
        }
        for (TSNode argument : namedChildren(arguments)) {
            if (is(argument, "argument")) {
                int count = argument.getNamedChildCount();
                if (count > 0) result.add(argument.getNamedChild(count - 1));
            } else if (!is(argument, "comment")) {
                result.add(argument);
            }
        }
        return result;
    }

    public String binaryOperator(TSNode binary) {
        TSNode operator = getChildByFieldName(binary, "operator");
        if (!isNull(operator)) return text(operator);
        List<String> tokens = anonymousTokens(sourceBytes, binary);
        return tokens.isEmpty() ? null : tokens.get(0);
    }

    public static TSNode left(TSNode node) {
        return getChildByFieldName(node, "left");
    }

    public static TSNode right(TSNode node) {
        return getChildByFieldName(node, "right");
    }

    /**
     * One {@code array_element_initializer}: key is null for list-style items.
     */
    public static final class ArrayElement {
        public final TSNode key;
        public final TSNode value;
        public final boolean spread;

        ArrayElement(TSNode key, TSNode value, boolean spread) {
            this.key = key;
            this.value = value;
            this.spread = spread;
        }
    }

    public List<ArrayElement> arrayElements(TSNode array) {
        List<ArrayElement> elements = new ArrayList<>();
        for (TSNode element : findAllChildren(array, ARRAY_ELEMENT)) {
            List<TSNode> parts = namedChildren(element);
            List<String> tokens = anonymousTokens(sourceBytes, element);
            if (parts.isEmpty()) continue;

            if (tokens.contains("...") || is(parts.get(0), SPREAD)) {
                elements.add(new ArrayElement(null, parts.get(parts.size() - 1), true));
            } else if (tokens.contains("=>") && parts.size() >= 2) {
                elements.add(new ArrayElement(parts.get(0), parts.get(parts.size() - 1), false));
            } else {
                elements.add(new ArrayElement(null, parts.get(parts.size() - 1), false));
            }
        }
        return elements;
    }

    /**
     * {@code StatusEnum::class} gives {@code StatusEnum}; null for any other expression.
     */
    public String classReference(TSNode node) {
        if (!is(node, CLASS_CONSTANT)) return null;
        String text = normalizeInline(text(node));
        if (text == null || !text.endsWith(CLASS_SUFFIX)) return null;
        String typeName = text.substring(0, text.length() - CLASS_SUFFIX.length()).trim();
        return typeName.isEmpty() ? null : typeName;
    }

    /**
     * Class named after {@code new}; null for anonymous classes and dynamic class expressions.
     */
    public String createdClassName(TSNode objectCreation) {
        if (!is(objectCreation, OBJECT_CREATION)) return null;
        TSNode designator = findFirstChild(objectCreation, "class_type_designator");
        TSNode holder = designator != null ? designator : objectCreation;
        for (TSNode child : namedChildren(holder)) {
            if (isNodeTypeOneOf(child, "name", "qualified_name")) {
                return text(child);
            }
        }
        return null;
    }
}
