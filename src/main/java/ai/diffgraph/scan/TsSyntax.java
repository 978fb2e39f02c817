package ai.diffgraph.scan;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.treesitter.TSNode;

/**
 * Source text access over a tree-sitter tree. Node offsets are UTF-8 byte offsets, so text
 * is sliced from the encoded content rather than from the Java string.
 */
final class TsSyntax {

    static final Set<String> JSX_NODES = Set.of("jsx_element", "jsx_self_closing_element", "jsx_fragment");

    private final byte[] bytes;

    TsSyntax(String content) {
        this.bytes = content.getBytes(StandardCharsets.UTF_8);
    }

    String text(TSNode node) {
        if (node == null) {
            return "";
        }
        return slice(node.getStartByte(), node.getEndByte());
    }

    String slice(int startByte, int endByte) {
        final int start = Math.max(0, Math.min(startByte, bytes.length));
        final int end = Math.max(start, Math.min(endByte, bytes.length));
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    static int endLine(TSNode node) {
        return node.getEndPoint().getRow() + 1;
    }

    static TSNode field(TSNode node, String name) {
        if (node == null) {
            return null;
        }
        final TSNode child = node.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    static TSNode parent(TSNode node) {
        final TSNode parent = node.getParent();
        return parent == null || parent.isNull() ? null : parent;
    }

    /** Every named child, comments included. */
    static List<TSNode> namedNodes(TSNode node) {
        final int count = node.getChildCount();
        final List<TSNode> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final TSNode child = node.getChild(i);
            if (child != null && !child.isNull() && child.isNamed()) {
                out.add(child);
            }
        }
        return out;
    }

    /** Named children without comments. */
    static List<TSNode> namedChildren(TSNode node) {
        final List<TSNode> out = new ArrayList<>();
        for (TSNode child : namedNodes(node)) {
            if (!"comment".equals(child.getType())) {
                out.add(child);
            }
        }
        return out;
    }

    static TSNode firstNamedChild(TSNode node) {
        final List<TSNode> children = namedChildren(node);
        return children.isEmpty() ? null : children.get(0);
    }

    static boolean hasToken(TSNode node, String token) {
        final int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            final TSNode child = node.getChild(i);
            if (child != null && !child.isNull() && !child.isNamed() && token.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }

    static boolean sameNode(TSNode a, TSNode b) {
        return a != null && b != null
                && a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    static String rangeKey(TSNode node) {
        return node.getStartByte() + ":" + node.getEndByte() + ":" + node.getType();
    }

    /** Strips {@code await} and redundant parentheses around an expression. */
    static TSNode unwrap(TSNode expression) {
        TSNode current = expression;
        while (current != null
                && ("await_expression".equals(current.getType())
                || "parenthesized_expression".equals(current.getType()))) {
            current = firstNamedChild(current);
        }
        return current;
    }

    /**
     * Name a call is made through: {@code foo}, {@code items.map}, or just the property for
     * calls on computed receivers ({@code fetch(a).then} becomes {@code then}). A leading
     * {@code this.} is dropped.
     */
    String calleeName(TSNode callExpression) {
        final TSNode function = field(callExpression, "function");
        if (function == null) {
            return "";
        }
        String name = text(function);
        if ("member_expression".equals(function.getType()) && (name.indexOf('(') >= 0 || name.indexOf('\n') >= 0)) {
            name = text(field(function, "property"));
        }
        name = name.replaceAll("\\s+", "");
        if (name.startsWith("this.")) {
            name = name.substring("this.".length());
        }
        return name;
    }

    boolean containsJsx(TSNode node) {
        if (JSX_NODES.contains(node.getType())) {
            return true;
        }
        for (TSNode child : namedNodes(node)) {
            if (containsJsx(child)) {
                return true;
            }
        }
        return false;
    }

    /** Distinct JSX tag names under {@code node}, in document order. */
    List<String> jsxTagNames(TSNode node) {
        final List<String> out = new ArrayList<>();
        collectJsxTags(node, out);
        return out;
    }

    private void collectJsxTags(TSNode node, List<String> out) {
        final String type = node.getType();
        if ("jsx_opening_element".equals(type) || "jsx_self_closing_element".equals(type)) {
            final String name = text(field(node, "name"));
            if (!name.isEmpty() && !out.contains(name)) {
                out.add(name);
            }
        }
        for (TSNode child : namedNodes(node)) {
            collectJsxTags(child, out);
        }
    }
}
