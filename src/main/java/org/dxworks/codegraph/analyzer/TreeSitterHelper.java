package org.dxworks.codegraph.analyzer;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class TreeSitterHelper {

    /**
     * Tree-sitter reports UTF-8 byte offsets; Java strings are UTF-16, so node text is cut
     * from the encoded source rather than from the string.
     */
    public static String getNodeText(byte[] sourceBytes, TSNode node) {
        if (node == null || node.isNull()) return null;
        int startByte = Math.max(0, node.getStartByte());
        int endByte = Math.min(sourceBytes.length, node.getEndByte());
        if (startByte >= endByte) return "";
        return new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /** 1-based line on which the node starts. */
    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /** 1-based line on which the node ends. */
    public static int endLine(TSNode node) {
        return node.getEndPoint().getRow() + 1;
    }

    /** Named children in source order, filtered from all children by {@code isNamed()}. */
    public static List<TSNode> namedChildren(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        if (parent == null || parent.isNull()) return result;
        int count = parent.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull() && child.isNamed()) {
                result.add(child);
            }
        }
        return result;
    }

    public static List<TSNode> findAllChildrenOfTypes(TSNode parent, String... types) {
        List<TSNode> result = new ArrayList<>();
        for (TSNode child : namedChildren(parent)) {
            if (isTypeOneOf(child.getType(), types)) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Pre-order, source-ordered walk of the named descendants of {@code root}, root included.
     */
    public static List<TSNode> findAllDescendantsOfTypes(TSNode root, String... types) {
        List<TSNode> result = new ArrayList<>();
        if (root == null || root.isNull()) return result;
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (node == null || node.isNull()) continue;
            if (isTypeOneOf(node.getType(), types)) result.add(node);
            List<TSNode> children = namedChildren(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    public static TSNode getChildByFieldName(TSNode parent, String fieldName) {
        if (parent == null || parent.isNull()) return null;
        // getFieldNameForChild indexes all children, anonymous tokens included
        for (int i = 0; i < parent.getChildCount(); i++) {
            if (fieldName.equals(parent.getFieldNameForChild(i))) {
                return parent.getChild(i);
            }
        }
        return null;
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(TSNode node, String... types) {
        if (node == null || node.isNull()) return false;
        return isTypeOneOf(node.getType(), types);
    }

    public static boolean sameNode(TSNode a, TSNode b) {
        if (a == null || b == null || a.isNull() || b.isNull()) return false;
        return a.getStartByte() == b.getStartByte() && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }
}
