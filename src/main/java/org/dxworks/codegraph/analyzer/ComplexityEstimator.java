package org.dxworks.codegraph.analyzer;

import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.Deque;

import static org.dxworks.codegraph.analyzer.TreeSitterHelper.endLine;
import static org.dxworks.codegraph.analyzer.TreeSitterHelper.isTypeOneOf;
import static org.dxworks.codegraph.analyzer.TreeSitterHelper.namedChildren;
import static org.dxworks.codegraph.analyzer.TreeSitterHelper.startLine;

/**
 * Branch-counting approximation of cyclomatic complexity over a Python syntax tree.
 * <p>
 * Starts at 1.0 and adds 1.0 for every {@code if}, {@code elif}, {@code for} (including
 * {@code async for}), {@code while}, {@code except} clause, {@code with} block and
 * {@code assert}. A boolean chain of N operands adds N-1; tree-sitter nests such chains as
 * binary {@code boolean_operator} nodes, so each node adds one.
 * <p>
 * The walk does not stop at nested definitions: a class scores the branches of all its
 * methods, and a function scores the branches of its inner functions.
 */
public final class ComplexityEstimator {

    static final double BASELINE = 1.0;

    private static final String[] BRANCH_TYPES = {
            "if_statement", "elif_clause",
            "for_statement", "while_statement",
            "except_clause", "except_group_clause",
            "with_statement",
            "assert_statement",
            "boolean_operator"
    };

    private ComplexityEstimator() {
    }

    public static double estimate(TSNode unit) {
        double complexity = BASELINE;
        if (unit == null || unit.isNull()) return complexity;

        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(unit);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (isTypeOneOf(node.getType(), BRANCH_TYPES)) {
                complexity += 1.0;
            }
            for (TSNode child : namedChildren(node)) {
                stack.push(child);
            }
        }
        return complexity;
    }

    public static int linesOfCode(TSNode unit) {
        if (unit == null || unit.isNull()) return 1;
        return Math.max(1, endLine(unit) - startLine(unit) + 1);
    }
}
