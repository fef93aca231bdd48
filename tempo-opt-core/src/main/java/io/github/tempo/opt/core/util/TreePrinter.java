package io.github.tempo.opt.core.util;

import io.github.tempo.opt.core.ext.CommonExts;
import io.github.tempo.opt.core.ops.TreeOps;
import io.github.tempo.opt.core.tree.Function;
import io.github.tempo.opt.core.tree.Node;

/**
 * Prints program trees in a canonical S-expression form.
 * <p>
 * Two functions print identically exactly when they are structurally identical,
 * so the printed form doubles as the byte representation used to check that
 * a pass left a function untouched.
 */
public class TreePrinter {
    private static final String INDENT = "  ";

    /**
     * Print a node and its subtree.
     *
     * @param node The node.
     * @return The printed form.
     */
    public static String print(Node node) {
        StringBuilder sb = new StringBuilder();
        print(sb, node, 0);
        return sb.toString();
    }

    /**
     * Print a function, including its signature and attributes.
     *
     * @param function The function.
     * @return The printed form.
     */
    public static String print(Function function) {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(function.getName())
                .append('#').append(function.getId())
                .append('(').append(String.join(", ", function.getParams())).append(')');
        if (function.isExported()) sb.append(" export");
        if (function.getRecursionDepth() != null) {
            sb.append(" recursion=").append(function.getRecursionDepth());
        }
        sb.append(' ');
        print(sb, function.getBody(), 0);
        return sb.toString();
    }

    private static void print(StringBuilder sb, Node node, int depth) {
        sb.append('(').append(node.op);
        Double probability = node.getNullable(CommonExts.BRANCH_PROBABILITY);
        if (probability != null) {
            sb.append(" [p=").append(probability).append(']');
        }
        boolean multiline = node.op == TreeOps.BLOCK;
        for (Node child : node.children) {
            if (multiline) {
                sb.append('\n');
                for (int i = 0; i <= depth; i++) {
                    sb.append(INDENT);
                }
                print(sb, child, depth + 1);
            } else {
                sb.append(' ');
                print(sb, child, depth);
            }
        }
        sb.append(')');
    }
}
