package io.github.tempo.opt.core.analysis;

import io.github.tempo.opt.core.ops.OpKey;
import io.github.tempo.opt.core.ops.TreeOps;
import io.github.tempo.opt.core.tree.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Checks that a program tree is internally consistent: every node has the arity of its kind,
 * structured statements have block bodies, and every call and global reference resolves.
 */
public class IntegrityCheck {
    public static final IntegrityCheck INSTANCE = new IntegrityCheck();

    /**
     * Find the first integrity problem in the program.
     *
     * @param program The program.
     * @return A description of the problem, or null if the tree is consistent.
     */
    @Nullable
    public String findProblem(ProgramView program) {
        for (Function function : program.functions()) {
            if (function.getBody() == null || function.getBody().op != TreeOps.BLOCK) {
                return String.format("body of %s is not a block", function.getName());
            }
            Deque<Node> stack = new ArrayDeque<>();
            stack.push(function.getBody());
            while (!stack.isEmpty()) {
                Node node = stack.pop();
                String problem = checkNode(program, node);
                if (problem != null) {
                    return String.format("%s\n  in function: %s\n  node: %s", problem, function.getName(), node.op);
                }
                for (Node child : node.children) {
                    stack.push(child);
                }
            }
        }
        return null;
    }

    /**
     * Check the program, throwing if it is inconsistent.
     *
     * @param program The program.
     * @throws IllegalArgumentException If the tree is inconsistent.
     */
    public void verify(ProgramView program) {
        String problem = findProblem(program);
        if (problem != null) {
            throw new IllegalArgumentException("malformed program tree: " + problem);
        }
    }

    @Nullable
    private String checkNode(ProgramView program, Node node) {
        OpKey key = node.op.key;
        int arity = node.children.size();
        if (!key.acceptsArity(arity)) {
            return String.format("expected %d children, got %d", key.arity, arity);
        }
        if (node.op == TreeOps.RETURN) return arity > 1 ? "return with " + arity + " values" : null;
        if (node.op == TreeOps.IF) {
            return node.child(1).op != TreeOps.BLOCK || node.child(2).op != TreeOps.BLOCK
                    ? "if arms must be blocks"
                    : null;
        }
        if (key == TreeOps.REPEAT) {
            return node.child(0).op != TreeOps.BLOCK ? "repeat body must be a block" : null;
        }
        if (key == TreeOps.WHILE) {
            return node.child(1).op != TreeOps.BLOCK ? "while body must be a block" : null;
        }
        if (key == TreeOps.GLOBAL_GET || key == TreeOps.GLOBAL_SET) {
            int id = key == TreeOps.GLOBAL_GET
                    ? TreeOps.GLOBAL_GET.cast(node.op).arg
                    : TreeOps.GLOBAL_SET.cast(node.op).arg;
            return program.global(id) == null ? "dangling reference to global #" + id : null;
        }
        if (key == TreeOps.CALL) {
            int id = TreeOps.CALL.cast(node.op).arg;
            Function callee = program.function(id);
            if (callee == null) return "dangling call to function #" + id;
            if (callee.getParams().size() != arity) {
                return String.format("call to %s with %d arguments, expected %d",
                        callee.getName(), arity, callee.getParams().size());
            }
        }
        return null;
    }
}
