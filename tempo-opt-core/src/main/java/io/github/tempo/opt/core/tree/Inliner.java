package io.github.tempo.opt.core.tree;

import io.github.tempo.opt.core.ext.CommonExts;
import io.github.tempo.opt.core.ops.TreeOps;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies the body of a function into a call site, binding the parameters to fresh locals.
 * <p>
 * Every local of the callee, parameters included, is renamed to {@code callee$index$name},
 * so the index must be unique among the inlinings into one caller.
 */
public class Inliner {
    private final Function from;
    private final String prefix;
    private final Map<String, String> localMap = new HashMap<>();

    public Inliner(Function from, int index) {
        this.from = from;
        this.prefix = from.getName() + "$" + index + "$";
    }

    /**
     * The result of inlining a call: statements to run in place of the call,
     * and the expression for its value.
     */
    public static class InlinedCall {
        public final List<Node> statements;
        @Nullable
        public final Node result;

        InlinedCall(List<Node> statements, @Nullable Node result) {
            this.statements = statements;
            this.result = result;
        }
    }

    /**
     * Check whether a function can be inlined: its only {@code return}, if any,
     * is the last statement of its body, and it does not call itself.
     *
     * @param function The function.
     * @return Whether it can be inlined.
     */
    public static boolean isInlinable(Function function) {
        List<Node> statements = function.getBody().children;
        for (int i = 0; i < statements.size(); i++) {
            Node statement = statements.get(i);
            boolean trailing = i == statements.size() - 1 && statement.op == TreeOps.RETURN;
            for (Node child : trailing ? statement.children : Collections.singletonList(statement)) {
                if (containsReturnOrSelfCall(child, function.getId())) return false;
            }
        }
        return true;
    }

    private static boolean containsReturnOrSelfCall(Node node, int selfId) {
        if (node.op == TreeOps.RETURN) return true;
        Integer callee = TreeOps.CALL.argNullable(node.op);
        if (callee != null && callee == selfId) return true;
        for (Node child : node.children) {
            if (containsReturnOrSelfCall(child, selfId)) return true;
        }
        return false;
    }

    /**
     * Inline the function, with the given argument expressions.
     *
     * @param args The arguments, one per parameter. They are used, not copied.
     * @return The inlined call.
     */
    public InlinedCall inline(List<Node> args) {
        List<String> params = from.getParams();
        if (args.size() != params.size()) {
            throw new IllegalArgumentException(String.format("%s takes %d arguments, got %d",
                    from.getName(), params.size(), args.size()));
        }
        List<Node> statements = new ArrayList<>();
        for (int i = 0; i < params.size(); i++) {
            Node binding = TreeOps.localSet(rename(params.get(i)), args.get(i));
            binding.attachExt(CommonExts.PARAMETER_BINDING, params.get(i));
            statements.add(binding);
        }
        Node result = null;
        List<Node> body = from.getBody().children;
        for (int i = 0; i < body.size(); i++) {
            Node copy = refreshLocals(body.get(i).copy());
            if (i == body.size() - 1 && copy.op == TreeOps.RETURN) {
                if (!copy.children.isEmpty()) result = copy.child(0);
            } else {
                statements.add(copy);
            }
        }
        return new InlinedCall(statements, result);
    }

    private Node refreshLocals(Node node) {
        String name = TreeOps.LOCAL_GET.argNullable(node.op);
        if (name != null) {
            node.op = TreeOps.LOCAL_GET.create(rename(name));
        }
        name = TreeOps.LOCAL_SET.argNullable(node.op);
        if (name != null) {
            node.op = TreeOps.LOCAL_SET.create(rename(name));
        }
        for (Node child : node.children) {
            refreshLocals(child);
        }
        return node;
    }

    private String rename(String local) {
        return localMap.computeIfAbsent(local, old -> prefix + old);
    }
}
