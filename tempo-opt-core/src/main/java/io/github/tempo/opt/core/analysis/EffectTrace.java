package io.github.tempo.opt.core.analysis;

import io.github.tempo.opt.core.ext.CommonExts;
import io.github.tempo.opt.core.ops.TreeOps;
import io.github.tempo.opt.core.tree.Function;
import io.github.tempo.opt.core.tree.Node;
import io.github.tempo.opt.core.tree.ProgramView;
import io.github.tempo.opt.core.tree.UnOp;
import io.github.tempo.opt.core.util.TreePrinter;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes the canonical effect trace of a function: the ordered observable effects
 * (stores, global writes, externs and returns) of its body, each with its printed operands.
 * <p>
 * Calls are expanded into the trace of their callee, preceded by the binding of each parameter
 * to its argument, and {@code repeat} bodies are expanded up to {@link #REPEAT_EXPANSION_LIMIT}
 * iterations. The arms of an {@code if} are ordered by the polarity of its condition.
 * Locals are printed without the {@code callee$index$} prefix the {@link io.github.tempo.opt.core.tree.Inliner}
 * gives them, and the statements it binds parameters with are printed as bindings, so that unrolling,
 * inlining and branch reordering all leave the trace unchanged.
 */
public class EffectTrace {
    public static final int REPEAT_EXPANSION_LIMIT = 256;

    private static final Pattern INLINED_LOCAL = Pattern.compile("([^$]+)\\$(\\d+)\\$(.+)");

    private final ProgramView program;
    private final Map<Integer, String> calleeTraces = new HashMap<>();
    private final Set<Integer> inProgress = new HashSet<>();

    public EffectTrace(ProgramView program) {
        this.program = program;
    }

    /**
     * The trace of a function as the entry point of a run, including its returns.
     *
     * @param function The function.
     * @return The trace.
     */
    public String trace(Function function) {
        StringBuilder sb = new StringBuilder();
        inProgress.add(function.getId());
        try {
            append(sb, function.getBody(), true);
        } finally {
            inProgress.remove(function.getId());
        }
        return sb.toString();
    }

    private String calleeTrace(Function callee) {
        String cached = calleeTraces.get(callee.getId());
        if (cached != null) return cached;
        if (inProgress.contains(callee.getId())) return "call#" + callee.getId() + ";";
        StringBuilder sb = new StringBuilder();
        inProgress.add(callee.getId());
        try {
            append(sb, callee.getBody(), false);
        } finally {
            inProgress.remove(callee.getId());
        }
        String trace = sb.toString();
        calleeTraces.put(callee.getId(), trace);
        return trace;
    }

    private void append(StringBuilder sb, Node node, boolean topLevel) {
        if (node.op == TreeOps.IF) {
            append(sb, node.child(0), topLevel);
            boolean negated = false;
            Node cond = node.child(0);
            while (TreeOps.UNARY.argNullable(cond.op) == UnOp.NOT) {
                negated = !negated;
                cond = cond.child(0);
            }
            Node first = negated ? node.child(2) : node.child(1);
            Node second = negated ? node.child(1) : node.child(2);
            StringBuilder arm = new StringBuilder();
            append(arm, first, topLevel);
            String firstTrace = arm.toString();
            arm.setLength(0);
            append(arm, second, topLevel);
            // effect-free branches are not observable
            if (!firstTrace.isEmpty() || arm.length() != 0) {
                sb.append("if{").append(firstTrace).append("}{").append(arm).append("}");
            }
            return;
        }
        if (node.op.key == TreeOps.REPEAT) {
            int tripCount = TreeOps.REPEAT.cast(node.op).arg;
            StringBuilder body = new StringBuilder();
            append(body, node.child(0), topLevel);
            if (body.length() == 0) return;
            if (tripCount <= REPEAT_EXPANSION_LIMIT) {
                for (int i = 0; i < tripCount; i++) {
                    sb.append(body);
                }
            } else {
                sb.append("repeat ").append(tripCount).append("{").append(body).append("}");
            }
            return;
        }
        if (node.op.key == TreeOps.WHILE) {
            StringBuilder loop = new StringBuilder();
            append(loop, node.child(0), topLevel);
            loop.append(";");
            append(loop, node.child(1), topLevel);
            if (loop.length() > 1) {
                sb.append("while{").append(loop).append("}");
            }
            return;
        }
        if (node.op.key == TreeOps.CALL) {
            appendCall(sb, node, topLevel);
            return;
        }

        for (Node child : node.children) {
            append(sb, child, topLevel);
        }
        if (node.getExt(CommonExts.HAS_SIDE_EFFECT).orElse(false)) {
            sb.append(effect(node)).append(";");
        } else if (node.getNullable(CommonExts.PARAMETER_BINDING) != null) {
            appendBinding(sb, node.getExtOrThrow(CommonExts.PARAMETER_BINDING), node.child(0));
        } else if (node.op == TreeOps.RETURN && topLevel) {
            sb.append("ret;");
        }
    }

    private void appendCall(StringBuilder sb, Node node, boolean topLevel) {
        Function callee = program.function(TreeOps.CALL.cast(node.op).arg);
        List<String> params = callee == null ? null : callee.getParams();
        for (int i = 0; i < node.children.size(); i++) {
            Node arg = node.child(i);
            append(sb, arg, topLevel);
            if (params != null && i < params.size()) appendBinding(sb, params.get(i), arg);
        }
        sb.append(callee == null ? "call#" + TreeOps.CALL.cast(node.op).arg + ";" : calleeTrace(callee));
    }

    private static void appendBinding(StringBuilder sb, String param, Node value) {
        sb.append("let:").append(param).append(" ").append(operand(value)).append(";");
    }

    private static String effect(Node node) {
        StringBuilder sb = new StringBuilder();
        if (node.op.key == TreeOps.STORE) {
            sb.append("store:").append(TreeOps.STORE.cast(node.op).arg);
        } else if (node.op.key == TreeOps.GLOBAL_SET) {
            sb.append("gset#").append(TreeOps.GLOBAL_SET.cast(node.op).arg);
        } else if (node.op.key == TreeOps.EXTERN) {
            sb.append("io:").append(TreeOps.EXTERN.cast(node.op).arg.name);
        } else {
            sb.append(node.op);
        }
        for (Node child : node.children) {
            sb.append(" ").append(operand(child));
        }
        return sb.toString();
    }

    private static String operand(Node node) {
        return TreePrinter.print(stripInlinePrefixes(node.copy()));
    }

    private static Node stripInlinePrefixes(Node node) {
        String name = TreeOps.LOCAL_GET.argNullable(node.op);
        if (name != null) node.op = TreeOps.LOCAL_GET.create(baseName(name));
        name = TreeOps.LOCAL_SET.argNullable(node.op);
        if (name != null) node.op = TreeOps.LOCAL_SET.create(baseName(name));
        for (Node child : node.children) {
            stripInlinePrefixes(child);
        }
        return node;
    }

    private static String baseName(String local) {
        Matcher m;
        while ((m = INLINED_LOCAL.matcher(local)).matches()) {
            local = m.group(3);
        }
        return local;
    }
}
