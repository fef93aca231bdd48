package io.github.tempo.opt.core.analysis;

import io.github.tempo.opt.core.ops.TreeOps;
import io.github.tempo.opt.core.tree.*;
import io.github.tempo.opt.core.util.GraphWalker;

import java.util.*;

/**
 * The functions and globals transitively referenced from the program roots
 * ({@code main} and exported functions).
 */
public final class Reachability {
    private final SortedSet<Integer> functions;
    private final SortedSet<Integer> globals;

    private Reachability(SortedSet<Integer> functions, SortedSet<Integer> globals) {
        this.functions = Collections.unmodifiableSortedSet(functions);
        this.globals = Collections.unmodifiableSortedSet(globals);
    }

    /**
     * Compute the reachable set with a forward worklist seeded from the roots,
     * following call edges and global references.
     *
     * @param program The program.
     * @return The reachable set.
     */
    public static Reachability compute(ProgramView program) {
        List<Symbol> roots = new ArrayList<>();
        for (Function function : program.functions()) {
            if (ProgramView.isRoot(function)) roots.add(function);
        }
        SortedSet<Integer> functions = new TreeSet<>();
        SortedSet<Integer> globals = new TreeSet<>();
        GraphWalker<Symbol> walker = new GraphWalker<>(roots, symbol -> symbol instanceof Function
                ? references(program, (Function) symbol)
                : Collections.<Symbol>emptyList());
        for (Symbol symbol : walker.preOrder()) {
            (symbol instanceof Function ? functions : globals).add(symbol.getId());
        }
        return new Reachability(functions, globals);
    }

    /**
     * The functions and globals referenced by a function body, in tree order.
     * References to missing symbols are skipped.
     *
     * @param program  The program to resolve IDs in.
     * @param function The function.
     * @return The referenced symbols.
     */
    public static List<Symbol> references(ProgramView program, Function function) {
        List<Symbol> refs = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(function.getBody());
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            Integer callee = TreeOps.CALL.argNullable(node.op);
            if (callee != null) {
                Function target = program.function(callee);
                if (target != null) refs.add(target);
            }
            Integer globalId = TreeOps.GLOBAL_GET.argNullable(node.op);
            if (globalId == null) globalId = TreeOps.GLOBAL_SET.argNullable(node.op);
            if (globalId != null) {
                GlobalVariable global = program.global(globalId);
                if (global != null) refs.add(global);
            }
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.child(i));
            }
        }
        return refs;
    }

    public SortedSet<Integer> getFunctions() {
        return functions;
    }

    public SortedSet<Integer> getGlobals() {
        return globals;
    }
}
