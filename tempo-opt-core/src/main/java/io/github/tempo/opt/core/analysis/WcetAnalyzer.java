package io.github.tempo.opt.core.analysis;

import io.github.tempo.opt.core.OptimizationException;
import io.github.tempo.opt.core.ops.TreeOps;
import io.github.tempo.opt.core.tree.*;

import java.util.*;

/**
 * Computes a conservative worst-case cycle bound and the dominant cost path of every function.
 * <p>
 * A bound is either proven finite or the analysis fails with an
 * {@link io.github.tempo.opt.core.OptimizationError.AnalysisFailure AnalysisFailure}:
 * loops need a static or declared iteration bound, the call graph must be acyclic
 * except for direct self-recursion with a declared depth, and cycle counts must fit in a {@code long}.
 */
public class WcetAnalyzer {
    private final CostModel model;
    private final CallProfile profile;

    public WcetAnalyzer(CostModel model, CallProfile profile) {
        this.model = model;
        this.profile = profile;
    }

    public WcetAnalyzer() {
        this(CostModel.DEFAULT, CallProfile.EMPTY);
    }

    /**
     * Analyze every function of a program.
     *
     * @param program The program.
     * @return The analysis results.
     * @throws OptimizationException If a bound cannot be proven finite.
     */
    public AnalysisResults analyze(ProgramView program) {
        Run run = new Run(program);
        for (Function function : program.functions()) {
            run.summarize(function);
        }
        SortedMap<Integer, Long> bounds = new TreeMap<>();
        SortedMap<Integer, CriticalPath> paths = new TreeMap<>();
        List<CriticalPath> criticalPaths = new ArrayList<>();
        for (Function function : program.functions()) {
            bounds.put(function.getId(), run.summaries.get(function.getId()).cycles);
            CriticalPath path = run.dominantPath(function);
            paths.put(function.getId(), path);
            if (ProgramView.isRoot(function)) criticalPaths.add(path);
        }
        return new AnalysisResults(Reachability.compute(program), bounds, paths, criticalPaths);
    }

    /**
     * The cost of a subtree on its worst path: cycles, and how often each callee is called on it.
     */
    private static final class Cost {
        final long cycles;
        final SortedMap<Integer, Long> calls;

        Cost(long cycles, SortedMap<Integer, Long> calls) {
            this.cycles = cycles;
            this.calls = calls;
        }

        Cost(long cycles) {
            this(cycles, new TreeMap<>());
        }
    }

    private class Run {
        final ProgramView program;
        final Map<Integer, Cost> summaries = new HashMap<>();
        final Deque<Function> stack = new ArrayDeque<>();

        Run(ProgramView program) {
            this.program = program;
        }

        Cost summarize(Function function) {
            Cost summary = summaries.get(function.getId());
            if (summary != null) return summary;
            if (stack.contains(function)) {
                List<String> cycle = new ArrayList<>();
                Iterator<Function> it = stack.descendingIterator();
                boolean inCycle = false;
                while (it.hasNext()) {
                    Function f = it.next();
                    if (f == function) inCycle = true;
                    if (inCycle) cycle.add(f.getName());
                }
                cycle.add(function.getName());
                throw OptimizationException.analysisFailure(function.getName(),
                        "unannotated recursion through " + String.join(" -> ", cycle));
            }
            stack.push(function);
            FunctionCost body = new FunctionCost(this, function);
            Cost cost = body.cost(function.getBody());
            Integer depth = function.getRecursionDepth();
            if (body.selfCalls && depth != null) {
                cost = body.times(cost, depth);
            } else if (body.selfCalls) {
                throw OptimizationException.analysisFailure(function.getName(),
                        "unannotated recursion through " + function.getName() + " -> " + function.getName());
            }
            stack.pop();
            summaries.put(function.getId(), cost);
            return cost;
        }

        CriticalPath dominantPath(Function start) {
            List<CriticalPath.Entry> entries = new ArrayList<>();
            Set<Integer> visited = new HashSet<>();
            Function current = start;
            long frequency = 1;
            while (current != null && visited.add(current.getId())) {
                entries.add(new CriticalPath.Entry(current.getId(), current.getName(), frequency));
                Function next = null;
                long nextFrequency = 0;
                long bestRank = -1;
                for (Map.Entry<Integer, Long> call : summaries.get(current.getId()).calls.entrySet()) {
                    Function callee = program.function(call.getKey());
                    if (callee == null || visited.contains(callee.getId())) continue;
                    Long observed = profile.frequency(callee.getName());
                    long calleeFrequency = observed != null
                            ? observed
                            : saturatingMultiply(frequency, call.getValue());
                    long rank = saturatingMultiply(calleeFrequency, summaries.get(callee.getId()).cycles);
                    if (rank > bestRank) {
                        bestRank = rank;
                        next = callee;
                        nextFrequency = calleeFrequency;
                    }
                }
                current = next;
                frequency = nextFrequency;
            }
            return new CriticalPath(entries);
        }
    }

    private static long saturatingMultiply(long a, long b) {
        long high = Math.multiplyHigh(a, b);
        long low = a * b;
        if (high != 0 || low < 0) return Long.MAX_VALUE;
        return low;
    }

    /**
     * Costs the nodes of one function body.
     */
    private class FunctionCost {
        final Run run;
        final Function function;
        boolean selfCalls = false;

        FunctionCost(Run run, Function function) {
            this.run = run;
            this.function = function;
        }

        Cost cost(Node node) {
            if (node.op == TreeOps.BLOCK) return block(node);
            if (node.op == TreeOps.EVAL) return cost(node.child(0));
            if (node.op == TreeOps.IF) return branch(node);
            if (node.op == TreeOps.RETURN) return withChildren(model.ret, node);
            switch (node.op.key.mnemonic) {
                case "const":
                    return new Cost(model.constant);
                case "local.get":
                case "local.set":
                    return withChildren(model.localAccess, node);
                case "global.get":
                case "global.set":
                    return withChildren(model.globalAccess, node);
                case "load":
                    return withChildren(model.load, node);
                case "store":
                    return withChildren(model.store, node);
                case "binary":
                    return withChildren(model.binary(TreeOps.BINARY.cast(node.op).arg), node);
                case "unary":
                    return withChildren(model.unary, node);
                case "extern":
                    return withChildren(TreeOps.EXTERN.cast(node.op).arg.cycles, node);
                case "call":
                    return call(node);
                case "repeat":
                    return repeat(node);
                case "while":
                    return whileLoop(node);
                default:
                    throw OptimizationException.analysisFailure(function.getName(),
                            "no cost known for node kind " + node.op.key);
            }
        }

        Cost withChildren(long own, Node node) {
            Cost total = new Cost(own);
            for (Node child : node.children) {
                total = plus(total, cost(child));
            }
            return total;
        }

        Cost block(Node block) {
            Cost total = new Cost(0);
            Node previous = null;
            for (Node statement : block.children) {
                Cost cost = cost(statement);
                if (previous != null && MemoryAccess.hitsPreviousLine(previous, statement, model.cacheLineBytes)) {
                    cost = new Cost(cost.cycles - model.load + Math.min(model.load, model.loadLineHit), cost.calls);
                }
                previous = statement;
                total = plus(total, cost);
            }
            return total;
        }

        Cost branch(Node node) {
            Node cond = node.child(0);
            // branch-on-false is the same instruction as branch-on-true
            if (TreeOps.UNARY.argNullable(cond.op) == UnOp.NOT) cond = cond.child(0);
            Cost thenCost = cost(node.child(1));
            Cost elseCost = cost(node.child(2));
            Cost worst = elseCost.cycles > thenCost.cycles ? elseCost : thenCost;
            return plus(plus(new Cost(model.branch), cost(cond)), worst);
        }

        Cost repeat(Node node) {
            int tripCount = TreeOps.REPEAT.cast(node.op).arg;
            Cost iteration = plus(new Cost(model.loopIteration), cost(node.child(0)));
            return times(iteration, tripCount);
        }

        Cost whileLoop(Node node) {
            Node cond = node.child(0);
            Integer declared = TreeOps.WHILE.cast(node.op).arg;
            Literal literalCond = TreeOps.literalOf(cond);
            long bound;
            if (literalCond != null && literalCond.isZero()) {
                bound = 0;
            } else if (declared != null) {
                bound = declared;
            } else {
                throw OptimizationException.analysisFailure(function.getName(),
                        "loop without a provable iteration bound: " + node.op);
            }
            Cost condCost = cost(cond);
            Cost iteration = plus(new Cost(model.loopIteration), cost(node.child(1)));
            return plus(times(condCost, add(bound, 1)), times(iteration, bound));
        }

        Cost call(Node node) {
            int calleeId = TreeOps.CALL.cast(node.op).arg;
            Function callee = run.program.function(calleeId);
            if (callee == null) {
                throw OptimizationException.analysisFailure(function.getName(),
                        "call to missing function #" + calleeId);
            }
            Cost args = withChildren(model.callOverhead, node);
            if (callee.getId() == function.getId()) {
                selfCalls = true;
                return args;
            }
            Cost calleeCost = run.summarize(callee);
            SortedMap<Integer, Long> calls = new TreeMap<>();
            calls.put(callee.getId(), 1L);
            return plus(args, new Cost(calleeCost.cycles, calls));
        }

        Cost plus(Cost a, Cost b) {
            SortedMap<Integer, Long> calls = new TreeMap<>(a.calls);
            for (Map.Entry<Integer, Long> entry : b.calls.entrySet()) {
                calls.merge(entry.getKey(), entry.getValue(), this::add);
            }
            return new Cost(add(a.cycles, b.cycles), calls);
        }

        Cost times(Cost a, long n) {
            SortedMap<Integer, Long> calls = new TreeMap<>();
            for (Map.Entry<Integer, Long> entry : a.calls.entrySet()) {
                if (n != 0) calls.put(entry.getKey(), multiply(entry.getValue(), n));
            }
            return new Cost(multiply(a.cycles, n), calls);
        }

        long add(long a, long b) {
            try {
                return Math.addExact(a, b);
            } catch (ArithmeticException e) {
                throw overflow();
            }
        }

        long multiply(long a, long b) {
            try {
                return Math.multiplyExact(a, b);
            } catch (ArithmeticException e) {
                throw overflow();
            }
        }

        OptimizationException overflow() {
            return OptimizationException.analysisFailure(function.getName(), "cycle count overflows 64 bits");
        }
    }
}
