package io.github.tempo.opt.core.passes.opts;

import io.github.tempo.opt.core.analysis.*;
import io.github.tempo.opt.core.ext.CommonExts;
import io.github.tempo.opt.core.ops.TreeOps;
import io.github.tempo.opt.core.passes.OptimizationPass;
import io.github.tempo.opt.core.passes.PassResult;
import io.github.tempo.opt.core.pipeline.OptimizerConfig;
import io.github.tempo.opt.core.tree.*;
import org.apache.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * An optimisation pass that speeds up the functions on the critical paths of the program roots,
 * where a cycle saved lowers the worst-case bound of the whole program.
 * <p>
 * Four independently enabled transforms are applied, in order:
 * <ol>
 *     <li>{@code repeat} loops with a small trip count and body are unrolled;</li>
 *     <li>hot statement-level calls are inlined, if that saves cycles;</li>
 *     <li>{@code if}s whose then arm is unlikely get their arms swapped and condition negated;</li>
 *     <li>runs of independent loads are sorted by address, so loads from one cache line are adjacent.</li>
 * </ol>
 * None of these changes the order of observable effects, which the
 * {@link #certifyDeterminism(ProgramSnapshot, ProgramView) certificate} checks with {@link EffectTrace}s.
 */
public class WcetGuidedOptimization implements OptimizationPass {
    private static final Logger LOGGER = Logger.getLogger(WcetGuidedOptimization.class);

    public static final String LOOPS_UNROLLED = "loopsUnrolled";
    public static final String CALLS_INLINED = "callsInlined";
    public static final String BRANCHES_REORDERED = "branchesReordered";
    public static final String ACCESSES_GROUPED = "accessesGrouped";

    private final OptimizerConfig config;
    private final WcetAnalyzer analyzer;

    public WcetGuidedOptimization(OptimizerConfig config) {
        this.config = config;
        this.analyzer = new WcetAnalyzer(config.getCostModel(), config.getCallProfile());
    }

    @Override
    public String name() {
        return "wcet-guided";
    }

    @Override
    public boolean isApplicable(ProgramView program, AnalysisResults analysis) {
        for (Function function : program.functions()) {
            if (!analysis.isOnCriticalPath(function.getId())) continue;
            Rewrite rewrite = new Rewrite(program, null, analysis, function);
            if (rewrite.run()) return true;
        }
        return false;
    }

    @Override
    public PassResult transform(Program program, AnalysisResults analysis) {
        PassResult.Builder result = PassResult.builder()
                .count(LOOPS_UNROLLED, 0)
                .count(CALLS_INLINED, 0)
                .count(BRANCHES_REORDERED, 0)
                .count(ACCESSES_GROUPED, 0);
        List<Function> touched = new ArrayList<>();
        long sizeBefore = 0;
        for (Function function : new ArrayList<>(program.functions())) {
            if (!analysis.isOnCriticalPath(function.getId())) continue;
            int size = function.getBody().size();
            Rewrite rewrite = new Rewrite(program, program, analysis, function);
            if (!rewrite.run()) continue;
            touched.add(function);
            sizeBefore += size;
            result.count(LOOPS_UNROLLED, rewrite.unrolled)
                    .count(CALLS_INLINED, rewrite.inlined)
                    .count(BRANCHES_REORDERED, rewrite.reordered)
                    .count(ACCESSES_GROUPED, rewrite.grouped);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(String.format("%s: unrolled %d, inlined %d, reordered %d, grouped %d",
                        function.getName(), rewrite.unrolled, rewrite.inlined, rewrite.reordered, rewrite.grouped));
            }
        }
        if (touched.isEmpty()) return PassResult.unchanged();

        long sizeAfter = 0;
        for (Function function : touched) {
            sizeAfter += function.getBody().size();
        }
        AnalysisResults after = analyzer.analyze(program);
        long wcetDelta = 0;
        for (Function function : touched) {
            Long oldBound = analysis.bound(function.getId());
            Long newBound = after.bound(function.getId());
            if (oldBound != null && newBound != null) wcetDelta += newBound - oldBound;
        }
        return result.setModified(true)
                .setEstimatedWcetDelta(wcetDelta)
                .setSizeDelta(sizeAfter - sizeBefore)
                .build();
    }

    @Override
    public boolean certifyDeterminism(ProgramSnapshot before, ProgramView after) {
        EffectTrace oldTraces = new EffectTrace(before);
        EffectTrace newTraces = new EffectTrace(after);
        for (int id : before.editedFunctionIds()) {
            Function old = before.function(id);
            Function now = after.function(id);
            if (old == null || now == null) return false;
            if (!oldTraces.trace(old).equals(newTraces.trace(now))) {
                LOGGER.debug("effect trace of " + now.getName() + " changed");
                return false;
            }
        }
        return before.removedFunctionIds().isEmpty() && before.removedGlobalIds().isEmpty();
    }

    /**
     * The rewriting of one function. With no program to edit, only checks whether there is anything to do.
     */
    private class Rewrite {
        final ProgramView view;
        @Nullable
        final Program program;
        final AnalysisResults analysis;
        final Function function;
        boolean edited = false;
        boolean found = false;
        int unrolled, inlined, reordered, grouped;

        Rewrite(ProgramView view, @Nullable Program program, AnalysisResults analysis, Function function) {
            this.view = view;
            this.program = program;
            this.analysis = analysis;
            this.function = function;
        }

        boolean dryRun() {
            return program == null;
        }

        /**
         * Called before each mutation.
         *
         * @return Whether to go ahead and mutate.
         */
        boolean mutate() {
            found = true;
            if (dryRun()) return false;
            if (!edited) {
                program.edit(function);
                edited = true;
            }
            return true;
        }

        boolean run() {
            if (config.isUnrollLoops()) {
                for (Node block : blocks(function.getBody())) unrollLoops(block);
                if (found && dryRun()) return true;
            }
            if (config.isInlineCalls()) {
                for (Node block : blocks(function.getBody())) inlineCalls(block);
                if (found && dryRun()) return true;
            }
            if (config.isReorderBranches()) {
                for (Node block : blocks(function.getBody())) reorderBranches(block);
                if (found && dryRun()) return true;
            }
            if (config.isGroupMemoryAccesses()) {
                for (Node block : blocks(function.getBody())) groupAccesses(block);
            }
            return found;
        }

        void unrollLoops(Node block) {
            List<Node> statements = block.children;
            for (int i = 0; i < statements.size(); i++) {
                Node statement = statements.get(i);
                Integer tripCount = TreeOps.REPEAT.argNullable(statement.op);
                if (tripCount == null
                        || tripCount >= config.getUnrollTripCountThreshold()
                        || statement.child(0).size() > config.getUnrollMaxBodySize()) {
                    continue;
                }
                if (!mutate()) return;
                List<Node> copies = new ArrayList<>();
                for (int k = 0; k < tripCount; k++) {
                    for (Node bodyStatement : statement.child(0).children) {
                        copies.add(bodyStatement.copy());
                    }
                }
                statements.remove(i);
                statements.addAll(i, copies);
                i += copies.size() - 1;
                unrolled++;
            }
        }

        void inlineCalls(Node block) {
            List<Node> statements = block.children;
            for (int i = 0; i < statements.size(); i++) {
                Node statement = statements.get(i);
                Node call = inlinableCall(statement);
                if (call == null) continue;
                Function callee = view.function(TreeOps.CALL.cast(call.op).arg);
                if (!mutate()) return;
                int index = function.getExtOrCompute(CommonExts.INLINE_COUNTER, () -> 0);
                function.attachExt(CommonExts.INLINE_COUNTER, index + 1);
                Inliner.InlinedCall inlinedCall = new Inliner(callee, index).inline(call.children);
                List<Node> replacement = new ArrayList<>(inlinedCall.statements);
                Node result = inlinedCall.result;
                if (statement.op == TreeOps.EVAL) {
                    if (result != null && !isPure(result)) replacement.add(TreeOps.eval(result));
                } else if (statement.op == TreeOps.RETURN) {
                    replacement.add(TreeOps.ret(Objects.requireNonNull(result)));
                } else {
                    replacement.add(TreeOps.localSet(TreeOps.LOCAL_SET.cast(statement.op).arg, Objects.requireNonNull(result)));
                }
                statements.remove(i);
                statements.addAll(i, replacement);
                i += replacement.size() - 1;
                inlined++;
            }
        }

        @Nullable
        Node inlinableCall(Node statement) {
            Node call;
            boolean needsValue;
            if (statement.op == TreeOps.EVAL) {
                call = statement.child(0);
                needsValue = false;
            } else if (statement.op == TreeOps.RETURN && statement.children.size() == 1
                    || TreeOps.LOCAL_SET.checkNullable(statement.op) != null) {
                call = statement.child(0);
                needsValue = true;
            } else {
                return null;
            }
            Integer calleeId = TreeOps.CALL.argNullable(call.op);
            if (calleeId == null || calleeId == function.getId()) return null;
            Function callee = view.function(calleeId);
            if (callee == null
                    || callee.getRecursionDepth() != null
                    || !analysis.isOnCriticalPath(calleeId)
                    || analysis.criticalFrequency(calleeId) <= config.getInlineCallFrequencyThreshold()
                    || callee.getBody().size() > config.getInlineMaxCalleeSize()
                    || !Inliner.isInlinable(callee)) {
                return null;
            }
            List<Node> body = callee.getBody().children;
            Node last = body.isEmpty() ? null : body.get(body.size() - 1);
            boolean trailingReturn = last != null && last.op == TreeOps.RETURN;
            if (needsValue && (!trailingReturn || last.children.isEmpty())) return null;
            CostModel model = config.getCostModel();
            long saved = model.callOverhead + (trailingReturn ? model.ret : 0);
            long added = (long) callee.getParams().size() * model.localAccess;
            return saved > added ? call : null;
        }

        void reorderBranches(Node block) {
            for (Node statement : block.children) {
                if (statement.op != TreeOps.IF) continue;
                Double probability = statement.getNullable(CommonExts.BRANCH_PROBABILITY);
                if (probability == null || probability >= 0.5 || !isBoolean(statement.child(0))) continue;
                if (!mutate()) return;
                Node cond = statement.child(0);
                Node negated = TreeOps.UNARY.argNullable(cond.op) == UnOp.NOT
                        ? cond.child(0)
                        : TreeOps.unary(UnOp.NOT, cond);
                Node thenBlock = statement.child(1);
                statement.children.set(0, negated);
                statement.children.set(1, statement.child(2));
                statement.children.set(2, thenBlock);
                statement.attachExt(CommonExts.BRANCH_PROBABILITY, 1 - probability);
                reordered++;
            }
        }

        void groupAccesses(Node block) {
            List<Node> statements = block.children;
            int start = 0;
            while (start < statements.size()) {
                int end = runEnd(statements, start);
                if (end - start >= 2) {
                    List<Node> sorted = new ArrayList<>(statements.subList(start, end));
                    sorted.sort(Comparator
                            .comparing((Node s) -> Objects.requireNonNull(MemoryAccess.ofLoadStatement(s)).base)
                            .thenComparingLong(s -> Objects.requireNonNull(MemoryAccess.ofLoadStatement(s)).offset));
                    List<Node> reordered = new ArrayList<>(statements);
                    for (int i = start; i < end; i++) {
                        reordered.set(i, sorted.get(i - start));
                    }
                    if (lineHits(reordered) > lineHits(statements)) {
                        if (!mutate()) return;
                        for (int i = start; i < end; i++) {
                            statements.set(i, sorted.get(i - start));
                        }
                        grouped++;
                    }
                }
                start = Math.max(end, start + 1);
            }
        }

        int runEnd(List<Node> statements, int start) {
            Set<String> targets = new HashSet<>();
            Set<String> readByAddresses = new HashSet<>();
            int end = start;
            while (end < statements.size()) {
                Node statement = statements.get(end);
                MemoryAccess access = MemoryAccess.ofLoadStatement(statement);
                if (access == null) break;
                String target = TreeOps.LOCAL_SET.cast(statement.op).arg;
                if (targets.contains(target) || readByAddresses.contains(target)) break;
                if (access.baseLocal != null && targets.contains(access.baseLocal)) break;
                targets.add(target);
                if (access.baseLocal != null) readByAddresses.add(access.baseLocal);
                end++;
            }
            return end;
        }

        int lineHits(List<Node> statements) {
            int hits = 0;
            for (int i = 1; i < statements.size(); i++) {
                if (MemoryAccess.hitsPreviousLine(statements.get(i - 1), statements.get(i),
                        config.getCostModel().cacheLineBytes)) {
                    hits++;
                }
            }
            return hits;
        }
    }

    private static boolean isPure(Node node) {
        if (!node.getExt(CommonExts.IS_PURE).orElse(false)) return false;
        for (Node child : node.children) {
            if (!isPure(child)) return false;
        }
        return true;
    }

    private static boolean isBoolean(Node cond) {
        BinOp op = TreeOps.BINARY.argNullable(cond.op);
        if (op != null) return op.isComparison();
        if (TreeOps.UNARY.argNullable(cond.op) == UnOp.NOT) return true;
        Literal literal = TreeOps.literalOf(cond);
        return literal != null && literal.type == NumType.BOOL;
    }

    /**
     * All blocks in a tree, innermost first.
     */
    private static List<Node> blocks(Node root) {
        List<Node> blocks = new ArrayList<>();
        collectBlocks(root, blocks);
        return blocks;
    }

    private static void collectBlocks(Node node, List<Node> blocks) {
        for (Node child : node.children) {
            collectBlocks(child, blocks);
        }
        if (node.op == TreeOps.BLOCK) blocks.add(node);
    }
}
