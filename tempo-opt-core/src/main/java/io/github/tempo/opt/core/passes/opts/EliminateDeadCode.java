package io.github.tempo.opt.core.passes.opts;

import io.github.tempo.opt.core.analysis.AnalysisResults;
import io.github.tempo.opt.core.analysis.Reachability;
import io.github.tempo.opt.core.passes.OptimizationPass;
import io.github.tempo.opt.core.passes.PassResult;
import io.github.tempo.opt.core.tree.*;
import io.github.tempo.opt.core.util.TreePrinter;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;

/**
 * An optimisation pass that removes any functions and globals unreachable from
 * {@code main} and the exported functions.
 */
public class EliminateDeadCode implements OptimizationPass {
    /**
     * An instance of this pass.
     */
    public static final EliminateDeadCode INSTANCE = new EliminateDeadCode();

    @Override
    public String name() {
        return "dead-code-elimination";
    }

    @Override
    public boolean isApplicable(ProgramView program, AnalysisResults analysis) {
        return analysis.reachableFunctions().size() < program.functions().size()
                || analysis.reachableGlobals().size() < program.globals().size();
    }

    @Override
    public PassResult transform(Program program, AnalysisResults analysis) {
        Reachability reachability = Reachability.compute(program);
        List<Function> deadFunctions = new ArrayList<>();
        for (Function function : program.functions()) {
            if (!reachability.getFunctions().contains(function.getId())) deadFunctions.add(function);
        }
        List<GlobalVariable> deadGlobals = new ArrayList<>();
        for (GlobalVariable global : program.globals()) {
            if (!reachability.getGlobals().contains(global.getId())) deadGlobals.add(global);
        }
        if (deadFunctions.isEmpty() && deadGlobals.isEmpty()) return PassResult.unchanged();

        long removedNodes = 0;
        for (Function function : deadFunctions) {
            removedNodes += function.getBody().size();
            program.removeFunction(function);
        }
        for (GlobalVariable global : deadGlobals) {
            program.removeGlobal(global);
        }
        return PassResult.builder()
                .setModified(true)
                .setEstimatedWcetDelta(-removedNodes)
                .setSizeDelta(-removedNodes)
                .count("functionsRemoved", deadFunctions.size())
                .count("globalsRemoved", deadGlobals.size())
                .build();
    }

    @Override
    public boolean certifyDeterminism(ProgramSnapshot before, ProgramView after) {
        Reachability reachableBefore = Reachability.compute(before);
        for (int id : reachableBefore.getFunctions()) {
            Function old = before.function(id);
            Function now = after.function(id);
            if (old == null || now == null) return false;
            if (!TreePrinter.print(old).equals(TreePrinter.print(now))) return false;
        }
        for (int id : reachableBefore.getGlobals()) {
            if (after.global(id) == null) return false;
        }
        SortedSet<Integer> reachableAfter = Reachability.compute(after).getFunctions();
        return reachableBefore.getFunctions().containsAll(reachableAfter);
    }
}
