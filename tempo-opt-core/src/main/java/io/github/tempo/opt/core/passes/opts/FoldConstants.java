package io.github.tempo.opt.core.passes.opts;

import io.github.tempo.opt.core.analysis.AnalysisResults;
import io.github.tempo.opt.core.ext.CommonExts;
import io.github.tempo.opt.core.ops.TreeOps;
import io.github.tempo.opt.core.passes.OptimizationPass;
import io.github.tempo.opt.core.passes.PassResult;
import io.github.tempo.opt.core.tree.*;
import io.github.tempo.opt.core.util.F;

/**
 * An optimisation pass that replaces operations on literals with their result,
 * computed with the exact semantics of the declared type.
 *
 * @see CommonExts#CONSTANT_FOLDER
 * @see io.github.tempo.opt.core.ops.Arithmetic
 */
public class FoldConstants implements OptimizationPass {
    /**
     * An instance of this pass.
     */
    public static final FoldConstants INSTANCE = new FoldConstants();

    @Override
    public String name() {
        return "constant-folding";
    }

    @Override
    public boolean isApplicable(ProgramView program, AnalysisResults analysis) {
        for (Function function : program.functions()) {
            if (hasFoldable(function.getBody())) return true;
        }
        return false;
    }

    @Override
    public PassResult transform(Program program, AnalysisResults analysis) {
        long folded = 0;
        long sizeDelta = 0;
        for (Function function : program.functions()) {
            if (!hasFoldable(function.getBody())) continue;
            program.edit(function);
            int sizeBefore = function.getBody().size();
            int foldedHere;
            do {
                foldedHere = fold(function.getBody());
                folded += foldedHere;
            } while (foldedHere != 0);
            sizeDelta += function.getBody().size() - sizeBefore;
        }
        if (folded == 0) return PassResult.unchanged();
        return PassResult.builder()
                .setModified(true)
                .setSizeDelta(sizeDelta)
                .count("nodesFolded", folded)
                .build();
    }

    @Override
    public boolean certifyDeterminism(ProgramSnapshot before, ProgramView after) {
        // folding is exact, so there is nothing observable to compare
        return true;
    }

    private static int fold(Node node) {
        int count = 0;
        for (Node child : node.children) {
            count += fold(child);
        }
        Literal result = tryFold(node);
        if (result != null) {
            node.become(TreeOps.constant(result));
            count++;
        }
        return count;
    }

    private static Literal tryFold(Node node) {
        F<Node, Literal> folder = node.getNullable(CommonExts.CONSTANT_FOLDER);
        return folder == null ? null : folder.apply(node);
    }

    private static boolean hasFoldable(Node node) {
        if (tryFold(node) != null) return true;
        for (Node child : node.children) {
            if (hasFoldable(child)) return true;
        }
        return false;
    }
}
