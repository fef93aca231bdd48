package io.github.tempo.opt.core.passes;

import io.github.tempo.opt.core.analysis.AnalysisResults;
import io.github.tempo.opt.core.tree.Program;
import io.github.tempo.opt.core.tree.ProgramSnapshot;
import io.github.tempo.opt.core.tree.ProgramView;

/**
 * A pass that transforms a {@link Program} in place, and can certify afterwards that
 * its change kept the program deterministic.
 * <p>
 * Passes are run by the {@link io.github.tempo.opt.core.pipeline.Pipeline Pipeline}, which
 * records every change a pass makes and validates it before running the next pass.
 */
public interface OptimizationPass {
    /**
     * A stable name, used in statistics and errors.
     *
     * @return The name.
     */
    String name();

    /**
     * Get whether running the pass could change anything. Must be cheap and must not mutate anything.
     *
     * @param program  The program.
     * @param analysis The analysis results for the program as it is.
     * @return Whether the pass should run.
     */
    boolean isApplicable(ProgramView program, AnalysisResults analysis);

    /**
     * Run the pass. The pass must call {@link Program#edit(io.github.tempo.opt.core.tree.Function)}
     * before it mutates a function.
     *
     * @param program  The program to mutate.
     * @param analysis The analysis results for the program as it was before the pass.
     * @return What the pass did.
     */
    PassResult transform(Program program, AnalysisResults analysis);

    /**
     * Check that the change made by the last {@link #transform(Program, AnalysisResults)}
     * preserved the observable behaviour of the program.
     *
     * @param before The program before the pass.
     * @param after  The program after the pass.
     * @return False if the change cannot be certified. Never throws for that.
     */
    boolean certifyDeterminism(ProgramSnapshot before, ProgramView after);
}
