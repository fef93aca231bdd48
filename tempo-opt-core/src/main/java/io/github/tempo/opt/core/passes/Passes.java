package io.github.tempo.opt.core.passes;

import io.github.tempo.opt.core.passes.opts.EliminateDeadCode;
import io.github.tempo.opt.core.passes.opts.FoldConstants;
import io.github.tempo.opt.core.passes.opts.WcetGuidedOptimization;
import io.github.tempo.opt.core.pipeline.OptimizerConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The pass catalog.
 */
public class Passes {
    /**
     * The standard catalog, in sweep order: cleanup before specialization.
     *
     * @param config The configuration of the configurable passes.
     * @return The passes.
     */
    public static List<OptimizationPass> standardCatalog(OptimizerConfig config) {
        List<OptimizationPass> passes = new ArrayList<>();
        passes.add(EliminateDeadCode.INSTANCE);
        passes.add(FoldConstants.INSTANCE);
        passes.add(new WcetGuidedOptimization(config));
        return Collections.unmodifiableList(passes);
    }
}
