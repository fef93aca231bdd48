package io.github.tempo.opt.core.analysis;

import io.github.tempo.opt.core.tree.ProgramView;
import org.jetbrains.annotations.Nullable;

/**
 * Holds the analysis results that are valid for the current state of a program.
 * <p>
 * The results are only ever swapped as a whole: a failed {@link #refresh(ProgramView)}
 * leaves the previous results in place.
 */
public class AnalysisCache {
    private final WcetAnalyzer analyzer;
    @Nullable
    private AnalysisResults results;

    public AnalysisCache(WcetAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Recompute everything for the program and make it current.
     *
     * @param program The program.
     * @return The new results.
     * @throws io.github.tempo.opt.core.OptimizationException If the analysis fails.
     */
    public AnalysisResults refresh(ProgramView program) {
        AnalysisResults fresh = analyzer.analyze(program);
        results = fresh;
        return fresh;
    }

    /**
     * Analyze the program without touching the current results.
     *
     * @param program The program.
     * @return The results.
     */
    public AnalysisResults compute(ProgramView program) {
        return analyzer.analyze(program);
    }

    public void replace(AnalysisResults results) {
        this.results = results;
    }

    public boolean isValid() {
        return results != null;
    }

    public void invalidate() {
        results = null;
    }

    /**
     * Get the current results.
     *
     * @return The results.
     * @throws IllegalStateException If nothing has been computed yet.
     */
    public AnalysisResults get() {
        if (results == null) {
            throw new IllegalStateException("analysis results are not computed");
        }
        return results;
    }
}
