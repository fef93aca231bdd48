package io.github.tempo.opt.core.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Statistics of a pipeline run.
 */
public final class PipelineMetadata {
    private final int sweeps;
    private final int modifications;
    private final boolean converged;
    private final Map<String, PassStats> passStats;
    private final SortedMap<String, Long> wcetBounds;

    PipelineMetadata(
            int sweeps,
            int modifications,
            boolean converged,
            Map<String, PassStats> passStats,
            SortedMap<String, Long> wcetBounds
    ) {
        this.sweeps = sweeps;
        this.modifications = modifications;
        this.converged = converged;
        this.passStats = Collections.unmodifiableMap(new LinkedHashMap<>(passStats));
        this.wcetBounds = Collections.unmodifiableSortedMap(new TreeMap<>(wcetBounds));
    }

    /**
     * The number of sweeps over the catalog, including the final sweep that changed nothing.
     *
     * @return The sweep count.
     */
    public int getSweeps() {
        return sweeps;
    }

    /**
     * The number of accepted pass runs that modified the program.
     *
     * @return The count.
     */
    public int getModifications() {
        return modifications;
    }

    /**
     * Whether the last sweep changed nothing, as opposed to the sweep limit being hit.
     *
     * @return Whether the pipeline reached a fixed point.
     */
    public boolean isConverged() {
        return converged;
    }

    /**
     * Per-pass statistics, in catalog order.
     *
     * @return The statistics by pass name.
     */
    public Map<String, PassStats> getPassStats() {
        return passStats;
    }

    /**
     * The WCET bounds of the optimized program.
     *
     * @return The bounds in cycles, by function name.
     */
    public SortedMap<String, Long> getWcetBounds() {
        return wcetBounds;
    }

    @Override
    public String toString() {
        return String.format("sweeps=%d modifications=%d converged=%s", sweeps, modifications, converged);
    }
}
