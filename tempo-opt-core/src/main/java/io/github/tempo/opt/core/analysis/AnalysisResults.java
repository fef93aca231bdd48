package io.github.tempo.opt.core.analysis;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Facts derived from a program: reachable sets, WCET bounds and critical paths.
 * <p>
 * Immutable; a changed program gets a new instance.
 */
public final class AnalysisResults {
    private final Reachability reachability;
    private final SortedMap<Integer, Long> bounds;
    private final SortedMap<Integer, CriticalPath> dominantPaths;
    private final List<CriticalPath> criticalPaths;
    private final SortedMap<Integer, Long> criticalFrequencies = new TreeMap<>();

    AnalysisResults(
            Reachability reachability,
            SortedMap<Integer, Long> bounds,
            SortedMap<Integer, CriticalPath> dominantPaths,
            List<CriticalPath> criticalPaths
    ) {
        this.reachability = reachability;
        this.bounds = Collections.unmodifiableSortedMap(new TreeMap<>(bounds));
        this.dominantPaths = Collections.unmodifiableSortedMap(new TreeMap<>(dominantPaths));
        this.criticalPaths = Collections.unmodifiableList(new ArrayList<>(criticalPaths));
        for (CriticalPath path : criticalPaths) {
            for (CriticalPath.Entry entry : path.getEntries()) {
                criticalFrequencies.merge(entry.functionId, entry.frequency, Math::max);
            }
        }
    }

    public SortedSet<Integer> reachableFunctions() {
        return reachability.getFunctions();
    }

    public SortedSet<Integer> reachableGlobals() {
        return reachability.getGlobals();
    }

    /**
     * All WCET bounds, in cycles, by function ID.
     *
     * @return The bounds.
     */
    public SortedMap<Integer, Long> bounds() {
        return bounds;
    }

    /**
     * The WCET bound of a function, if it was analyzed.
     *
     * @param functionId The function ID.
     * @return The bound in cycles, or null if the function did not exist at analysis time.
     */
    @Nullable
    public Long bound(int functionId) {
        return bounds.get(functionId);
    }

    @Nullable
    public CriticalPath dominantPath(int functionId) {
        return dominantPaths.get(functionId);
    }

    /**
     * The dominant paths of the program roots, in root ID order.
     *
     * @return The critical paths.
     */
    public List<CriticalPath> criticalPaths() {
        return criticalPaths;
    }

    public boolean isOnCriticalPath(int functionId) {
        return criticalFrequencies.containsKey(functionId);
    }

    /**
     * The largest frequency with which a function appears on a root critical path.
     *
     * @param functionId The function ID.
     * @return The frequency, or 0 if it is on no critical path.
     */
    public long criticalFrequency(int functionId) {
        return criticalFrequencies.getOrDefault(functionId, 0L);
    }
}
