package io.github.tempo.opt.core.pipeline;

import io.github.tempo.opt.core.passes.PassResult;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * What one pass did over a whole pipeline run.
 */
public final class PassStats {
    private int invocations;
    private int skips;
    private int modifications;
    private long estimatedWcetDelta;
    private long sizeDelta;
    private final SortedMap<String, Long> counters = new TreeMap<>();

    void recordSkip() {
        skips++;
    }

    void recordInvocation() {
        invocations++;
    }

    void recordModification(PassResult result) {
        modifications++;
        estimatedWcetDelta += result.getEstimatedWcetDelta();
        sizeDelta += result.getSizeDelta();
        result.getCounters().forEach((name, value) -> counters.merge(name, value, Long::sum));
    }

    /**
     * How many times the pass was run, i.e. was applicable.
     *
     * @return The count.
     */
    public int getInvocations() {
        return invocations;
    }

    /**
     * How many times the pass was not applicable.
     *
     * @return The count.
     */
    public int getSkips() {
        return skips;
    }

    public int getModifications() {
        return modifications;
    }

    public long getEstimatedWcetDelta() {
        return estimatedWcetDelta;
    }

    public long getSizeDelta() {
        return sizeDelta;
    }

    public SortedMap<String, Long> getCounters() {
        return Collections.unmodifiableSortedMap(counters);
    }

    public long getCounter(String name) {
        return counters.getOrDefault(name, 0L);
    }

    @Override
    public String toString() {
        return String.format("invocations=%d skips=%d modifications=%d wcet=%+d size=%+d %s",
                invocations, skips, modifications, estimatedWcetDelta, sizeDelta, counters);
    }
}
