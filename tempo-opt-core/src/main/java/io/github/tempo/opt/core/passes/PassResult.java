package io.github.tempo.opt.core.passes;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * What a pass reports it did. The pipeline decides whether to accept it.
 */
public final class PassResult {
    private static final PassResult UNCHANGED = new PassResult(false, 0, 0, new TreeMap<>());

    private final boolean modified;
    private final long estimatedWcetDelta;
    private final long sizeDelta;
    private final SortedMap<String, Long> counters;

    private PassResult(boolean modified, long estimatedWcetDelta, long sizeDelta, SortedMap<String, Long> counters) {
        this.modified = modified;
        this.estimatedWcetDelta = estimatedWcetDelta;
        this.sizeDelta = sizeDelta;
        this.counters = Collections.unmodifiableSortedMap(counters);
    }

    public static PassResult unchanged() {
        return UNCHANGED;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isModified() {
        return modified;
    }

    /**
     * The estimated change of WCET, in cycles. Negative is an improvement.
     *
     * @return The estimate.
     */
    public long getEstimatedWcetDelta() {
        return estimatedWcetDelta;
    }

    /**
     * The change in the number of tree nodes.
     *
     * @return The delta.
     */
    public long getSizeDelta() {
        return sizeDelta;
    }

    public SortedMap<String, Long> getCounters() {
        return counters;
    }

    public long getCounter(String name) {
        return counters.getOrDefault(name, 0L);
    }

    @Override
    public String toString() {
        return String.format("modified=%s wcet=%+d size=%+d %s", modified, estimatedWcetDelta, sizeDelta, counters);
    }

    public static class Builder {
        private boolean modified;
        private long estimatedWcetDelta;
        private long sizeDelta;
        private final SortedMap<String, Long> counters = new TreeMap<>();

        private Builder() {
        }

        public Builder setModified(boolean modified) {
            this.modified = modified;
            return this;
        }

        public Builder setEstimatedWcetDelta(long estimatedWcetDelta) {
            this.estimatedWcetDelta = estimatedWcetDelta;
            return this;
        }

        public Builder setSizeDelta(long sizeDelta) {
            this.sizeDelta = sizeDelta;
            return this;
        }

        /**
         * Add to a pass-specific counter. Counters are reported even when zero.
         *
         * @param name  The counter.
         * @param delta The amount.
         * @return This builder.
         */
        public Builder count(String name, long delta) {
            counters.merge(name, delta, Long::sum);
            return this;
        }

        public PassResult build() {
            return new PassResult(modified, estimatedWcetDelta, sizeDelta, new TreeMap<>(counters));
        }
    }
}
