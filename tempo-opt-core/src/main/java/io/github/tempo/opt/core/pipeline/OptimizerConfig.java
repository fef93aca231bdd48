package io.github.tempo.opt.core.pipeline;

import io.github.tempo.opt.core.analysis.CallProfile;
import io.github.tempo.opt.core.analysis.CostModel;
import io.github.tempo.opt.core.analysis.EffectTrace;

import java.util.Properties;

/**
 * The configuration of a {@link Pipeline} and of the configurable passes.
 * <p>
 * Immutable; create one with {@link #builder()} or {@link #fromProperties(Properties)}.
 */
public final class OptimizerConfig {
    /**
     * The prefix of the keys read by {@link #fromProperties(Properties)}.
     */
    public static final String PROPERTY_PREFIX = "tempo.opt.";

    public static final OptimizerConfig DEFAULT = builder().build();

    private final int maxOptimizationPasses;
    private final boolean preserveWcetBounds;
    private final double maxWcetDegradationPercent;
    private final boolean unrollLoops;
    private final boolean inlineCalls;
    private final boolean reorderBranches;
    private final boolean groupMemoryAccesses;
    private final int unrollTripCountThreshold;
    private final int unrollMaxBodySize;
    private final long inlineCallFrequencyThreshold;
    private final int inlineMaxCalleeSize;
    private final CostModel costModel;
    private final CallProfile callProfile;

    private OptimizerConfig(Builder builder) {
        this.maxOptimizationPasses = builder.maxOptimizationPasses;
        this.preserveWcetBounds = builder.preserveWcetBounds;
        this.maxWcetDegradationPercent = builder.maxWcetDegradationPercent;
        this.unrollLoops = builder.unrollLoops;
        this.inlineCalls = builder.inlineCalls;
        this.reorderBranches = builder.reorderBranches;
        this.groupMemoryAccesses = builder.groupMemoryAccesses;
        this.unrollTripCountThreshold = builder.unrollTripCountThreshold;
        this.unrollMaxBodySize = builder.unrollMaxBodySize;
        this.inlineCallFrequencyThreshold = builder.inlineCallFrequencyThreshold;
        this.inlineMaxCalleeSize = builder.inlineMaxCalleeSize;
        this.costModel = builder.costModel;
        this.callProfile = builder.callProfile;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read a configuration from properties, with every key prefixed by {@link #PROPERTY_PREFIX}.
     * Missing keys keep their default.
     *
     * @param properties The properties.
     * @return The configuration.
     * @throws IllegalArgumentException If a value is malformed or out of range.
     */
    public static OptimizerConfig fromProperties(Properties properties) {
        Builder builder = builder();
        PropertyReader reader = new PropertyReader(properties);
        reader.readInt("maxOptimizationPasses", builder::setMaxOptimizationPasses);
        reader.readBoolean("preserveWcetBounds", builder::setPreserveWcetBounds);
        reader.readDouble("maxWcetDegradationPercent", builder::setMaxWcetDegradationPercent);
        reader.readBoolean("unrollLoops", builder::setUnrollLoops);
        reader.readBoolean("inlineCalls", builder::setInlineCalls);
        reader.readBoolean("reorderBranches", builder::setReorderBranches);
        reader.readBoolean("groupMemoryAccesses", builder::setGroupMemoryAccesses);
        reader.readInt("unrollTripCountThreshold", builder::setUnrollTripCountThreshold);
        reader.readInt("unrollMaxBodySize", builder::setUnrollMaxBodySize);
        reader.readLong("inlineCallFrequencyThreshold", builder::setInlineCallFrequencyThreshold);
        reader.readInt("inlineMaxCalleeSize", builder::setInlineMaxCalleeSize);
        return builder.build();
    }

    public int getMaxOptimizationPasses() {
        return maxOptimizationPasses;
    }

    public boolean isPreserveWcetBounds() {
        return preserveWcetBounds;
    }

    public double getMaxWcetDegradationPercent() {
        return maxWcetDegradationPercent;
    }

    public boolean isUnrollLoops() {
        return unrollLoops;
    }

    public boolean isInlineCalls() {
        return inlineCalls;
    }

    public boolean isReorderBranches() {
        return reorderBranches;
    }

    public boolean isGroupMemoryAccesses() {
        return groupMemoryAccesses;
    }

    public int getUnrollTripCountThreshold() {
        return unrollTripCountThreshold;
    }

    public int getUnrollMaxBodySize() {
        return unrollMaxBodySize;
    }

    public long getInlineCallFrequencyThreshold() {
        return inlineCallFrequencyThreshold;
    }

    public int getInlineMaxCalleeSize() {
        return inlineMaxCalleeSize;
    }

    public CostModel getCostModel() {
        return costModel;
    }

    public CallProfile getCallProfile() {
        return callProfile;
    }

    /**
     * A builder for {@link OptimizerConfig}s.
     */
    public static class Builder {
        private int maxOptimizationPasses = 10;
        private boolean preserveWcetBounds = true;
        private double maxWcetDegradationPercent = 0.0;
        private boolean unrollLoops = true;
        private boolean inlineCalls = true;
        private boolean reorderBranches = true;
        private boolean groupMemoryAccesses = true;
        private int unrollTripCountThreshold = 4;
        private int unrollMaxBodySize = 32;
        private long inlineCallFrequencyThreshold = 1;
        private int inlineMaxCalleeSize = 64;
        private CostModel costModel = CostModel.DEFAULT;
        private CallProfile callProfile = CallProfile.EMPTY;

        private Builder() {
        }

        /**
         * Set the maximum number of sweeps over the pass catalog.
         *
         * @param maxOptimizationPasses The maximum, at least 1.
         * @return This builder.
         */
        public Builder setMaxOptimizationPasses(int maxOptimizationPasses) {
            if (maxOptimizationPasses < 1) {
                throw new IllegalArgumentException("maxOptimizationPasses must be at least 1, got " + maxOptimizationPasses);
            }
            this.maxOptimizationPasses = maxOptimizationPasses;
            return this;
        }

        public Builder setPreserveWcetBounds(boolean preserveWcetBounds) {
            this.preserveWcetBounds = preserveWcetBounds;
            return this;
        }

        /**
         * Set how much, in percent, a pass may raise the WCET bound of a function it touches.
         *
         * @param maxWcetDegradationPercent The budget, at least 0.
         * @return This builder.
         */
        public Builder setMaxWcetDegradationPercent(double maxWcetDegradationPercent) {
            if (!(maxWcetDegradationPercent >= 0)) {
                throw new IllegalArgumentException("maxWcetDegradationPercent must be non-negative, got " + maxWcetDegradationPercent);
            }
            this.maxWcetDegradationPercent = maxWcetDegradationPercent;
            return this;
        }

        public Builder setUnrollLoops(boolean unrollLoops) {
            this.unrollLoops = unrollLoops;
            return this;
        }

        public Builder setInlineCalls(boolean inlineCalls) {
            this.inlineCalls = inlineCalls;
            return this;
        }

        public Builder setReorderBranches(boolean reorderBranches) {
            this.reorderBranches = reorderBranches;
            return this;
        }

        public Builder setGroupMemoryAccesses(boolean groupMemoryAccesses) {
            this.groupMemoryAccesses = groupMemoryAccesses;
            return this;
        }

        /**
         * Set the trip count below which {@code repeat} loops are unrolled.
         * At most {@link EffectTrace#REPEAT_EXPANSION_LIMIT}, so that unrolling can always be certified.
         *
         * @param unrollTripCountThreshold The threshold.
         * @return This builder.
         */
        public Builder setUnrollTripCountThreshold(int unrollTripCountThreshold) {
            if (unrollTripCountThreshold < 0 || unrollTripCountThreshold > EffectTrace.REPEAT_EXPANSION_LIMIT) {
                throw new IllegalArgumentException(String.format("unrollTripCountThreshold must be in [0, %d], got %d",
                        EffectTrace.REPEAT_EXPANSION_LIMIT, unrollTripCountThreshold));
            }
            this.unrollTripCountThreshold = unrollTripCountThreshold;
            return this;
        }

        public Builder setUnrollMaxBodySize(int unrollMaxBodySize) {
            this.unrollMaxBodySize = requireNonNegative("unrollMaxBodySize", unrollMaxBodySize);
            return this;
        }

        public Builder setInlineCallFrequencyThreshold(long inlineCallFrequencyThreshold) {
            if (inlineCallFrequencyThreshold < 0) {
                throw new IllegalArgumentException("inlineCallFrequencyThreshold must be non-negative, got " + inlineCallFrequencyThreshold);
            }
            this.inlineCallFrequencyThreshold = inlineCallFrequencyThreshold;
            return this;
        }

        public Builder setInlineMaxCalleeSize(int inlineMaxCalleeSize) {
            this.inlineMaxCalleeSize = requireNonNegative("inlineMaxCalleeSize", inlineMaxCalleeSize);
            return this;
        }

        public Builder setCostModel(CostModel costModel) {
            if (costModel == null) throw new IllegalArgumentException("costModel is null");
            this.costModel = costModel;
            return this;
        }

        public Builder setCallProfile(CallProfile callProfile) {
            if (callProfile == null) throw new IllegalArgumentException("callProfile is null");
            this.callProfile = callProfile;
            return this;
        }

        public OptimizerConfig build() {
            return new OptimizerConfig(this);
        }

        private static int requireNonNegative(String name, int value) {
            if (value < 0) throw new IllegalArgumentException(name + " must be non-negative, got " + value);
            return value;
        }
    }
}
