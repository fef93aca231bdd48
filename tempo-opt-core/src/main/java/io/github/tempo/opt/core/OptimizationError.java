package io.github.tempo.opt.core;

/**
 * A fatal optimization error, with the structured detail a driver needs to build diagnostics.
 * <p>
 * Exactly one of the three kinds: {@link DeterminismViolated}, {@link WcetDegradationExceeded}
 * and {@link AnalysisFailure}. Each aborts the whole pipeline.
 *
 * @see OptimizationException
 */
public abstract class OptimizationError {
    /**
     * The kind of an error, for switching on.
     */
    public enum Kind {
        DETERMINISM_VIOLATED,
        WCET_DEGRADATION_EXCEEDED,
        ANALYSIS_FAILURE,
    }

    private OptimizationError() {
    }

    public abstract Kind getKind();

    /**
     * A human-readable description of the error.
     *
     * @return The message.
     */
    public abstract String getMessage();

    @Override
    public String toString() {
        return getKind() + ": " + getMessage();
    }

    /**
     * A pass could not certify that its change kept the program deterministic.
     */
    public static final class DeterminismViolated extends OptimizationError {
        private final String pass;
        private final String reason;

        public DeterminismViolated(String pass, String reason) {
            this.pass = pass;
            this.reason = reason;
        }

        public String getPass() {
            return pass;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public Kind getKind() {
            return Kind.DETERMINISM_VIOLATED;
        }

        @Override
        public String getMessage() {
            return String.format("pass %s violated determinism: %s", pass, reason);
        }
    }

    /**
     * A pass raised the WCET bound of a function by more than the configured budget.
     */
    public static final class WcetDegradationExceeded extends OptimizationError {
        private final String function;
        private final long oldCycles;
        private final long newCycles;
        private final double percent;

        public WcetDegradationExceeded(String function, long oldCycles, long newCycles, double percent) {
            this.function = function;
            this.oldCycles = oldCycles;
            this.newCycles = newCycles;
            this.percent = percent;
        }

        public String getFunction() {
            return function;
        }

        public long getOldCycles() {
            return oldCycles;
        }

        public long getNewCycles() {
            return newCycles;
        }

        public double getPercent() {
            return percent;
        }

        @Override
        public Kind getKind() {
            return Kind.WCET_DEGRADATION_EXCEEDED;
        }

        @Override
        public String getMessage() {
            return String.format("WCET of %s degraded from %d to %d cycles (%.2f%%)",
                    function, oldCycles, newCycles, percent);
        }
    }

    /**
     * The WCET bound of a function could not be proven finite.
     */
    public static final class AnalysisFailure extends OptimizationError {
        private final String function;
        private final String reason;

        public AnalysisFailure(String function, String reason) {
            this.function = function;
            this.reason = reason;
        }

        public String getFunction() {
            return function;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public Kind getKind() {
            return Kind.ANALYSIS_FAILURE;
        }

        @Override
        public String getMessage() {
            return String.format("cannot bound WCET of %s: %s", function, reason);
        }
    }
}
