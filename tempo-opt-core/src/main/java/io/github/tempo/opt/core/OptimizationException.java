package io.github.tempo.opt.core;

/**
 * Thrown when optimization must abort; carries the structured {@link OptimizationError}.
 * <p>
 * No partially optimized program is ever returned alongside this.
 */
public class OptimizationException extends RuntimeException {
    private final OptimizationError error;

    public OptimizationException(OptimizationError error) {
        super(error.getMessage());
        this.error = error;
    }

    public OptimizationError getError() {
        return error;
    }

    public static OptimizationException analysisFailure(String function, String reason) {
        return new OptimizationException(new OptimizationError.AnalysisFailure(function, reason));
    }

    public static OptimizationException determinismViolated(String pass, String reason) {
        return new OptimizationException(new OptimizationError.DeterminismViolated(pass, reason));
    }
}
