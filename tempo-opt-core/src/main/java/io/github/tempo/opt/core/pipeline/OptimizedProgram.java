package io.github.tempo.opt.core.pipeline;

import io.github.tempo.opt.core.tree.Program;

/**
 * The result of a successful pipeline run: the frozen program and statistics.
 */
public final class OptimizedProgram {
    private final Program program;
    private final PipelineMetadata metadata;

    OptimizedProgram(Program program, PipelineMetadata metadata) {
        this.program = program;
        this.metadata = metadata;
    }

    /**
     * The optimized program. It is {@link Program#isFrozen() frozen}.
     *
     * @return The program.
     */
    public Program getProgram() {
        return program;
    }

    public PipelineMetadata getMetadata() {
        return metadata;
    }
}
