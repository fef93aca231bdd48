package io.github.tempo.opt.core.pipeline;

import io.github.tempo.opt.core.OptimizationError;
import io.github.tempo.opt.core.OptimizationException;
import io.github.tempo.opt.core.analysis.AnalysisCache;
import io.github.tempo.opt.core.analysis.AnalysisResults;
import io.github.tempo.opt.core.analysis.IntegrityCheck;
import io.github.tempo.opt.core.analysis.WcetAnalyzer;
import io.github.tempo.opt.core.passes.OptimizationPass;
import io.github.tempo.opt.core.passes.PassResult;
import io.github.tempo.opt.core.passes.Passes;
import io.github.tempo.opt.core.tree.Function;
import io.github.tempo.opt.core.tree.Program;
import io.github.tempo.opt.core.tree.ProgramSnapshot;
import org.apache.log4j.Logger;

import java.util.*;

/**
 * Runs a catalog of passes over a program until none of them changes anything,
 * validating every change before the next pass runs.
 * <p>
 * A change is accepted only if the tree is still consistent, the pass certifies that it kept the
 * program deterministic, the program can still be bounded, and (unless disabled) no function the
 * pass touched got slower than the configured budget allows. Otherwise the whole run is aborted
 * with an {@link OptimizationException}, and no program is returned.
 */
public class Pipeline {
    private static final Logger LOGGER = Logger.getLogger(Pipeline.class);

    private final OptimizerConfig config;
    private final List<OptimizationPass> passes;
    private final AnalysisCache cache;

    public Pipeline(OptimizerConfig config, List<OptimizationPass> passes) {
        if (passes.isEmpty()) throw new IllegalArgumentException("no passes");
        Set<String> names = new HashSet<>();
        for (OptimizationPass pass : passes) {
            if (!names.add(pass.name())) {
                throw new IllegalArgumentException("duplicate pass name " + pass.name());
            }
        }
        this.config = config;
        this.passes = Collections.unmodifiableList(new ArrayList<>(passes));
        this.cache = new AnalysisCache(new WcetAnalyzer(config.getCostModel(), config.getCallProfile()));
    }

    /**
     * Create a pipeline with the {@link Passes#standardCatalog(OptimizerConfig) standard catalog}.
     *
     * @param config The configuration.
     * @return The pipeline.
     */
    public static Pipeline standard(OptimizerConfig config) {
        return new Pipeline(config, Passes.standardCatalog(config));
    }

    public List<OptimizationPass> getPasses() {
        return passes;
    }

    /**
     * Optimize a program in place.
     *
     * @param program The program. It is frozen when this returns, and must be discarded if this throws.
     * @return The optimized program and statistics.
     * @throws OptimizationException    If a change cannot be validated, or the program cannot be bounded.
     * @throws IllegalArgumentException If the program is frozen or its tree is malformed.
     */
    public OptimizedProgram run(Program program) {
        if (program.isFrozen()) throw new IllegalArgumentException("program is already frozen");
        IntegrityCheck.INSTANCE.verify(program);
        LOGGER.info(String.format("optimizing %d functions and %d globals with %d passes",
                program.functions().size(), program.globals().size(), passes.size()));
        try {
            return run0(program);
        } catch (OptimizationException e) {
            LOGGER.error("optimization aborted: " + e.getError());
            throw e;
        } finally {
            cache.invalidate();
        }
    }

    private OptimizedProgram run0(Program program) {
        cache.refresh(program);
        Map<String, PassStats> stats = new LinkedHashMap<>();
        for (OptimizationPass pass : passes) {
            stats.put(pass.name(), new PassStats());
        }

        int sweeps = 0;
        int modifications = 0;
        boolean converged = false;
        while (sweeps < config.getMaxOptimizationPasses()) {
            sweeps++;
            int sweepModifications = 0;
            for (OptimizationPass pass : passes) {
                PassStats passStats = stats.get(pass.name());
                AnalysisResults analysis = cache.get();
                if (!pass.isApplicable(program, analysis)) {
                    passStats.recordSkip();
                    continue;
                }
                passStats.recordInvocation();
                ProgramSnapshot before = program.beginRecording();
                PassResult result;
                try {
                    result = pass.transform(program, analysis);
                } finally {
                    program.endRecording();
                }
                if (!result.isModified() && before.isEmpty()) {
                    LOGGER.debug(String.format("sweep %d: %s changed nothing", sweeps, pass.name()));
                    continue;
                }
                cache.replace(validate(pass, program, before, result, analysis));
                passStats.recordModification(result);
                sweepModifications++;
                modifications++;
                LOGGER.debug(String.format("sweep %d: %s %s", sweeps, pass.name(), result));
            }
            if (sweepModifications == 0) {
                converged = true;
                break;
            }
        }
        if (!converged) {
            LOGGER.warn(String.format("no fixed point after %d sweeps, keeping the last validated program", sweeps));
        }

        SortedMap<String, Long> bounds = new TreeMap<>();
        for (Map.Entry<Integer, Long> entry : cache.get().bounds().entrySet()) {
            Function function = program.function(entry.getKey());
            if (function != null) bounds.put(function.getName(), entry.getValue());
        }
        program.freeze();
        PipelineMetadata metadata = new PipelineMetadata(sweeps, modifications, converged, stats, bounds);
        LOGGER.info("optimization finished: " + metadata);
        return new OptimizedProgram(program, metadata);
    }

    private AnalysisResults validate(
            OptimizationPass pass,
            Program program,
            ProgramSnapshot before,
            PassResult result,
            AnalysisResults previous
    ) {
        String problem = IntegrityCheck.INSTANCE.findProblem(program);
        if (problem != null) {
            throw OptimizationException.determinismViolated(pass.name(), "tree integrity broken: " + problem);
        }
        if (!result.isModified()) {
            throw OptimizationException.determinismViolated(pass.name(),
                    "changed the program but reported no modification");
        }
        if (!pass.certifyDeterminism(before, program)) {
            throw OptimizationException.determinismViolated(pass.name(),
                    "determinism certificate rejected the change");
        }

        AnalysisResults analysis = cache.compute(program);
        if (config.isPreserveWcetBounds()) {
            for (int id : before.editedFunctionIds()) {
                Function function = program.function(id);
                Long oldCycles = previous.bound(id);
                Long newCycles = analysis.bound(id);
                if (function == null || oldCycles == null || newCycles == null) continue;
                double percent = degradationPercent(oldCycles, newCycles);
                if (percent > config.getMaxWcetDegradationPercent()) {
                    throw new OptimizationException(new OptimizationError.WcetDegradationExceeded(
                            function.getName(), oldCycles, newCycles, percent));
                }
            }
        }
        return analysis;
    }

    /**
     * The relative change of a bound, in percent. Any growth from zero is infinite.
     */
    static double degradationPercent(long oldCycles, long newCycles) {
        if (oldCycles == 0) {
            return newCycles > 0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return (newCycles - oldCycles) * 100.0 / oldCycles;
    }
}
