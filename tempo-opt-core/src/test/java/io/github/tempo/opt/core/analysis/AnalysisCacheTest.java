package io.github.tempo.opt.core.analysis;

import io.github.tempo.opt.core.OptimizationException;
import io.github.tempo.opt.core.tree.Function;
import io.github.tempo.opt.core.tree.Program;
import org.junit.jupiter.api.Test;

import static io.github.tempo.opt.core.ops.TreeOps.*;
import static org.junit.jupiter.api.Assertions.*;

public class AnalysisCacheTest {
    @Test
    void testFailedRefreshKeepsResults() {
        Program program = new Program();
        Function main = program.addFunction("main");
        AnalysisCache cache = new AnalysisCache(new WcetAnalyzer());
        assertFalse(cache.isValid());
        assertThrows(IllegalStateException.class, cache::get);

        AnalysisResults first = cache.refresh(program);
        assertSame(first, cache.get());

        main.setBody(block(whileLoop(null, localGet("x"), block())));
        assertThrows(OptimizationException.class, () -> cache.refresh(program));
        assertSame(first, cache.get());

        cache.invalidate();
        assertFalse(cache.isValid());
    }
}
