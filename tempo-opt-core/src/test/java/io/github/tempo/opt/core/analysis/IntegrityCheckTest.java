package io.github.tempo.opt.core.analysis;

import io.github.tempo.opt.core.ops.TreeOps;
import io.github.tempo.opt.core.tree.*;
import org.junit.jupiter.api.Test;

import static io.github.tempo.opt.core.ops.TreeOps.*;
import static org.junit.jupiter.api.Assertions.*;

public class IntegrityCheckTest {
    @Test
    void testConsistentProgram() {
        Program program = new Program();
        GlobalVariable g = program.addGlobal("g", Literal.of(NumType.I32, 0));
        Function f = program.addFunction("f", "a", "b");
        f.setBody(block(ret(binary(BinOp.ADD, localGet("a"), localGet("b")))));
        program.addFunction("main").setBody(block(
                globalSet(g, call(f, i32(1), globalGet(g))),
                ifElse(bool(true), block(), block()),
                repeat(2, block()),
                whileLoop(3, bool(true), block())));
        assertNull(IntegrityCheck.INSTANCE.findProblem(program));
        assertDoesNotThrow(() -> IntegrityCheck.INSTANCE.verify(program));
    }

    @Test
    void testCallArity() {
        Program program = new Program();
        Function f = program.addFunction("f", "a");
        program.addFunction("main").setBody(block(eval(call(f))));
        String problem = IntegrityCheck.INSTANCE.findProblem(program);
        assertNotNull(problem);
        assertTrue(problem.contains("expected 1"), problem);
    }

    @Test
    void testDanglingReferences() {
        Program program = new Program();
        Function f = program.addFunction("f");
        program.addFunction("main").setBody(block(eval(call(f))));
        program.removeFunction(f);
        assertNotNull(IntegrityCheck.INSTANCE.findProblem(program));

        Program globals = new Program();
        globals.addFunction("main").setBody(block(eval(TreeOps.GLOBAL_GET.create(7).node())));
        assertTrue(IntegrityCheck.INSTANCE.findProblem(globals).contains("#7"));
        assertThrows(IllegalArgumentException.class, () -> IntegrityCheck.INSTANCE.verify(globals));
    }

    @Test
    void testMalformedNodes() {
        Program program = new Program();
        program.addFunction("main").setBody(block(
                ifElse(bool(true), block(), ret())));
        assertNotNull(IntegrityCheck.INSTANCE.findProblem(program));

        Program arity = new Program();
        arity.addFunction("main").setBody(block(eval(BINARY.create(BinOp.ADD).node(i32(1)))));
        assertTrue(IntegrityCheck.INSTANCE.findProblem(arity).contains("expected 2 children"));
    }
}
