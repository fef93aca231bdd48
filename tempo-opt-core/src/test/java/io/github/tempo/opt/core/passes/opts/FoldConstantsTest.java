package io.github.tempo.opt.core.passes.opts;

import io.github.tempo.opt.core.analysis.AnalysisResults;
import io.github.tempo.opt.core.analysis.WcetAnalyzer;
import io.github.tempo.opt.core.ops.TreeOps;
import io.github.tempo.opt.core.passes.PassResult;
import io.github.tempo.opt.core.tree.*;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static io.github.tempo.opt.core.ops.TreeOps.*;
import static org.junit.jupiter.api.Assertions.*;

public class FoldConstantsTest {
    private static PassResult fold(Program program) {
        AnalysisResults analysis = new WcetAnalyzer().analyze(program);
        ProgramSnapshot before = program.beginRecording();
        PassResult result = FoldConstants.INSTANCE.transform(program, analysis);
        program.endRecording();
        assertTrue(FoldConstants.INSTANCE.certifyDeterminism(before, program));
        return result;
    }

    @Test
    void testFoldsNestedExpressions() {
        Program program = new Program();
        Function main = program.addFunction("main");
        main.setBody(block(
                localSet("x", binary(BinOp.ADD, i32(2), binary(BinOp.MUL, i32(3), i32(4)))),
                ret(localGet("x"))));
        PassResult result = fold(program);
        assertTrue(result.isModified());
        assertEquals(2, result.getCounter("nodesFolded"));
        assertEquals(-4, result.getSizeDelta());
        assertEquals(Literal.of(NumType.I32, 14), TreeOps.literalOf(main.getBody().child(0).child(0)));
    }

    @Test
    void testWrapsAndCompares() {
        Program program = new Program();
        Function main = program.addFunction("main");
        main.setBody(block(
                eval(binary(BinOp.ADD, i32(Integer.MAX_VALUE), i32(1))),
                eval(unary(UnOp.NOT, binary(BinOp.LT, constant(NumType.U8, 200), constant(NumType.U8, 100))))));
        fold(program);
        assertEquals(Literal.of(NumType.I32, Integer.MIN_VALUE), TreeOps.literalOf(main.getBody().child(0).child(0)));
        assertEquals(Literal.TRUE, TreeOps.literalOf(main.getBody().child(1).child(0)));
    }

    @Test
    void testLeavesFaultsAndVariables() {
        Program program = new Program();
        Function main = program.addFunction("main");
        main.setBody(block(
                eval(binary(BinOp.DIV, i32(7), i32(0))),
                eval(binary(BinOp.REM, i32(Integer.MIN_VALUE), i32(-1))),
                eval(binary(BinOp.ADD, localGet("x"), i32(1)))));
        String printed = main.toString();
        AnalysisResults analysis = new WcetAnalyzer().analyze(program);
        assertFalse(FoldConstants.INSTANCE.isApplicable(program, analysis));
        ProgramSnapshot before = program.beginRecording();
        assertFalse(FoldConstants.INSTANCE.transform(program, analysis).isModified());
        program.endRecording();
        assertTrue(before.isEmpty());
        assertEquals(printed, main.toString());
    }

    @Test
    void testOnlyTouchesFoldableFunctions() {
        Program program = new Program();
        Function main = program.addFunction("main");
        main.setBody(block(eval(unary(UnOp.NEG, i32(5)))));
        Function other = program.addFunction("other");
        other.setBody(block(eval(localGet("x"))));
        AnalysisResults analysis = new WcetAnalyzer().analyze(program);
        ProgramSnapshot before = program.beginRecording();
        FoldConstants.INSTANCE.transform(program, analysis);
        program.endRecording();
        assertEquals(Collections.singleton(main.getId()), before.editedFunctionIds());
    }
}
