package io.github.tempo.opt.core.tree;

import io.github.tempo.opt.core.ops.TreeOps;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.tempo.opt.core.ops.TreeOps.*;
import static org.junit.jupiter.api.Assertions.*;

public class InlinerTest {
    @Test
    void testInlineRenamesLocals() {
        Program program = new Program();
        Function add = program.addFunction("add", "a", "b");
        add.setBody(block(
                localSet("t", binary(BinOp.ADD, localGet("a"), localGet("b"))),
                ret(localGet("t"))));

        Inliner.InlinedCall call = new Inliner(add, 2).inline(Arrays.asList(i32(1), localGet("a")));
        assertEquals(3, call.statements.size());
        assertEquals("add$2$a", TreeOps.LOCAL_SET.cast(call.statements.get(0).op).arg);
        assertEquals(Literal.of(NumType.I32, 1), TreeOps.literalOf(call.statements.get(0).child(0)));
        // the argument keeps the caller's name
        assertEquals("a", TreeOps.LOCAL_GET.cast(call.statements.get(1).child(0).op).arg);
        assertEquals("add$2$t", TreeOps.LOCAL_SET.cast(call.statements.get(2).op).arg);
        Node result = call.result;
        assertNotNull(result);
        assertEquals("add$2$t", TreeOps.LOCAL_GET.cast(result.op).arg);

        // the callee is untouched
        assertEquals("t", TreeOps.LOCAL_SET.cast(add.getBody().child(0).op).arg);
    }

    @Test
    void testVoidCallee() {
        Program program = new Program();
        GlobalVariable counter = program.addGlobal("counter", Literal.of(NumType.I32, 0));
        Function bump = program.addFunction("bump");
        bump.setBody(block(globalSet(counter, i32(1)), ret()));
        Inliner.InlinedCall call = new Inliner(bump, 0).inline(Collections.emptyList());
        assertEquals(1, call.statements.size());
        assertNull(call.result);
    }

    @Test
    void testArityMismatch() {
        Program program = new Program();
        Function f = program.addFunction("f", "x");
        assertThrows(IllegalArgumentException.class, () -> new Inliner(f, 0).inline(Collections.emptyList()));
    }

    @Test
    void testIsInlinable() {
        Program program = new Program();
        Function trailing = program.addFunction("trailing");
        trailing.setBody(block(eval(extern("io", 3)), ret(i32(1))));
        assertTrue(Inliner.isInlinable(trailing));

        Function early = program.addFunction("early", "x");
        early.setBody(block(
                ifElse(localGet("x"), block(ret(i32(0))), block()),
                ret(i32(1))));
        assertFalse(Inliner.isInlinable(early));

        Function self = program.addFunction("self");
        self.setBody(block(eval(call(self)), ret()));
        assertFalse(Inliner.isInlinable(self));
    }
}
