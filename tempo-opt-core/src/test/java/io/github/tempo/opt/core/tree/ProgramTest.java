package io.github.tempo.opt.core.tree;

import io.github.tempo.opt.core.util.TreePrinter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.github.tempo.opt.core.ops.TreeOps.*;
import static org.junit.jupiter.api.Assertions.*;

public class ProgramTest {
    @Test
    void testIdsAreStableAndOrdered() {
        Program program = new Program();
        Function a = program.addFunction("a");
        Function b = program.addFunction("b", "x", "y");
        program.removeFunction(a);
        Function c = program.addFunction("c");
        assertEquals(0, a.getId());
        assertEquals(1, b.getId());
        assertEquals(2, c.getId());
        List<String> names = new ArrayList<>();
        for (Function function : program.functions()) {
            names.add(function.getName());
        }
        assertEquals(List.of("b", "c"), names);
        assertNull(program.function("a"));
        assertSame(b, program.function("b"));
    }

    @Test
    void testDuplicateNamesAreRejected() {
        Program program = new Program();
        program.addFunction("f");
        program.addGlobal("g", Literal.of(NumType.I32, 1));
        assertThrows(IllegalArgumentException.class, () -> program.addFunction("f"));
        assertThrows(IllegalArgumentException.class, () -> program.addGlobal("g", Literal.of(NumType.I32, 2)));
    }

    @Test
    void testFrozenProgramRejectsEdits() {
        Program program = new Program();
        Function f = program.addFunction("f");
        program.freeze();
        assertTrue(program.isFrozen());
        assertThrows(IllegalStateException.class, () -> program.edit(f));
        assertThrows(IllegalStateException.class, () -> program.addFunction("g"));
        assertThrows(IllegalStateException.class, () -> program.removeFunction(f));
    }

    @Test
    void testFrozenFunctionsRejectEdits() {
        Program program = new Program();
        Function f = program.addFunction("f", "p");
        f.setBody(block(localSet("x", localGet("p")), ret(localGet("x"))));
        program.freeze();

        assertThrows(IllegalStateException.class, () -> f.setBody(block(ret())));
        assertThrows(IllegalStateException.class, () -> f.setExported(true));
        assertThrows(IllegalStateException.class, () -> f.setRecursionDepth(2));
        Node body = f.getBody();
        assertTrue(body.isFrozen());
        assertThrows(IllegalStateException.class, () -> body.children.add(ret()));
        assertThrows(IllegalStateException.class, () -> body.children.remove(0));
        assertThrows(IllegalStateException.class, () -> body.children.set(0, ret()));
        assertThrows(IllegalStateException.class, () -> body.children.clear());
        assertThrows(IllegalStateException.class, () -> body.children.subList(0, 1).clear());
        assertThrows(IllegalStateException.class, () -> body.child(0).children.set(0, i32(1)));
        assertThrows(IllegalStateException.class, () -> body.become(block()));
        assertEquals("(block\n  (local.set x (local.get p))\n  (return (local.get x)))", TreePrinter.print(body));

        Function copied = program.copy().function("f");
        assertFalse(copied.getBody().isFrozen());
        copied.setExported(true);
        copied.getBody().children.remove(0);
        assertEquals(1, copied.getBody().children.size());
    }

    @Test
    void testCopyIsDeep() {
        Program program = new Program();
        Function f = program.addFunction("f", "p");
        f.setBody(block(localSet("x", localGet("p")), ret(localGet("x"))));
        f.setExported(true);
        program.addGlobal("g", Literal.of(NumType.U8, 300));
        program.freeze();

        Program copy = program.copy();
        assertFalse(copy.isFrozen());
        Function copied = copy.function("f");
        assertNotSame(f, copied);
        assertEquals(TreePrinter.print(f), TreePrinter.print(copied));
        copy.edit(copied);
        copied.getBody().children.clear();
        assertEquals(2, f.getBody().children.size());
        assertEquals(Literal.of(NumType.U8, 44), copy.global("g").getInitial());
        assertEquals(1, copy.addFunction("h").getId());
    }

    @Test
    void testPrinting() {
        Program program = new Program();
        Function f = program.addFunction("f", "p");
        f.setRecursionDepth(2);
        f.setBody(block(
                eval(binary(BinOp.ADD, localGet("p"), i32(1))),
                ret()));
        assertEquals("fn f#0(p) recursion=2 (block\n"
                + "  (eval (binary + (local.get p) (const 1:i32)))\n"
                + "  (return))", TreePrinter.print(f));
    }

    @Test
    void testBodiesMustBeBlocks() {
        Program program = new Program();
        Function f = program.addFunction("f");
        assertThrows(IllegalArgumentException.class, () -> f.setBody(ret()));
        assertThrows(IllegalArgumentException.class, () -> f.setRecursionDepth(0));
    }
}
