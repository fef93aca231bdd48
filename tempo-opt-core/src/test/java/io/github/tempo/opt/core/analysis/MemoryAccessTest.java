package io.github.tempo.opt.core.analysis;

import io.github.tempo.opt.core.tree.BinOp;
import io.github.tempo.opt.core.tree.NumType;
import org.junit.jupiter.api.Test;

import static io.github.tempo.opt.core.ops.TreeOps.*;
import static org.junit.jupiter.api.Assertions.*;

public class MemoryAccessTest {
    @Test
    void testDecomposition() {
        MemoryAccess plain = MemoryAccess.ofAddress(localGet("p"));
        MemoryAccess offset = MemoryAccess.ofAddress(binary(BinOp.ADD, localGet("p"), i32(12)));
        MemoryAccess flipped = MemoryAccess.ofAddress(binary(BinOp.ADD, i32(20), localGet("p")));
        MemoryAccess absolute = MemoryAccess.ofAddress(i32(64));
        assertNotNull(plain);
        assertEquals("p", plain.baseLocal);
        assertEquals(12, offset.offset);
        assertEquals(20, flipped.offset);
        assertEquals("", absolute.base);
        assertNull(absolute.baseLocal);
        assertTrue(plain.sameLine(offset, 16));
        assertFalse(plain.sameLine(flipped, 16));
        assertFalse(plain.sameLine(absolute, 128));
        assertNull(MemoryAccess.ofAddress(binary(BinOp.MUL, localGet("p"), i32(4))));
        assertNull(MemoryAccess.ofAddress(binary(BinOp.ADD, localGet("p"), localGet("q"))));
    }

    @Test
    void testLoadStatements() {
        assertNotNull(MemoryAccess.ofLoadStatement(localSet("x", load(NumType.I32, localGet("p")))));
        assertNull(MemoryAccess.ofLoadStatement(localSet("x", localGet("p"))));
        assertNull(MemoryAccess.ofLoadStatement(eval(load(NumType.I32, localGet("p")))));
    }
}
