package io.github.tempo.opt.core.ops;

import io.github.tempo.opt.core.tree.BinOp;
import io.github.tempo.opt.core.tree.Literal;
import io.github.tempo.opt.core.tree.NumType;
import io.github.tempo.opt.core.tree.UnOp;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ArithmeticTest {
    private static final int[] INTS = {0, 1, -1, 7, -7, 31, 32, 33, 1000, Integer.MAX_VALUE, Integer.MIN_VALUE};
    private static final long[] LONGS = {0, 1, -1, 63, 64, 65, 1L << 40, Long.MAX_VALUE, Long.MIN_VALUE};

    private static Literal i32(int value) {
        return Literal.of(NumType.I32, value);
    }

    private static Literal i64(long value) {
        return Literal.of(NumType.I64, value);
    }

    @Test
    void testI32MatchesJavaInt() {
        for (int a : INTS) {
            for (int b : INTS) {
                assertEquals(i32(a + b), Arithmetic.evalBinary(BinOp.ADD, i32(a), i32(b)));
                assertEquals(i32(a - b), Arithmetic.evalBinary(BinOp.SUB, i32(a), i32(b)));
                assertEquals(i32(a * b), Arithmetic.evalBinary(BinOp.MUL, i32(a), i32(b)));
                assertEquals(i32(a & b), Arithmetic.evalBinary(BinOp.AND, i32(a), i32(b)));
                assertEquals(i32(a | b), Arithmetic.evalBinary(BinOp.OR, i32(a), i32(b)));
                assertEquals(i32(a ^ b), Arithmetic.evalBinary(BinOp.XOR, i32(a), i32(b)));
                assertEquals(i32(a << b), Arithmetic.evalBinary(BinOp.SHL, i32(a), i32(b)));
                assertEquals(i32(a >> b), Arithmetic.evalBinary(BinOp.SHR, i32(a), i32(b)));
                assertEquals(Literal.bool(a < b), Arithmetic.evalBinary(BinOp.LT, i32(a), i32(b)));
                assertEquals(Literal.bool(a >= b), Arithmetic.evalBinary(BinOp.GE, i32(a), i32(b)));
                if (b != 0 && !(a == Integer.MIN_VALUE && b == -1)) {
                    assertEquals(i32(a / b), Arithmetic.evalBinary(BinOp.DIV, i32(a), i32(b)));
                    assertEquals(i32(a % b), Arithmetic.evalBinary(BinOp.REM, i32(a), i32(b)));
                }
            }
            assertEquals(i32(-a), Arithmetic.evalUnary(UnOp.NEG, i32(a)));
            assertEquals(i32(~a), Arithmetic.evalUnary(UnOp.BNOT, i32(a)));
        }
    }

    @Test
    void testI64MatchesJavaLong() {
        for (long a : LONGS) {
            for (long b : LONGS) {
                assertEquals(i64(a + b), Arithmetic.evalBinary(BinOp.ADD, i64(a), i64(b)));
                assertEquals(i64(a * b), Arithmetic.evalBinary(BinOp.MUL, i64(a), i64(b)));
                assertEquals(i64(a >> b), Arithmetic.evalBinary(BinOp.SHR, i64(a), i64(b)));
                assertEquals(i64(a << b), Arithmetic.evalBinary(BinOp.SHL, i64(a), i64(b)));
                if (b != 0 && !(a == Long.MIN_VALUE && b == -1)) {
                    assertEquals(i64(a / b), Arithmetic.evalBinary(BinOp.DIV, i64(a), i64(b)));
                }
            }
        }
    }

    @Test
    void testUnsigned() {
        Literal max = Literal.of(NumType.U32, 0xFFFF_FFFFL);
        Literal two = Literal.of(NumType.U32, 2);
        assertEquals(Literal.of(NumType.U32, 0x7FFF_FFFFL), Arithmetic.evalBinary(BinOp.DIV, max, two));
        assertEquals(Literal.of(NumType.U32, 0x7FFF_FFFFL), Arithmetic.evalBinary(BinOp.SHR, max, Literal.of(NumType.U32, 1)));
        assertEquals(Literal.TRUE, Arithmetic.evalBinary(BinOp.GT, max, two));
        assertEquals(Literal.of(NumType.U32, 1), Arithmetic.evalBinary(BinOp.ADD, max, two));

        Literal u64Max = Literal.of(NumType.U64, -1);
        assertEquals(Literal.TRUE, Arithmetic.evalBinary(BinOp.GT, u64Max, Literal.of(NumType.U64, 1)));
        assertEquals(Literal.of(NumType.U64, Long.divideUnsigned(-1, 3)),
                Arithmetic.evalBinary(BinOp.DIV, u64Max, Literal.of(NumType.U64, 3)));
    }

    @Test
    void testSaturating() {
        assertEquals(Literal.of(NumType.SAT_I8, 127),
                Arithmetic.evalBinary(BinOp.ADD, Literal.of(NumType.SAT_I8, 100), Literal.of(NumType.SAT_I8, 100)));
        assertEquals(Literal.of(NumType.SAT_I8, -128),
                Arithmetic.evalBinary(BinOp.SUB, Literal.of(NumType.SAT_I8, -100), Literal.of(NumType.SAT_I8, 100)));
        assertEquals(Literal.of(NumType.SAT_I8, 127), Arithmetic.evalUnary(UnOp.NEG, Literal.of(NumType.SAT_I8, -128)));
        assertEquals(Literal.of(NumType.SAT_U8, 0),
                Arithmetic.evalBinary(BinOp.SUB, Literal.of(NumType.SAT_U8, 3), Literal.of(NumType.SAT_U8, 5)));
        assertEquals(Literal.of(NumType.SAT_I32, Integer.MAX_VALUE),
                Arithmetic.evalBinary(BinOp.MUL, Literal.of(NumType.SAT_I32, 1 << 20), Literal.of(NumType.SAT_I32, 1 << 20)));
        assertEquals(Literal.of(NumType.SAT_I32, Integer.MIN_VALUE),
                Arithmetic.evalBinary(BinOp.MUL, Literal.of(NumType.SAT_I32, -(1 << 20)), Literal.of(NumType.SAT_I32, 1 << 20)));
        assertEquals(Literal.of(NumType.SAT_U32, 0xFFFF_FFFFL),
                Arithmetic.evalBinary(BinOp.MUL, Literal.of(NumType.SAT_U32, 0xFFFF_FFFFL), Literal.of(NumType.SAT_U32, 0xFFFF_FFFFL)));
    }

    @Test
    void testFaultingDivisionIsNotFolded() {
        assertNull(Arithmetic.evalBinary(BinOp.DIV, i32(7), i32(0)));
        assertNull(Arithmetic.evalBinary(BinOp.REM, i32(7), i32(0)));
        assertNull(Arithmetic.evalBinary(BinOp.DIV, Literal.of(NumType.U8, 7), Literal.of(NumType.U8, 0)));
        assertNull(Arithmetic.evalBinary(BinOp.DIV, i32(Integer.MIN_VALUE), i32(-1)));
        assertNull(Arithmetic.evalBinary(BinOp.REM, i64(Long.MIN_VALUE), i64(-1)));
        assertNull(Arithmetic.evalBinary(BinOp.DIV, Literal.of(NumType.I8, -128), Literal.of(NumType.I8, -1)));
    }

    @Test
    void testIllTypedIsNotFolded() {
        assertNull(Arithmetic.evalBinary(BinOp.ADD, i32(1), i64(1)));
        assertNull(Arithmetic.evalBinary(BinOp.ADD, Literal.TRUE, Literal.TRUE));
        assertNull(Arithmetic.evalUnary(UnOp.NOT, i32(0)));
        assertEquals(Literal.FALSE, Arithmetic.evalUnary(UnOp.NOT, Literal.TRUE));
        assertEquals(i32(8), Arithmetic.evalBinary(BinOp.SHL, i32(1), Literal.of(NumType.U8, 3)));
    }
}
