package io.github.tempo.opt.core.ops;

import io.github.tempo.opt.core.tree.BinOp;
import io.github.tempo.opt.core.tree.Literal;
import io.github.tempo.opt.core.tree.NumType;
import io.github.tempo.opt.core.tree.UnOp;
import org.jetbrains.annotations.Nullable;

/**
 * The semantics of Tempo's operators on literals, exactly as the target computes them.
 * <p>
 * A null result means the operation must not be evaluated ahead of time,
 * because the target faults on it or because the operands are ill-typed.
 */
public final class Arithmetic {
    private Arithmetic() {
    }

    @Nullable
    public static Literal evalBinary(BinOp op, Literal lhs, Literal rhs) {
        NumType type = lhs.type;
        if (op.isShift()) {
            if (type == NumType.BOOL || rhs.type == NumType.BOOL) return null;
        } else if (type != rhs.type) {
            return null;
        }
        long a = lhs.bits;
        long b = rhs.bits;
        switch (op) {
            case ADD:
                if (type == NumType.BOOL) return null;
                return type.saturating ? Literal.of(type, type.clamp(a + b)) : Literal.of(type, a + b);
            case SUB:
                if (type == NumType.BOOL) return null;
                return type.saturating ? Literal.of(type, type.clamp(a - b)) : Literal.of(type, a - b);
            case MUL:
                if (type == NumType.BOOL) return null;
                return type.saturating ? Literal.of(type, saturatingMultiply(type, a, b)) : Literal.of(type, a * b);
            case DIV:
            case REM:
                return divide(op, type, a, b);
            case AND:
                return Literal.of(type, a & b);
            case OR:
                return Literal.of(type, a | b);
            case XOR:
                return Literal.of(type, a ^ b);
            case SHL:
                return Literal.of(type, a << shiftAmount(type, b));
            case SHR:
                return Literal.of(type, type.signed ? a >> shiftAmount(type, b) : a >>> shiftAmount(type, b));
            case EQ:
                return Literal.bool(a == b);
            case NE:
                return Literal.bool(a != b);
            case LT:
                return Literal.bool(compare(type, a, b) < 0);
            case LE:
                return Literal.bool(compare(type, a, b) <= 0);
            case GT:
                return Literal.bool(compare(type, a, b) > 0);
            case GE:
                return Literal.bool(compare(type, a, b) >= 0);
            default:
                throw new IllegalArgumentException("unknown operator " + op);
        }
    }

    @Nullable
    public static Literal evalUnary(UnOp op, Literal operand) {
        NumType type = operand.type;
        long a = operand.bits;
        switch (op) {
            case NEG:
                if (type == NumType.BOOL) return null;
                return type.saturating ? Literal.of(type, type.clamp(-a)) : Literal.of(type, -a);
            case NOT:
                if (type != NumType.BOOL) return null;
                return Literal.bool(a == 0);
            case BNOT:
                if (type == NumType.BOOL) return null;
                return Literal.of(type, ~a);
            default:
                throw new IllegalArgumentException("unknown operator " + op);
        }
    }

    @Nullable
    private static Literal divide(BinOp op, NumType type, long a, long b) {
        // division faults are runtime behavior: zero divisors and signed MIN / -1 stay in the tree
        if (type == NumType.BOOL || b == 0) return null;
        if (type.signed) {
            if (a == type.minValue() && b == -1) return null;
            return Literal.of(type, op == BinOp.DIV ? a / b : a % b);
        }
        return Literal.of(type, op == BinOp.DIV
                ? Long.divideUnsigned(a, b)
                : Long.remainderUnsigned(a, b));
    }

    private static long saturatingMultiply(NumType type, long a, long b) {
        long low = a * b;
        if (Math.multiplyHigh(a, b) != (low >> 63)) {
            return (a < 0) == (b < 0) ? type.maxValue() : type.minValue();
        }
        return type.clamp(low);
    }

    private static int shiftAmount(NumType type, long amount) {
        return (int) (amount & (type.bits - 1));
    }

    private static int compare(NumType type, long a, long b) {
        return type.signed ? Long.compare(a, b) : Long.compareUnsigned(a, b);
    }
}
