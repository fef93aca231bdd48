package io.github.tempo.opt.core.tree;

import java.util.Objects;

/**
 * A typed constant value.
 */
public final class Literal {
    public static final Literal TRUE = new Literal(NumType.BOOL, 1);
    public static final Literal FALSE = new Literal(NumType.BOOL, 0);

    /**
     * The declared type of the literal.
     */
    public final NumType type;
    /**
     * The value, normalized to {@link #type}.
     */
    public final long bits;

    private Literal(NumType type, long bits) {
        this.type = type;
        this.bits = bits;
    }

    /**
     * Create a literal, normalizing the value to the type's width.
     *
     * @param type  The type.
     * @param value The value.
     * @return The literal.
     */
    public static Literal of(NumType type, long value) {
        if (type == NumType.BOOL) return bool(value != 0);
        return new Literal(type, type.wrap(value));
    }

    public static Literal bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean isZero() {
        return bits == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Literal literal = (Literal) o;
        return bits == literal.bits && type == literal.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, bits);
    }

    @Override
    public String toString() {
        if (type == NumType.BOOL) return bits == 0 ? "false" : "true";
        String value = type.signed ? Long.toString(bits) : Long.toUnsignedString(bits);
        return value + ":" + type;
    }
}
