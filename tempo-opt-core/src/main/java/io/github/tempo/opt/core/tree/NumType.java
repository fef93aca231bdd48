package io.github.tempo.opt.core.tree;

/**
 * A declared numeric width of the Tempo language.
 * <p>
 * Values of a type are kept in a {@code long}, sign-extended for signed types and
 * zero-extended for unsigned ones. Plain types wrap on overflow, {@code sat.*} types
 * clamp the results of addition, subtraction, multiplication and negation.
 */
public enum NumType {
    I8("i8", 8, true, false),
    I16("i16", 16, true, false),
    I32("i32", 32, true, false),
    I64("i64", 64, true, false),
    U8("u8", 8, false, false),
    U16("u16", 16, false, false),
    U32("u32", 32, false, false),
    U64("u64", 64, false, false),
    SAT_I8("sat.i8", 8, true, true),
    SAT_I16("sat.i16", 16, true, true),
    SAT_I32("sat.i32", 32, true, true),
    SAT_U8("sat.u8", 8, false, true),
    SAT_U16("sat.u16", 16, false, true),
    SAT_U32("sat.u32", 32, false, true),
    BOOL("bool", 1, false, false);

    public final String mnemonic;
    public final int bits;
    public final boolean signed;
    public final boolean saturating;

    NumType(String mnemonic, int bits, boolean signed, boolean saturating) {
        this.mnemonic = mnemonic;
        this.bits = bits;
        this.signed = signed;
        this.saturating = saturating;
    }

    /**
     * Truncate a value to this width, wrapping around.
     *
     * @param value The value.
     * @return The normalized value.
     */
    public long wrap(long value) {
        if (bits == 64) return value;
        int shift = 64 - bits;
        return signed
                ? (value << shift) >> shift
                : (value << shift) >>> shift;
    }

    /**
     * The smallest value of this type. Only meaningful for types narrower than 64 bits,
     * or signed 64-bit types.
     *
     * @return The minimum value.
     */
    public long minValue() {
        if (!signed) return 0;
        return bits == 64 ? Long.MIN_VALUE : -(1L << (bits - 1));
    }

    /**
     * The largest value of this type. Not meaningful for {@link #U64}.
     *
     * @return The maximum value.
     */
    public long maxValue() {
        if (bits == 64) return Long.MAX_VALUE;
        return signed ? (1L << (bits - 1)) - 1 : (1L << bits) - 1;
    }

    /**
     * Clamp an exact result into the range of this type.
     * Saturating types are at most 32 bits wide, so exact results of their operations fit in a {@code long}.
     *
     * @param exact The exact result.
     * @return The clamped value.
     */
    public long clamp(long exact) {
        return Math.max(minValue(), Math.min(maxValue(), exact));
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
