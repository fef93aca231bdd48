package io.github.tempo.opt.core.ops;

import io.github.tempo.opt.core.ext.ExtHolder;

/**
 * An operation key, representing a kind of tree node, without intermediates.
 * <p>
 * Each kind declares how many children its nodes take, or {@link #VARIADIC} if that varies.
 */
public abstract class OpKey extends ExtHolder {
    public static final int VARIADIC = -1;

    public final String mnemonic;
    public final int arity;

    public OpKey(String mnemonic, int arity) {
        if (arity < VARIADIC) throw new IllegalArgumentException("bad arity " + arity + " for " + mnemonic);
        this.mnemonic = mnemonic;
        this.arity = arity;
    }

    /**
     * Check whether a node of this kind may have the given number of children.
     *
     * @param children The number of children.
     * @return Whether that is allowed.
     */
    public boolean acceptsArity(int children) {
        return arity == VARIADIC || arity == children;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
