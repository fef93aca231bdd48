package io.github.tempo.opt.core.tree;

public enum UnOp {
    NEG("neg"),
    /**
     * Logical negation, only defined on {@link NumType#BOOL}.
     */
    NOT("not"),
    /**
     * Bitwise complement.
     */
    BNOT("bnot");

    public final String mnemonic;

    UnOp(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
