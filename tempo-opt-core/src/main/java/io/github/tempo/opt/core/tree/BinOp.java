package io.github.tempo.opt.core.tree;

public enum BinOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    REM("%"),
    AND("&"),
    OR("|"),
    XOR("^"),
    SHL("<<"),
    SHR(">>"),
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    public final String symbol;

    BinOp(String symbol) {
        this.symbol = symbol;
    }

    public boolean isComparison() {
        return ordinal() >= EQ.ordinal();
    }

    public boolean isShift() {
        return this == SHL || this == SHR;
    }

    public boolean isDivision() {
        return this == DIV || this == REM;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
