package io.github.tempo.opt.core.tree;

import io.github.tempo.opt.core.ext.ExtHolder;

/**
 * A global variable of a {@link Program}, with a constant initializer.
 */
public final class GlobalVariable extends ExtHolder implements Symbol {
    private final int id;
    private final String name;
    private final NumType type;
    private final Literal initial;

    GlobalVariable(int id, String name, NumType type, Literal initial) {
        if (initial.type != type) {
            throw new IllegalArgumentException(String.format(
                    "initializer %s of global %s does not have type %s", initial, name, type));
        }
        this.id = id;
        this.name = name;
        this.type = type;
        this.initial = initial;
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    public NumType getType() {
        return type;
    }

    public Literal getInitial() {
        return initial;
    }

    @Override
    public String toString() {
        return "global " + name + "#" + id + " = " + initial;
    }
}
