package io.github.tempo.opt.core.tree;

import java.util.Objects;

/**
 * A runtime routine outside the program (an I/O-equivalent operation), with a
 * cycle cost declared by the target's runtime.
 */
public final class Extern {
    public final String name;
    public final long cycles;

    public Extern(String name, long cycles) {
        if (cycles < 0) throw new IllegalArgumentException("negative cycle cost for extern " + name);
        this.name = name;
        this.cycles = cycles;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Extern extern = (Extern) o;
        return cycles == extern.cycles && name.equals(extern.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, cycles);
    }

    @Override
    public String toString() {
        return name + "[" + cycles + "]";
    }
}
