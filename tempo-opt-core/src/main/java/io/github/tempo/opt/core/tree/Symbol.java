package io.github.tempo.opt.core.tree;

/**
 * A named, top-level entity of a {@link Program}, identified by a stable integer ID.
 */
public interface Symbol {
    int getId();

    String getName();
}
