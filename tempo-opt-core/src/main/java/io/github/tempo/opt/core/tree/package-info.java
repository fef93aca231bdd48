/**
 * This package defines the program tree the optimizer works on.
 * <p>
 * A {@link io.github.tempo.opt.core.tree.Program} is an arena of
 * {@link io.github.tempo.opt.core.tree.Function functions} and
 * {@link io.github.tempo.opt.core.tree.GlobalVariable globals}, each with a stable integer ID.
 * Function bodies are trees of {@link io.github.tempo.opt.core.tree.Node}s, whose kinds are the
 * operations in {@link io.github.tempo.opt.core.ops.TreeOps}. Nodes refer to other functions and
 * globals by ID only, so removing a function never leaves an object reference behind, only an
 * ID that {@link io.github.tempo.opt.core.analysis.IntegrityCheck} reports as dangling.
 * <p>
 * The tree arrives name-resolved and type-checked from the front end: both operands of a binary
 * node have the same declared type, except for shifts whose amount may have any integer type.
 * <p>
 * The tree is mutated in place. Passes announce edits through
 * {@link io.github.tempo.opt.core.tree.Program#edit(io.github.tempo.opt.core.tree.Function)},
 * which lets a {@link io.github.tempo.opt.core.tree.ProgramSnapshot} keep the pre-pass state of
 * exactly the touched functions.
 */
package io.github.tempo.opt.core.tree;
