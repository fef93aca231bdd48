package io.github.tempo.opt.core.ext;

import io.github.tempo.opt.core.ops.Op;
import io.github.tempo.opt.core.ops.OpKey;
import io.github.tempo.opt.core.passes.opts.WcetGuidedOptimization;
import io.github.tempo.opt.core.passes.opts.FoldConstants;
import io.github.tempo.opt.core.tree.Function;
import io.github.tempo.opt.core.tree.Inliner;
import io.github.tempo.opt.core.tree.Literal;
import io.github.tempo.opt.core.tree.Node;
import io.github.tempo.opt.core.util.F;

/**
 * The {@link Ext}s used throughout the optimizer.
 */
public class CommonExts {
    /**
     * Attached to a {@link Node}, {@link Op} or {@link OpKey}.
     * Whether evaluating the node has no observable side effects of its own.
     */
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");

    /**
     * Attached to an {@link Op} or {@link OpKey}.
     * Whether the operation itself is an observable side effect
     * (memory write, global write, I/O-equivalent runtime call), whose order must be kept.
     */
    public static final Ext<Boolean> HAS_SIDE_EFFECT = Ext.create(Boolean.class, "HAS_SIDE_EFFECT");

    /**
     * Attached to an {@link OpKey}. Folds a node of that kind whose operands are all literals,
     * returning the resulting literal, or null if the node must be left for the runtime.
     *
     * @see FoldConstants
     */
    public static final Ext<F<Node, Literal>> CONSTANT_FOLDER = Ext.create(F.class, "CONSTANT_FOLDER");

    /**
     * Attached to an {@code if} {@link Node} by the front end.
     * The probability, in {@code [0, 1]}, that the condition holds.
     */
    public static final Ext<Double> BRANCH_PROBABILITY = Ext.create(Double.class, "BRANCH_PROBABILITY");

    /**
     * Attached to a {@link Function}, used by {@link WcetGuidedOptimization}.
     * The number of call sites inlined into the function so far, used to name fresh locals.
     */
    public static final Ext<Integer> INLINE_COUNTER = Ext.create(Integer.class, "INLINE_COUNTER");

    /**
     * Attached to a {@code local.set} {@link Node} by the {@link Inliner}.
     * The name of the callee parameter that the statement binds to its argument.
     */
    public static final Ext<String> PARAMETER_BINDING = Ext.create(String.class, "PARAMETER_BINDING");

    /**
     * Mark something as pure, by attaching {@link #IS_PURE} {@code = true} to it.
     *
     * @param t   The thing to mark as pure.
     * @param <T> The type of {@code t}.
     * @return {@code t}.
     */
    public static <T extends ExtContainer> T markPure(T t) {
        t.attachExt(IS_PURE, true);
        return t;
    }

    /**
     * Mark something as an observable side effect.
     *
     * @param t   The thing to mark.
     * @param <T> The type of {@code t}.
     * @return {@code t}.
     */
    public static <T extends ExtContainer> T markSideEffect(T t) {
        t.attachExt(HAS_SIDE_EFFECT, true);
        return t;
    }
}
