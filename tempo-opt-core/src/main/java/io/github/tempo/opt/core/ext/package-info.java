/**
 * The ext API allows for associating arbitrary data with
 * instances of {@link io.github.tempo.opt.core.ext.ExtContainer}.
 *
 * <pre>{@code
 * Node branch = TreeOps.ifElse(cond, thenBlock, elseBlock);
 * branch.attachExt(CommonExts.BRANCH_PROBABILITY, 0.2);
 *
 * branch.getExtOrThrow(CommonExts.BRANCH_PROBABILITY); // => 0.2
 * TreeOps.STORE.getExtOrThrow(CommonExts.HAS_SIDE_EFFECT); // => true
 * }</pre>
 * <p>
 * This is used for facts the upstream front end knows but the tree shape does not
 * express (branch probabilities), for facts shared by every node of a kind (purity,
 * side effects), and for per-run scratch data of passes, without changing the tree classes.
 * <p>
 * {@link io.github.tempo.opt.core.ext.DelegatingExtHolder}s fall back to another container,
 * which is how a {@link io.github.tempo.opt.core.tree.Node} sees the exts of its operation.
 */
package io.github.tempo.opt.core.ext;
