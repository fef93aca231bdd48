package io.github.tempo.opt.core.ops;

import io.github.tempo.opt.core.ext.DelegatingExtHolder;
import io.github.tempo.opt.core.ext.ExtContainer;
import io.github.tempo.opt.core.tree.Node;

import java.util.Arrays;
import java.util.List;

/**
 * An operation, encapsulating an {@link OpKey operation key} and any intermediates.
 * <p>
 * Operations are immutable and may be shared between nodes.
 */
public /* virtual */ class Op extends DelegatingExtHolder {
    /**
     * The key of the operation.
     */
    public final OpKey key;

    /**
     * Construct an operation with the given key.
     *
     * @param key The key.
     */
    protected Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    /**
     * Construct a node with this as its operation, applied to the given children.
     *
     * @param children The children.
     * @return The node.
     */
    public Node node(Node... children) {
        return new Node(this, Arrays.asList(children));
    }

    /**
     * Construct a node with this as its operation, applied to the given children.
     *
     * @param children The children.
     * @return The node.
     */
    public Node node(List<Node> children) {
        return new Node(this, children);
    }
}
