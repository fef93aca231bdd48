package io.github.tempo.opt.core.tree;

import io.github.tempo.opt.core.ext.DelegatingExtHolder;
import io.github.tempo.opt.core.ext.ExtContainer;
import io.github.tempo.opt.core.ops.Op;
import io.github.tempo.opt.core.util.TreePrinter;

import java.util.ArrayList;
import java.util.List;

/**
 * A node of the program tree: an {@link Op} applied to an ordered list of children.
 * <p>
 * Statements and expressions are both nodes; the kind of a node is its {@link Op#key operation key}.
 * Exts not found on the node itself are looked up on its operation.
 * <p>
 * Once {@link #freeze() frozen}, the children of a node and its subtree reject mutation.
 * The {@link #op} field and exts stay assignable, and only copies may rewrite them.
 */
public final class Node extends DelegatingExtHolder {
    public Op op;
    public final List<Node> children;

    public Node(Op op, List<Node> children) {
        this.op = op;
        this.children = new ChildList(children);
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    public Node child(int i) {
        return children.get(i);
    }

    /**
     * Deep-copy this node, with the exts attached directly to each node.
     *
     * @return The copy.
     */
    public Node copy() {
        List<Node> copied = new ArrayList<>(children.size());
        for (Node child : children) {
            copied.add(child.copy());
        }
        Node node = new Node(op, copied);
        node.copyExtsFrom(this);
        return node;
    }

    /**
     * Replace the contents of this node with those of another, keeping this node's identity.
     *
     * @param other The node whose operation, children and exts to take.
     */
    public void become(Node other) {
        if (isFrozen()) throw new IllegalStateException("node is frozen");
        op = other.op;
        children.clear();
        children.addAll(other.children);
        copyExtsFrom(other);
    }

    /**
     * Reject any further change to the children of this subtree.
     */
    public void freeze() {
        ((ChildList) children).freeze();
        for (Node child : children) {
            child.freeze();
        }
    }

    public boolean isFrozen() {
        return ((ChildList) children).isFrozen();
    }

    /**
     * Count the nodes in this subtree.
     *
     * @return The number of nodes, including this one.
     */
    public int size() {
        int size = 1;
        for (Node child : children) {
            size += child.size();
        }
        return size;
    }

    @Override
    public String toString() {
        return TreePrinter.print(this);
    }
}
