package io.github.tempo.opt.core.tree;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.RandomAccess;

/**
 * The children of a {@link Node}, which reject every mutation once the node is frozen.
 * <p>
 * Iterators, sublists and sorting all mutate through {@link #set(int, Node)},
 * {@link #add(int, Node)} and {@link #remove(int)}, so those are the only places that check.
 */
final class ChildList extends AbstractList<Node> implements RandomAccess {
    private final List<Node> viewed;
    private boolean frozen;

    ChildList(Collection<Node> children) {
        this.viewed = new ArrayList<>(children);
    }

    void freeze() {
        frozen = true;
    }

    boolean isFrozen() {
        return frozen;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("node is frozen");
        }
    }

    @Override
    public Node get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public Node set(int index, Node element) {
        checkMutable();
        return viewed.set(index, element);
    }

    @Override
    public void add(int index, Node element) {
        checkMutable();
        viewed.add(index, element);
        modCount++;
    }

    @Override
    public Node remove(int index) {
        checkMutable();
        Node removed = viewed.remove(index);
        modCount++;
        return removed;
    }

    @Override
    public void clear() {
        checkMutable();
        viewed.clear();
        modCount++;
    }

    @Override
    public boolean addAll(int index, Collection<? extends Node> c) {
        checkMutable();
        boolean changed = viewed.addAll(index, c);
        if (changed) modCount++;
        return changed;
    }
}
