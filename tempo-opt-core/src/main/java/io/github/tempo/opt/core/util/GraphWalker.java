package io.github.tempo.opt.core.util;

import java.util.*;

/**
 * A class for walking a graph depth-first, in pre-order, from a set of roots.
 * <p>
 * The visit order depends only on the order of the roots and of the successor
 * function's results, never on hashing.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    /**
     * The roots of the walk.
     */
    final List<T> roots;
    /**
     * The successor function.
     */
    final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from root nodes and a successor function.
     * <p>
     * Elements yielded later by the successor function will be visited first.
     *
     * @param roots       The roots of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(Collection<? extends T> roots, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.roots = new ArrayList<>(roots);
        this.getChildren = getChildren;
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        /**
         * Collect this order to a list.
         *
         * @return The elements of the graph, in this order.
         */
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    /**
     * Get the pre-order traversal of the graph.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

        {
            for (int i = roots.size() - 1; i >= 0; i--) {
                T root = roots.get(i);
                if (seen.add(root)) {
                    stack.add(root);
                }
            }
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }
}
