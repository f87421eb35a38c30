package io.github.shadeir.core.util;

import io.github.shadeir.core.ssa.BasicBlock;
import io.github.shadeir.core.ssa.Function;

import java.util.*;

/**
 * Walks a graph depth-first in pre-order, visiting each node reachable from the root once.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    final T root;
    final F<? super T, ? extends List<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     * <p>
     * Children are pushed in order, so the last child of a node is visited first.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, F<? super T, ? extends List<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a walker over the live blocks of a {@link Function}, following
     * {@link ControlFlow#successors(BasicBlock)} from the entry block.
     *
     * @param func        The function whose blocks should be walked.
     * @param thenFirst   If true, the then branch of an if is walked before the else branch.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(Function func, boolean thenFirst) {
        if (!thenFirst) return new GraphWalker<>(func.getEntry(), ControlFlow::successors);
        return new GraphWalker<>(func.getEntry(), bb -> {
            List<BasicBlock> succs = new ArrayList<>(ControlFlow.successors(bb));
            Collections.reverse(succs);
            return succs;
        });
    }

    /**
     * Create a walker over the live blocks of a {@link Function}.
     *
     * @param func The function whose blocks should be walked.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(Function func) {
        return blockWalker(func, false);
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
         * @return The nodes of the graph, in this order.
         */
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            forEach(ls::add);
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
        private final Deque<T> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        PreIter() {
            stack.push(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            T top = stack.poll();
            if (top == null) throw new NoSuchElementException();
            for (T child : getChildren.apply(top)) {
                if (seen.add(child)) stack.push(child);
            }
            return top;
        }
    }
}
