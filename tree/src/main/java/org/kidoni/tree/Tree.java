package org.kidoni.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntUnaryOperator;
import java.util.stream.Collectors;

/**
 * Labeled tree: either a {@link Leaf} carrying a value, or a {@link Node} carrying a value
 * and an ordered, possibly empty, list of children.
 * <pre>
 *     7
 *    / \
 *   2   3
 *      / \
 *     5   1
 *    / \
 *   1   8
 *
 *  Node(7, [Leaf(2), Node(3, [Node(5, [Leaf(1), Leaf(8)]), Leaf(1)])])
 * </pre>
 */
public sealed interface Tree {

    static Tree leaf(final int value) {
        return new Leaf(value);
    }

    static Tree node(final int value, final Tree... children) {
        return new Node(value, List.of(children));
    }

    static Tree node(final int value, final List<Tree> children) {
        return new Node(value, children);
    }

    int value();

    /**
     * @return {@code true} if this position or any descendant is labeled {@code value}
     */
    boolean has(int value);

    /**
     * Applies {@code f} to every label, keeping the shape and child order.
     */
    Tree map(IntUnaryOperator f);

    /**
     * Number of {@link Leaf} positions. A node never counts itself, so a node without
     * children has no leaves.
     */
    int countLeaves();

    /**
     * Number of positions, leaves and nodes alike.
     */
    int size();

    /**
     * Labels in pre-order: own label first, then each child left to right.
     */
    default List<Integer> preOrder() {
        final List<Integer> labels = new ArrayList<>(size());
        TreeSorter.collect(this, labels);
        return List.copyOf(labels);
    }

    /**
     * A tree of the same shape whose pre-order reading is the ascending sort of this
     * tree's labels. Values move across subtrees; this is not a per-node sort.
     */
    default Tree sort() {
        return TreeSorter.sort(this);
    }

    /**
     * @return {@code true} if {@code other} has the same leaf/node pattern and arity at every
     * position, labels ignored
     */
    default boolean sameShape(final Tree other) {
        if (this instanceof Leaf) {
            return other instanceof Leaf;
        }
        if (!(other instanceof Node that)) {
            return false;
        }
        final List<Tree> children = ((Node) this).children();
        if (children.size() != that.children().size()) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).sameShape(that.children().get(i))) {
                return false;
            }
        }
        return true;
    }

    record Leaf(int value) implements Tree {
        @Override
        public boolean has(final int value) {
            return this.value == value;
        }

        @Override
        public Tree map(final IntUnaryOperator f) {
            return new Leaf(f.applyAsInt(value));
        }

        @Override
        public int countLeaves() {
            return 1;
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public String toString() {
            return "Leaf(" + value + ")";
        }
    }

    record Node(int value, List<Tree> children) implements Tree {
        public Node {
            children = List.copyOf(Objects.requireNonNull(children, "children"));
        }

        @Override
        public boolean has(final int value) {
            return this.value == value || children.stream().anyMatch(child -> child.has(value));
        }

        @Override
        public Tree map(final IntUnaryOperator f) {
            return new Node(f.applyAsInt(value), children.stream().map(child -> child.map(f)).toList());
        }

        @Override
        public int countLeaves() {
            return children.stream().mapToInt(Tree::countLeaves).sum();
        }

        @Override
        public int size() {
            return 1 + children.stream().mapToInt(Tree::size).sum();
        }

        @Override
        public String toString() {
            return children.stream()
                    .map(Tree::toString)
                    .collect(Collectors.joining(", ", "Node(" + value + ", [", "])"));
        }
    }
}
