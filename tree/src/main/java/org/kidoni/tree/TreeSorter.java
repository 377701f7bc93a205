package org.kidoni.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sort over a {@link Tree}: flatten the labels in pre-order, sort them, then relabel the
 * input shape in the same pre-order from one cursor over the sorted labels.
 */
abstract class TreeSorter {
    private static final Logger LOG = LoggerFactory.getLogger(TreeSorter.class);

    static Tree sort(final Tree tree) {
        final List<Integer> labels = new ArrayList<>(tree.size());
        collect(tree, labels);
        LOG.debug("pre-order labels: {}", labels);

        Collections.sort(labels);
        LOG.debug("sorted labels: {}", labels);

        final Iterator<Integer> cursor = labels.iterator();
        return relabel(tree, cursor);
    }

    static void collect(final Tree tree, final List<Integer> labels) {
        labels.add(tree.value());
        if (tree instanceof Tree.Node node) {
            for (Tree child : node.children()) {
                collect(child, labels);
            }
        }
    }

    // one label per position, so the cursor runs out exactly at the last position
    private static Tree relabel(final Tree shape, final Iterator<Integer> cursor) {
        final int value = cursor.next();
        if (shape instanceof Tree.Node node) {
            final List<Tree> children = new ArrayList<>(node.children().size());
            for (Tree child : node.children()) {
                children.add(relabel(child, cursor));
            }
            return new Tree.Node(value, children);
        }
        return new Tree.Leaf(value);
    }
}
