// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.dom;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * An immutable document tree.
 * <p>
 * Nodes live in an arena and are addressed by ids in the range {@code [0, size())}. Structural relations are stored as
 * id fields, with {@link #NONE} marking an absent relation. The root is always the {@link Node.Root} at {@link #ROOT}.
 * Ids are assigned in document order, so a parent's id is always smaller than the ids of its descendants.
 * <p>
 * Each document carries the navigation generation it was built for, which the layout engine stamps onto box trees.
 */
public final class Document {
    Document(
        final long generation,
        final List<Node> nodes,
        final int[] parents,
        final int[] firstChildren,
        final int[] nextSiblings,
        final int[] previousSiblings
    ) {
        this.generation = generation;
        this.nodes = nodes;
        this.parents = parents;
        this.firstChildren = firstChildren;
        this.nextSiblings = nextSiblings;
        this.previousSiblings = previousSiblings;
    }

    public long generation() {
        return generation;
    }

    /**
     * Returns the number of nodes, including the root.
     */
    public int size() {
        return nodes.size();
    }

    public boolean contains(final int id) {
        return id >= 0 && id < nodes.size();
    }

    public Node node(final int id) {
        return nodes.get(id);
    }

    /**
     * Returns the element with the given id.
     *
     * @throws IllegalArgumentException If the node with the given id isn't an element.
     */
    public Node.Element element(final int id) {
        if (nodes.get(id) instanceof Node.Element element) {
            return element;
        }
        throw new IllegalArgumentException("Node " + id + " is not an element: " + nodes.get(id));
    }

    public boolean isElement(final int id) {
        return nodes.get(id) instanceof Node.Element;
    }

    public int parent(final int id) {
        return parents[id];
    }

    public int firstChild(final int id) {
        return firstChildren[id];
    }

    public int nextSibling(final int id) {
        return nextSiblings[id];
    }

    public int previousSibling(final int id) {
        return previousSiblings[id];
    }

    /**
     * Returns the ids of the children of the given node, in order.
     */
    public List<Integer> children(final int id) {
        final var result = new ArrayList<Integer>();
        for (var child = firstChildren[id]; child != NONE; child = nextSiblings[child]) {
            result.add(child);
        }
        return result;
    }

    /**
     * Returns the nearest preceding sibling of the given node that is an element, or {@link #NONE}.
     */
    public int previousElementSibling(final int id) {
        var sibling = previousSiblings[id];
        while (sibling != NONE && !isElement(sibling)) {
            sibling = previousSiblings[sibling];
        }
        return sibling;
    }

    /**
     * Returns the nearest ancestor of the given node that is an element, or {@link #NONE}.
     */
    public int parentElement(final int id) {
        final var parent = parents[id];
        return (parent != NONE && isElement(parent)) ? parent : NONE;
    }

    /**
     * Calls the given consumer with the id of every node below the given one, in document order.
     */
    public void forEachDescendant(final int id, final IntConsumer consumer) {
        // Walks the sibling and parent links, so arbitrarily deep trees don't need a deep stack.
        var current = firstChildren[id];
        while (current != NONE) {
            consumer.accept(current);
            if (firstChildren[current] != NONE) {
                current = firstChildren[current];
                continue;
            }
            while (current != id && nextSiblings[current] == NONE) {
                current = parents[current];
            }
            current = (current == id) ? NONE : nextSiblings[current];
        }
    }

    /**
     * Returns the ids of all elements with the given tag name, in document order.
     */
    public List<Integer> elementsByTagName(final String tagName) {
        final var result = new ArrayList<Integer>();
        forEachDescendant(ROOT, id -> {
            if (nodes.get(id) instanceof Node.Element element && element.hasTagName(tagName)) {
                result.add(id);
            }
        });
        return result;
    }

    /**
     * Returns the concatenated content of all text nodes below the given node.
     */
    public String textContent(final int id) {
        final var builder = new StringBuilder();
        forEachDescendant(id, descendant -> {
            if (nodes.get(descendant) instanceof Node.Text text) {
                builder.append(text.content());
            }
        });
        return builder.toString();
    }

    @Override
    public String toString() {
        return "Document[generation=" + generation + ", size=" + nodes.size() + "]";
    }

    /**
     * Id of the root node.
     */
    public static final int ROOT = 0;

    /**
     * Marks the absence of a node in structural relations.
     */
    public static final int NONE = -1;

    private final long generation;
    private final List<Node> nodes;
    private final int[] parents;
    private final int[] firstChildren;
    private final int[] nextSiblings;
    private final int[] previousSiblings;
}
