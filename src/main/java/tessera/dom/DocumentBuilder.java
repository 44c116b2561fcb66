// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.dom;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Appends nodes to a new document tree, then freezes it into a {@link Document}.
 * <p>
 * Nodes can only be appended as the last child of an existing node. Because the tree is built in a single pass this is
 * all a tree constructor needs, and it keeps ids in document order.
 */
public final class DocumentBuilder {
    /**
     * Initializes a builder for a document of the given generation, containing only the root.
     */
    public DocumentBuilder(final long generation) {
        this.generation = generation;
        allocate(new Node.Root(), Document.NONE);
    }

    /**
     * Appends a new element as the last child of {@code parent}, returning its id.
     */
    public int appendElement(final int parent, final String tagName, final Attributes attributes) {
        return allocate(new Node.Element(tagName, attributes), parent);
    }

    /**
     * Appends text as the last child of {@code parent}.
     * <p>
     * If the current last child is already a text node, the text is merged into it instead, and its id is returned.
     */
    public int appendText(final int parent, final String content) {
        final var last = lastChildren[parent];
        if (last != Document.NONE && nodes.get(last) instanceof Node.Text text) {
            nodes.set(last, new Node.Text(text.content() + content));
            return last;
        }
        return allocate(new Node.Text(content), parent);
    }

    public int appendComment(final int parent, final String content) {
        return allocate(new Node.Comment(content), parent);
    }

    /**
     * Returns the document built so far. The builder must not be used afterwards.
     */
    public Document build() {
        final var size = nodes.size();
        return new Document(
            generation,
            List.copyOf(nodes),
            Arrays.copyOf(parents, size),
            Arrays.copyOf(firstChildren, size),
            Arrays.copyOf(nextSiblings, size),
            Arrays.copyOf(previousSiblings, size)
        );
    }

    private int allocate(final Node node, final int parent) {
        final var id = nodes.size();
        if (id == parents.length) {
            final var capacity = id * 2;
            parents = Arrays.copyOf(parents, capacity);
            firstChildren = Arrays.copyOf(firstChildren, capacity);
            lastChildren = Arrays.copyOf(lastChildren, capacity);
            nextSiblings = Arrays.copyOf(nextSiblings, capacity);
            previousSiblings = Arrays.copyOf(previousSiblings, capacity);
        }
        nodes.add(node);
        parents[id] = parent;
        firstChildren[id] = Document.NONE;
        lastChildren[id] = Document.NONE;
        nextSiblings[id] = Document.NONE;
        previousSiblings[id] = Document.NONE;
        if (parent != Document.NONE) {
            final var previous = lastChildren[parent];
            if (previous == Document.NONE) {
                firstChildren[parent] = id;
            } else {
                nextSiblings[previous] = id;
                previousSiblings[id] = previous;
            }
            lastChildren[parent] = id;
        }
        return id;
    }

    private final long generation;
    private final ArrayList<Node> nodes = new ArrayList<>();
    private int[] parents = new int[initialCapacity];
    private int[] firstChildren = new int[initialCapacity];
    private int[] lastChildren = new int[initialCapacity];
    private int[] nextSiblings = new int[initialCapacity];
    private int[] previousSiblings = new int[initialCapacity];

    private static final int initialCapacity = 64;
}
