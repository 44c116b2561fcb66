// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.dom;

/**
 * The payload of a document tree node.
 * <p>
 * Nodes are immutable and carry no structural links; parent, child and sibling relations are kept by the owning
 * {@link Document}, which addresses nodes by integer id.
 */
public sealed interface Node {
    /**
     * The root of every document tree. There is exactly one per document, at id {@link Document#ROOT}.
     */
    record Root() implements Node {
    }

    /**
     * An element, with an ASCII-lowercase tag name and its attributes.
     */
    record Element(String tagName, Attributes attributes) implements Node {
        public boolean hasTagName(final String name) {
            return tagName.equals(name);
        }
    }

    /**
     * Character data. Adjacent text is always coalesced into one node.
     */
    record Text(String content) implements Node {
    }

    /**
     * A comment. Comments take part in the tree structure but never in styling or layout.
     */
    record Comment(String content) implements Node {
    }
}
