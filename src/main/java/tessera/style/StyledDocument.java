// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.style;

import tessera.dom.Document;
import tessera.dom.Node;

/**
 * A document together with the computed style of each of its nodes.
 * <p>
 * Styles are indexed by node id. Elements have their own computed style; text nodes share their parent's, and the
 * root has the initial style.
 */
public final class StyledDocument {
    StyledDocument(final Document document, final ComputedStyle[] styles) {
        this.document = document;
        this.styles = styles;
    }

    public Document document() {
        return document;
    }

    /**
     * Returns the computed style of the node with the given id.
     */
    public ComputedStyle style(final int id) {
        return styles[id];
    }

    /**
     * Returns whether the given node takes part in rendering at all: comments and the contents of {@code display:
     * none} elements never do.
     */
    public boolean isRendered(final int id) {
        if (document.node(id) instanceof Node.Comment) {
            return false;
        }
        for (var node = id; node != Document.NONE; node = document.parent(node)) {
            if (document.isElement(node) && styles[node].display() == Display.NONE) {
                return false;
            }
        }
        return true;
    }

    private final Document document;
    private final ComputedStyle[] styles;
}
