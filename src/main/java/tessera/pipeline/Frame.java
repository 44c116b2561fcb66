// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.pipeline;

import java.net.URI;
import tessera.dom.Document;
import tessera.layout.BoxTree;
import tessera.paint.DisplayList;
import tessera.style.StyledDocument;

/**
 * A complete, immutable rendering of a document, as published by the navigator.
 *
 * @param url         The URL of the document.
 * @param generation  The generation of the request that produced this frame: a navigation, or a relayout after a
 *                    resize.
 * @param styled      The document and its computed styles.
 * @param boxes       The box tree.
 * @param displayList The display list painted from the box tree.
 */
public record Frame(URI url, long generation, StyledDocument styled, BoxTree boxes, DisplayList displayList) {
    public Document document() {
        return styled.document();
    }

    public double viewportWidth() {
        return boxes.viewportWidth();
    }
}
