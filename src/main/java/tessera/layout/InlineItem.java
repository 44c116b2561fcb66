// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

import tessera.style.Color;

/**
 * A piece of inline content, in document order, as fed to the {@link LineBreaker}.
 */
public sealed interface InlineItem {
    /**
     * The content of a text node, with the font and colour inherited from its parent element.
     */
    record Text(String text, FontSpec font, Color color, int nodeId) implements InlineItem {
    }

    /**
     * A forced line break, from a {@code <br>} element.
     */
    record ForcedBreak() implements InlineItem {
    }
}
