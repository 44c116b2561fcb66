// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

import java.util.List;
import tessera.style.Color;

/**
 * A laid-out box.
 * <p>
 * Every box refers back to the document node that generated it by id; the box doesn't own the node. Boxes are
 * immutable and compare by value, so two layouts of the same input compare equal.
 */
public sealed interface Box {
    /**
     * Returns the id of the node this box was generated for.
     */
    int nodeId();

    /**
     * Returns the border box of this box.
     */
    Geometry geometry();

    /**
     * A block box, stacking its children vertically.
     *
     * @param nodeId      The generating element, or for an anonymous box, the element whose inline content it wraps.
     * @param anonymous   Whether this box wraps inline content sitting next to block siblings.
     * @param geometry    The border box.
     * @param margin      The resolved margins, outside of the border box.
     * @param border      The resolved border widths.
     * @param padding     The resolved padding.
     * @param background  The background colour of the border box.
     * @param borderColor The colour of all four borders.
     * @param children    The child boxes, top to bottom.
     */
    record Block(
        int nodeId,
        boolean anonymous,
        Geometry geometry,
        Edges margin,
        Edges border,
        Edges padding,
        Color background,
        Color borderColor,
        List<Box> children
    ) implements Box {
        public Block {
            children = List.copyOf(children);
        }

        /**
         * Returns the content box, inside the border and the padding.
         */
        public Geometry contentGeometry() {
            return new Geometry(
                geometry.x() + border.left() + padding.left(),
                geometry.y() + border.top() + padding.top(),
                Math.max(0, geometry.width() - border.horizontal() - padding.horizontal()),
                Math.max(0, geometry.height() - border.vertical() - padding.vertical())
            );
        }
    }

    /**
     * A box holding lines of inline content.
     *
     * @param nodeId   The element establishing the inline content.
     * @param geometry The area of the lines, as wide as the containing block.
     * @param lines    The lines, top to bottom.
     */
    record Inline(int nodeId, Geometry geometry, List<Line> lines) implements Box {
        public Inline {
            lines = List.copyOf(lines);
        }
    }
}
