// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.paint;

import java.util.ArrayList;
import tessera.layout.Box;
import tessera.layout.BoxTree;
import tessera.layout.Geometry;
import tessera.style.Color;
import tessera.util.UnreachableCodeReachedError;

/**
 * Turns a box tree into a display list.
 * <p>
 * Boxes are painted in tree order, parents before children, so that children are drawn on top of their parents. For
 * each block box the background comes first, then the four borders. Transparent fills and zero-width borders produce
 * no commands.
 */
public final class Painter {
    private Painter() {
    }

    public static DisplayList paint(final BoxTree tree) {
        final var painter = new Painter();
        tree.forEachBox(painter::paintBox);
        return new DisplayList(painter.commands, tree.extent());
    }

    private void paintBox(final Box box) {
        if (box instanceof Box.Block block) {
            paintBlock(block);
        } else if (box instanceof Box.Inline inline) {
            for (final var line : inline.lines()) {
                for (final var run : line.runs()) {
                    commands.add(new DisplayList.Text(run.geometry(), run.color(), run.font(), run.text(),
                        run.baseline()));
                }
            }
        } else {
            throw new UnreachableCodeReachedError("Unknown box type: " + box);
        }
    }

    private void paintBlock(final Box.Block block) {
        final var rect = block.geometry();
        fill(rect, block.background());
        final var border = block.border();
        final var color = block.borderColor();
        fill(new Geometry(rect.x(), rect.y(), rect.width(), border.top()), color);
        fill(new Geometry(rect.right() - border.right(), rect.y(), border.right(), rect.height()), color);
        fill(new Geometry(rect.x(), rect.bottom() - border.bottom(), rect.width(), border.bottom()), color);
        fill(new Geometry(rect.x(), rect.y(), border.left(), rect.height()), color);
    }

    private void fill(final Geometry rect, final Color color) {
        if (color.isTransparent() || rect.width() <= 0 || rect.height() <= 0) {
            return;
        }
        commands.add(new DisplayList.Fill(rect, color));
    }

    private final ArrayList<DisplayList.Command> commands = new ArrayList<>();
}
