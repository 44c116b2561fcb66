// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

import java.util.ArrayDeque;
import java.util.Optional;
import java.util.function.Consumer;
import tessera.util.UnreachableCodeReachedError;
import tessera.util.annotation.Nullable;

/**
 * The result of one layout pass: the root box, plus the document generation and viewport width it was laid out for.
 */
public record BoxTree(Box.Block root, long generation, double viewportWidth) {
    /**
     * Returns the deepest box containing the given point, together with the node it's attributed to: the text node
     * of the run under the point if there's one, otherwise the box's own node.
     */
    public Optional<Hit> hitTest(final double x, final double y) {
        return root.geometry().contains(x, y) ? Optional.of(hitTest(root, x, y)) : Optional.empty();
    }

    /**
     * Returns the smallest rectangle containing every box and line, which is the scrollable area of the document.
     */
    public Geometry extent() {
        final var extent = new Geometry[]{root.geometry()};
        forEachBox(box -> {
            extent[0] = extent[0].union(box.geometry());
            if (box instanceof Box.Inline inline) {
                for (final var line : inline.lines()) {
                    extent[0] = extent[0].union(line.geometry());
                }
            }
        });
        return extent[0];
    }

    /**
     * Calls the given consumer for every box, parents before children.
     */
    public void forEachBox(final Consumer<Box> consumer) {
        forEachBox(root, consumer);
    }

    private static void forEachBox(final Box root, final Consumer<Box> consumer) {
        final var pending = new ArrayDeque<Box>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final var box = pending.pop();
            consumer.accept(box);
            if (box instanceof Box.Block block) {
                final var children = block.children();
                for (int i = children.size() - 1; i >= 0; i -= 1) {
                    pending.push(children.get(i));
                }
            }
        }
    }

    private static Hit hitTest(final Box root, final double x, final double y) {
        var box = root;
        while (box instanceof Box.Block block) {
            final var child = childAt(block, x, y);
            if (child == null) {
                return new Hit(block, block.nodeId());
            }
            box = child;
        }
        if (box instanceof Box.Inline inline) {
            for (final var line : inline.lines()) {
                for (final var run : line.runs()) {
                    if (run.geometry().contains(x, y)) {
                        return new Hit(inline, run.nodeId());
                    }
                }
            }
            return new Hit(inline, inline.nodeId());
        }
        throw new UnreachableCodeReachedError("Unknown box type: " + box);
    }

    private static @Nullable Box childAt(final Box.Block block, final double x, final double y) {
        // Later siblings are painted over earlier ones.
        final var children = block.children();
        for (int i = children.size() - 1; i >= 0; i -= 1) {
            final var child = children.get(i);
            if (child.geometry().contains(x, y)) {
                return child;
            }
        }
        return null;
    }

    /**
     * The result of a hit test.
     *
     * @param box    The deepest box containing the point.
     * @param nodeId The id of the node the point is attributed to.
     */
    public record Hit(Box box, int nodeId) {
    }
}
