// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.cli;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Locale;
import tessera.dom.Document;
import tessera.layout.Box;
import tessera.layout.Geometry;
import tessera.paint.DisplayList;
import tessera.util.UnreachableCodeReachedError;

/**
 * Human-readable text dumps of box trees and display lists.
 */
final class Dump {
    private Dump() {
    }

    static void boxes(final PrintStream out, final Box root, final Document document) {
        final var pending = new ArrayDeque<Nested>();
        pending.push(new Nested(root, 0));
        while (!pending.isEmpty()) {
            final var nested = pending.pop();
            box(out, nested.box(), document, nested.depth());
            if (nested.box() instanceof Box.Block block) {
                final var children = block.children();
                for (int i = children.size() - 1; i >= 0; i -= 1) {
                    pending.push(new Nested(children.get(i), nested.depth() + 1));
                }
            }
        }
    }

    static void displayList(final PrintStream out, final DisplayList displayList) {
        out.println("extent " + geometry(displayList.extent()));
        for (final var command : displayList.commands()) {
            if (command instanceof DisplayList.Fill fill) {
                out.println("fill " + fill.color() + " " + geometry(fill.rect()));
            } else if (command instanceof DisplayList.Text text) {
                out.println("text " + text.color() + " " + geometry(text.rect()) + " " + quote(text.text()));
            } else {
                throw new UnreachableCodeReachedError("Unknown display command: " + command);
            }
        }
    }

    private static void box(final PrintStream out, final Box box, final Document document, final int depth) {
        final var indent = "  ".repeat(depth);
        if (box instanceof Box.Block block) {
            final var kind = block.anonymous() ? "anonymous block" : "block";
            out.println(indent + kind + " " + describe(document, block.nodeId()) + " " + geometry(block.geometry()));
        } else if (box instanceof Box.Inline inline) {
            out.println(indent + "inline " + describe(document, inline.nodeId()) + " " + geometry(inline.geometry()));
            for (final var line : inline.lines()) {
                out.println(indent + "  line " + geometry(line.geometry()) + " " + quote(line.text()));
            }
        } else {
            throw new UnreachableCodeReachedError("Unknown box type: " + box);
        }
    }

    private static String describe(final Document document, final int id) {
        return document.isElement(id) ? "<" + document.element(id).tagName() + ">" : "#document";
    }

    private static String geometry(final Geometry geometry) {
        return String.format(
            Locale.ROOT,
            "(%.2f, %.2f, %.2f x %.2f)",
            geometry.x(),
            geometry.y(),
            geometry.width(),
            geometry.height()
        );
    }

    private static String quote(final String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    private record Nested(Box box, int depth) {
    }
}
