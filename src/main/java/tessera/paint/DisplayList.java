// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.paint;

import java.util.List;
import tessera.layout.FontSpec;
import tessera.layout.Geometry;
import tessera.style.Color;

/**
 * An ordered list of drawing commands, back to front, plus the extent of the whole document for scrolling.
 */
public record DisplayList(List<Command> commands, Geometry extent) {
    public DisplayList {
        commands = List.copyOf(commands);
    }

    /**
     * A drawing command.
     */
    public sealed interface Command {
        Geometry rect();

        Color color();
    }

    /**
     * Fills a rectangle with a solid colour.
     */
    public record Fill(Geometry rect, Color color) implements Command {
    }

    /**
     * Draws a run of text, with its baseline at the given absolute y coordinate.
     */
    public record Text(Geometry rect, Color color, FontSpec font, String text, double baseline) implements Command {
    }
}
