// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

import java.util.List;

/**
 * A line of text runs, already aligned.
 *
 * @param geometry The line box: its x and width cover the runs only, its height is the tallest run's line height.
 * @param baseline The absolute y coordinate of the shared baseline.
 * @param runs     The runs, left to right.
 */
public record Line(Geometry geometry, double baseline, List<TextRun> runs) {
    public Line {
        runs = List.copyOf(runs);
    }

    /**
     * Returns the text of the line, for diagnostics and tests.
     */
    public String text() {
        final var builder = new StringBuilder();
        for (final var run : runs) {
            builder.append(run.text());
        }
        return builder.toString();
    }
}
