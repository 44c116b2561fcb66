// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

import java.util.Arrays;
import tessera.util.annotation.Nullable;

/**
 * The metrics of a measured piece of text.
 *
 * @param advances   The advance width of each UTF-16 unit of the text. The second unit of a surrogate pair has a zero
 *                   advance.
 * @param ascent     The distance from the baseline to the top of the line box.
 * @param descent    The distance from the baseline to the bottom of the line box.
 * @param lineHeight The height of a line of this text.
 */
public record Measurement(double[] advances, double ascent, double descent, double lineHeight) {
    public Measurement {
        advances = advances.clone();
    }

    /**
     * Returns the total advance of the units in {@code [start, end)}.
     */
    public double width(final int start, final int end) {
        var sum = 0.0;
        for (int i = start; i < end; i += 1) {
            sum += advances[i];
        }
        return sum;
    }

    public double width() {
        return width(0, advances.length);
    }

    @Override
    public double[] advances() {
        return advances.clone();
    }

    @Override
    public boolean equals(final @Nullable Object other) {
        return other instanceof Measurement that
            && Arrays.equals(advances, that.advances)
            && ascent == that.ascent
            && descent == that.descent
            && lineHeight == that.lineHeight;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(advances) * 31 + Double.hashCode(ascent + descent + lineHeight);
    }

    @Override
    public String toString() {
        return "Measurement[advances=" + Arrays.toString(advances) + ", ascent=" + ascent + ", descent=" + descent
            + ", lineHeight=" + lineHeight + "]";
    }
}
