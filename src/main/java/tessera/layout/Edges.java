// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

/**
 * Resolved widths of the four sides of a margin, border or padding.
 */
public record Edges(double top, double right, double bottom, double left) {
    public double horizontal() {
        return left + right;
    }

    public double vertical() {
        return top + bottom;
    }

    public static final Edges zero = new Edges(0, 0, 0, 0);
}
