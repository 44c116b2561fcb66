// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

/**
 * An axis-aligned rectangle in layout units, with the origin at the top left of the document.
 */
public record Geometry(double x, double y, double width, double height) {
    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public boolean contains(final double pointX, final double pointY) {
        return pointX >= x && pointX < right() && pointY >= y && pointY < bottom();
    }

    /**
     * Returns whether every coordinate is finite and the size isn't negative.
     */
    public boolean isWellFormed() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(width) && Double.isFinite(height)
            && width >= 0 && height >= 0;
    }

    /**
     * Returns the smallest rectangle containing both this one and the other.
     */
    public Geometry union(final Geometry other) {
        final var left = Math.min(x, other.x);
        final var top = Math.min(y, other.y);
        return new Geometry(left, top, Math.max(right(), other.right()) - left, Math.max(bottom(), other.bottom()) - top);
    }
}
