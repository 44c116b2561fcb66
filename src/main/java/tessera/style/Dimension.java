// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.style;

/**
 * A computed size: {@code auto}, an absolute length in pixels, or a percentage of the containing block's width.
 */
public record Dimension(Kind kind, double value) {
    public enum Kind {
        AUTO,
        PX,
        PERCENT,
    }

    public static Dimension auto() {
        return auto;
    }

    public static Dimension px(final double value) {
        return new Dimension(Kind.PX, value);
    }

    public static Dimension percent(final double value) {
        return new Dimension(Kind.PERCENT, value);
    }

    public boolean isAuto() {
        return kind == Kind.AUTO;
    }

    /**
     * Resolves this dimension against the given percentage base. {@code auto} resolves to {@code autoValue}.
     * <p>
     * Percentages resolve to at most {@link #maximumLength} in magnitude, so nested percentages stay finite.
     */
    public double resolve(final double percentageBase, final double autoValue) {
        return switch (kind) {
            case AUTO -> autoValue;
            case PX -> value;
            case PERCENT -> clamp(percentageBase * value / 100.0);
        };
    }

    /**
     * Returns whether the given number of pixels, or percent, is a length layout can work with.
     */
    public static boolean isUsable(final double value) {
        return Double.isFinite(value) && Math.abs(value) <= maximumLength;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case AUTO -> "auto";
            case PX -> value + "px";
            case PERCENT -> value + "%";
        };
    }

    private static double clamp(final double value) {
        return Math.max(-maximumLength, Math.min(maximumLength, value));
    }

    private static final Dimension auto = new Dimension(Kind.AUTO, 0);

    /**
     * The largest magnitude of a length, in pixels, or of a percentage.
     */
    public static final double maximumLength = 1 << 25;

    /**
     * Zero pixels.
     */
    public static final Dimension zero = new Dimension(Kind.PX, 0);
}
