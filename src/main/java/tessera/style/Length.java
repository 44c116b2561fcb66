// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.style;

/**
 * A specified length, before resolution against font sizes or containing blocks.
 */
public record Length(double value, Unit unit) {
    public enum Unit {
        PX,
        EM,
        PERCENT,
    }

    public static Length px(final double value) {
        return new Length(value, Unit.PX);
    }

    @Override
    public String toString() {
        return switch (unit) {
            case PX -> value + "px";
            case EM -> value + "em";
            case PERCENT -> value + "%";
        };
    }
}
