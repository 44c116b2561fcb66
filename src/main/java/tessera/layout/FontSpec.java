// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

import tessera.style.ComputedStyle;
import tessera.style.FontStyle;

/**
 * The font properties that affect text measurement.
 *
 * @param size   The font size in layout units.
 * @param weight The numeric font weight, 100 to 900.
 * @param style  The font style.
 */
public record FontSpec(double size, int weight, FontStyle style) {
    public static FontSpec of(final ComputedStyle style) {
        return new FontSpec(style.fontSize(), style.fontWeight(), style.fontStyle());
    }

    public boolean isBold() {
        return weight >= 600;
    }

    public boolean isSlanted() {
        return style != FontStyle.NORMAL;
    }
}
