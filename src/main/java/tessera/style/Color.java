// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.style;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * An sRGB colour with 8-bit channels, alpha included.
 */
public record Color(int red, int green, int blue, int alpha) {
    public Color {
        checkChannel(red);
        checkChannel(green);
        checkChannel(blue);
        checkChannel(alpha);
    }

    public static Color rgb(final int red, final int green, final int blue) {
        return new Color(red, green, blue, 255);
    }

    /**
     * Looks up a colour keyword, case-insensitively. {@code transparent} is included.
     */
    public static Optional<Color> named(final String name) {
        return Optional.ofNullable(namedColors.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Parses the digits of a {@code #rgb}, {@code #rgba}, {@code #rrggbb} or {@code #rrggbbaa} colour.
     */
    public static Optional<Color> fromHex(final String digits) {
        for (int i = 0; i < digits.length(); i += 1) {
            if (Character.digit(digits.charAt(i), 16) < 0) {
                return Optional.empty();
            }
        }
        return switch (digits.length()) {
            case 3, 4 -> Optional.of(new Color(
                shortHex(digits, 0),
                shortHex(digits, 1),
                shortHex(digits, 2),
                (digits.length() == 4) ? shortHex(digits, 3) : 255
            ));
            case 6, 8 -> Optional.of(new Color(
                longHex(digits, 0),
                longHex(digits, 2),
                longHex(digits, 4),
                (digits.length() == 8) ? longHex(digits, 6) : 255
            ));
            default -> Optional.empty();
        };
    }

    public boolean isTransparent() {
        return alpha == 0;
    }

    @Override
    public String toString() {
        return (alpha == 255)
            ? String.format("#%02x%02x%02x", red, green, blue)
            : String.format("#%02x%02x%02x%02x", red, green, blue, alpha);
    }

    private static int shortHex(final String digits, final int index) {
        return Character.digit(digits.charAt(index), 16) * 0x11;
    }

    private static int longHex(final String digits, final int index) {
        return Integer.parseInt(digits.substring(index, index + 2), 16);
    }

    private static void checkChannel(final int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Colour channel out of range: " + value);
        }
    }

    public static final Color black = rgb(0, 0, 0);
    public static final Color white = rgb(255, 255, 255);
    public static final Color transparent = new Color(0, 0, 0, 0);

    private static final Map<String, Color> namedColors = Map.ofEntries(
        Map.entry("transparent", transparent),
        Map.entry("black", black),
        Map.entry("white", white),
        Map.entry("silver", rgb(192, 192, 192)),
        Map.entry("gray", rgb(128, 128, 128)),
        Map.entry("grey", rgb(128, 128, 128)),
        Map.entry("lightgray", rgb(211, 211, 211)),
        Map.entry("lightgrey", rgb(211, 211, 211)),
        Map.entry("darkgray", rgb(169, 169, 169)),
        Map.entry("darkgrey", rgb(169, 169, 169)),
        Map.entry("maroon", rgb(128, 0, 0)),
        Map.entry("red", rgb(255, 0, 0)),
        Map.entry("purple", rgb(128, 0, 128)),
        Map.entry("fuchsia", rgb(255, 0, 255)),
        Map.entry("magenta", rgb(255, 0, 255)),
        Map.entry("green", rgb(0, 128, 0)),
        Map.entry("lime", rgb(0, 255, 0)),
        Map.entry("olive", rgb(128, 128, 0)),
        Map.entry("yellow", rgb(255, 255, 0)),
        Map.entry("navy", rgb(0, 0, 128)),
        Map.entry("blue", rgb(0, 0, 255)),
        Map.entry("teal", rgb(0, 128, 128)),
        Map.entry("aqua", rgb(0, 255, 255)),
        Map.entry("cyan", rgb(0, 255, 255)),
        Map.entry("orange", rgb(255, 165, 0)),
        Map.entry("brown", rgb(165, 42, 42)),
        Map.entry("pink", rgb(255, 192, 203)),
        Map.entry("gold", rgb(255, 215, 0)),
        Map.entry("indigo", rgb(75, 0, 130)),
        Map.entry("violet", rgb(238, 130, 238)),
        Map.entry("crimson", rgb(220, 20, 60)),
        Map.entry("coral", rgb(255, 127, 80)),
        Map.entry("salmon", rgb(250, 128, 114)),
        Map.entry("tomato", rgb(255, 99, 71)),
        Map.entry("khaki", rgb(240, 230, 140)),
        Map.entry("beige", rgb(245, 245, 220)),
        Map.entry("ivory", rgb(255, 255, 240)),
        Map.entry("lavender", rgb(230, 230, 250)),
        Map.entry("skyblue", rgb(135, 206, 235)),
        Map.entry("steelblue", rgb(70, 130, 180)),
        Map.entry("royalblue", rgb(65, 105, 225)),
        Map.entry("darkblue", rgb(0, 0, 139)),
        Map.entry("darkgreen", rgb(0, 100, 0)),
        Map.entry("darkred", rgb(139, 0, 0)),
        Map.entry("whitesmoke", rgb(245, 245, 245)),
        Map.entry("gainsboro", rgb(220, 220, 220)),
        Map.entry("rebeccapurple", rgb(102, 51, 153))
    );
}
