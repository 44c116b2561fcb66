// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.html;

import java.util.Map;

/**
 * Character reference decoding.
 * <p>
 * Named references must be terminated by a semicolon and come from a small table. Numeric references are decimal
 * ({@code &#NN;}) or hexadecimal ({@code &#xHH;}). Anything that isn't a complete known reference is kept literally.
 */
final class Entities {
    private Entities() {
    }

    /**
     * Returns the given text with all character references decoded.
     */
    static String decode(final String text) {
        var ampersand = text.indexOf('&');
        if (ampersand < 0) {
            return text;
        }
        final var builder = new StringBuilder(text.length());
        var index = 0;
        while (ampersand >= 0) {
            builder.append(text, index, ampersand);
            final var end = decodeReference(text, ampersand, builder);
            index = end;
            ampersand = text.indexOf('&', end);
        }
        builder.append(text, index, text.length());
        return builder.toString();
    }

    // Decodes the reference starting at the ampersand at `start` into the builder and returns the index just past it.
    // If there's no valid reference there, appends the ampersand alone.
    private static int decodeReference(final String text, final int start, final StringBuilder builder) {
        final var semicolon = text.indexOf(';', start + 1);
        if (semicolon < 0 || semicolon - start > maxReferenceLength) {
            builder.append('&');
            return start + 1;
        }
        final var body = text.substring(start + 1, semicolon);
        if (body.startsWith("#")) {
            final var codePoint = parseNumeric(body.substring(1));
            if (codePoint == notNumeric) {
                builder.append('&');
                return start + 1;
            }
            builder.appendCodePoint(isValidCodePoint(codePoint) ? codePoint : replacementCharacter);
            return semicolon + 1;
        }
        final var replacement = namedReferences.get(body);
        if (replacement == null) {
            builder.append('&');
            return start + 1;
        }
        builder.append(replacement);
        return semicolon + 1;
    }

    private static int parseNumeric(final String digits) {
        final var hex = digits.startsWith("x") || digits.startsWith("X");
        final var string = hex ? digits.substring(1) : digits;
        if (string.isEmpty()) {
            return notNumeric;
        }
        final var radix = hex ? 16 : 10;
        var value = 0;
        for (int i = 0; i < string.length(); i += 1) {
            final var digit = Character.digit(string.charAt(i), radix);
            if (digit < 0) {
                return notNumeric;
            }
            // Saturate past the Unicode range, the result is invalid either way.
            value = Math.min(value * radix + digit, Character.MAX_CODE_POINT + 1);
        }
        return value;
    }

    private static boolean isValidCodePoint(final int codePoint) {
        return codePoint > 0
            && codePoint <= Character.MAX_CODE_POINT
            && !(codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE);
    }

    private static final int notNumeric = -1;
    private static final int replacementCharacter = 0xFFFD;
    private static final int maxReferenceLength = 32;

    private static final Map<String, String> namedReferences = Map.ofEntries(
        Map.entry("amp", "&"),
        Map.entry("lt", "<"),
        Map.entry("gt", ">"),
        Map.entry("quot", "\""),
        Map.entry("apos", "'"),
        Map.entry("nbsp", "\u00A0"),
        Map.entry("shy", "\u00AD"),
        Map.entry("copy", "©"),
        Map.entry("reg", "®"),
        Map.entry("trade", "™"),
        Map.entry("deg", "°"),
        Map.entry("plusmn", "±"),
        Map.entry("times", "×"),
        Map.entry("divide", "÷"),
        Map.entry("middot", "·"),
        Map.entry("sect", "§"),
        Map.entry("para", "¶"),
        Map.entry("laquo", "«"),
        Map.entry("raquo", "»"),
        Map.entry("lsquo", "‘"),
        Map.entry("rsquo", "’"),
        Map.entry("ldquo", "“"),
        Map.entry("rdquo", "”"),
        Map.entry("ndash", "–"),
        Map.entry("mdash", "—"),
        Map.entry("hellip", "…"),
        Map.entry("bull", "•"),
        Map.entry("cent", "¢"),
        Map.entry("pound", "£"),
        Map.entry("yen", "¥"),
        Map.entry("euro", "€")
    );
}
