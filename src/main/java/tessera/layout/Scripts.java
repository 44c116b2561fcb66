// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

/**
 * Script properties of characters relevant to line breaking and measurement.
 */
final class Scripts {
    private Scripts() {
    }

    /**
     * Returns whether the character belongs to a script written without word separators, so a line may break before
     * or after it.
     */
    static boolean breaksAnywhere(final int codePoint) {
        final var script = Character.UnicodeScript.of(codePoint);
        if (script == Character.UnicodeScript.HAN
            || script == Character.UnicodeScript.HIRAGANA
            || script == Character.UnicodeScript.KATAKANA
            || script == Character.UnicodeScript.BOPOMOFO
            || script == Character.UnicodeScript.YI) {
            return true;
        }
        final var block = Character.UnicodeBlock.of(codePoint);
        return block == Character.UnicodeBlock.CJK_SYMBOLS_AND_PUNCTUATION
            || block == Character.UnicodeBlock.HIRAGANA
            || block == Character.UnicodeBlock.KATAKANA
            || block == Character.UnicodeBlock.CJK_COMPATIBILITY_FORMS
            || block == Character.UnicodeBlock.VERTICAL_FORMS
            || isFullwidthForm(codePoint);
    }

    /**
     * Returns whether the character is rendered twice as wide as a narrow one in East Asian typography.
     */
    static boolean isWide(final int codePoint) {
        return breaksAnywhere(codePoint) || Character.UnicodeScript.of(codePoint) == Character.UnicodeScript.HANGUL;
    }

    private static boolean isFullwidthForm(final int codePoint) {
        return (codePoint >= 0xFF01 && codePoint <= 0xFF60) || (codePoint >= 0xFFE0 && codePoint <= 0xFFE6);
    }
}
