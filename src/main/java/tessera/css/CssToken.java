// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.css;

/**
 * A CSS token. Comments never become tokens.
 */
public sealed interface CssToken {
    /**
     * An identifier, kept in its original case.
     */
    record Ident(String name) implements CssToken {
        public boolean is(final String keyword) {
            return name.equalsIgnoreCase(keyword);
        }
    }

    /**
     * An identifier immediately followed by an opening parenthesis, such as {@code rgb(}.
     */
    record Function(String name) implements CssToken {
    }

    record AtKeyword(String name) implements CssToken {
    }

    /**
     * A {@code #} followed by name characters, used both for id selectors and hex colours.
     */
    record Hash(String name) implements CssToken {
    }

    record StringToken(String value) implements CssToken {
    }

    record Number(double value) implements CssToken {
    }

    record Percentage(double value) implements CssToken {
    }

    /**
     * A number with a unit. The unit is ASCII-lowercase.
     */
    record Dimension(double value, String unit) implements CssToken {
    }

    record Whitespace() implements CssToken {
    }

    record Colon() implements CssToken {
    }

    record Semicolon() implements CssToken {
    }

    record Comma() implements CssToken {
    }

    record OpenBrace() implements CssToken {
    }

    record CloseBrace() implements CssToken {
    }

    record OpenParen() implements CssToken {
    }

    record CloseParen() implements CssToken {
    }

    /**
     * Any other single character.
     */
    record Delim(char value) implements CssToken {
        public boolean is(final char character) {
            return value == character;
        }
    }
}
