// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.css;

import java.util.ArrayList;
import java.util.List;

/**
 * The CSS tokenizer.
 * <p>
 * Produces the whole token list of the input at once. Tokenization never fails; comments are skipped, and an
 * unterminated comment or string simply runs to the end of the input.
 */
public final class Tokenizer {
    private Tokenizer(final String input) {
        this.input = input;
    }

    /**
     * Returns the tokens of the given text.
     */
    public static List<CssToken> tokenize(final String input) {
        final var tokenizer = new Tokenizer(input);
        tokenizer.run();
        return List.copyOf(tokenizer.tokens);
    }

    private void run() {
        while (position < input.length()) {
            final var c = input.charAt(position);
            if (input.startsWith("/*", position)) {
                final var end = input.indexOf("*/", position + 2);
                position = (end < 0) ? input.length() : end + 2;
            } else if (isWhitespace(c)) {
                while (position < input.length() && isWhitespace(input.charAt(position))) {
                    position += 1;
                }
                emitWhitespace();
            } else if (c == '"' || c == '\'') {
                tokens.add(new CssToken.StringToken(consumeString(c)));
            } else if (startsNumber(position)) {
                consumeNumeric();
            } else if (startsIdentifier(position)) {
                final var name = consumeName();
                if (peek(0) == '(') {
                    position += 1;
                    tokens.add(new CssToken.Function(name));
                } else {
                    tokens.add(new CssToken.Ident(name));
                }
            } else if (c == '#' && isNameCharacter(peek(1))) {
                position += 1;
                tokens.add(new CssToken.Hash(consumeName()));
            } else if (c == '@' && startsIdentifier(position + 1)) {
                position += 1;
                tokens.add(new CssToken.AtKeyword(consumeName()));
            } else {
                position += 1;
                tokens.add(single(c));
            }
        }
    }

    private static CssToken single(final char c) {
        return switch (c) {
            case ':' -> new CssToken.Colon();
            case ';' -> new CssToken.Semicolon();
            case ',' -> new CssToken.Comma();
            case '{' -> new CssToken.OpenBrace();
            case '}' -> new CssToken.CloseBrace();
            case '(' -> new CssToken.OpenParen();
            case ')' -> new CssToken.CloseParen();
            default -> new CssToken.Delim(c);
        };
    }

    // Comments between whitespace runs must not produce two whitespace tokens in a row.
    private void emitWhitespace() {
        if (tokens.isEmpty() || !(tokens.get(tokens.size() - 1) instanceof CssToken.Whitespace)) {
            tokens.add(new CssToken.Whitespace());
        }
    }

    private String consumeString(final char quote) {
        position += 1;
        final var builder = new StringBuilder();
        while (position < input.length()) {
            final var c = input.charAt(position);
            position += 1;
            if (c == quote) {
                break;
            } else if (c == '\\' && position < input.length()) {
                final var escaped = input.charAt(position);
                position += 1;
                if (escaped != '\n') {
                    builder.append(escaped);
                }
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    private void consumeNumeric() {
        final var start = position;
        if (peek(0) == '+' || peek(0) == '-') {
            position += 1;
        }
        consumeDigits();
        if (peek(0) == '.' && isDigit(peek(1))) {
            position += 1;
            consumeDigits();
        }
        if ((peek(0) == 'e' || peek(0) == 'E')
            && (isDigit(peek(1)) || ((peek(1) == '+' || peek(1) == '-') && isDigit(peek(2))))) {
            position += 2;
            consumeDigits();
        }
        final var value = Double.parseDouble(input.substring(start, position));
        if (peek(0) == '%') {
            position += 1;
            tokens.add(new CssToken.Percentage(value));
        } else if (startsIdentifier(position)) {
            tokens.add(new CssToken.Dimension(value, asciiLowercase(consumeName())));
        } else {
            tokens.add(new CssToken.Number(value));
        }
    }

    private void consumeDigits() {
        while (isDigit(peek(0))) {
            position += 1;
        }
    }

    private String consumeName() {
        final var builder = new StringBuilder();
        while (position < input.length()) {
            final var c = input.charAt(position);
            if (c == '\\' && position + 1 < input.length() && input.charAt(position + 1) != '\n') {
                builder.append(input.charAt(position + 1));
                position += 2;
            } else if (isNameCharacter(c)) {
                builder.append(c);
                position += 1;
            } else {
                break;
            }
        }
        return builder.toString();
    }

    private boolean startsNumber(final int index) {
        var i = index;
        final var c = charAt(i);
        if (c == '+' || c == '-') {
            i += 1;
        }
        return isDigit(charAt(i)) || (charAt(i) == '.' && isDigit(charAt(i + 1)));
    }

    private boolean startsIdentifier(final int index) {
        final var c = charAt(index);
        if (c == '-') {
            final var next = charAt(index + 1);
            return next == '-' || isNameStart(next) || next == '\\';
        }
        return isNameStart(c) || (c == '\\' && charAt(index + 1) != '\n' && index + 1 < input.length());
    }

    private char peek(final int offset) {
        return charAt(position + offset);
    }

    private char charAt(final int index) {
        return (index < input.length()) ? input.charAt(index) : '\0';
    }

    private static boolean isNameStart(final char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c >= 0x80;
    }

    private static boolean isNameCharacter(final char c) {
        return isNameStart(c) || isDigit(c) || c == '-';
    }

    private static boolean isDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWhitespace(final char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    static String asciiLowercase(final String string) {
        final var builder = new StringBuilder(string.length());
        for (int i = 0; i < string.length(); i += 1) {
            final var c = string.charAt(i);
            builder.append((c >= 'A' && c <= 'Z') ? (char) (c + ('a' - 'A')) : c);
        }
        return builder.toString();
    }

    private final String input;
    private int position = 0;
    private final ArrayList<CssToken> tokens = new ArrayList<>();
}
