// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.css;

import java.util.ArrayList;
import java.util.List;
import tessera.util.annotation.Nullable;

/**
 * Parses one complex selector: compound selectors joined by descendant, {@code >}, {@code +} or {@code ~}
 * combinators. Anything else, such as attribute selectors or pseudo-classes, makes the selector malformed.
 */
final class SelectorParser {
    private SelectorParser(final List<CssToken> tokens) {
        this.tokens = tokens;
    }

    static @Nullable Selector parse(final List<CssToken> tokens) {
        final var trimmed = Parser.trim(tokens);
        if (trimmed.isEmpty()) {
            Parser.error("Empty selector");
            return null;
        }
        final var parser = new SelectorParser(trimmed);
        final var result = parser.parseComplex();
        if (result == null) {
            Parser.error("Malformed selector '" + render(trimmed) + "', rule dropped");
        }
        return result;
    }

    private @Nullable Selector parseComplex() {
        var result = parseCompound();
        if (result == null) {
            return null;
        }
        while (position < tokens.size()) {
            final var sawWhitespace = skipWhitespace();
            final var combinator = (position < tokens.size() && tokens.get(position) instanceof CssToken.Delim delim)
                ? delim.value()
                : ' ';
            if (combinator == '>' || combinator == '+' || combinator == '~') {
                position += 1;
                skipWhitespace();
            } else if (!sawWhitespace) {
                return null;
            }
            final var subject = parseCompound();
            if (subject == null) {
                return null;
            }
            result = switch (combinator) {
                case '>' -> new Selector.Child(result, subject);
                case '+' -> new Selector.NextSibling(result, subject);
                case '~' -> new Selector.SubsequentSibling(result, subject);
                default -> new Selector.Descendant(result, subject);
            };
        }
        return result;
    }

    private @Nullable Selector parseCompound() {
        final var parts = new ArrayList<Selector>();
        if (position < tokens.size()) {
            final var first = tokens.get(position);
            if (first instanceof CssToken.Ident ident) {
                parts.add(new Selector.Tag(Tokenizer.asciiLowercase(ident.name())));
                position += 1;
            } else if (first instanceof CssToken.Delim delim && delim.is('*')) {
                parts.add(new Selector.Universal());
                position += 1;
            }
        }
        while (position < tokens.size()) {
            final var token = tokens.get(position);
            if (token instanceof CssToken.Hash hash) {
                parts.add(new Selector.Id(hash.name()));
                position += 1;
            } else if (token instanceof CssToken.Delim delim && delim.is('.')
                && position + 1 < tokens.size() && tokens.get(position + 1) instanceof CssToken.Ident ident) {
                parts.add(new Selector.Class(ident.name()));
                position += 2;
            } else if (token instanceof CssToken.Whitespace || isCombinator(token)) {
                break;
            } else {
                return null;
            }
        }
        if (parts.isEmpty()) {
            return null;
        }
        return (parts.size() == 1) ? parts.get(0) : new Selector.Compound(parts);
    }

    private boolean skipWhitespace() {
        final var start = position;
        while (position < tokens.size() && tokens.get(position) instanceof CssToken.Whitespace) {
            position += 1;
        }
        return position > start;
    }

    private static boolean isCombinator(final CssToken token) {
        return token instanceof CssToken.Delim delim && (delim.is('>') || delim.is('+') || delim.is('~'));
    }

    private static String render(final List<CssToken> tokens) {
        return new Declaration("", tokens, false).valueText();
    }

    private final List<CssToken> tokens;
    private int position = 0;
}
