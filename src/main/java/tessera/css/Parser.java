// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.css;

import java.util.ArrayList;
import java.util.List;
import tessera.util.annotation.Nullable;
import tessera.util.condition.ConditionContext;

/**
 * The CSS parser.
 * <p>
 * Parsing never fails as a whole. Each problem is recovered from at the smallest possible scope, signaling a
 * {@link CssParseErrorCondition}: a malformed declaration is skipped alone, a rule with a malformed selector is
 * dropped, and at-rules are skipped entirely, including their block.
 */
public final class Parser {
    private Parser(final List<CssToken> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a stylesheet of the given origin.
     */
    public static Stylesheet parseStylesheet(final String text, final Origin origin) {
        final var parser = new Parser(Tokenizer.tokenize(text));
        return new Stylesheet(origin, parser.parseRules());
    }

    /**
     * Parses the contents of a {@code style} attribute, which is a bare declaration list.
     */
    public static List<Declaration> parseDeclarations(final String text) {
        return parseDeclarationList(Tokenizer.tokenize(text));
    }

    /**
     * Parses a single selector, or returns {@code null} after signaling a condition if it's malformed.
     */
    public static @Nullable Selector parseSelector(final String text) {
        return SelectorParser.parse(Tokenizer.tokenize(text));
    }

    private List<Rule> parseRules() {
        final var rules = new ArrayList<Rule>();
        while (true) {
            skipWhitespace();
            if (atEnd()) {
                return rules;
            }
            if (tokens.get(position) instanceof CssToken.AtKeyword atKeyword) {
                error("Unsupported at-rule '@" + atKeyword.name() + "' skipped");
                skipAtRule();
                continue;
            }
            final var preludeStart = position;
            while (!atEnd() && !(tokens.get(position) instanceof CssToken.OpenBrace)) {
                position += 1;
            }
            if (atEnd()) {
                error("Rule without a declaration block at end of input dropped");
                return rules;
            }
            final var prelude = tokens.subList(preludeStart, position);
            position += 1;
            final var block = consumeBlockContents();
            final var declarations = parseDeclarationList(block);
            final var selectors = parseSelectorList(prelude);
            if (selectors != null) {
                for (final var selector : selectors) {
                    rules.add(new Rule(selector, declarations));
                }
            }
        }
    }

    private static @Nullable List<Selector> parseSelectorList(final List<CssToken> prelude) {
        final var result = new ArrayList<Selector>();
        for (final var part : splitTopLevel(prelude, CssToken.Comma.class)) {
            final var selector = SelectorParser.parse(part);
            if (selector == null) {
                return null;
            }
            result.add(selector);
        }
        return result;
    }

    private static List<Declaration> parseDeclarationList(final List<CssToken> tokens) {
        final var result = new ArrayList<Declaration>();
        for (final var part : splitTopLevel(tokens, CssToken.Semicolon.class)) {
            final var declaration = parseDeclaration(trim(part));
            if (declaration != null) {
                result.add(declaration);
            }
        }
        return result;
    }

    private static @Nullable Declaration parseDeclaration(final List<CssToken> tokens) {
        if (tokens.isEmpty()) {
            return null;
        }
        if (!(tokens.get(0) instanceof CssToken.Ident name)) {
            error("Declaration not starting with a property name skipped");
            return null;
        }
        var index = 1;
        while (index < tokens.size() && tokens.get(index) instanceof CssToken.Whitespace) {
            index += 1;
        }
        if (index >= tokens.size() || !(tokens.get(index) instanceof CssToken.Colon)) {
            error("Declaration of '" + name.name() + "' without a colon skipped");
            return null;
        }
        var value = trim(tokens.subList(index + 1, tokens.size()));
        var important = false;
        final var size = value.size();
        if (size >= 2
            && value.get(size - 1) instanceof CssToken.Ident last && last.is("important")
            && value.get(size - 2) instanceof CssToken.Delim bang && bang.is('!')) {
            important = true;
            value = trim(value.subList(0, size - 2));
        }
        if (value.isEmpty()) {
            error("Declaration of '" + name.name() + "' without a value skipped");
            return null;
        }
        return new Declaration(Tokenizer.asciiLowercase(name.name()), value, important);
    }

    // Called just past an opening brace; returns the tokens up to the matching closing brace and moves past it.
    private List<CssToken> consumeBlockContents() {
        final var start = position;
        var depth = 1;
        while (!atEnd()) {
            final var token = tokens.get(position);
            position += 1;
            if (token instanceof CssToken.OpenBrace) {
                depth += 1;
            } else if (token instanceof CssToken.CloseBrace) {
                depth -= 1;
                if (depth == 0) {
                    return tokens.subList(start, position - 1);
                }
            }
        }
        error("Unterminated block at end of input");
        return tokens.subList(start, position);
    }

    private void skipAtRule() {
        position += 1;
        while (!atEnd()) {
            final var token = tokens.get(position);
            position += 1;
            if (token instanceof CssToken.Semicolon) {
                return;
            }
            if (token instanceof CssToken.OpenBrace) {
                consumeBlockContents();
                return;
            }
        }
    }

    private void skipWhitespace() {
        while (!atEnd() && tokens.get(position) instanceof CssToken.Whitespace) {
            position += 1;
        }
    }

    private boolean atEnd() {
        return position >= tokens.size();
    }

    // Splits on the given separator outside of parentheses and blocks.
    private static List<List<CssToken>> splitTopLevel(
        final List<CssToken> tokens,
        final Class<? extends CssToken> separator
    ) {
        final var result = new ArrayList<List<CssToken>>();
        var depth = 0;
        var start = 0;
        for (int i = 0; i < tokens.size(); i += 1) {
            final var token = tokens.get(i);
            if (token instanceof CssToken.OpenParen || token instanceof CssToken.Function
                || token instanceof CssToken.OpenBrace) {
                depth += 1;
            } else if ((token instanceof CssToken.CloseParen || token instanceof CssToken.CloseBrace) && depth > 0) {
                depth -= 1;
            } else if (depth == 0 && separator.isInstance(token)) {
                result.add(tokens.subList(start, i));
                start = i + 1;
            }
        }
        result.add(tokens.subList(start, tokens.size()));
        return result;
    }

    static List<CssToken> trim(final List<CssToken> tokens) {
        var start = 0;
        var end = tokens.size();
        while (start < end && tokens.get(start) instanceof CssToken.Whitespace) {
            start += 1;
        }
        while (end > start && tokens.get(end - 1) instanceof CssToken.Whitespace) {
            end -= 1;
        }
        return tokens.subList(start, end);
    }

    static void error(final String message) {
        ConditionContext.signal(new CssParseErrorCondition(message));
    }

    private final List<CssToken> tokens;
    private int position = 0;
}
