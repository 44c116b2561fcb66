// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.css;

import java.util.List;

/**
 * A single {@code property: value} declaration.
 *
 * @param property  The ASCII-lowercase property name.
 * @param value     The value tokens, with leading and trailing whitespace and the {@code !important} marker removed.
 * @param important Whether the declaration was marked {@code !important}.
 */
public record Declaration(String property, List<CssToken> value, boolean important) {
    public Declaration {
        value = List.copyOf(value);
    }

    /**
     * Returns the value rendered back into CSS text, for diagnostics.
     */
    public String valueText() {
        final var builder = new StringBuilder();
        for (final var token : value) {
            appendToken(builder, token);
        }
        return builder.toString();
    }

    private static void appendToken(final StringBuilder builder, final CssToken token) {
        if (token instanceof CssToken.Ident ident) {
            builder.append(ident.name());
        } else if (token instanceof CssToken.Function function) {
            builder.append(function.name()).append('(');
        } else if (token instanceof CssToken.AtKeyword atKeyword) {
            builder.append('@').append(atKeyword.name());
        } else if (token instanceof CssToken.Hash hash) {
            builder.append('#').append(hash.name());
        } else if (token instanceof CssToken.StringToken string) {
            builder.append('"').append(string.value()).append('"');
        } else if (token instanceof CssToken.Number number) {
            builder.append(formatNumber(number.value()));
        } else if (token instanceof CssToken.Percentage percentage) {
            builder.append(formatNumber(percentage.value())).append('%');
        } else if (token instanceof CssToken.Dimension dimension) {
            builder.append(formatNumber(dimension.value())).append(dimension.unit());
        } else if (token instanceof CssToken.Whitespace) {
            builder.append(' ');
        } else if (token instanceof CssToken.Colon) {
            builder.append(':');
        } else if (token instanceof CssToken.Semicolon) {
            builder.append(';');
        } else if (token instanceof CssToken.Comma) {
            builder.append(',');
        } else if (token instanceof CssToken.OpenBrace) {
            builder.append('{');
        } else if (token instanceof CssToken.CloseBrace) {
            builder.append('}');
        } else if (token instanceof CssToken.OpenParen) {
            builder.append('(');
        } else if (token instanceof CssToken.CloseParen) {
            builder.append(')');
        } else if (token instanceof CssToken.Delim delim) {
            builder.append(delim.value());
        }
    }

    private static String formatNumber(final double value) {
        return (value == Math.rint(value) && !Double.isInfinite(value))
            ? Long.toString((long) value)
            : Double.toString(value);
    }
}
