// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.style;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import tessera.css.CssParseErrorCondition;
import tessera.css.CssToken;
import tessera.css.Declaration;
import tessera.util.annotation.Nullable;
import tessera.util.condition.ConditionContext;

/**
 * Turns parsed declarations into longhand declarations with parsed values.
 * <p>
 * Declarations of unknown properties, and declarations whose value doesn't have a valid shape, are dropped
 * individually with a {@link CssParseErrorCondition}. Whether a well-formed value is actually usable is only decided
 * when it's computed.
 * <p>
 * Supported shorthands: {@code margin}, {@code padding} and {@code border-width} with one to four sides,
 * {@code background} with a bare colour, and {@code border} with any of a width, a style and a colour.
 */
final class DeclarationExpander {
    private DeclarationExpander() {
    }

    static List<Longhand> expand(final Declaration declaration) {
        final var result = expandImpl(declaration);
        if (result == null) {
            ConditionContext.signal(new CssParseErrorCondition(
                "Invalid value '" + declaration.valueText() + "' for '" + declaration.property() + "' skipped"
            ));
            return List.of();
        }
        return result;
    }

    private static @Nullable List<Longhand> expandImpl(final Declaration declaration) {
        final var name = declaration.property();
        final var longhand = Property.byName(name);
        if (longhand.isPresent()) {
            final var value = parseSingle(declaration.value());
            return (value == null) ? null : List.of(longhand(declaration, longhand.get(), value));
        }
        return switch (name) {
            case "margin" -> expandSides(declaration, marginSides);
            case "padding" -> expandSides(declaration, paddingSides);
            case "border-width" -> expandSides(declaration, borderWidthSides);
            case "background" -> expandBackground(declaration);
            case "border" -> expandBorder(declaration);
            default -> {
                ConditionContext.signal(new CssParseErrorCondition("Unknown property '" + name + "' skipped"));
                yield List.of();
            }
        };
    }

    private static @Nullable List<Longhand> expandSides(final Declaration declaration, final List<Property> sides) {
        final var components = components(declaration.value());
        if (components == null || components.isEmpty() || components.size() > 4) {
            return null;
        }
        if (components.size() > 1 && containsCssWideKeyword(components)) {
            return null;
        }
        final var top = components.get(0);
        final var right = (components.size() > 1) ? components.get(1) : top;
        final var bottom = (components.size() > 2) ? components.get(2) : top;
        final var left = (components.size() > 3) ? components.get(3) : right;
        return List.of(
            longhand(declaration, sides.get(0), top),
            longhand(declaration, sides.get(1), right),
            longhand(declaration, sides.get(2), bottom),
            longhand(declaration, sides.get(3), left)
        );
    }

    private static @Nullable List<Longhand> expandBackground(final Declaration declaration) {
        final var value = parseSingle(declaration.value());
        if (value == null) {
            return null;
        }
        if (value instanceof SpecifiedValue.Keyword keyword && keyword.name().equals("none")) {
            return List.of(longhand(declaration, Property.BACKGROUND_COLOR, new SpecifiedValue.Initial()));
        }
        return List.of(longhand(declaration, Property.BACKGROUND_COLOR, value));
    }

    private static @Nullable List<Longhand> expandBorder(final Declaration declaration) {
        final var components = components(declaration.value());
        if (components == null || components.isEmpty() || components.size() > 3) {
            return null;
        }
        if (components.size() == 1 && isCssWideKeyword(components.get(0))) {
            final var result = new ArrayList<Longhand>();
            for (final var side : borderWidthSides) {
                result.add(longhand(declaration, side, components.get(0)));
            }
            result.add(longhand(declaration, Property.BORDER_COLOR, components.get(0)));
            return result;
        }
        @Nullable SpecifiedValue width = null;
        @Nullable SpecifiedValue color = null;
        var hidden = false;
        for (final var component : components) {
            if (component instanceof SpecifiedValue.Keyword keyword && borderStyles.contains(keyword.name())) {
                hidden = keyword.name().equals("none") || keyword.name().equals("hidden");
            } else if (isBorderWidth(component) && width == null) {
                width = component;
            } else if (color == null && !isCssWideKeyword(component)) {
                color = component;
            } else {
                return null;
            }
        }
        final var result = new ArrayList<Longhand>();
        final SpecifiedValue effectiveWidth = hidden
            ? new SpecifiedValue.NumberValue(0)
            : (width != null) ? width : new SpecifiedValue.Keyword("medium");
        for (final var side : borderWidthSides) {
            result.add(longhand(declaration, side, effectiveWidth));
        }
        result.add(longhand(
            declaration,
            Property.BORDER_COLOR,
            (color != null) ? color : new SpecifiedValue.CurrentColor()
        ));
        return result;
    }

    private static boolean isBorderWidth(final SpecifiedValue value) {
        if (value instanceof SpecifiedValue.Keyword keyword) {
            return keyword.name().equals("thin") || keyword.name().equals("medium") || keyword.name().equals("thick");
        }
        return value instanceof SpecifiedValue.LengthValue || value instanceof SpecifiedValue.NumberValue;
    }

    private static Longhand longhand(
        final Declaration declaration,
        final Property property,
        final SpecifiedValue value
    ) {
        return new Longhand(property, value, declaration.valueText(), declaration.important());
    }

    private static boolean containsCssWideKeyword(final List<SpecifiedValue> values) {
        for (final var value : values) {
            if (isCssWideKeyword(value)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isCssWideKeyword(final SpecifiedValue value) {
        return value instanceof SpecifiedValue.Inherit || value instanceof SpecifiedValue.Initial;
    }

    // Splits a value on whitespace, parsing each component.
    private static @Nullable List<SpecifiedValue> components(final List<CssToken> tokens) {
        final var result = new ArrayList<SpecifiedValue>();
        var start = 0;
        var depth = 0;
        for (int i = 0; i <= tokens.size(); i += 1) {
            final var token = (i < tokens.size()) ? tokens.get(i) : null;
            if (token instanceof CssToken.Function) {
                depth += 1;
            } else if (token instanceof CssToken.CloseParen && depth > 0) {
                depth -= 1;
            }
            if (token == null || (depth == 0 && token instanceof CssToken.Whitespace)) {
                if (i > start) {
                    final var value = parseSingle(tokens.subList(start, i));
                    if (value == null) {
                        return null;
                    }
                    result.add(value);
                }
                start = i + 1;
            }
        }
        return result;
    }

    /**
     * Parses a value made of exactly one component.
     */
    static @Nullable SpecifiedValue parseSingle(final List<CssToken> tokens) {
        if (tokens.isEmpty()) {
            return null;
        }
        final var first = tokens.get(0);
        if (first instanceof CssToken.Function function) {
            return parseColorFunction(function.name(), tokens.subList(1, tokens.size()));
        }
        if (tokens.size() != 1) {
            return null;
        }
        if (first instanceof CssToken.Ident ident) {
            final var name = ident.name().toLowerCase(Locale.ROOT);
            return switch (name) {
                case "inherit" -> new SpecifiedValue.Inherit();
                case "initial" -> new SpecifiedValue.Initial();
                case "currentcolor" -> new SpecifiedValue.CurrentColor();
                default -> new SpecifiedValue.Keyword(name);
            };
        } else if (first instanceof CssToken.Number number) {
            return new SpecifiedValue.NumberValue(number.value());
        } else if (first instanceof CssToken.Percentage percentage) {
            return new SpecifiedValue.LengthValue(new Length(percentage.value(), Length.Unit.PERCENT));
        } else if (first instanceof CssToken.Dimension dimension) {
            return switch (dimension.unit()) {
                case "px" -> new SpecifiedValue.LengthValue(new Length(dimension.value(), Length.Unit.PX));
                case "em" -> new SpecifiedValue.LengthValue(new Length(dimension.value(), Length.Unit.EM));
                default -> null;
            };
        } else if (first instanceof CssToken.Hash hash) {
            return Color.fromHex(hash.name()).<SpecifiedValue>map(SpecifiedValue.ColorValue::new).orElse(null);
        }
        return null;
    }

    // Parses rgb() and rgba(); `arguments` are the tokens after the function token, including the closing paren.
    private static @Nullable SpecifiedValue parseColorFunction(final String name, final List<CssToken> arguments) {
        final var lowercaseName = name.toLowerCase(Locale.ROOT);
        if (!lowercaseName.equals("rgb") && !lowercaseName.equals("rgba")) {
            return null;
        }
        if (arguments.isEmpty() || !(arguments.get(arguments.size() - 1) instanceof CssToken.CloseParen)) {
            return null;
        }
        final var channels = new ArrayList<CssToken>();
        var expectValue = true;
        for (final var token : arguments.subList(0, arguments.size() - 1)) {
            if (token instanceof CssToken.Whitespace) {
                continue;
            }
            if (expectValue) {
                if (!(token instanceof CssToken.Number || token instanceof CssToken.Percentage)) {
                    return null;
                }
                channels.add(token);
            } else if (!(token instanceof CssToken.Comma)) {
                return null;
            }
            expectValue = !expectValue;
        }
        if (expectValue || (channels.size() != 3 && channels.size() != 4)) {
            return null;
        }
        final var alpha = (channels.size() == 4) ? alphaChannel(channels.get(3)) : 255;
        return new SpecifiedValue.ColorValue(new Color(
            colorChannel(channels.get(0)),
            colorChannel(channels.get(1)),
            colorChannel(channels.get(2)),
            alpha
        ));
    }

    private static int colorChannel(final CssToken token) {
        final var value = (token instanceof CssToken.Percentage percentage)
            ? percentage.value() * 255.0 / 100.0
            : ((CssToken.Number) token).value();
        return clampChannel(value);
    }

    private static int alphaChannel(final CssToken token) {
        final var value = (token instanceof CssToken.Percentage percentage)
            ? percentage.value() / 100.0
            : ((CssToken.Number) token).value();
        return clampChannel(value * 255.0);
    }

    private static int clampChannel(final double value) {
        return (int) Math.round(Math.max(0.0, Math.min(255.0, value)));
    }

    private static final List<Property> marginSides =
        List.of(Property.MARGIN_TOP, Property.MARGIN_RIGHT, Property.MARGIN_BOTTOM, Property.MARGIN_LEFT);
    private static final List<Property> paddingSides =
        List.of(Property.PADDING_TOP, Property.PADDING_RIGHT, Property.PADDING_BOTTOM, Property.PADDING_LEFT);
    private static final List<Property> borderWidthSides = List.of(
        Property.BORDER_TOP_WIDTH,
        Property.BORDER_RIGHT_WIDTH,
        Property.BORDER_BOTTOM_WIDTH,
        Property.BORDER_LEFT_WIDTH
    );
    private static final List<String> borderStyles =
        List.of("none", "hidden", "solid", "dashed", "dotted", "double", "groove", "ridge", "inset", "outset");
}
