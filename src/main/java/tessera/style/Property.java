// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.style;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import tessera.util.annotation.Nullable;

/**
 * The supported longhand properties.
 * <p>
 * Constants are declared in computation order: {@code font-size} comes first because {@code em} lengths of every
 * other property resolve against it, and {@code color} second because {@code currentcolor} resolves against it.
 */
public enum Property {
    FONT_SIZE("font-size", true, 16.0, Property::computeFontSize),
    COLOR("color", true, Color.black, Property::computeColor),
    DISPLAY("display", false, Display.INLINE, Property::computeDisplay),
    BACKGROUND_COLOR("background-color", false, Color.transparent, Property::computeColor),
    FONT_WEIGHT("font-weight", true, 400, Property::computeFontWeight),
    FONT_STYLE("font-style", true, FontStyle.NORMAL, Property::computeFontStyle),
    TEXT_ALIGN("text-align", true, TextAlign.LEFT, Property::computeTextAlign),
    WIDTH("width", false, Dimension.auto(), Property::computeSize),
    HEIGHT("height", false, Dimension.auto(), Property::computeSize),
    MARGIN_TOP("margin-top", false, Dimension.zero, Property::computeMargin),
    MARGIN_RIGHT("margin-right", false, Dimension.zero, Property::computeMargin),
    MARGIN_BOTTOM("margin-bottom", false, Dimension.zero, Property::computeMargin),
    MARGIN_LEFT("margin-left", false, Dimension.zero, Property::computeMargin),
    PADDING_TOP("padding-top", false, Dimension.zero, Property::computePadding),
    PADDING_RIGHT("padding-right", false, Dimension.zero, Property::computePadding),
    PADDING_BOTTOM("padding-bottom", false, Dimension.zero, Property::computePadding),
    PADDING_LEFT("padding-left", false, Dimension.zero, Property::computePadding),
    BORDER_TOP_WIDTH("border-top-width", false, 0.0, Property::computeBorderWidth),
    BORDER_RIGHT_WIDTH("border-right-width", false, 0.0, Property::computeBorderWidth),
    BORDER_BOTTOM_WIDTH("border-bottom-width", false, 0.0, Property::computeBorderWidth),
    BORDER_LEFT_WIDTH("border-left-width", false, 0.0, Property::computeBorderWidth),
    BORDER_COLOR("border-color", false, Color.black, Property::computeColor);

    Property(final String cssName, final boolean inherited, final Object initialValue, final Computer computer) {
        this.cssName = cssName;
        this.inherited = inherited;
        this.initialValue = initialValue;
        this.computer = computer;
    }

    /**
     * Looks up a longhand property by its CSS name.
     */
    public static Optional<Property> byName(final String cssName) {
        return Optional.ofNullable(Holder.byName.get(cssName));
    }

    public String cssName() {
        return cssName;
    }

    public boolean isInherited() {
        return inherited;
    }

    public Object initialValue() {
        return initialValue;
    }

    /**
     * Computes the given specified value, or returns {@code null} if it can't be used for this property.
     * The CSS-wide keywords are handled by the caller.
     */
    @Nullable Object compute(final SpecifiedValue value, final Context context) {
        return computer.compute(value, context);
    }

    private static @Nullable Object computeFontSize(final SpecifiedValue value, final Context context) {
        final var parentSize = context.parent().fontSize();
        if (value instanceof SpecifiedValue.Keyword keyword) {
            return switch (keyword.name()) {
                case "xx-small" -> 9.0;
                case "x-small" -> 10.0;
                case "small" -> 13.0;
                case "medium" -> 16.0;
                case "large" -> 18.0;
                case "x-large" -> 24.0;
                case "xx-large" -> 32.0;
                case "smaller" -> parentSize / 1.2;
                case "larger" -> parentSize * 1.2;
                default -> null;
            };
        }
        if (value instanceof SpecifiedValue.LengthValue lengthValue
            && lengthValue.length().unit() == Length.Unit.PERCENT) {
            return nonNegative(parentSize * lengthValue.length().value() / 100.0);
        }
        final var length = absoluteLength(value, parentSize);
        return (length == null) ? null : nonNegative(length);
    }

    private static @Nullable Object computeColor(final SpecifiedValue value, final Context context) {
        if (value instanceof SpecifiedValue.ColorValue colorValue) {
            return colorValue.color();
        } else if (value instanceof SpecifiedValue.Keyword keyword) {
            return Color.named(keyword.name()).orElse(null);
        } else if (value instanceof SpecifiedValue.CurrentColor) {
            // For 'color' itself, the context colour is still the parent's.
            return context.color();
        }
        return null;
    }

    private static @Nullable Object computeDisplay(final SpecifiedValue value, final Context context) {
        if (!(value instanceof SpecifiedValue.Keyword keyword)) {
            return null;
        }
        return switch (keyword.name()) {
            case "block", "list-item" -> Display.BLOCK;
            case "inline", "inline-block" -> Display.INLINE;
            case "none" -> Display.NONE;
            default -> null;
        };
    }

    private static @Nullable Object computeFontWeight(final SpecifiedValue value, final Context context) {
        final int parentWeight = context.parent().fontWeight();
        if (value instanceof SpecifiedValue.Keyword keyword) {
            return switch (keyword.name()) {
                case "normal" -> 400;
                case "bold" -> 700;
                case "bolder" -> (parentWeight < 600) ? 700 : 900;
                case "lighter" -> (parentWeight < 600) ? 100 : 400;
                default -> null;
            };
        }
        if (value instanceof SpecifiedValue.NumberValue number) {
            final var weight = number.value();
            if (weight >= 100 && weight <= 900 && weight % 100 == 0) {
                return (int) weight;
            }
        }
        return null;
    }

    private static @Nullable Object computeFontStyle(final SpecifiedValue value, final Context context) {
        if (!(value instanceof SpecifiedValue.Keyword keyword)) {
            return null;
        }
        return switch (keyword.name()) {
            case "normal" -> FontStyle.NORMAL;
            case "italic" -> FontStyle.ITALIC;
            case "oblique" -> FontStyle.OBLIQUE;
            default -> null;
        };
    }

    private static @Nullable Object computeTextAlign(final SpecifiedValue value, final Context context) {
        if (!(value instanceof SpecifiedValue.Keyword keyword)) {
            return null;
        }
        return switch (keyword.name()) {
            case "left", "start" -> TextAlign.LEFT;
            case "right", "end" -> TextAlign.RIGHT;
            case "center" -> TextAlign.CENTER;
            default -> null;
        };
    }

    private static @Nullable Object computeSize(final SpecifiedValue value, final Context context) {
        final var dimension = dimension(value, context, true);
        return (dimension == null || dimension.value() < 0) ? null : dimension;
    }

    private static @Nullable Object computeMargin(final SpecifiedValue value, final Context context) {
        return dimension(value, context, true);
    }

    private static @Nullable Object computePadding(final SpecifiedValue value, final Context context) {
        final var dimension = dimension(value, context, false);
        return (dimension == null || dimension.value() < 0) ? null : dimension;
    }

    private static @Nullable Object computeBorderWidth(final SpecifiedValue value, final Context context) {
        if (value instanceof SpecifiedValue.Keyword keyword) {
            return switch (keyword.name()) {
                case "thin" -> 1.0;
                case "medium" -> 3.0;
                case "thick" -> 5.0;
                default -> null;
            };
        }
        final var length = absoluteLength(value, context.fontSize());
        return (length == null) ? null : nonNegative(length);
    }

    private static @Nullable Dimension dimension(
        final SpecifiedValue value,
        final Context context,
        final boolean allowAuto
    ) {
        if (value instanceof SpecifiedValue.Keyword keyword) {
            return (allowAuto && keyword.name().equals("auto")) ? Dimension.auto() : null;
        }
        if (value instanceof SpecifiedValue.LengthValue lengthValue
            && lengthValue.length().unit() == Length.Unit.PERCENT) {
            final var percentage = lengthValue.length().value();
            return Dimension.isUsable(percentage) ? Dimension.percent(percentage) : null;
        }
        final var length = absoluteLength(value, context.fontSize());
        return (length == null) ? null : Dimension.px(length);
    }

    // Resolves px, em and unitless zero to pixels. Lengths too large to lay out are unusable.
    private static @Nullable Double absoluteLength(final SpecifiedValue value, final double emBase) {
        if (value instanceof SpecifiedValue.LengthValue lengthValue) {
            final var length = lengthValue.length();
            final var pixels = switch (length.unit()) {
                case PX -> length.value();
                case EM -> length.value() * emBase;
                case PERCENT -> Double.NaN;
            };
            return Dimension.isUsable(pixels) ? pixels : null;
        }
        if (value instanceof SpecifiedValue.NumberValue number && number.value() == 0) {
            return 0.0;
        }
        return null;
    }

    private static @Nullable Double nonNegative(final double value) {
        return (value >= 0 && Dimension.isUsable(value)) ? value : null;
    }

    private final String cssName;
    private final boolean inherited;
    private final Object initialValue;
    private final Computer computer;

    /**
     * What a value is computed against: the parent's computed style, and this element's own font size and colour once
     * they are known.
     */
    record Context(ComputedStyle parent, double fontSize, Color color) {
    }

    @FunctionalInterface
    private interface Computer {
        @Nullable Object compute(SpecifiedValue value, Context context);
    }

    private static final class Holder {
        private static final Map<String, Property> byName = new HashMap<>();

        static {
            for (final var property : values()) {
                byName.put(property.cssName, property);
            }
        }
    }
}
