// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.style;

import java.util.Arrays;
import tessera.util.annotation.Nullable;

/**
 * The computed value of every supported property of one element. Immutable.
 */
public final class ComputedStyle {
    private ComputedStyle(final Object[] values) {
        this.values = values;
    }

    /**
     * Returns the style in which every property has its initial value.
     */
    public static ComputedStyle initial() {
        return initial;
    }

    /**
     * Returns the computed value of the given property.
     */
    public Object get(final Property property) {
        return values[property.ordinal()];
    }

    public Display display() {
        return (Display) get(Property.DISPLAY);
    }

    public Color color() {
        return (Color) get(Property.COLOR);
    }

    public Color backgroundColor() {
        return (Color) get(Property.BACKGROUND_COLOR);
    }

    /**
     * Returns the font size in pixels.
     */
    public double fontSize() {
        return (Double) get(Property.FONT_SIZE);
    }

    public int fontWeight() {
        return (Integer) get(Property.FONT_WEIGHT);
    }

    public FontStyle fontStyle() {
        return (FontStyle) get(Property.FONT_STYLE);
    }

    public TextAlign textAlign() {
        return (TextAlign) get(Property.TEXT_ALIGN);
    }

    public Dimension width() {
        return (Dimension) get(Property.WIDTH);
    }

    public Dimension height() {
        return (Dimension) get(Property.HEIGHT);
    }

    public Dimension marginTop() {
        return (Dimension) get(Property.MARGIN_TOP);
    }

    public Dimension marginRight() {
        return (Dimension) get(Property.MARGIN_RIGHT);
    }

    public Dimension marginBottom() {
        return (Dimension) get(Property.MARGIN_BOTTOM);
    }

    public Dimension marginLeft() {
        return (Dimension) get(Property.MARGIN_LEFT);
    }

    public Dimension paddingTop() {
        return (Dimension) get(Property.PADDING_TOP);
    }

    public Dimension paddingRight() {
        return (Dimension) get(Property.PADDING_RIGHT);
    }

    public Dimension paddingBottom() {
        return (Dimension) get(Property.PADDING_BOTTOM);
    }

    public Dimension paddingLeft() {
        return (Dimension) get(Property.PADDING_LEFT);
    }

    public double borderTopWidth() {
        return (Double) get(Property.BORDER_TOP_WIDTH);
    }

    public double borderRightWidth() {
        return (Double) get(Property.BORDER_RIGHT_WIDTH);
    }

    public double borderBottomWidth() {
        return (Double) get(Property.BORDER_BOTTOM_WIDTH);
    }

    public double borderLeftWidth() {
        return (Double) get(Property.BORDER_LEFT_WIDTH);
    }

    public Color borderColor() {
        return (Color) get(Property.BORDER_COLOR);
    }

    @Override
    public boolean equals(final @Nullable Object other) {
        return other instanceof ComputedStyle that && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        final var builder = new StringBuilder("{");
        for (final var property : Property.values()) {
            if (builder.length() > 1) {
                builder.append("; ");
            }
            builder.append(property.cssName()).append(": ").append(values[property.ordinal()]);
        }
        return builder.append('}').toString();
    }

    private final Object[] values;

    private static final ComputedStyle initial = builder().build();

    static Builder builder() {
        return new Builder();
    }

    /**
     * Collects computed values property by property; properties never set keep their initial value.
     */
    static final class Builder {
        private Builder() {
            for (final var property : Property.values()) {
                values[property.ordinal()] = property.initialValue();
            }
        }

        Builder set(final Property property, final Object value) {
            values[property.ordinal()] = value;
            return this;
        }

        ComputedStyle build() {
            return new ComputedStyle(values.clone());
        }

        private final Object[] values = new Object[Property.values().length];
    }
}
