// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

import java.awt.Font;
import java.awt.font.FontRenderContext;

/**
 * Font metrics backed by {@code java.awt} fonts of the given logical family. Works in headless mode.
 */
public final class AwtFontMetrics implements FontMetrics {
    /**
     * Initializes metrics for the given logical font family, such as {@link Font#SERIF}.
     */
    public AwtFontMetrics(final String family) {
        this.family = family;
    }

    @Override
    public Measurement measure(final FontSpec font, final String text) {
        final var awtFont = new Font(family, awtStyle(font), 1).deriveFont((float) font.size());
        final var advances = new double[text.length()];
        for (int i = 0; i < text.length(); ) {
            final var codePoint = text.codePointAt(i);
            final var count = Character.charCount(codePoint);
            advances[i] = awtFont.getStringBounds(text, i, i + count, renderContext).getWidth();
            i += count;
        }
        final var lineMetrics = awtFont.getLineMetrics(text.isEmpty() ? " " : text, renderContext);
        final double ascent = lineMetrics.getAscent();
        final double descent = lineMetrics.getDescent();
        return new Measurement(advances, ascent, descent, ascent + descent + lineMetrics.getLeading());
    }

    private static int awtStyle(final FontSpec font) {
        return (font.isBold() ? Font.BOLD : Font.PLAIN) | (font.isSlanted() ? Font.ITALIC : Font.PLAIN);
    }

    private final String family;

    private static final FontRenderContext renderContext = new FontRenderContext(null, true, true);
}
