// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

import tessera.style.Color;

/**
 * A positioned piece of text in a single font, taken from a single text node.
 *
 * @param text     The text, with whitespace collapsed.
 * @param geometry The box the text occupies, from its ascent to its descent.
 * @param baseline The absolute y coordinate of the baseline.
 * @param font     The font to draw the text with.
 * @param color    The colour to draw the text with.
 * @param nodeId   The id of the text node the text comes from.
 */
public record TextRun(String text, Geometry geometry, double baseline, FontSpec font, Color color, int nodeId) {
}
