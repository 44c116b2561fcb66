// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.style;

/**
 * A declaration of a single longhand property, after shorthand expansion and value parsing.
 */
record Longhand(Property property, SpecifiedValue value, String valueText, boolean important) {
}
