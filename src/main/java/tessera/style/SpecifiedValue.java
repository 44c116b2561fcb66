// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.style;

/**
 * The syntactic shape of a single-component property value, before it's computed for a particular property.
 */
sealed interface SpecifiedValue {
    record Inherit() implements SpecifiedValue {
    }

    record Initial() implements SpecifiedValue {
    }

    record CurrentColor() implements SpecifiedValue {
    }

    /**
     * A keyword other than the CSS-wide ones, ASCII-lowercase.
     */
    record Keyword(String name) implements SpecifiedValue {
    }

    record LengthValue(Length length) implements SpecifiedValue {
    }

    record NumberValue(double value) implements SpecifiedValue {
    }

    record ColorValue(Color color) implements SpecifiedValue {
    }
}
