// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.style;

import tessera.util.condition.Condition;

/**
 * A non-fatal condition signaled when a declared value can't be used for its property, so the initial value is used
 * instead.
 */
public final class StyleFallbackCondition extends Condition {
    public StyleFallbackCondition(final Property property, final String value, final String element) {
        super("Unusable value '" + value + "' for '" + property.cssName() + "' on " + element + ", using initial value");
        this.property = property;
    }

    public Property property() {
        return property;
    }

    private final Property property;
}
