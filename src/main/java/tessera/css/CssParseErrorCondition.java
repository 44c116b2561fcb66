// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.css;

import tessera.util.condition.Condition;

/**
 * A non-fatal condition signaled when a malformed or unsupported piece of CSS is skipped.
 */
public final class CssParseErrorCondition extends Condition {
    public CssParseErrorCondition(final String message) {
        super(message);
    }
}
