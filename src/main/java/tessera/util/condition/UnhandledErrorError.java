// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a fatal condition was signaled with {@link ConditionContext#error(Condition)} and no handler unwound.
 * <p>
 * Every navigation runs under a handler that unwinds, so reaching this means a stage was invoked outside of one.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final @NotNull Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
    }
}
