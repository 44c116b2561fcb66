// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The base type for all conditions.
 * <p>
 * Unlike exceptions, condition handlers execute <em>before</em> the stack is unwound. A handler can therefore simply
 * observe a condition, such as a CSS declaration that was skipped, and let the signaling code carry on, or transfer
 * control to a restart established further up, such as the navigator's "abandon-navigation" restart.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Retrieves the user-readable message representing this condition.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Retrieves the full, detailed, user-readable message representing this condition.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getName() + ": " + message;
    }

    private final @NotNull String message;
}
