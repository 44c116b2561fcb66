// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The procedure run by a {@link Handler} for each signaled condition.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Processes the given condition.
     * <p>
     * Returning normally declines to handle the condition. Handling it means transferring control elsewhere, usually
     * with {@link Restart#unwindTo()}.
     */
    void handle(@NotNull SignaledCondition condition) throws Unwind;

    /**
     * A handler procedure that may be invoked from any thread.
     * <p>
     * Thread-safe handlers are carried into worker threads by {@link ConditionContext#saveInheritableState()} and
     * {@link ConditionContext#inheritState(ConditionContext.InheritedState)}.
     */
    @FunctionalInterface
    interface ThreadSafe extends HandlerProcedure {
    }
}
