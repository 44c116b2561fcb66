// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The condition being signaled, together with whether it was signaled as an error.
 *
 * @param condition The condition being signaled.
 * @param isFatal   {@code true} iff the condition was signaled with {@link ConditionContext#error(Condition)}.
 */
public record SignaledCondition(@NotNull Condition condition, boolean isFatal) {
}
