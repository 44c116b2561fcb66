// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Throwable used by the restart mechanism to transfer control to a restart point.
 * <p>
 * Exposed so that methods can declare it. Catching or throwing it manually is discouraged except to carry a restart
 * across a thread boundary.
 * <p>
 * It represents neither an exceptional situation nor a serious error, so it extends {@link Throwable} directly.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    // Unwinds are never serialized.
    private final transient @NotNull Restart target;
}
