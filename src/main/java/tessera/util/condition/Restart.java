// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.util.condition;

import tessera.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A named point control can be transferred to, established by
 * {@link ConditionContext#withRestart(String, RestartCallback)}.
 */
public final class Restart {
    Restart(final @NotNull String name) {
        final var context = ConditionContext.localContext();
        next = context.firstRestart;
        this.name = name;
        ownerContext = context;
        context.firstRestart = this;
    }

    public @NotNull String name() {
        return name;
    }

    /**
     * Transfers control to this restart point by throwing {@link Unwind}. Never returns.
     */
    public void unwindTo() {
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    void unlink() {
        assert ownerContext == ConditionContext.localContext() : "Restart unlinked by a different thread";
        assert ownerContext.firstRestart == this : "Restart chain corrupt";
        ownerContext.firstRestart = next;
    }

    @Override
    public @NotNull String toString() {
        return "Restart[" + name + "]";
    }

    final @Nullable Restart next;
    private final @NotNull String name;
    private final @NotNull ConditionContext ownerContext;
}
