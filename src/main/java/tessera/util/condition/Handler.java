// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.util.condition;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import tessera.util.SneakyThrow;

/**
 * A condition handler registered for the lifetime of a try-with-resources block.
 */
public final class Handler implements AutoCloseable {
    /**
     * Registers a handler running the given procedure in the calling thread's condition context.
     */
    public Handler(final @NotNull HandlerProcedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.firstHandler;
        this.procedure = procedure;
        ownerContext = context;
        context.firstHandler = this;
    }

    /**
     * Does nothing; silences warnings about an unreferenced resource.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert ownerContext == ConditionContext.localContext() : "Handler closed by a different thread";
        assert ownerContext.firstHandler == this : "Handler chain corrupt";
        ownerContext.firstHandler = next;
    }

    void handle(final @NotNull SignaledCondition condition) {
        try {
            procedure.handle(condition);
        } catch (final Unwind u) {
            throw SneakyThrow.doThrow(u);
        }
    }

    boolean usableIn(final @NotNull ConditionContext context) {
        return ownerContext == context || procedure instanceof HandlerProcedure.ThreadSafe;
    }

    final @Nullable Handler next;
    private final @NotNull HandlerProcedure procedure;
    private final @NotNull ConditionContext ownerContext;
}
