// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.util.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import tessera.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Per-thread registry of condition handlers and restart points.
 * <p>
 * Every thread owns one context. It is never handed out; the static methods below always act on the calling thread's
 * context. Worker threads that need their parent's handlers use {@link #saveInheritableState()} and
 * {@link #inheritState(InheritedState)}.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition as non-fatal.
     * <p>
     * Handlers run newest first. When every handler returns normally, so does this method. A handler may unwind to a
     * restart, in which case {@link Unwind} propagates out of this method.
     */
    public static void signal(final @NotNull Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as fatal.
     * <p>
     * Handlers run as with {@link #signal(Condition)}; if they all decline, {@link UnhandledErrorError} is thrown.
     * The return type lets call sites write {@code throw ConditionContext.error(...)}.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Signals the given exception as a {@link SuppressedExceptionCondition}.
     * <p>
     * Handlers must not unwind in response, since this is called from cleanup paths.
     */
    public static void signalSuppressedException(final @NotNull Exception exception) {
        try {
            SneakyThrow.<Unwind>pretendThrows();
            signal(new SuppressedExceptionCondition(exception));
        } catch (final Unwind u) {
            throw new AssertionError("A handler attempted to unwind a suppressed exception condition", u);
        }
    }

    /**
     * Runs the given callback, turning any exception it throws into a suppressed exception condition.
     */
    public static void withSuppressedExceptions(final @NotNull ThrowingCallback callback) {
        try {
            callback.run();
        } catch (final Exception e) {
            signalSuppressedException(e);
        }
    }

    /**
     * Runs the given callback with a restart point named {@code restartName} established around it.
     *
     * @return The callback's result, or {@code null} if control was transferred to the restart.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the active restart points of the calling thread, newest first.
     */
    public static @NotNull List<@NotNull Restart> restarts() {
        final var result = new ArrayList<@NotNull Restart>();
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            result.add(restart);
        }
        return result;
    }

    /**
     * Finds the newest active restart with the given name.
     */
    public static @NotNull Optional<@NotNull Restart> findRestart(final @NotNull String name) {
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            if (restart.name().equals(name)) {
                return Optional.of(restart);
            }
        }
        return Optional.empty();
    }

    /**
     * Captures the restarts and thread-safe handlers of the calling thread so a worker thread can use them.
     */
    public static @NotNull InheritedState saveInheritableState() {
        final var context = localContext();
        // signal() skips handlers that aren't usable in the signaling thread, so the chain can be shared as is.
        return new InheritedState(context.firstHandler, context.firstRestart);
    }

    /**
     * Installs previously captured state into the calling thread, whose context must be empty.
     *
     * @return A token for {@link #restoreState(PreviousState)}.
     */
    public static @NotNull PreviousState inheritState(final @NotNull InheritedState inheritedState) {
        final var context = localContext();
        assert context.firstHandler == null : "Attempted to inherit state into a thread that already has handlers";
        assert context.firstRestart == null : "Attempted to inherit state into a thread that already has restarts";
        context.firstHandler = inheritedState.firstHandler;
        context.firstRestart = inheritedState.firstRestart;
        return PreviousState.instance;
    }

    /**
     * Empties the calling thread's context again after {@link #inheritState(InheritedState)}.
     */
    public static void restoreState(@SuppressWarnings("unused") final @NotNull PreviousState previousState) {
        final var context = localContext();
        context.firstHandler = null;
        context.firstRestart = null;
    }

    static @NotNull ConditionContext localContext() {
        return localContexts.get();
    }

    private void signal(final @NotNull SignaledCondition condition) {
        // While a handler runs, only handlers older than it are considered, so a handler never sees its own signals.
        var handler = (currentHandler == null) ? firstHandler : currentHandler.next;
        for (; handler != null; handler = handler.next) {
            if (!handler.usableIn(this)) {
                continue;
            }
            final var saved = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } finally {
                currentHandler = saved;
            }
        }
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<@NotNull ConditionContext> localContexts =
        ThreadLocal.withInitial(ConditionContext::new);

    /**
     * A callback allowed to throw checked exceptions, for {@link #withSuppressedExceptions(ThrowingCallback)}.
     */
    @FunctionalInterface
    public interface ThrowingCallback {
        void run() throws Exception;
    }

    /**
     * Opaque snapshot of a thread's inheritable handlers and restarts.
     */
    public static final class InheritedState {
        private InheritedState(final @Nullable Handler firstHandler, final @Nullable Restart firstRestart) {
            this.firstHandler = firstHandler;
            this.firstRestart = firstRestart;
        }

        private final @Nullable Handler firstHandler;
        private final @Nullable Restart firstRestart;
    }

    /**
     * Opaque token returned by {@link #inheritState(InheritedState)}.
     */
    public static final class PreviousState {
        private PreviousState() {
        }

        private static final PreviousState instance = new PreviousState();
    }
}
