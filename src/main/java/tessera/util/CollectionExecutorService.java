// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.function.Function;
import tessera.util.condition.ConditionContext;
import tessera.util.condition.Unwind;
import org.jetbrains.annotations.NotNull;

/**
 * A wrapper around {@link ExecutorService} providing concurrent operations on collections.
 * <p>
 * The navigator uses it to fetch all external stylesheets of a document at once.
 */
public final class CollectionExecutorService {
    /**
     * Initializes a new collection executor service that will submit tasks to the given executor service.
     */
    public CollectionExecutorService(final @NotNull ExecutorService executorService) {
        this.executorService = executorService;
    }

    /**
     * Returns an unmodifiable list containing the results of applying the given function to the elements of the given
     * iterable, in iteration order.
     * <p>
     * Elements are processed concurrently. The tasks inherit the {@link ConditionContext} state of the calling thread,
     * and unwinds that escape a task are propagated to the calling thread.
     * <p>
     * This method waits for all the submitted tasks to finish before returning.
     */
    public <T, R> @NotNull List<R> map(
        final @NotNull Iterable<? extends T> iterable,
        final @NotNull Function<? super T, ? extends R> function
    ) {
        final var results = new ArrayList<R>();
        new AwaitImpl<R>(submitTasks(iterable, function).iterator(), results::add).awaitAll();
        return List.copyOf(results);
    }

    private <T, R> @NotNull List<@NotNull Future<R>> submitTasks(
        final @NotNull Iterable<? extends T> iterable,
        final @NotNull Function<? super T, ? extends R> function
    ) {
        final var inheritedState = ConditionContext.saveInheritableState();
        final var futures = new ArrayList<@NotNull Future<R>>();
        for (final T item : iterable) {
            futures.add(executorService.submit(() -> {
                final var previousState = ConditionContext.inheritState(inheritedState);
                try (final var trace = new Trace(() -> "Executing a task in thread " + Thread.currentThread().getName())) {
                    trace.use();
                    return function.apply(item);
                } finally {
                    ConditionContext.restoreState(previousState);
                }
            }));
        }
        return futures;
    }

    private final @NotNull ExecutorService executorService;

    private static final class AwaitImpl<T> {
        private AwaitImpl(
            final @NotNull Iterator<? extends @NotNull Future<? extends T>> iterator,
            final @NotNull Consumer<? super T> consumer
        ) {
            this.iterator = iterator;
            this.consumer = consumer;
        }

        private void awaitAll() {
            try {
                while (iterator.hasNext()) {
                    awaitOne(iterator.next());
                }
                checkInterruptions();
            } finally {
                cancelIfNeeded();
            }
        }

        private void checkInterruptions() {
            if (foundInterrupt) {
                throw new AssertionError("A task was interrupted, but no other task threw anything concrete");
            }
        }

        private void cancelIfNeeded() {
            if (needsCancellation) {
                while (iterator.hasNext()) {
                    iterator.next().cancel(true);
                }
            }
        }

        private void awaitOne(final @NotNull Future<? extends T> future) {
            try {
                consumer.accept(future.get());
            } catch (final InterruptedException e) {
                throw SneakyThrow.doThrow(e);
            } catch (final ExecutionException e) {
                recover(e);
            }
        }

        private void recover(final @NotNull ExecutionException executionException) {
            needsCancellation = true;
            final var cause = executionException.getCause();
            if (cause instanceof Unwind) {
                // Cross-thread unwind to a restart, continue unwinding in the calling thread.
                throw SneakyThrow.doThrow(cause);
            } else if (cause instanceof InterruptedException) {
                // Keep looking, another future will likely carry a more concrete throwable.
                foundInterrupt = true;
            } else if (cause instanceof Error error) {
                throw error;
            } else if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            } else {
                throw new AssertionError("An exception escaped from a worker through a future", cause);
            }
        }

        private final @NotNull Iterator<? extends @NotNull Future<? extends T>> iterator;
        private final @NotNull Consumer<? super T> consumer;
        private boolean foundInterrupt = false;
        private boolean needsCancellation = false;
    }
}
