// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A trace message, intended to be used within try-with-resources.
 * <p>
 * Traces describe what the pipeline is doing in user-readable terms, such as "Fetching stylesheet x.css" or "Laying
 * out generation 3", so that a reported condition can be put in context. They are not a machine stack trace.
 * <p>
 * Trace objects must never be used outside the thread that created them.
 */
public final class Trace implements AutoCloseable {
    /**
     * Initializes a new trace with the given lazily evaluated message, registering it as the innermost active trace of
     * the calling thread. The supplier is called at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Initializes a new trace with the given message, registering it as the innermost active trace of the calling
     * thread.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object object) {
        final var context = localContext();
        next = context.firstTrace;
        messageOrSupplier = object;
        ownerContext = context;
        context.firstTrace = this;
    }

    /**
     * Returns an iterable over the calling thread's active trace messages, innermost first.
     */
    public static Iterable<String> activeTraces() {
        return IterableImpl.instance;
    }

    /**
     * Returns a snapshot of the calling thread's active trace messages, innermost first.
     * <p>
     * Handlers take this snapshot while a condition is being signaled, so that the condition can be reported with
     * its context after the stack has been unwound, possibly on another thread.
     */
    public static List<String> snapshot() {
        final var result = new ArrayList<String>();
        for (final var message : activeTraces()) {
            result.add(message);
        }
        return List.copyOf(result);
    }

    /**
     * Does nothing; silences warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Unregisters the trace. Use try-with-resources rather than calling this directly.
     */
    @Override
    public void close() {
        checkUnlinkInvariants();
        ownerContext.firstTrace = next;
    }

    @SuppressWarnings("MethodOnlyUsedFromInnerClass")
    private String message() {
        return (messageOrSupplier instanceof final String string) ? string : runSupplier();
    }

    private String runSupplier() {
        assert messageOrSupplier instanceof MessageSupplier : "runSupplier called with no supplier present";
        final var supplier = (MessageSupplier) messageOrSupplier;
        final var string = supplier.get();
        messageOrSupplier = string;
        return string;
    }

    private void checkUnlinkInvariants() {
        assert ownerContext == localContext() : "Trace closed by a different thread";
        assert ownerContext.firstTrace == this : "Trace chain corrupt";
    }

    private static Context localContext() {
        return context.get();
    }

    @SuppressWarnings("nullness:type.argument")
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    // Either the message itself, or the MessageSupplier that produces it.
    private Object messageOrSupplier;
    private final Context ownerContext;

    private static final class Context {
        private @Nullable Trace firstTrace = null;
    }

    private static final class IterableImpl implements Iterable<String> {
        @Override
        public @NonNull Iterator<String> iterator() {
            return new IteratorImpl(localContext().firstTrace);
        }

        private static final IterableImpl instance = new IterableImpl();
    }

    private static final class IteratorImpl implements Iterator<String> {
        private IteratorImpl(final @Nullable Trace firstTrace) {
            current = firstTrace;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public String next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more traces left");
            }
            current = result.next;
            return result.message();
        }

        private @Nullable Trace current;
    }
}
