// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.cli;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.util.concurrent.locks.ReentrantLock;
import tessera.util.SneakyThrow;

/**
 * Exclusive access to the standard streams, so that output from the worker threads doesn't interleave with the
 * main thread's.
 */
final class Streams implements AutoCloseable {
    // The corresponding unlock is in close(), so this is fine.
    @SuppressWarnings("LockAcquiredButNotSafelyReleased")
    private Streams() {
        try {
            Holder.lock.lockInterruptibly();
        } catch (final InterruptedException e) {
            throw SneakyThrow.doThrow(e);
        }
    }

    static Streams acquire() {
        return new Streams();
    }

    @Override
    public void close() {
        Holder.lock.unlock();
    }

    @SuppressWarnings({"MethodMayBeStatic", "SameReturnValue", "UseOfSystemOutOrSystemErr"})
    PrintStream out() {
        return System.out;
    }

    @SuppressWarnings({"MethodMayBeStatic", "SameReturnValue", "UseOfSystemOutOrSystemErr"})
    PrintStream err() {
        return System.err;
    }

    @SuppressWarnings("MethodMayBeStatic")
    BufferedReader in() {
        return Holder.inputReader;
    }

    // Put the state in a separate class for lazy initialization.
    private static final class Holder {
        private static Charset getInputCharset() {
            final var console = System.console();
            return (console == null) ? Charset.defaultCharset() : console.charset();
        }

        private static final ReentrantLock lock = new ReentrantLock();
        private static final BufferedReader inputReader =
            new BufferedReader(new InputStreamReader(System.in, getInputCharset()));
    }
}
