// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import tessera.util.Trace;
import tessera.util.condition.Condition;
import tessera.util.condition.ConditionContext;
import tessera.util.condition.HandlerProcedure;
import tessera.util.condition.Restart;
import tessera.util.condition.SignaledCondition;
import tessera.util.condition.SuppressedExceptionCondition;

/**
 * The outermost handler of the command line interface.
 * <p>
 * Non-fatal conditions are printed only in verbose mode, except for suppressed exceptions, which are always printed.
 * Fatal conditions are printed with the operation trace, and the user is asked which restart to take.
 */
final class FallbackHandler implements HandlerProcedure.ThreadSafe {
    private FallbackHandler(final boolean verbose) {
        this.verbose = verbose;
    }

    static FallbackHandler create(final boolean verbose) {
        return new FallbackHandler(verbose);
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            final var inner = condition.condition();
            if (inner instanceof SuppressedExceptionCondition || verbose) {
                try (final var streams = Streams.acquire()) {
                    showCondition(streams, inner, "A condition");
                }
            }
            return;
        }
        final var restarts = ConditionContext.restarts();
        try (final var streams = Streams.acquire()) {
            showCondition(streams, condition.condition(), "A fatal condition");
            chooseRestart(streams, restarts).unwindTo();
        }
    }

    private static void showCondition(final Streams streams, final Condition condition, final String prefix) {
        final var err = streams.err();
        err.println(prefix + " of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private static Restart chooseRestart(final Streams streams, final List<Restart> restarts) {
        if (restarts.isEmpty()) {
            throw new RuntimeException("No restarts available");
        }
        final var last = restarts.get(restarts.size() - 1);

        final var err = streams.err();
        showRestarts(err, restarts);
        while (true) {
            err.print("Enter restart number > ");
            try {
                final var line = streams.in().readLine();
                if (line == null) {
                    err.println("End of input found, arbitrarily picking the last restart.");
                    return last;
                }
                final var index = Integer.parseInt(line.strip());
                if (index >= 1 && index <= restarts.size()) {
                    return restarts.get(index - 1);
                } else {
                    err.println("Invalid restart index " + index + ", value out of bounds.");
                }
            } catch (final NumberFormatException e) {
                err.println("Restart index not an integer: " + e);
            } catch (final IOException e) {
                err.println("I/O error occurred: " + e);
                err.println("Arbitrarily picking the last restart.");
                return last;
            }
        }
    }

    private static void showRestarts(final PrintStream stream, final List<Restart> restarts) {
        int index = 1;
        stream.println("Available restarts:");
        for (final var restart : restarts) {
            stream.println(" " + index + ". " + restart.name());
            index += 1;
        }
        stream.println();
    }

    private final boolean verbose;
}
