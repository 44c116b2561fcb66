// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.util.condition;

/**
 * A condition type indicating that an exception was suppressed, for example one thrown by a navigation listener.
 * <p>
 * Never fatal; handlers must not unwind in response to it.
 */
public final class SuppressedExceptionCondition extends Condition {
    /**
     * Initializes a new suppressed exception condition indicating that the given exception was suppressed.
     */
    public SuppressedExceptionCondition(final Exception exception) {
        super("Suppressed exception: " + exception);
        this.exception = exception;
    }

    /**
     * Retrieves the exception that was suppressed.
     */
    public Exception exception() {
        return exception;
    }

    private final Exception exception;
}
