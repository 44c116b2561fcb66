// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.pipeline;

/**
 * Receives notifications from a {@link Navigator}.
 * <p>
 * All methods are called on the navigator's worker thread. Exceptions thrown by listeners are reported as suppressed
 * exception conditions and otherwise ignored.
 */
public interface NavigationListener {
    /**
     * Called after a frame has been published.
     */
    void frameReady(Frame frame);

    /**
     * Called when the latest navigation was abandoned.
     */
    default void navigationFailed(final NavigationFailure failure) {
    }

    /**
     * Called once the navigator has stopped accepting requests after its first published frame.
     */
    default void halted() {
    }
}
