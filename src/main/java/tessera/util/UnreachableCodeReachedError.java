// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.util;

import org.jetbrains.annotations.NotNull;

/**
 * Signals that control flow reached a branch the pipeline considers impossible, such as an unknown variant of a
 * sealed node or box type.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }
}
