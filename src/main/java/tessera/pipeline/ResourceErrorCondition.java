// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.pipeline;

import java.io.IOException;
import tessera.util.condition.Condition;

/**
 * A condition type indicating that a resource couldn't be fetched.
 * <p>
 * Fatal for the document being navigated to; non-fatal for its stylesheets, which are then skipped.
 */
public final class ResourceErrorCondition extends Condition {
    public ResourceErrorCondition(final String location, final IOException exception) {
        super("Couldn't fetch " + location + ": " + exception.getMessage());
        this.location = location;
        this.exception = exception;
    }

    public String location() {
        return location;
    }

    public IOException exception() {
        return exception;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nCaused by: " + exception;
    }

    private final String location;
    private final IOException exception;
}
