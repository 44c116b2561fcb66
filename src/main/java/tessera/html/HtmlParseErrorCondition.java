// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.html;

import tessera.util.condition.Condition;

/**
 * A non-fatal condition signaled when malformed markup is recovered from.
 */
public final class HtmlParseErrorCondition extends Condition {
    HtmlParseErrorCondition(final String message, final int offset) {
        super(message);
        this.offset = offset;
    }

    HtmlParseErrorCondition(final String message) {
        this(message, unknownOffset);
    }

    /**
     * Returns the offset in the input, in chars, where the problem was found, or -1 if it isn't known.
     */
    public int offset() {
        return offset;
    }

    @Override
    public String detailedMessage() {
        return (offset == unknownOffset) ? message() : message() + " (at offset " + offset + ")";
    }

    private final int offset;

    private static final int unknownOffset = -1;
}
