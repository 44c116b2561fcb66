// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.pipeline;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import tessera.util.condition.Condition;

/**
 * A condition type indicating that a pipeline stage failed with an exception, or ran out of stack on a document nested
 * too deeply. Always fatal.
 */
public final class RenderingFailureCondition extends Condition {
    public RenderingFailureCondition(final Throwable cause) {
        super((cause instanceof StackOverflowError)
            ? "The document is nested too deeply to render"
            : "Rendering failed: " + cause);
        this.cause = cause;
    }

    public Throwable cause() {
        return cause;
    }

    @Override
    public String detailedMessage() {
        final var charset = StandardCharsets.UTF_8;
        final var stream = new ByteArrayOutputStream();
        final var printStream = new PrintStream(stream, false, charset);
        cause.printStackTrace(printStream);
        printStream.flush();
        return message() + "\n" + stream.toString(charset);
    }

    private final Throwable cause;
}
