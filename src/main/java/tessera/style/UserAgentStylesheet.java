// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.style;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import tessera.css.Origin;
import tessera.css.Parser;
import tessera.css.Stylesheet;

/**
 * The bundled default stylesheet, loaded from the {@code html.css} resource next to this class.
 */
public final class UserAgentStylesheet {
    private UserAgentStylesheet() {
    }

    /**
     * Returns the parsed default stylesheet. It's parsed once, on first use.
     */
    public static Stylesheet get() {
        return Holder.stylesheet;
    }

    private static Stylesheet load() {
        try (final var stream = UserAgentStylesheet.class.getResourceAsStream(resourceName)) {
            if (stream == null) {
                throw new IllegalStateException("Resource " + resourceName + " not found");
            }
            return Parser.parseStylesheet(new String(stream.readAllBytes(), StandardCharsets.UTF_8), Origin.USER_AGENT);
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to read " + resourceName, e);
        }
    }

    private static final String resourceName = "html.css";

    // Put the state in a separate class for lazy initialization.
    private static final class Holder {
        private static final Stylesheet stylesheet = load();
    }
}
