// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.pipeline;

import java.util.Locale;
import java.util.function.UnaryOperator;
import tessera.util.annotation.Nullable;

/**
 * Settings of the navigator and the command line interface.
 * <p>
 * Each setting is read from a system property, falling back to an environment variable, falling back to the default.
 * Values that can't be parsed are ignored.
 *
 * @param haltAfterFirstLayout Whether to stop accepting requests once the first frame is published:
 *                             {@code tessera.haltAfterFirstLayout} or {@code TESSERA_HALT_AFTER_FIRST_LAYOUT}.
 * @param viewportWidth        The initial viewport width: {@code tessera.viewportWidth} or
 *                             {@code TESSERA_VIEWPORT_WIDTH}, 800 by default.
 * @param verbose              Whether to report non-fatal conditions: {@code tessera.verbose} or
 *                             {@code TESSERA_VERBOSE}.
 */
public record Configuration(boolean haltAfterFirstLayout, double viewportWidth, boolean verbose) {
    public static Configuration defaults() {
        return defaults;
    }

    /**
     * Reads the configuration from the system properties and the environment of this process.
     */
    public static Configuration fromEnvironment() {
        return from(System::getProperty, System::getenv);
    }

    /**
     * Reads the configuration from the given lookup functions, each returning {@code null} for an unset key.
     */
    public static Configuration from(
        final UnaryOperator<@Nullable String> properties,
        final UnaryOperator<@Nullable String> environment
    ) {
        final var reader = new Reader(properties, environment);
        return new Configuration(
            reader.bool(
                "tessera.haltAfterFirstLayout",
                "TESSERA_HALT_AFTER_FIRST_LAYOUT",
                defaults.haltAfterFirstLayout
            ),
            reader.positiveDouble("tessera.viewportWidth", "TESSERA_VIEWPORT_WIDTH", defaults.viewportWidth),
            reader.bool("tessera.verbose", "TESSERA_VERBOSE", defaults.verbose)
        );
    }

    public Configuration withHaltAfterFirstLayout(final boolean haltAfterFirstLayout) {
        return new Configuration(haltAfterFirstLayout, viewportWidth, verbose);
    }

    public Configuration withViewportWidth(final double viewportWidth) {
        return new Configuration(haltAfterFirstLayout, viewportWidth, verbose);
    }

    public Configuration withVerbose(final boolean verbose) {
        return new Configuration(haltAfterFirstLayout, viewportWidth, verbose);
    }

    private static final Configuration defaults = new Configuration(false, 800, false);

    private record Reader(UnaryOperator<@Nullable String> properties, UnaryOperator<@Nullable String> environment) {
        private @Nullable String lookup(final String property, final String variable) {
            final var value = properties.apply(property);
            return (value != null) ? value : environment.apply(variable);
        }

        private boolean bool(final String property, final String variable, final boolean defaultValue) {
            final var value = lookup(property, variable);
            if (value == null) {
                return defaultValue;
            }
            return switch (value.strip().toLowerCase(Locale.ROOT)) {
                case "1", "true", "yes", "on" -> true;
                case "0", "false", "no", "off" -> false;
                default -> defaultValue;
            };
        }

        private double positiveDouble(final String property, final String variable, final double defaultValue) {
            final var value = lookup(property, variable);
            if (value == null) {
                return defaultValue;
            }
            try {
                final var parsed = Double.parseDouble(value.strip());
                return (Double.isFinite(parsed) && parsed > 0) ? parsed : defaultValue;
            } catch (final NumberFormatException e) {
                return defaultValue;
            }
        }
    }
}
