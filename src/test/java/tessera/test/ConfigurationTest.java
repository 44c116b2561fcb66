// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.test;

import java.util.Map;
import tessera.pipeline.Configuration;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class ConfigurationTest {
    @Test
    void defaultsApplyWhenNothingIsSet() {
        assertThat(read(Map.of(), Map.of())).isEqualTo(new Configuration(false, 800, false));
        assertThat(Configuration.defaults()).isEqualTo(new Configuration(false, 800, false));
    }

    @Test
    void readsEnvironmentVariables() {
        final var configuration = read(Map.of(), Map.of(
            "TESSERA_HALT_AFTER_FIRST_LAYOUT", "yes",
            "TESSERA_VIEWPORT_WIDTH", "1024",
            "TESSERA_VERBOSE", "1"
        ));
        assertThat(configuration).isEqualTo(new Configuration(true, 1024, true));
    }

    @Test
    void systemPropertiesOverrideEnvironment() {
        final var configuration = read(
            Map.of("tessera.viewportWidth", "640", "tessera.verbose", "off"),
            Map.of("TESSERA_VIEWPORT_WIDTH", "1024", "TESSERA_VERBOSE", "on")
        );
        assertThat(configuration.viewportWidth()).isEqualTo(640.0);
        assertThat(configuration.verbose()).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
        "true, true",
        "TRUE, true",
        "' on ', true",
        "no, false",
        "0, false",
        "maybe, false",
        "'', false",
    })
    void parsesBooleans(final String value, final boolean expected) {
        assertThat(read(Map.of("tessera.haltAfterFirstLayout", value), Map.of()).haltAfterFirstLayout())
            .isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "1280, 1280",
        "' 320.5 ', 320.5",
        "0, 800",
        "-5, 800",
        "NaN, 800",
        "Infinity, 800",
        "wide, 800",
    })
    void parsesViewportWidth(final String value, final double expected) {
        assertThat(read(Map.of("tessera.viewportWidth", value), Map.of()).viewportWidth()).isEqualTo(expected);
    }

    @Test
    void copyMethodsChangeOneSetting() {
        final var configuration = Configuration.defaults()
            .withHaltAfterFirstLayout(true)
            .withViewportWidth(300)
            .withVerbose(true);
        assertThat(configuration).isEqualTo(new Configuration(true, 300, true));
    }

    private static Configuration read(final Map<String, String> properties, final Map<String, String> environment) {
        return Configuration.from(properties::get, environment::get);
    }
}
