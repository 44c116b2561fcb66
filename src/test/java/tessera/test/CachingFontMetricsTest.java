// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.test;

import java.util.concurrent.atomic.AtomicInteger;
import tessera.layout.CachingFontMetrics;
import tessera.layout.FixedFontMetrics;
import tessera.layout.FontMetrics;
import tessera.layout.FontSpec;
import tessera.style.FontStyle;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class CachingFontMetricsTest {
    @Test
    void measuresEachTextOnce() {
        final var calls = new AtomicInteger(0);
        final var cache = new CachingFontMetrics(counting(calls));
        final var first = cache.measure(font, "hello");
        final var second = cache.measure(font, "hello");
        assertThat(second).isSameAs(first);
        assertThat(calls.get()).isEqualTo(1);
        cache.measure(new FontSpec(32, 400, FontStyle.NORMAL), "hello");
        assertThat(calls.get()).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void dropsEntriesUnusedForAGeneration() {
        final var cache = new CachingFontMetrics(FixedFontMetrics.instance());
        cache.measure(font, "kept");
        cache.measure(font, "dropped");
        cache.nextGeneration();
        cache.measure(font, "kept");
        cache.nextGeneration();
        assertThat(cache.size()).isEqualTo(1);
        cache.nextGeneration();
        assertThat(cache.size()).isZero();
    }

    @Test
    void fixedMetricsAreUniform() {
        final var measurement = FixedFontMetrics.instance().measure(font, "a日b");
        assertThat(measurement.advances()).containsExactly(8, 16, 8);
        assertThat(measurement.width()).isEqualTo(32.0);
        assertThat(measurement.width(1, 3)).isEqualTo(24.0);
        assertThat(measurement.lineHeight()).isEqualTo(16.0);
    }

    private static FontMetrics counting(final AtomicInteger calls) {
        return (font, text) -> {
            calls.incrementAndGet();
            return FixedFontMetrics.instance().measure(font, text);
        };
    }

    private static final FontSpec font = new FontSpec(16, 400, FontStyle.NORMAL);
}
