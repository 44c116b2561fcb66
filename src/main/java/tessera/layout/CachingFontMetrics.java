// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A concurrent cache in front of another {@link FontMetrics}.
 * <p>
 * Invalidation uses explicit generations: the owner calls {@link #nextGeneration()} every so often, typically once per
 * navigation, which drops the entries not used since the previous call.
 * <p>
 * This class is thread-safe. Since measurements are deterministic, concurrent misses on the same key are harmless.
 */
public final class CachingFontMetrics implements FontMetrics {
    public CachingFontMetrics(final FontMetrics delegate) {
        this.delegate = delegate;
    }

    /**
     * Advances the cache into the next generation, removing all entries that weren't used since the last call.
     */
    public void nextGeneration() {
        final var previousGeneration = currentGeneration.getAndAdd(1);
        final var newGeneration = previousGeneration + 1;
        map.values().removeIf(entry -> {
            final var entryGeneration = entry.generation;
            // Keep the new generation too, in case there are concurrent writers.
            return entryGeneration != previousGeneration && entryGeneration != newGeneration;
        });
    }

    @Override
    public Measurement measure(final FontSpec font, final String text) {
        final var key = new Key(font, text);
        final var cached = map.get(key);
        if (cached != null) {
            cached.generation = currentGeneration.get();
            return cached.measurement;
        }
        final var measurement = delegate.measure(font, text);
        final var existing = map.putIfAbsent(key, new Entry(measurement, currentGeneration.get()));
        return (existing != null) ? existing.measurement : measurement;
    }

    /**
     * Returns the number of cached measurements.
     */
    public int size() {
        return map.size();
    }

    private final FontMetrics delegate;
    private final ConcurrentHashMap<Key, Entry> map = new ConcurrentHashMap<>();
    private final AtomicInteger currentGeneration = new AtomicInteger(0);

    private record Key(FontSpec font, String text) {
    }

    private static final class Entry {
        private Entry(final Measurement measurement, final int generation) {
            this.measurement = measurement;
            this.generation = generation;
        }

        private final Measurement measurement;
        private volatile int generation;
    }
}
