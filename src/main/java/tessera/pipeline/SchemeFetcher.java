// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.pipeline;

import java.io.IOException;
import java.net.URI;
import java.util.Locale;
import java.util.Map;
import tessera.util.annotation.Nullable;

/**
 * Dispatches each fetch to a fetcher chosen by the scheme of the resolved URL.
 */
public final class SchemeFetcher implements Fetcher {
    public SchemeFetcher(final Map<String, Fetcher> fetchersByScheme) {
        this.fetchersByScheme = Map.copyOf(fetchersByScheme);
    }

    /**
     * Returns a fetcher supporting the {@code data:} and {@code file:} schemes.
     */
    public static SchemeFetcher standard() {
        return standard;
    }

    @Override
    public Resource fetch(final URI url, final @Nullable URI base) throws IOException {
        final var resolved = Fetcher.resolve(url, base);
        final var scheme = resolved.getScheme();
        final var fetcher = (scheme == null) ? null : fetchersByScheme.get(scheme.toLowerCase(Locale.ROOT));
        if (fetcher == null) {
            throw new IOException("Unsupported URL: " + resolved);
        }
        return fetcher.fetch(resolved, null);
    }

    private final Map<String, Fetcher> fetchersByScheme;

    private static final SchemeFetcher standard =
        new SchemeFetcher(Map.of("data", DataUrlFetcher.instance(), "file", FileFetcher.instance()));
}
