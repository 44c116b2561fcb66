// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.pipeline;

import java.io.IOException;
import java.net.URI;
import tessera.util.annotation.Nullable;

/**
 * Retrieves resources by URL.
 * <p>
 * Implementations must be safe to call from several threads at once, as external stylesheets are fetched
 * concurrently. Redirects, caching and content encodings are not a concern of this interface.
 */
@FunctionalInterface
public interface Fetcher {
    /**
     * Fetches the resource at the given URL, resolved against the given base URL if it's relative.
     *
     * @throws IOException If the resource can't be retrieved.
     */
    Resource fetch(URI url, @Nullable URI base) throws IOException;

    /**
     * Resolves the given URL against the given base. Absolute URLs and a missing base leave the URL as is.
     */
    static URI resolve(final URI url, final @Nullable URI base) {
        return (base == null || url.isAbsolute()) ? url : base.resolve(url);
    }
}
