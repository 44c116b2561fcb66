// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.pipeline;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import tessera.util.annotation.Nullable;

/**
 * Fetches {@code file:} URLs from the local file system. The content type is guessed from the file name extension.
 */
public final class FileFetcher implements Fetcher {
    private FileFetcher() {
    }

    public static FileFetcher instance() {
        return instance;
    }

    @Override
    public Resource fetch(final URI url, final @Nullable URI base) throws IOException {
        final var resolved = Fetcher.resolve(url, base);
        if (!"file".equalsIgnoreCase(resolved.getScheme())) {
            throw new IOException("Not a file URL: " + resolved);
        }
        final Path path;
        try {
            path = Path.of(resolved);
        } catch (final IllegalArgumentException e) {
            throw new IOException("Malformed file URL: " + resolved, e);
        }
        return new Resource(Files.readAllBytes(path), contentTypeOf(path), resolved);
    }

    private static String contentTypeOf(final Path path) {
        final var fileName = path.getFileName();
        final var name = (fileName == null) ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".html") || name.endsWith(".htm")) {
            return "text/html";
        } else if (name.endsWith(".css")) {
            return "text/css";
        } else if (name.endsWith(".txt")) {
            return "text/plain";
        }
        return "application/octet-stream";
    }

    private static final FileFetcher instance = new FileFetcher();
}
