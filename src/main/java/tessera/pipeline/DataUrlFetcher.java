// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.pipeline;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import tessera.util.annotation.Nullable;

/**
 * Fetches {@code data:} URLs, as described by RFC 2397.
 * <p>
 * The data is percent-decoded, then base64-decoded if the header ends with {@code ;base64}. A missing media type
 * defaults to {@code text/plain;charset=US-ASCII}. A data URL has no meaningful base, so relative references inside
 * the resource stay unresolved.
 */
public final class DataUrlFetcher implements Fetcher {
    private DataUrlFetcher() {
    }

    public static DataUrlFetcher instance() {
        return instance;
    }

    @Override
    public Resource fetch(final URI url, final @Nullable URI base) throws IOException {
        final var resolved = Fetcher.resolve(url, base);
        if (!"data".equalsIgnoreCase(resolved.getScheme())) {
            throw new IOException("Not a data URL: " + resolved);
        }
        final var content = resolved.getRawSchemeSpecificPart();
        final var comma = content.indexOf(',');
        if (comma < 0) {
            throw new IOException("Data URL without a comma: " + resolved);
        }
        var header = new String(percentDecode(content.substring(0, comma)), StandardCharsets.UTF_8).strip();
        final var isBase64 = header.toLowerCase(Locale.ROOT).endsWith(";base64");
        if (isBase64) {
            header = header.substring(0, header.length() - ";base64".length());
        }
        final var data = percentDecode(content.substring(comma + 1));
        final var bytes = isBase64 ? decodeBase64(data, resolved) : data;
        return new Resource(bytes, mediaTypeOf(header), resolved);
    }

    private static String mediaTypeOf(final String header) {
        if (header.isEmpty()) {
            return defaultMediaType;
        } else if (header.startsWith(";")) {
            return "text/plain" + header;
        }
        return header;
    }

    private static byte[] decodeBase64(final byte[] data, final URI url) throws IOException {
        final var stripped = new String(data, StandardCharsets.US_ASCII).replaceAll("[ \t\n\r\f]", "");
        try {
            return Base64.getDecoder().decode(stripped);
        } catch (final IllegalArgumentException e) {
            throw new IOException("Invalid base64 data in " + url, e);
        }
    }

    // Characters that aren't part of a valid escape are kept as their UTF-8 bytes.
    static byte[] percentDecode(final String text) {
        final var output = new ByteArrayOutputStream(text.length());
        int i = 0;
        while (i < text.length()) {
            final var c = text.charAt(i);
            if (c == '%' && i + 2 < text.length()
                && isHexDigit(text.charAt(i + 1)) && isHexDigit(text.charAt(i + 2))) {
                output.write(Character.digit(text.charAt(i + 1), 16) * 16 + Character.digit(text.charAt(i + 2), 16));
                i += 3;
                continue;
            }
            final var codePoint = text.codePointAt(i);
            final var encoded = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
            output.write(encoded, 0, encoded.length);
            i += Character.charCount(codePoint);
        }
        return output.toByteArray();
    }

    private static boolean isHexDigit(final char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static final String defaultMediaType = "text/plain;charset=US-ASCII";

    private static final DataUrlFetcher instance = new DataUrlFetcher();
}
