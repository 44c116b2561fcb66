// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.pipeline;

import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Arrays;
import java.util.Locale;
import tessera.util.annotation.Nullable;

/**
 * A fetched resource.
 *
 * @param bytes       The raw content. Must not be modified.
 * @param contentType The media type with its parameters, such as {@code text/html; charset=utf-8}.
 * @param baseUrl     The URL relative references inside the resource resolve against.
 */
public record Resource(byte[] bytes, String contentType, URI baseUrl) {
    /**
     * Returns the media type without parameters, lowercased.
     */
    public String mediaType() {
        final var semicolon = contentType.indexOf(';');
        final var type = (semicolon < 0) ? contentType : contentType.substring(0, semicolon);
        return type.strip().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the charset named by the content type's {@code charset} parameter, or UTF-8 if there's none or it names
     * an unknown charset.
     */
    public Charset charset() {
        final var name = parameter("charset");
        if (name == null) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(name);
        } catch (final IllegalCharsetNameException | UnsupportedCharsetException e) {
            return StandardCharsets.UTF_8;
        }
    }

    /**
     * Decodes the content as text. Malformed and unmappable bytes are replaced with U+FFFD.
     */
    public String text() {
        final var decoder = charset().newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (final CharacterCodingException e) {
            throw new AssertionError("Decoder with replacement reported a coding error", e);
        }
    }

    private @Nullable String parameter(final String name) {
        final var parts = contentType.split(";");
        for (int i = 1; i < parts.length; i += 1) {
            final var part = parts[i];
            final var equals = part.indexOf('=');
            if (equals < 0 || !part.substring(0, equals).strip().equalsIgnoreCase(name)) {
                continue;
            }
            var value = part.substring(equals + 1).strip();
            if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                value = value.substring(1, value.length() - 1);
            }
            return value;
        }
        return null;
    }

    @Override
    public boolean equals(final @Nullable Object other) {
        return other instanceof Resource that
            && Arrays.equals(bytes, that.bytes)
            && contentType.equals(that.contentType)
            && baseUrl.equals(that.baseUrl);
    }

    @Override
    public int hashCode() {
        return (Arrays.hashCode(bytes) * 31 + contentType.hashCode()) * 31 + baseUrl.hashCode();
    }

    @Override
    public String toString() {
        return "Resource[" + bytes.length + " bytes, contentType=" + contentType + ", baseUrl=" + baseUrl + "]";
    }
}
