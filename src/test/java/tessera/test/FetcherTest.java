// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.test;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import tessera.pipeline.DataUrlFetcher;
import tessera.pipeline.Fetcher;
import tessera.pipeline.FileFetcher;
import tessera.pipeline.Resource;
import tessera.pipeline.SchemeFetcher;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

final class FetcherTest {
    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "data:,hello|text/plain|hello",
        "data:,hello%20world|text/plain|hello world",
        "data:text/html,%3Cp%3Ehi|text/html|<p>hi",
        "data:text/plain;base64,aGVsbG8=|text/plain|hello",
        "data:;base64,aGk=|text/plain|hi",
        "data:;charset=utf-8,caf%C3%A9|text/plain|café",
        "data:text/plain;charset=ISO-8859-1,caf%E9|text/plain|café",
    })
    void decodesDataUrls(final String url, final String mediaType, final String text) throws IOException {
        final var resource = DataUrlFetcher.instance().fetch(URI.create(url), null);
        assertThat(resource.mediaType()).isEqualTo(mediaType);
        assertThat(resource.text()).isEqualTo(text);
    }

    @Test
    void dataUrlDefaultsToAscii() throws IOException {
        final var resource = DataUrlFetcher.instance().fetch(URI.create("data:,x"), null);
        assertThat(resource.contentType()).isEqualTo("text/plain;charset=US-ASCII");
        assertThat(resource.charset()).isEqualTo(StandardCharsets.US_ASCII);
    }

    @ParameterizedTest
    @ValueSource(strings = {"data:text/plain", "data:;base64,!!!!", "file:/not/a/data/url"})
    void rejectsMalformedDataUrls(final String url) {
        assertThatThrownBy(() -> DataUrlFetcher.instance().fetch(URI.create(url), null))
            .isInstanceOf(IOException.class);
    }

    @Test
    void readsFilesAndResolvesRelativeUrls(@TempDir final Path directory) throws IOException {
        final var page = directory.resolve("index.html");
        Files.writeString(page, "<p>hi</p>");
        Files.writeString(directory.resolve("style.css"), "p { color: red }");
        final var pageResource = FileFetcher.instance().fetch(page.toUri(), null);
        assertThat(pageResource.mediaType()).isEqualTo("text/html");
        assertThat(pageResource.text()).isEqualTo("<p>hi</p>");
        assertThat(pageResource.baseUrl()).isEqualTo(page.toUri());

        final var sheet = FileFetcher.instance().fetch(URI.create("style.css"), pageResource.baseUrl());
        assertThat(sheet.mediaType()).isEqualTo("text/css");
        assertThat(sheet.text()).isEqualTo("p { color: red }");
    }

    @Test
    void missingFileIsAnIoError(@TempDir final Path directory) {
        final var url = directory.resolve("missing.html").toUri();
        assertThatThrownBy(() -> FileFetcher.instance().fetch(url, null)).isInstanceOf(IOException.class);
    }

    @Test
    void schemeFetcherDispatchesByScheme(@TempDir final Path directory) throws IOException {
        final var file = directory.resolve("notes.txt");
        Files.writeString(file, "notes");
        final var fetcher = SchemeFetcher.standard();
        assertThat(fetcher.fetch(URI.create("DATA:,x"), null).text()).isEqualTo("x");
        assertThat(fetcher.fetch(file.toUri(), null).mediaType()).isEqualTo("text/plain");
        assertThatThrownBy(() -> fetcher.fetch(URI.create("https://example.com/"), null))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("https://example.com/");
    }

    @Test
    void schemeFetcherPassesTheResolvedUrl() throws IOException {
        final var expected = new Resource(new byte[]{1, 2}, "application/octet-stream", URI.create("mem:/a/b"));
        final Fetcher memory = (url, base) -> {
            assertThat(url).isEqualTo(URI.create("mem:/a/b"));
            assertThat(base).isNull();
            return expected;
        };
        final var fetcher = new SchemeFetcher(Map.of("mem", memory));
        assertThat(fetcher.fetch(URI.create("b"), URI.create("mem:/a/c"))).isEqualTo(expected);
    }

    @Test
    void resourceTextReplacesMalformedBytes() {
        final var resource = new Resource(new byte[]{'a', (byte) 0xFF, 'b'}, "text/html", URI.create("data:,"));
        assertThat(resource.text()).isEqualTo("a\uFFFDb");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "text/html|UTF-8",
        "text/html; charset=ISO-8859-1|ISO-8859-1",
        "text/html; Charset=\"utf-16be\"|UTF-16BE",
        "text/html; charset=no-such-charset|UTF-8",
        "text/html; charset=|UTF-8",
    })
    void resourceCharsetComesFromTheContentType(final String contentType, final String charset) {
        final var resource = new Resource(new byte[0], contentType, URI.create("data:,"));
        assertThat(resource.charset().name()).isEqualTo(charset);
    }

    @Test
    void relativeUrlsResolveAgainstTheBase() {
        final var base = URI.create("file:/site/pages/index.html");
        assertThat(Fetcher.resolve(URI.create("../style.css"), base)).isEqualTo(URI.create("file:/site/style.css"));
        assertThat(Fetcher.resolve(URI.create("data:,x"), base)).isEqualTo(URI.create("data:,x"));
        assertThat(Fetcher.resolve(URI.create("a.css"), null)).isEqualTo(URI.create("a.css"));
    }
}
