// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.test;

import java.io.IOException;
import java.io.StringWriter;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import tessera.dom.Serializer;
import tessera.layout.FixedFontMetrics;
import tessera.paint.DisplayList;
import tessera.pipeline.Configuration;
import tessera.pipeline.Fetcher;
import tessera.pipeline.Frame;
import tessera.pipeline.NavigationFailure;
import tessera.pipeline.NavigationListener;
import tessera.pipeline.Navigator;
import tessera.pipeline.RenderingFailureCondition;
import tessera.pipeline.Resource;
import tessera.pipeline.ResourceErrorCondition;
import tessera.pipeline.Status;
import tessera.style.Color;
import tessera.util.annotation.Nullable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(30)
final class NavigatorTest {
    @Test
    void publishesFrameOfNavigation() throws InterruptedException {
        final var fetcher = new MemoryFetcher(Map.of("mem:/index.html", "<body><p>hello</p></body>"));
        final var listener = new RecordingListener();
        try (final var navigator = new Navigator(fetcher, metrics, configuration.withViewportWidth(400))) {
            navigator.addListener(listener);
            assertThat(navigator.status()).isEqualTo(Status.IDLE);
            assertThat(navigator.frame()).isEmpty();

            final var request = navigator.navigate(URI.create("mem:/index.html"));
            final var frame = listener.nextFrame();
            assertThat(frame.generation()).isEqualTo(request.generation());
            assertThat(frame.url()).isEqualTo(URI.create("mem:/index.html"));
            assertThat(frame.document().generation()).isEqualTo(request.generation());
            assertThat(frame.viewportWidth()).isEqualTo(400.0);
            assertThat(frame.displayList().commands())
                .filteredOn(command -> command instanceof DisplayList.Text)
                .extracting(command -> ((DisplayList.Text) command).text())
                .containsExactly("hello");
            assertThat(navigator.frame()).contains(frame);
            assertThat(navigator.status()).isEqualTo(Status.DONE);
        }
    }

    @Test
    void staleNavigationIsNeverPublished() throws InterruptedException {
        final var release = new CountDownLatch(1);
        final Fetcher fetcher = (url, base) -> {
            if (url.toString().equals("mem:/slow")) {
                try {
                    release.await();
                } catch (final InterruptedException e) {
                    throw new IOException("Interrupted", e);
                }
            }
            return MemoryFetcher.html(url, "<p>" + url.getPath() + "</p>");
        };
        final var listener = new RecordingListener();
        try (final var navigator = new Navigator(fetcher, metrics, configuration)) {
            navigator.addListener(listener);
            final var slow = navigator.navigate(URI.create("mem:/slow"));
            final var fast = navigator.navigate(URI.create("mem:/fast"));
            assertThat(fast.generation()).isGreaterThan(slow.generation());
            release.countDown();

            final var frame = listener.nextFrame();
            assertThat(frame.url()).isEqualTo(URI.create("mem:/fast"));
            assertThat(frame.generation()).isEqualTo(fast.generation());
            // Requests run in order, so the stale one has finished by now.
            assertThat(listener.frames).isEmpty();
            assertThat(listener.failures).isEmpty();
        }
    }

    @Test
    void supersededNavigationIsNotPublishedOnceTheNextOneIsRequested() throws InterruptedException {
        final var fetcher = new MemoryFetcher(Map.of("mem:/page", "<p>page</p>"));
        final var listener = new RecordingListener();
        try (final var navigator = new Navigator(fetcher, metrics, configuration)) {
            navigator.addListener(listener);
            for (int i = 0; i < 50; i += 1) {
                navigator.navigate(URI.create("mem:/page"));
                final var failing = navigator.navigate(URI.create("mem:/missing"));
                final var published = navigator.frame();
                assertThat(listener.nextFailure().generation()).isEqualTo(failing.generation());
                assertThat(navigator.frame()).isEqualTo(published);
                assertThat(navigator.status()).isEqualTo(Status.FAILED);
            }
        }
    }

    @Test
    void deeplyNestedDocumentIsPublished() throws InterruptedException, IOException {
        final var depth = 5000;
        final var fetcher = new MemoryFetcher(Map.of("mem:/deep", "<div>".repeat(depth) + "x"));
        final var listener = new RecordingListener();
        try (final var navigator = new Navigator(fetcher, metrics, configuration)) {
            navigator.addListener(listener);
            navigator.navigate(URI.create("mem:/deep"));
            final var frame = listener.nextFrame();
            final var boxes = new AtomicInteger(0);
            frame.boxes().forEachBox(box -> boxes.incrementAndGet());
            // The root, every div and the inline box of the innermost one.
            assertThat(boxes.get()).isEqualTo(depth + 2);
            assertThat(navigator.status()).isEqualTo(Status.DONE);

            final var writer = new StringWriter();
            Serializer.serialize(writer, frame.document());
            assertThat(writer.toString()).isEqualTo("<div>".repeat(depth) + "x" + "</div>".repeat(depth));
        }
    }

    @Test
    void exceptionInStageAbandonsNavigation() throws InterruptedException {
        final Fetcher fetcher = (url, base) -> {
            throw new IllegalStateException("fetcher is broken");
        };
        final var listener = new RecordingListener();
        try (final var navigator = new Navigator(fetcher, metrics, configuration)) {
            navigator.addListener(listener);
            final var request = navigator.navigate(URI.create("mem:/any"));
            final var failure = listener.nextFailure();
            assertThat(failure.generation()).isEqualTo(request.generation());
            assertThat(failure.condition()).isInstanceOf(RenderingFailureCondition.class);
            assertThat(((RenderingFailureCondition) failure.condition()).cause())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("fetcher is broken");
            assertThat(navigator.status()).isEqualTo(Status.FAILED);
            assertThat(navigator.frame()).isEmpty();
        }
        assertThat(new RenderingFailureCondition(new StackOverflowError()).message()).contains("nested too deeply");
    }

    @Test
    void resizeRelaysOutTheCurrentDocument() throws InterruptedException {
        final var fetcher = new MemoryFetcher(Map.of("mem:/a", "<p>one two three four five six</p>"));
        final var listener = new RecordingListener();
        try (final var navigator = new Navigator(fetcher, metrics, configuration)) {
            navigator.addListener(listener);
            final var request = navigator.navigate(URI.create("mem:/a"));
            final var first = listener.nextFrame();

            final var generation = navigator.resize(100);
            final var second = listener.nextFrame();
            assertThat(generation).isGreaterThan(request.generation());
            assertThat(second.generation()).isEqualTo(generation);
            assertThat(second.document()).isSameAs(first.document());
            assertThat(second.viewportWidth()).isEqualTo(100.0);
            assertThat(navigator.viewportWidth()).isEqualTo(100.0);
            assertThat(second.boxes().root().geometry().height())
                .isGreaterThan(first.boxes().root().geometry().height());
        }
    }

    @Test
    void resizeRejectsInvalidWidths() {
        try (final var navigator = new Navigator(new MemoryFetcher(Map.of()), metrics, configuration)) {
            assertThatThrownBy(() -> navigator.resize(0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> navigator.resize(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
            assertThat(navigator.viewportWidth()).isEqualTo(800.0);
        }
    }

    @Test
    void failedFetchAbandonsNavigation() throws InterruptedException {
        final var listener = new RecordingListener();
        try (final var navigator = new Navigator(new MemoryFetcher(Map.of()), metrics, configuration)) {
            navigator.addListener(listener);
            final var request = navigator.navigate(URI.create("mem:/missing"));
            final var failure = listener.nextFailure();
            assertThat(failure.generation()).isEqualTo(request.generation());
            assertThat(failure.condition()).isInstanceOf(ResourceErrorCondition.class);
            assertThat(((ResourceErrorCondition) failure.condition()).exception()).isInstanceOf(NoSuchFileException.class);
            assertThat(failure.traces()).anySatisfy(trace -> assertThat(trace).contains("mem:/missing"));
            assertThat(navigator.status()).isEqualTo(Status.FAILED);
            assertThat(navigator.frame()).isEmpty();
        }
    }

    @Test
    void failedStylesheetIsSkipped() throws InterruptedException {
        final var fetcher = new MemoryFetcher(Map.of(
            "mem:/site/index.html",
            "<head><style>p { color: red } em { color: red }</style>"
                + "<link rel=stylesheet href=missing.css>"
                + "<link rel='alternate StyleSheet' href=css/blue.css>"
                + "<link rel=icon href=icon.css></head>"
                + "<body><p>x <em>y</em></p></body>",
            "mem:/site/css/blue.css",
            "p { color: blue }",
            "mem:/site/icon.css",
            "p { color: green }"
        ));
        final var listener = new RecordingListener();
        try (
            final var recorder = new ConditionRecorder();
            final var navigator = new Navigator(fetcher, metrics, configuration)
        ) {
            navigator.addListener(listener);
            navigator.navigate(URI.create("mem:/site/index.html"));
            final var frame = listener.nextFrame();
            final var document = frame.document();
            final var p = document.elementsByTagName("p").get(0);
            final var em = document.elementsByTagName("em").get(0);
            assertThat(frame.styled().style(p).color()).isEqualTo(Color.rgb(0, 0, 255));
            assertThat(frame.styled().style(em).color()).isEqualTo(Color.rgb(255, 0, 0));
            assertThat(recorder.ofType(ResourceErrorCondition.class))
                .extracting(ResourceErrorCondition::location)
                .containsExactly("missing.css");
            assertThat(fetcher.requested).doesNotContain(URI.create("mem:/site/icon.css"));
        }
    }

    @Test
    void haltsAfterFirstLayoutWhenConfigured() throws InterruptedException {
        final var fetcher = new MemoryFetcher(Map.of("mem:/a", "<p>a</p>"));
        final var listener = new RecordingListener();
        try (final var navigator = new Navigator(fetcher, metrics, configuration.withHaltAfterFirstLayout(true))) {
            navigator.addListener(listener);
            navigator.navigate(URI.create("mem:/a"));
            listener.nextFrame();
            assertThat(listener.halted.await(10, TimeUnit.SECONDS)).isTrue();
            assertThat(navigator.isHalted()).isTrue();
            assertThatThrownBy(() -> navigator.navigate(URI.create("mem:/a"))).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> navigator.resize(100)).isInstanceOf(IllegalStateException.class);
            assertThat(navigator.frame()).isPresent();
        }
    }

    @Test
    void throwingListenerDoesNotStopOthers() throws InterruptedException {
        final var fetcher = new MemoryFetcher(Map.of("mem:/a", "<p>a</p>"));
        final var listener = new RecordingListener();
        try (
            final var recorder = new ConditionRecorder();
            final var navigator = new Navigator(fetcher, metrics, configuration)
        ) {
            navigator.addListener(frame -> {
                throw new IllegalStateException("listener failure");
            });
            navigator.addListener(listener);
            navigator.navigate(URI.create("mem:/a"));
            listener.nextFrame();
            assertThat(recorder.all()).anySatisfy(
                condition -> assertThat(condition.message()).contains("listener failure")
            );
        }
    }

    private static final FixedFontMetrics metrics = FixedFontMetrics.instance();
    private static final Configuration configuration = Configuration.defaults();

    private static final class MemoryFetcher implements Fetcher {
        private MemoryFetcher(final Map<String, String> contents) {
            this.contents = contents;
        }

        @Override
        public Resource fetch(final URI url, final @Nullable URI base) throws IOException {
            final var resolved = Fetcher.resolve(url, base);
            requested.add(resolved);
            final var content = contents.get(resolved.toString());
            if (content == null) {
                throw new NoSuchFileException(resolved.toString());
            }
            return html(resolved, content);
        }

        private static Resource html(final URI url, final String content) {
            return new Resource(content.getBytes(StandardCharsets.UTF_8), "text/html; charset=utf-8", url);
        }

        private final Map<String, String> contents;
        private final List<URI> requested = new CopyOnWriteArrayList<>();
    }

    private static final class RecordingListener implements NavigationListener {
        @Override
        public void frameReady(final Frame frame) {
            frames.add(frame);
        }

        @Override
        public void navigationFailed(final NavigationFailure failure) {
            failures.add(failure);
        }

        @Override
        public void halted() {
            halted.countDown();
        }

        private Frame nextFrame() throws InterruptedException {
            final var frame = frames.poll(10, TimeUnit.SECONDS);
            assertThat(frame).as("published frame").isNotNull();
            return frame;
        }

        private NavigationFailure nextFailure() throws InterruptedException {
            final var failure = failures.poll(10, TimeUnit.SECONDS);
            assertThat(failure).as("navigation failure").isNotNull();
            return failure;
        }

        private final BlockingQueue<Frame> frames = new LinkedBlockingQueue<>();
        private final BlockingQueue<NavigationFailure> failures = new LinkedBlockingQueue<>();
        private final CountDownLatch halted = new CountDownLatch(1);
    }
}
