// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.pipeline;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Supplier;
import tessera.css.Origin;
import tessera.css.Parser;
import tessera.css.Stylesheet;
import tessera.dom.Document;
import tessera.dom.Node;
import tessera.html.TreeConstructor;
import tessera.layout.BoxVerifier;
import tessera.layout.CachingFontMetrics;
import tessera.layout.FontMetrics;
import tessera.layout.LayoutEngine;
import tessera.paint.Painter;
import tessera.style.StyleResolver;
import tessera.style.StyledDocument;
import tessera.util.CollectionExecutorService;
import tessera.util.SneakyThrow;
import tessera.util.Trace;
import tessera.util.UnreachableCodeReachedError;
import tessera.util.annotation.Nullable;
import tessera.util.condition.ConditionContext;
import tessera.util.condition.Handler;
import tessera.util.condition.HandlerProcedure;
import tessera.util.condition.Restart;

/**
 * Runs the fetch, parse, style and layout chain for each navigation on a background worker, and publishes the
 * resulting frames.
 * <p>
 * Every request gets a generation number, higher than all earlier ones. Requests are processed one at a time, in
 * order. A navigation whose generation is no longer the latest requested navigation is discarded between stages and
 * never published; a stage, once started, always runs to completion. Publication replaces the current {@link Frame}
 * atomically, so readers always see a complete frame.
 * <p>
 * Resizing re-runs layout on the current frame's styled document, under a new generation.
 * <p>
 * A fatal condition signaled while processing a request unwinds to the {@code abandon-navigation} restart: nothing is
 * published, the status becomes {@link Status#FAILED} and listeners are told why. Thread-safe condition handlers
 * active in the thread that created the navigator also see the conditions signaled by its worker.
 * <p>
 * This class is thread-safe.
 */
public final class Navigator implements AutoCloseable {
    /**
     * Initializes a new navigator and starts its worker.
     */
    public Navigator(final Fetcher fetcher, final FontMetrics metrics, final Configuration configuration) {
        this.fetcher = fetcher;
        this.metrics = new CachingFontMetrics(metrics);
        haltAfterFirstLayout = configuration.haltAfterFirstLayout();
        viewportWidth = configuration.viewportWidth();
        inheritedState = ConditionContext.saveInheritableState();
        worker = Executors.newSingleThreadExecutor(
            runnable -> new Thread(null, runnable, "navigator-worker", workerStackSize)
        );
        fetchThreadPool = createFetchThreadPool();
        fetchExecutor = new CollectionExecutorService(fetchThreadPool);
    }

    /**
     * Requests navigation to the given URL.
     *
     * @throws IllegalStateException If the navigator has halted.
     */
    public synchronized NavigationRequest navigate(final URI url) {
        checkAccepting();
        final var request = new NavigationRequest(url, generations.incrementAndGet());
        latestNavigation.set(request.generation());
        submit(() -> runNavigation(request));
        return request;
    }

    /**
     * Changes the viewport width, requesting a relayout of the current frame at the new width.
     *
     * @return The generation of the relayout request.
     * @throws IllegalArgumentException If the width isn't a positive finite number.
     * @throws IllegalStateException    If the navigator has halted.
     */
    public synchronized long resize(final double width) {
        if (!Double.isFinite(width) || width <= 0) {
            throw new IllegalArgumentException("Invalid viewport width: " + width);
        }
        checkAccepting();
        viewportWidth = width;
        final var generation = generations.incrementAndGet();
        submit(() -> runRelayout(generation));
        return generation;
    }

    public void addListener(final NavigationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(final NavigationListener listener) {
        listeners.remove(listener);
    }

    /**
     * Returns the most recently published frame, if any.
     */
    public Optional<Frame> frame() {
        return Optional.ofNullable(frame.get());
    }

    public Status status() {
        return status;
    }

    public double viewportWidth() {
        return viewportWidth;
    }

    /**
     * Returns whether the navigator has stopped accepting requests after publishing its first frame.
     */
    public boolean isHalted() {
        return halted;
    }

    /**
     * Stops the worker, discarding pending requests, and waits for it to terminate.
     */
    @Override
    public void close() {
        shutDown(worker);
        shutDown(fetchThreadPool);
    }

    private void checkAccepting() {
        if (halted) {
            throw new IllegalStateException("The navigator has halted after its first layout");
        }
    }

    private void submit(final Runnable task) {
        worker.execute(() -> {
            final var previousState = ConditionContext.inheritState(inheritedState);
            try {
                task.run();
            } finally {
                ConditionContext.restoreState(previousState);
            }
        });
    }

    private void runNavigation(final NavigationRequest request) {
        final BooleanSupplier isCurrent = () -> request.generation() == latestNavigation.get();
        if (halted || !isCurrent.getAsBoolean()) {
            return;
        }
        metrics.nextGeneration();
        run(request, isCurrent, () -> load(request, isCurrent));
    }

    private void runRelayout(final long generation) {
        // A later request will lay out at the new width anyway.
        final BooleanSupplier isCurrent = () -> generation == generations.get();
        if (halted || !isCurrent.getAsBoolean()) {
            return;
        }
        final var current = frame.get();
        // Without a frame of the latest navigation, that navigation's own layout picks up the new width.
        if (current == null || current.document().generation() != latestNavigation.get()) {
            return;
        }
        final var request = new NavigationRequest(current.url(), generation);
        run(request, isCurrent, () -> {
            try (final var trace = new Trace(() -> "Relaying out " + current.url() + " at width " + viewportWidth)) {
                trace.use();
                status = Status.LAYOUT;
                return Optional.of(render(request, current.styled()));
            }
        });
    }

    private void run(
        final NavigationRequest request,
        final BooleanSupplier isCurrent,
        final Supplier<Optional<Frame>> stages
    ) {
        final var failure = new AtomicReference<@Nullable NavigationFailure>();
        final var result = ConditionContext.withRestart(abandonNavigation, restart -> {
            try (final var handler = new Handler(abandonOnFatal(request, restart, failure))) {
                handler.use();
                try {
                    return stages.get();
                } catch (final RuntimeException | StackOverflowError e) {
                    throw ConditionContext.error(new RenderingFailureCondition(e));
                }
            }
        });
        if (result == null) {
            final var reported = failure.get();
            final boolean current;
            synchronized (this) {
                current = isCurrent.getAsBoolean();
                if (current) {
                    status = Status.FAILED;
                }
            }
            if (current && reported != null) {
                notifyListeners(listener -> listener.navigationFailed(reported));
            }
            return;
        }
        result.ifPresent(newFrame -> publish(newFrame, isCurrent));
    }

    private static HandlerProcedure.ThreadSafe abandonOnFatal(
        final NavigationRequest request,
        final Restart restart,
        final AtomicReference<@Nullable NavigationFailure> failure
    ) {
        return condition -> {
            if (condition.isFatal()) {
                failure.compareAndSet(null, new NavigationFailure(
                    request.url(),
                    request.generation(),
                    condition.condition(),
                    Trace.snapshot()
                ));
                restart.unwindTo();
            }
        };
    }

    private Optional<Frame> load(final NavigationRequest request, final BooleanSupplier isCurrent) {
        final var url = request.url();
        try (final var trace = new Trace(() -> "Navigating to " + url + " (generation " + request.generation() + ")")) {
            trace.use();
            status = Status.LOAD;
            final var resource = fetchDocument(url);
            if (!isCurrent.getAsBoolean()) {
                return Optional.empty();
            }
            status = Status.PARSE;
            final var document = TreeConstructor.parse(resource.text(), request.generation());
            if (!isCurrent.getAsBoolean()) {
                return Optional.empty();
            }
            status = Status.STYLE;
            final var sheets = loadStylesheets(document, resource.baseUrl());
            final var styled = StyleResolver.resolveWithDefaults(document, sheets);
            if (!isCurrent.getAsBoolean()) {
                return Optional.empty();
            }
            status = Status.LAYOUT;
            return Optional.of(render(request, styled));
        }
    }

    private Resource fetchDocument(final URI url) {
        try (final var trace = new Trace(() -> "Fetching document " + url)) {
            trace.use();
            try {
                return fetcher.fetch(url, null);
            } catch (final IOException e) {
                throw ConditionContext.error(new ResourceErrorCondition(url.toString(), e));
            }
        }
    }

    // Embedded and linked sheets are returned in document order, which is their cascade order.
    private List<Stylesheet> loadStylesheets(final Document document, final URI base) {
        final var sources = new ArrayList<StylesheetSource>();
        document.forEachDescendant(Document.ROOT, id -> {
            if (!(document.node(id) instanceof Node.Element element)) {
                return;
            }
            if (element.hasTagName("style")) {
                sources.add(new StylesheetSource.Embedded(document.textContent(id)));
            } else if (element.hasTagName("link") && isStylesheetLink(element)) {
                element.attributes().get("href").ifPresent(href -> sources.add(new StylesheetSource.Linked(href)));
            }
        });
        return fetchExecutor.map(sources, source -> loadStylesheet(source, base));
    }

    private static boolean isStylesheetLink(final Node.Element element) {
        final var rel = element.attributes().get("rel").orElse("");
        for (final var token : rel.toLowerCase(Locale.ROOT).split("[ \t\n\r\f]+")) {
            if (token.equals("stylesheet")) {
                return true;
            }
        }
        return false;
    }

    private Stylesheet loadStylesheet(final StylesheetSource source, final URI base) {
        if (source instanceof StylesheetSource.Embedded embedded) {
            return Parser.parseStylesheet(embedded.text(), Origin.AUTHOR);
        } else if (source instanceof StylesheetSource.Linked linked) {
            final var href = linked.href().strip();
            try (final var trace = new Trace(() -> "Fetching stylesheet " + href)) {
                trace.use();
                try {
                    final var resource = fetcher.fetch(new URI(href), base);
                    return Parser.parseStylesheet(resource.text(), Origin.AUTHOR);
                } catch (final URISyntaxException e) {
                    ConditionContext.signal(new ResourceErrorCondition(href, new IOException("Malformed URL", e)));
                } catch (final IOException e) {
                    ConditionContext.signal(new ResourceErrorCondition(href, e));
                }
                return Stylesheet.empty(Origin.AUTHOR);
            }
        }
        throw new UnreachableCodeReachedError("Unknown stylesheet source: " + source);
    }

    private Frame render(final NavigationRequest request, final StyledDocument styled) {
        final var width = viewportWidth;
        final var boxes = LayoutEngine.layout(styled, width, metrics);
        BoxVerifier.verify(boxes, styled.document());
        return new Frame(request.url(), request.generation(), styled, boxes, Painter.paint(boxes));
    }

    // The staleness check and the swap happen under the lock navigate and resize take to issue generations.
    private void publish(final Frame newFrame, final BooleanSupplier isCurrent) {
        final boolean haltedNow;
        synchronized (this) {
            if (!isCurrent.getAsBoolean()) {
                return;
            }
            frame.set(newFrame);
            status = Status.DONE;
            haltedNow = haltAfterFirstLayout && !halted;
            if (haltedNow) {
                halted = true;
            }
        }
        notifyListeners(listener -> listener.frameReady(newFrame));
        if (haltedNow) {
            notifyListeners(NavigationListener::halted);
        }
    }

    private void notifyListeners(final Consumer<NavigationListener> action) {
        for (final var listener : listeners) {
            ConditionContext.withSuppressedExceptions(() -> action.accept(listener));
        }
    }

    private static ThreadPoolExecutor createFetchThreadPool() {
        final var threadId = new AtomicInteger(0);
        return new ThreadPoolExecutor(
            Runtime.getRuntime().availableProcessors(),
            Integer.MAX_VALUE,
            0,
            TimeUnit.NANOSECONDS,
            new LinkedBlockingQueue<>(),
            runnable -> new Thread(runnable, "fetch-thread-" + threadId.addAndGet(1))
        );
    }

    @SuppressWarnings("ResultOfMethodCallIgnored")
    private static void shutDown(final ExecutorService executor) {
        executor.shutdownNow();
        try {
            executor.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
        } catch (final InterruptedException e) {
            throw SneakyThrow.doThrow(e);
        }
    }

    private final Fetcher fetcher;
    private final CachingFontMetrics metrics;
    private final boolean haltAfterFirstLayout;
    private final ConditionContext.InheritedState inheritedState;
    private final ExecutorService worker;
    private final ThreadPoolExecutor fetchThreadPool;
    private final CollectionExecutorService fetchExecutor;

    private final AtomicLong generations = new AtomicLong(0);
    private final AtomicLong latestNavigation = new AtomicLong(0);
    private final AtomicReference<@Nullable Frame> frame = new AtomicReference<>();
    private final CopyOnWriteArrayList<NavigationListener> listeners = new CopyOnWriteArrayList<>();
    private volatile double viewportWidth;
    private volatile Status status = Status.IDLE;
    private volatile boolean halted = false;

    private static final String abandonNavigation = "abandon-navigation";
    // Layout recurses once per nesting level of the document.
    private static final long workerStackSize = 256L << 20;

    private sealed interface StylesheetSource {
        record Embedded(String text) implements StylesheetSource {
        }

        record Linked(String href) implements StylesheetSource {
        }
    }
}
