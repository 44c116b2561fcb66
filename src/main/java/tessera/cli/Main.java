// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.cli;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import tessera.dom.Serializer;
import tessera.layout.AwtFontMetrics;
import tessera.layout.FixedFontMetrics;
import tessera.layout.FontMetrics;
import tessera.pipeline.Configuration;
import tessera.pipeline.Frame;
import tessera.pipeline.NavigationFailure;
import tessera.pipeline.NavigationListener;
import tessera.pipeline.Navigator;
import tessera.pipeline.SchemeFetcher;
import tessera.util.SneakyThrow;
import tessera.util.annotation.Nullable;
import tessera.util.condition.ConditionContext;
import tessera.util.condition.Handler;

final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(mainImpl(args).value);
    }

    private static ExitCode mainImpl(final String[] args) {
        final Options options;
        try {
            options = Options.parse(args, Configuration.fromEnvironment());
        } catch (final IllegalArgumentException e) {
            try (final var streams = Streams.acquire()) {
                streams.err().println(e.getMessage());
                streams.err().println(usage);
                return ExitCode.USAGE;
            }
        }

        try (final var handler = new Handler(FallbackHandler.create(options.configuration().verbose()))) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> render(options));
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static ExitCode render(final Options options) {
        final var frame = new AtomicReference<@Nullable Frame>();
        final var failure = new AtomicReference<@Nullable NavigationFailure>();
        final var done = new CountDownLatch(1);
        try (final var navigator = new Navigator(SchemeFetcher.standard(), options.metrics(), options.configuration())) {
            navigator.addListener(new NavigationListener() {
                @Override
                public void frameReady(final Frame newFrame) {
                    frame.set(newFrame);
                    done.countDown();
                }

                @Override
                public void navigationFailed(final NavigationFailure navigationFailure) {
                    failure.set(navigationFailure);
                    done.countDown();
                }
            });
            navigator.navigate(options.url());
            try {
                done.await();
            } catch (final InterruptedException e) {
                throw SneakyThrow.doThrow(e);
            }
        }

        final var navigationFailure = failure.get();
        final var result = frame.get();
        try (final var streams = Streams.acquire()) {
            if (navigationFailure != null || result == null) {
                showFailure(streams, navigationFailure);
                return ExitCode.ERROR;
            }
            final var out = streams.out();
            switch (options.mode()) {
                case BOXES -> Dump.boxes(out, result.boxes().root(), result.document());
                case DISPLAY_LIST -> Dump.displayList(out, result.displayList());
                case DOM -> {
                    final var writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
                    try {
                        Serializer.serialize(writer, result.document());
                        writer.write('\n');
                        writer.flush();
                    } catch (final IOException e) {
                        throw SneakyThrow.doThrow(e);
                    }
                }
            }
            return ExitCode.SUCCESS;
        }
    }

    private static void showFailure(final Streams streams, final @Nullable NavigationFailure failure) {
        final var err = streams.err();
        if (failure == null) {
            err.println("Navigation was abandoned.");
            return;
        }
        err.println("Navigation to " + failure.url() + " failed.");
        err.println("\nDetailed message:");
        err.println(failure.condition().detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : failure.traces()) {
            err.println(" - " + traceMessage);
        }
    }

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }

    private enum Mode {
        BOXES,
        DISPLAY_LIST,
        DOM,
    }

    private record Options(URI url, Mode mode, Configuration configuration, FontMetrics metrics) {
        private static Options parse(final String[] args, final Configuration environment) {
            var configuration = environment.withHaltAfterFirstLayout(true);
            var mode = Mode.BOXES;
            FontMetrics metrics = FixedFontMetrics.instance();
            @Nullable URI url = null;
            for (int i = 0; i < args.length; i += 1) {
                final var arg = args[i];
                switch (arg) {
                    case "--boxes" -> mode = Mode.BOXES;
                    case "--display-list" -> mode = Mode.DISPLAY_LIST;
                    case "--dom" -> mode = Mode.DOM;
                    case "--verbose" -> configuration = configuration.withVerbose(true);
                    case "--width" -> {
                        i += 1;
                        configuration = configuration.withViewportWidth(parseWidth(valueOf(args, i, arg)));
                    }
                    case "--awt-font" -> {
                        i += 1;
                        metrics = new AwtFontMetrics(valueOf(args, i, arg));
                    }
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option " + arg);
                        } else if (url != null) {
                            throw new IllegalArgumentException("Exactly one document expected");
                        }
                        url = toUrl(arg);
                    }
                }
            }
            if (url == null) {
                throw new IllegalArgumentException("No document given");
            }
            return new Options(url, mode, configuration, metrics);
        }

        private static String valueOf(final String[] args, final int index, final String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Option " + option + " requires a value");
            }
            return args[index];
        }

        private static double parseWidth(final String value) {
            try {
                final var width = Double.parseDouble(value);
                if (Double.isFinite(width) && width > 0) {
                    return width;
                }
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException("Invalid width " + value, e);
            }
            throw new IllegalArgumentException("Invalid width " + value);
        }

        // Accepts data: URLs as typed, other absolute URLs, and file paths.
        private static URI toUrl(final String arg) {
            try {
                if (arg.regionMatches(true, 0, "data:", 0, 5)) {
                    return new URI("data", arg.substring(5), null);
                } else if (arg.regionMatches(true, 0, "file:", 0, 5)) {
                    return new URI(arg);
                }
                return Path.of(arg).toAbsolutePath().toUri();
            } catch (final URISyntaxException | InvalidPathException e) {
                throw new IllegalArgumentException("Invalid document location " + arg, e);
            }
        }
    }

    private static final String usage =
        "Usage: tessera [--boxes | --display-list | --dom] [--width N] [--verbose] [--awt-font FAMILY] <file | URL>";
}
